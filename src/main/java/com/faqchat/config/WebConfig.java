package com.faqchat.config;

import com.faqchat.web.CorrelationIdFilter;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
                .allowedOriginPatterns(
                    "http://localhost:*",
                    "http://127.0.0.1:*"
                )
                .allowedMethods(
                    "GET",
                    "POST",
                    "OPTIONS"
                )
                .allowedHeaders("*")
                .exposedHeaders(CorrelationIdFilter.HEADER)
                .allowCredentials(true)
                .maxAge(3600);
    }
}
