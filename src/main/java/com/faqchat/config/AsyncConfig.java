package com.faqchat.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

@Configuration
@EnableScheduling
public class AsyncConfig {

    @Bean("notificationTaskExecutor")
    public ThreadPoolTaskExecutor notificationTaskExecutor(ChatbotConfig chatbotConfig) {
        ChatbotConfig.Notification notification = chatbotConfig.getNotification() != null
                ? chatbotConfig.getNotification()
                : new ChatbotConfig.Notification();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(notification.getCorePoolSize() != null ? notification.getCorePoolSize() : 1);
        executor.setMaxPoolSize(notification.getMaxPoolSize() != null ? notification.getMaxPoolSize() : 2);
        executor.setQueueCapacity(notification.getQueueCapacity() != null ? notification.getQueueCapacity() : 100);
        executor.setThreadNamePrefix("Notify-");
        // a full queue drops the event rather than blocking the request thread
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }
}
