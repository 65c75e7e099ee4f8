package com.faqchat.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import lombok.Data;

/**
 * Q&A dataset location and format
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "faq-chat.dataset")
public class DatasetConfig {

    /**
     * Filesystem path or {@code classpath:} location of the delimited Q&A file
     */
    private String path = "classpath:qa_data.csv";

    /**
     * Column delimiter
     */
    private char delimiter = ',';

    /**
     * Remarks value that marks a row as a featured FAQ for its category
     */
    private String faqMarker = "よくある質問";

    /**
     * Fail application startup when the dataset cannot be loaded
     */
    private boolean failFast = false;
}
