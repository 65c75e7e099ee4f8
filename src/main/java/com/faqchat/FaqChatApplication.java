package com.faqchat;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FaqChatApplication {

    public static void main(String[] args) {
        SpringApplication.run(FaqChatApplication.class, args);
    }
}
