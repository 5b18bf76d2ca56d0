package com.deepansh.focus;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class FocusAssistantApplication {
    public static void main(String[] args) {
        SpringApplication.run(FocusAssistantApplication.class, args);
    }
}
