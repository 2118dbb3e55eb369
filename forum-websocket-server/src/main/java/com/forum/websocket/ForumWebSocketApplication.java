package com.forum.websocket;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ForumWebSocketApplication {

    public static void main(String[] args) {
        SpringApplication.run(ForumWebSocketApplication.class, args);
    }
}
