package com.example.cardlobby;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CardLobbyApplication {

    public static void main(String[] args) {
        SpringApplication.run(CardLobbyApplication.class, args);
    }
}
