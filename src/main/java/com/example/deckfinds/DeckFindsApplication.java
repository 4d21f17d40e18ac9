package com.example.deckfinds;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DeckFindsApplication {

    public static void main(String[] args) {
        SpringApplication.run(DeckFindsApplication.class, args);
    }
}
