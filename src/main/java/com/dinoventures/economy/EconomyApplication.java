package com.dinoventures.economy;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EconomyApplication {

    public static void main(String[] args) {
        SpringApplication.run(EconomyApplication.class, args);
    }
}
