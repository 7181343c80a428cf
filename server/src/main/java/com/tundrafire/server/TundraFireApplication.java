package com.tundrafire.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TundraFireApplication {

    public static void main(String[] args) {
        SpringApplication.run(TundraFireApplication.class, args);
    }
}
