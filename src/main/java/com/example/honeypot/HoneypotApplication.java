package com.example.honeypot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class HoneypotApplication {

    public static void main(String[] args) {
        SpringApplication.run(HoneypotApplication.class, args);
    }
}
