package com.vibeforge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VibeForgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(VibeForgeApplication.class, args);
    }
}
