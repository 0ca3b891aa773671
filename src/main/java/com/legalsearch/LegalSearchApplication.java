package com.legalsearch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LegalSearchApplication {

    public static void main(String[] args) {
        SpringApplication.run(LegalSearchApplication.class, args);
    }
}
