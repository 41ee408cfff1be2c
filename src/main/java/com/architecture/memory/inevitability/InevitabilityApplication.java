package com.architecture.memory.inevitability;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class InevitabilityApplication {

    public static void main(String[] args) {
        SpringApplication.run(InevitabilityApplication.class, args);
    }
}
