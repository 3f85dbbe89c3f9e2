package com.vedant.securequery;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SecureQueryApplication {

    public static void main(String[] args) {
        SpringApplication.run(SecureQueryApplication.class, args);
    }
}
