package com.example.apirecovery;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ApiRecoveryApplication {

    public static void main(String[] args) {
        SpringApplication.run(ApiRecoveryApplication.class, args);
    }
}
