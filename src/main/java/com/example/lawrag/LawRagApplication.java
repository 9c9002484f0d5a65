package com.example.lawrag;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.retry.annotation.EnableRetry;

@SpringBootApplication
@EnableRetry
public class LawRagApplication {

    public static void main(String[] args) {
        SpringApplication.run(LawRagApplication.class, args);
    }
}
