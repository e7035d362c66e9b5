package com.lawcheck;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LawcheckApplication {

    public static void main(String[] args) {
        SpringApplication.run(LawcheckApplication.class, args);
    }
}
