package com.calmtable.restaurant;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;

@SpringBootApplication
@EntityScan(basePackages = "com.calmtable.restaurant.model")
public class CalmTableApplication {
    public static void main(String[] args) {
        SpringApplication.run(CalmTableApplication.class, args);
    }
}
