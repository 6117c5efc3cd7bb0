package com.scoutim;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ScoutImApplication {
    public static void main(String[] args) {
        SpringApplication.run(ScoutImApplication.class, args);
    }
}
