package com.oilevels;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OiLevelsApplication {

    public static void main(String[] args) {
        SpringApplication.run(OiLevelsApplication.class, args);
    }
}
