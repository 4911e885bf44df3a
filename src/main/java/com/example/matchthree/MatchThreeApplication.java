package com.example.matchthree;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MatchThreeApplication {

    public static void main(String[] args) {
        SpringApplication.run(MatchThreeApplication.class, args);
    }

}
