package com.beerpong;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BeerPongApplication {
    public static void main(String[] args) {
        SpringApplication.run(BeerPongApplication.class, args);
    }
}
