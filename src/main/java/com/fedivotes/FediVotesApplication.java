package com.fedivotes;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class FediVotesApplication {

    public static void main(String[] args) {
        SpringApplication.run(FediVotesApplication.class, args);
    }
}
