package com.albatross;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class AlbatrossApplication {

    public static void main(String[] args) {
        SpringApplication.run(AlbatrossApplication.class, args);
    }
}
