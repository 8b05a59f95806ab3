package com.example.cachesync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CacheSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(CacheSyncApplication.class, args);
    }
}
