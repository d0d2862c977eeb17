package com.health.misinfo;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class MisinfoGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(MisinfoGuardApplication.class, args);
    }
}
