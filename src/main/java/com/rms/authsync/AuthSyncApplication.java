package com.rms.authsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AuthSyncApplication {
    public static void main(String[] args) {
        SpringApplication.run(AuthSyncApplication.class, args);
    }
}
