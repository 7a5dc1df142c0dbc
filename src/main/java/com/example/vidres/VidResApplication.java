package com.example.vidres;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VidResApplication {
    private static final Logger logger = LoggerFactory.getLogger(VidResApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(VidResApplication.class, args);
        logger.info("Application started");
    }
}
