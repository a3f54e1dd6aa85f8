package com.aind.metadata;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MetadataCaptureApplication {

    public static void main(String[] args) {
        SpringApplication.run(MetadataCaptureApplication.class, args);
    }
}
