package com.exposureplatform.exposure;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ExposureServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(ExposureServiceApplication.class, args);
    }
}
