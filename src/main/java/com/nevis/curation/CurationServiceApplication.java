package com.nevis.curation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableAsync;

@EnableRetry
@EnableAsync
@SpringBootApplication
@ConfigurationPropertiesScan
public class CurationServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(CurationServiceApplication.class, args);
    }
}
