package com.sni.curation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CurationServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(CurationServiceApplication.class, args);
    }
}
