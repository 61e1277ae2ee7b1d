package com.hemovita;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class HemoVitaApplication {

    public static void main(String[] args) {
        SpringApplication.run(HemoVitaApplication.class, args);
    }
}
