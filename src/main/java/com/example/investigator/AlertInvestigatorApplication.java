package com.example.investigator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AlertInvestigatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(AlertInvestigatorApplication.class, args);
    }
}
