package com.enterprise.morpher;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class MorpherApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(MorpherApplication.class, args)));
    }
}
