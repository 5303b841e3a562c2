package com.potatoregistry;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PotatoRegistryApplication {

    public static void main(String[] args) {
        SpringApplication.run(PotatoRegistryApplication.class, args);
    }
}
