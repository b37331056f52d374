package com.tagatlas;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TagAtlasApplication {

    public static void main(String[] args) {
        SpringApplication.run(TagAtlasApplication.class, args);
    }
}
