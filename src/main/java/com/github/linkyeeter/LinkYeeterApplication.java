package com.github.linkyeeter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@ConfigurationPropertiesScan
@SpringBootApplication
public class LinkYeeterApplication {

    public static void main(String[] args) {
        SpringApplication.run(LinkYeeterApplication.class, args);
    }
}
