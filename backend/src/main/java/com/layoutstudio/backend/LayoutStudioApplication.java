package com.layoutstudio.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class LayoutStudioApplication {
    public static void main(String[] args) {
        SpringApplication.run(LayoutStudioApplication.class, args);
    }
}
