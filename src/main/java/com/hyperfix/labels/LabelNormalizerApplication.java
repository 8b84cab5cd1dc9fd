package com.hyperfix.labels;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class LabelNormalizerApplication {

    public static void main(String[] args) {
        SpringApplication.run(LabelNormalizerApplication.class, args);
    }
}
