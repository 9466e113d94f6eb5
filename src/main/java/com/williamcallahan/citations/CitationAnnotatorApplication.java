package com.williamcallahan.citations;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CitationAnnotatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(CitationAnnotatorApplication.class, args);
    }

}
