package com.avtimeline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AvTimelineApplication {

    public static void main(String[] args) {
        SpringApplication.run(AvTimelineApplication.class, args);
    }
}
