package com.reliabledownloader;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan("com.reliabledownloader")
public class ReliableDownloaderApplication {
    public static void main(String[] args) {
        SpringApplication.run(ReliableDownloaderApplication.class, args);
    }
}
