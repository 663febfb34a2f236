package com.propertyintel.poi;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties
public class PoiCrawlerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PoiCrawlerApplication.class, args);
    }
}
