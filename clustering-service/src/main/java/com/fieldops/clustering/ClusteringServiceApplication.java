package com.fieldops.clustering;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ClusteringServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(ClusteringServiceApplication.class, args);
    }
}
