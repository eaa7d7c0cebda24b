package com.fieldops.clustering.config;

import com.fieldops.clustering.engine.GeoClusteringEngine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ClusteringConfig {

    @Bean
    public GeoClusteringEngine geoClusteringEngine() {
        return new GeoClusteringEngine();
    }
}
