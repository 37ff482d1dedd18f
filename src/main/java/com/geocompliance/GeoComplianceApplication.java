package com.geocompliance;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ComplianceProperties.class)
public class GeoComplianceApplication {

    public static void main(String[] args) {
        SpringApplication.run(GeoComplianceApplication.class, args);
    }
}
