package com.kincircle.trust;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TrustCoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(TrustCoreApplication.class, args);
    }
}
