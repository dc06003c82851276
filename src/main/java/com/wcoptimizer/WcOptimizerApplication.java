package com.wcoptimizer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class WcOptimizerApplication {

    public static void main(String[] args) {
        SpringApplication.run(WcOptimizerApplication.class, args);
    }
}
