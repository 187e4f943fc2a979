package com.flagship.prior_auth;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
public class PriorAuthApplication {

    public static void main(String[] args) {
        SpringApplication.run(PriorAuthApplication.class, args);
    }
}
