package com.bko.delegation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DelegationApplication {

    public static void main(String[] args) {
        SpringApplication.run(DelegationApplication.class, args);
    }
}
