package com.myinfra.deployments.ownership;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OwnershipResolverApplication {

    public static void main(String[] args) {
        SpringApplication.run(OwnershipResolverApplication.class, args);
    }
}
