package com.github.dimitryivaniuta.egress;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EgressToolkitApplication {

    public static void main(String[] args) {
        SpringApplication.run(EgressToolkitApplication.class, args);
    }
}
