package com.example.jewelry_pricing;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class JewelryPricingApplication {
    public static void main(String[] args) {
        SpringApplication.run(JewelryPricingApplication.class, args);
    }
}
