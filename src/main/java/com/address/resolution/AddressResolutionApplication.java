package com.address.resolution;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AddressResolutionApplication {

    public static void main(String[] args) {
        // Warn early when the provider key is missing; every lookup would be denied
        String apiKey = System.getenv("GOOGLE_MAPS_API_KEY");
        if (apiKey == null || apiKey.isEmpty()) {
            System.out.println("WARNING: GOOGLE_MAPS_API_KEY is NOT set in environment variables!");
        }

        SpringApplication.run(AddressResolutionApplication.class, args);
    }
}
