package com.entitystore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entity store service.
 *
 * Opens the canned response, utterance and journey stores on the configured backend,
 * migrating older data on the way.
 */
@SpringBootApplication
public class EntityStoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(EntityStoreApplication.class, args);
    }

}
