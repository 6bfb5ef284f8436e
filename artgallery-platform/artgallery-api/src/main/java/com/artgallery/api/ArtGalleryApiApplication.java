package com.artgallery.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Art Gallery Registry API Application
 *
 * REST surface over the registry engine: galleries, listings, purchases,
 * reviews, fee administration and the event feed.
 */
@SpringBootApplication
public class ArtGalleryApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(ArtGalleryApiApplication.class, args);
    }
}
