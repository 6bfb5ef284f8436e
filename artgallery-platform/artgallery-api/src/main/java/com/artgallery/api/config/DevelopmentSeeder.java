package com.artgallery.api.config;

import com.artgallery.core.engine.TransactionEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * Seeds a fresh development registry with a gallery and one listed artwork.
 */
@Component
@Profile("dev")
public class DevelopmentSeeder implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(DevelopmentSeeder.class);

    static final String GALLERY_KEY = "main-gallery";
    static final BigInteger TEST_ARTWORK_PRICE = BigInteger.TEN.pow(17); // 0.1 ether

    private final TransactionEngine engine;
    private final RegistryProperties properties;

    public DevelopmentSeeder(TransactionEngine engine, RegistryProperties properties) {
        this.engine = engine;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!engine.listGalleries().isEmpty()) {
            return;
        }
        String administrator = properties.getAdministrator();
        engine.createGallery(GALLERY_KEY, "Main Gallery", "The primary gallery for all artworks", administrator);
        long id = engine.createAsset("Test Artwork", "ipfs://QmTest", TEST_ARTWORK_PRICE, GALLERY_KEY, 10,
                administrator);
        log.info("Seeded development gallery {} with artwork {}", GALLERY_KEY, id);
    }
}
