package com.chaintruth.registry;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.ConfigurationPropertySources;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.core.env.PropertySource;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Binds the shipped application.yml catalog and checks the per-network confirmation thresholds.
 */
class RegistryCatalogTest {

    private static AssetNetworkRegistry catalog;

    @BeforeAll
    static void loadCatalog() throws IOException {
        List<PropertySource<?>> sources = new YamlPropertySourceLoader()
                .load("application", new ClassPathResource("application.yml"));
        RegistryProperties props = new Binder(ConfigurationPropertySources.from(sources))
                .bind("chaintruth.registry", RegistryProperties.class)
                .orElseThrow(() -> new IllegalStateException("chaintruth.registry missing from application.yml"));
        catalog = new AssetNetworkRegistry(props);
    }

    @ParameterizedTest
    @CsvSource({
            "ethereum, 12",
            "bsc, 3",
            "polygon, 128",
            "arbitrum, 1",
            "optimism, 1",
            "base, 1",
            "avalanche, 1",
            "bitcoin, 1",
            "litecoin, 1",
            "solana, 32"
    })
    void confirmationThresholds(String networkId, int required) {
        assertThat(catalog.network(networkId).confirmationsRequired()).isEqualTo(required);
    }
}
