package com.chaintruth.config;

import com.chaintruth.registry.RegistryProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Clock and the asset/network catalog properties. Everything that reads time takes the Clock bean.
 */
@Configuration
@EnableConfigurationProperties(RegistryProperties.class)
public class CoreConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
