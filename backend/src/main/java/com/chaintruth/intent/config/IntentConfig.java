package com.chaintruth.intent.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Intent module configuration: lifecycle policy and deposit addresses.
 */
@Configuration
@EnableConfigurationProperties({ IntentProperties.class, DepositAddressProperties.class })
public class IntentConfig {
}
