package com.chaintruth.chain.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Backoff for transient chain errors (exponential ± jitter). Documented in application.yml.
 */
@ConfigurationProperties(prefix = "chaintruth.chain.retry")
@NoArgsConstructor
@Getter
@Setter
public class ChainRetryProperties {

    /** Base delay in ms for the first retry; doubles each attempt. */
    private long baseDelayMs = 500L;

    /** Jitter factor 0..1 (0.2 = ±20%). */
    private double jitterFactor = 0.2;

    /** Total attempts per verification call, including the first. */
    private int maxAttempts = 3;
}
