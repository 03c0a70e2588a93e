package com.chaintruth.intent.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Intent lifecycle policy. Documented in application.yml under chaintruth.intent.
 */
@ConfigurationProperties(prefix = "chaintruth.intent")
@NoArgsConstructor
@Getter
@Setter
public class IntentProperties {

    /** How long an unmatched intent stays open. */
    private Duration expiry = Duration.ofHours(24);

    /** Max intents expired per sweeper run. */
    private int sweepBatchSize = 500;

    /**
     * Smallest requested amount, as a multiple of 10^nonceWidth raw units, so the nonce stays a small
     * fraction of what the donor sends (100 = at most 1%).
     */
    private int minAmountNonceFactor = 100;

    /** Nonce draws before giving up on finding an amount no open intent on the address uses. */
    private int nonceDrawAttempts = 5;
}
