package com.chaintruth.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Allowed intent status transitions. Every conditional write on an intent takes its source set from here.
 * <p>
 * Moves out of EXPIRED are allowed only for a verification that started before the intent expired;
 * the repository enforces that extra condition.
 */
public final class IntentTransitions {

    private static final Map<PaymentIntentStatus, Set<PaymentIntentStatus>> SOURCES = new EnumMap<>(PaymentIntentStatus.class);

    static {
        SOURCES.put(PaymentIntentStatus.CREATED, EnumSet.noneOf(PaymentIntentStatus.class));
        SOURCES.put(PaymentIntentStatus.DETECTING, EnumSet.of(PaymentIntentStatus.CREATED, PaymentIntentStatus.DETECTING,
                PaymentIntentStatus.EXPIRED));
        SOURCES.put(PaymentIntentStatus.CONFIRMING, EnumSet.of(PaymentIntentStatus.DETECTING, PaymentIntentStatus.CONFIRMING,
                PaymentIntentStatus.EXPIRED));
        SOURCES.put(PaymentIntentStatus.CONFIRMED, EnumSet.of(PaymentIntentStatus.DETECTING, PaymentIntentStatus.CONFIRMING,
                PaymentIntentStatus.EXPIRED));
        SOURCES.put(PaymentIntentStatus.EXPIRED, EnumSet.of(PaymentIntentStatus.CREATED, PaymentIntentStatus.DETECTING));
        SOURCES.put(PaymentIntentStatus.FAILED, EnumSet.of(PaymentIntentStatus.DETECTING, PaymentIntentStatus.CONFIRMING));
        SOURCES.put(PaymentIntentStatus.MISMATCH, EnumSet.of(PaymentIntentStatus.DETECTING));
    }

    private IntentTransitions() {
    }

    /**
     * Statuses an intent may be in for a move to {@code target}.
     */
    public static Set<PaymentIntentStatus> sourcesOf(PaymentIntentStatus target) {
        return Collections.unmodifiableSet(SOURCES.get(target));
    }

    public static boolean isAllowed(PaymentIntentStatus from, PaymentIntentStatus to) {
        return SOURCES.get(to).contains(from);
    }
}
