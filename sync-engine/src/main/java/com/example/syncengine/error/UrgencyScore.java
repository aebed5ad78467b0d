package com.example.syncengine.error;

import java.util.List;

/**
 * @param score   0 to 100
 * @param factors human readable reasons, one per contributing signal
 */
public record UrgencyScore(int score, UrgencyLevel level, List<String> factors) {

    public UrgencyScore {
        factors = List.copyOf(factors);
    }
}
