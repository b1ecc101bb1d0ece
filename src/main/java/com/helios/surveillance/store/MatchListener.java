package com.helios.surveillance.store;

import com.helios.surveillance.model.MatchAlert;

/**
 * Receives one alert per flushed match. Delivery is at-least-once.
 */
@FunctionalInterface
public interface MatchListener {

    void onMatch(MatchAlert alert);

    MatchListener NONE = alert -> {
    };
}
