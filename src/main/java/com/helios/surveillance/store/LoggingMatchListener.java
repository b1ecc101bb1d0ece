package com.helios.surveillance.store;

import com.helios.surveillance.model.MatchAlert;

import java.util.logging.Logger;

/**
 * Writes each alert to the log. Default listener of the standalone server.
 */
public class LoggingMatchListener implements MatchListener {
    private static final Logger logger = Logger.getLogger(LoggingMatchListener.class.getName());

    @Override
    public void onMatch(MatchAlert alert) {
        logger.info(() -> String.format("Profile '%s' (%s) matched killmail %d: %s, %.0f ISK",
                alert.profileName(), alert.profileId(), alert.killmailId(),
                alert.displaySummary().shipName(), alert.displaySummary().totalValue()));
    }
}
