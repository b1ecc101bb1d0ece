package com.helios.surveillance.core.recording;

import com.helios.surveillance.model.DisplaySummary;
import com.helios.surveillance.model.Killmail;
import com.helios.surveillance.model.MatchAlert;
import com.helios.surveillance.model.MatchRecord;

import java.time.Instant;

/**
 * One match waiting in the recorder's queue for the next flush.
 */
public record PendingMatch(String profileId, String profileName, Killmail killmail, Instant matchedAt) {

    MatchRecord toRecord() {
        DisplaySummary summary = DisplaySummary.of(killmail);
        return new MatchRecord(profileId, killmail.killmailId(), killmail.killmailTime(), summary,
                summary.totalValue(), matchedAt);
    }

    MatchAlert toAlert() {
        return new MatchAlert(profileId, profileName, killmail.killmailId(), DisplaySummary.of(killmail), matchedAt);
    }
}
