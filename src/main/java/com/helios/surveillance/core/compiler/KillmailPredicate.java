package com.helios.surveillance.core.compiler;

import com.helios.surveillance.model.Killmail;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Executable form of a filter tree.
 */
@FunctionalInterface
public interface KillmailPredicate {

    boolean test(Killmail killmail);

    KillmailPredicate NEVER = killmail -> false;

    /**
     * Wraps {@code delegate} so that any runtime failure evaluates to {@code false}.
     */
    static KillmailPredicate guarded(KillmailPredicate delegate) {
        return killmail -> {
            try {
                return delegate.test(killmail);
            } catch (RuntimeException e) {
                Logger.getLogger(KillmailPredicate.class.getName())
                        .log(Level.FINE, "Predicate failed, treating as no match", e);
                return false;
            }
        };
    }
}
