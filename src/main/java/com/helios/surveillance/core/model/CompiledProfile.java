package com.helios.surveillance.core.model;

import com.helios.surveillance.core.compiler.KillmailPredicate;
import com.helios.surveillance.core.index.IndexContribution;
import com.helios.surveillance.model.FilterNode;
import com.helios.surveillance.model.Killmail;

/**
 * Read-only projection of a profile inside one generation.
 */
public record CompiledProfile(
        String id,
        String name,
        FilterNode filter,
        KillmailPredicate predicate,
        IndexContribution index
) {

    public boolean matches(Killmail killmail) {
        return predicate.test(killmail);
    }

    public boolean isIndexed() {
        return !index.isEmpty();
    }
}
