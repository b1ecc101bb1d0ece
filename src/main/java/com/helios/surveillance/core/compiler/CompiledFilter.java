package com.helios.surveillance.core.compiler;

import com.helios.surveillance.model.FilterNode;

/**
 * Result of a successful compilation: the parsed tree and its guarded predicate.
 */
public record CompiledFilter(FilterNode ast, KillmailPredicate predicate) {
}
