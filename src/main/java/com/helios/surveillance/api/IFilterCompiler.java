package com.helios.surveillance.api;

import com.helios.surveillance.core.compiler.CompilationException;
import com.helios.surveillance.core.compiler.CompiledFilter;

import java.util.Map;

/**
 * Contract for compiling a profile's filter tree into an executable predicate.
 */
public interface IFilterCompiler {

    /**
     * Compiles a filter tree in its raw JSON shape.
     *
     * @param filterTree {@code {"condition": "and"|"or", "rules": [...]}}
     * @return the parsed tree and a predicate that never throws
     * @throws CompilationException if the tree is malformed
     */
    CompiledFilter compile(Map<String, ?> filterTree) throws CompilationException;
}
