package com.helios.surveillance.core.model;

import com.helios.surveillance.api.IFilterCompiler;
import com.helios.surveillance.core.compiler.CompilationException;
import com.helios.surveillance.core.compiler.CompiledFilter;
import com.helios.surveillance.core.index.IndexBuilder;
import com.helios.surveillance.core.index.IndexContribution;
import com.helios.surveillance.core.index.ProfileIndexes;
import com.helios.surveillance.model.Profile;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Compiles a list of profiles into a new {@link Generation}.
 * <p>
 * Each profile compiles in isolation: one that fails is logged, recorded in
 * {@link Generation#failures()}, and left out. Inactive profiles and repeated ids are skipped.
 */
public class GenerationBuilder {
    private static final Logger logger = Logger.getLogger(GenerationBuilder.class.getName());

    private final IFilterCompiler compiler;
    private final IndexBuilder indexBuilder;
    private final Tracer tracer;

    public GenerationBuilder(IFilterCompiler compiler, IndexBuilder indexBuilder, Tracer tracer) {
        this.compiler = compiler;
        this.indexBuilder = indexBuilder;
        this.tracer = tracer;
    }

    public Generation build(long generationId, List<Profile> profiles, Instant builtAt) {
        Span span = tracer.spanBuilder("build-generation").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("generation", generationId);
            span.setAttribute("profiles.input", profiles.size());

            List<CompiledProfile> compiled = new ArrayList<>(profiles.size());
            Map<String, String> failures = new LinkedHashMap<>();
            Set<String> seen = new HashSet<>();
            ProfileIndexes.Builder indexes = ProfileIndexes.builder();

            for (Profile profile : profiles) {
                if (!profile.active()) {
                    continue;
                }
                if (!seen.add(profile.id())) {
                    logger.warning("Duplicate profile id " + profile.id() + ", keeping the first occurrence");
                    continue;
                }
                try {
                    CompiledFilter filter = compiler.compile(profile.filterTree());
                    IndexContribution contribution = indexBuilder.build(profile.id(), filter.ast());
                    indexes.add(compiled.size(), contribution);
                    compiled.add(new CompiledProfile(profile.id(), profile.name(), filter.ast(),
                            filter.predicate(), contribution));
                } catch (CompilationException e) {
                    failures.put(profile.id(), e.getMessage());
                    logger.warning("Profile " + profile.id() + " failed to compile and is excluded: " + e.getMessage());
                } catch (RuntimeException e) {
                    failures.put(profile.id(), e.toString());
                    logger.log(Level.WARNING,
                            "Profile " + profile.id() + " could not be built and is excluded", e);
                }
            }

            Generation generation = new Generation(generationId, builtAt, compiled, indexes.build(), failures);
            span.setAttribute("profiles.compiled", generation.size());
            span.setAttribute("profiles.indexed", generation.indexedCount());
            span.setAttribute("profiles.failed", failures.size());
            logger.info(String.format("Built generation %d: %d profiles (%d indexed, %d unindexed, %d failed)",
                    generationId, generation.size(), generation.indexedCount(),
                    generation.size() - generation.indexedCount(), failures.size()));
            return generation;
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }
}
