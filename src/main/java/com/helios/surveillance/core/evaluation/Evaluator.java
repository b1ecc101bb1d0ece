package com.helios.surveillance.core.evaluation;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.helios.surveillance.core.model.CompiledProfile;
import com.helios.surveillance.core.model.Generation;
import com.helios.surveillance.metrics.Counter;
import com.helios.surveillance.metrics.MetricsRegistry;
import com.helios.surveillance.model.Killmail;
import org.roaringbitmap.IntIterator;
import org.roaringbitmap.RoaringBitmap;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs candidate profile predicates against a killmail.
 * <p>
 * Small candidate sets are evaluated on the calling thread. Larger ones fan out over a bounded
 * worker pool; a profile that does not finish within the per-profile timeout, or that fails,
 * counts as not matched. The result is ordered by profile ordinal either way.
 * <p>
 * The per-profile timeout is a wait on that profile's result, taken in ordinal order once all
 * tasks are submitted. It is not measured from when the task starts running: a profile whose
 * result is collected late has had extra time to finish, while a task still queued behind slow
 * ones may time out without having run. The overall match timeout of the caller bounds the total.
 * <p>
 * If the calling thread is interrupted, evaluation stops early and returns the matches found so
 * far with the interrupt flag still set. Callers must treat such a result as partial.
 */
public class Evaluator implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(Evaluator.class.getName());

    private final int sequentialThreshold;
    private final Duration profileTimeout;
    private final ExecutorService workers;

    private final Counter evaluations;
    private final Counter timeouts;
    private final Counter failures;

    public Evaluator(int sequentialThreshold, int parallelism, Duration profileTimeout, MetricsRegistry metrics) {
        this.sequentialThreshold = sequentialThreshold;
        this.profileTimeout = profileTimeout;
        this.workers = Executors.newFixedThreadPool(parallelism,
                new ThreadFactoryBuilder()
                        .setNameFormat("surveillance-evaluator-%d")
                        .setDaemon(true)
                        .build());
        this.evaluations = metrics.counter("surveillance_profile_evaluations_total");
        this.timeouts = metrics.counter("surveillance_profile_evaluation_timeouts_total");
        this.failures = metrics.counter("surveillance_profile_evaluation_failures_total");
    }

    /**
     * @return ids of the candidate profiles whose filter matched, in ordinal order
     */
    public Set<String> evaluate(Killmail killmail, Generation generation, RoaringBitmap candidates) {
        int count = candidates.getCardinality();
        if (count == 0) {
            return Collections.emptySet();
        }
        evaluations.increment(count);
        return count <= sequentialThreshold
                ? evaluateSequential(killmail, generation, candidates)
                : evaluateParallel(killmail, generation, candidates);
    }

    private Set<String> evaluateSequential(Killmail killmail, Generation generation, RoaringBitmap candidates) {
        Set<String> matched = new LinkedHashSet<>();
        IntIterator it = candidates.getIntIterator();
        while (it.hasNext() && !Thread.currentThread().isInterrupted()) {
            CompiledProfile profile = generation.profile(it.next());
            try {
                if (profile.matches(killmail)) {
                    matched.add(profile.id());
                }
            } catch (RuntimeException e) {
                failures.increment();
                logger.log(Level.WARNING, "Profile " + profile.id() + " failed on killmail "
                        + killmail.killmailId(), e);
            }
        }
        return matched;
    }

    private Set<String> evaluateParallel(Killmail killmail, Generation generation, RoaringBitmap candidates) {
        List<CompiledProfile> profiles = new ArrayList<>(candidates.getCardinality());
        List<Future<Boolean>> futures = new ArrayList<>(candidates.getCardinality());
        IntIterator it = candidates.getIntIterator();
        while (it.hasNext()) {
            CompiledProfile profile = generation.profile(it.next());
            profiles.add(profile);
            futures.add(workers.submit(() -> profile.matches(killmail)));
        }

        Set<String> matched = new LinkedHashSet<>();
        for (int i = 0; i < futures.size(); i++) {
            if (Thread.currentThread().isInterrupted()) {
                // get() on a completed future does not check the flag
                futures.subList(i, futures.size()).forEach(f -> f.cancel(true));
                break;
            }
            Future<Boolean> future = futures.get(i);
            CompiledProfile profile = profiles.get(i);
            try {
                if (future.get(profileTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    matched.add(profile.id());
                }
            } catch (TimeoutException e) {
                future.cancel(true);
                timeouts.increment();
                logger.warning("Profile " + profile.id() + " timed out on killmail " + killmail.killmailId());
            } catch (ExecutionException e) {
                failures.increment();
                logger.log(Level.WARNING, "Profile " + profile.id() + " failed on killmail "
                        + killmail.killmailId(), e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.subList(i, futures.size()).forEach(f -> f.cancel(true));
                break;
            }
        }
        return matched;
    }

    @Override
    public void close() {
        workers.shutdownNow();
    }
}
