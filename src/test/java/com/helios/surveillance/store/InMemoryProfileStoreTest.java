package com.helios.surveillance.store;

import com.helios.surveillance.model.Profile;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryProfileStoreTest {

    private static Profile profile(String id) {
        return Profile.active(id, id, Map.of());
    }

    @Test
    void shouldKeepInsertionOrderAndFilterInactive() throws ProfileStoreException {
        InMemoryProfileStore store = new InMemoryProfileStore(List.of(profile("b"), profile("a")));
        store.put(profile("c").withActive(false));

        assertThat(store.findActiveProfiles()).extracting(Profile::id).containsExactly("b", "a");
    }

    @Test
    void shouldReplaceProfileWithSameId() throws ProfileStoreException {
        InMemoryProfileStore store = new InMemoryProfileStore();
        store.put(profile("a"));
        store.put(Profile.active("a", "renamed", Map.of()));
        store.remove("missing");

        assertThat(store.findActiveProfiles()).extracting(Profile::name).containsExactly("renamed");
    }

    @Test
    void shouldThrowWhileUnavailable() throws ProfileStoreException {
        InMemoryProfileStore store = new InMemoryProfileStore(List.of(profile("a")));
        store.setAvailable(false);

        assertThatThrownBy(store::findActiveProfiles).isInstanceOf(ProfileStoreException.class);

        store.setAvailable(true);
        assertThat(store.findActiveProfiles()).hasSize(1);
    }

    @Test
    void matchStoreShouldAccumulateCounts() {
        InMemoryMatchStore store = new InMemoryMatchStore();
        Instant first = Instant.parse("2024-05-01T00:00:00Z");

        store.incrementMatchCount("a", 2, first.plusSeconds(60));
        store.incrementMatchCount("a", 3, first);

        assertThat(store.matchCount("a")).isEqualTo(5);
        assertThat(store.lastMatchAt("a")).isEqualTo(first.plusSeconds(60));
        assertThat(store.records("a")).isEmpty();
    }
}
