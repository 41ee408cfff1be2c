package com.architecture.memory.inevitability.service.cache;

import com.architecture.memory.inevitability.model.intervention.InterventionSet;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class AnalysisCacheTest {

    private final AnalysisCache cache = new AnalysisCache();

    @Test
    void computesOnce_forRepeatedKey() {
        AtomicInteger computations = new AtomicInteger();
        CacheKey key = CacheKey.of("scm:v1:a", "mcs", "goal", "q1");

        String first = cache.getOrCompute(key, String.class, () -> "value-" + computations.incrementAndGet());
        String second = cache.getOrCompute(key, String.class, () -> "value-" + computations.incrementAndGet());

        assertThat(first).isEqualTo("value-1");
        assertThat(second).isEqualTo("value-1");
        assertThat(computations.get()).isEqualTo(1);
        assertThat(cache.getHits()).isEqualTo(1);
        assertThat(cache.getMisses()).isEqualTo(1);
    }

    @Test
    void invalidatesOnlyEntriesOfGivenVersion() {
        cache.put(CacheKey.of("scm:v1:a", "mcs", "g1", "q"), "a1");
        cache.put(CacheKey.of("scm:v1:a", "do", null, "q"), "a2");
        cache.put(CacheKey.of("scm:v1:b", "mcs", "g1", "q"), "b1");

        assertThat(cache.invalidate("scm:v1:a")).isEqualTo(2);
        assertThat(cache.size()).isEqualTo(1);
        assertThat(cache.get(CacheKey.of("scm:v1:b", "mcs", "g1", "q"), String.class)).contains("b1");
    }

    @Test
    void evictsValuesMatchingPredicate() {
        cache.put(CacheKey.of("v", "k", "g", "1"), "keep");
        cache.put(CacheKey.of("v", "k", "g", "2"), "drop");
        cache.put(CacheKey.of("v", "k", "g", "3"), 42);

        assertThat(cache.evictValues(String.class, "drop"::equals)).isEqualTo(1);
        assertThat(cache.size()).isEqualTo(2);
    }

    @Test
    void generatesEqualKeys_forEqualInterventionSets() {
        InterventionSet forward = InterventionSet.empty().with("a", true).with("b", false);
        InterventionSet backward = InterventionSet.empty().with("b", false).with("a", true);

        assertThat(CacheKeyGenerator.forInterventions(forward))
                .isEqualTo(CacheKeyGenerator.forInterventions(backward))
                .startsWith("do:v1:");
        assertThat(CacheKeyGenerator.forInterventions(forward))
                .isNotEqualTo(CacheKeyGenerator.forInterventions(InterventionSet.empty().with("a", true)));
    }
}
