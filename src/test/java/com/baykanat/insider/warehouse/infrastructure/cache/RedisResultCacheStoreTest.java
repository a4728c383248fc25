package com.baykanat.insider.warehouse.infrastructure.cache;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the SCAN pattern built by {@link RedisResultCacheStore}.
 */
class RedisResultCacheStoreTest {

    @Test
    @DisplayName("Plain prefixes are used as-is")
    void plainPrefix() {
        assertThat(RedisResultCacheStore.escapeGlob("warehouse:subject_performance:"))
                .isEqualTo("warehouse:subject_performance:");
    }

    @Test
    @DisplayName("Glob metacharacters in the prefix are matched literally")
    void escapesGlobCharacters() {
        assertThat(RedisResultCacheStore.escapeGlob("a*b?c[d]e\\f"))
                .isEqualTo("a\\*b\\?c\\[d\\]e\\\\f");
    }
}
