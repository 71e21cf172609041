package com.perfsentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link SeriesIdentifier}.
 */
class SeriesIdentifierTest {

    @Test
    @DisplayName("Plain components should join with slashes")
    void shouldJoinPlainComponents() {
        SeriesIdentifier id = new SeriesIdentifier("sys-perf", "linux-standalone", "bestbuy_agg", "count", "4");

        assertThat(id.key()).isEqualTo("sys-perf/linux-standalone/bestbuy_agg/count/4");
    }

    @Test
    @DisplayName("Identifiers differing only in where a slash falls should have different keys")
    void shouldNotCollideOnEmbeddedSlash() {
        SeriesIdentifier first = new SeriesIdentifier("sys/perf", "linux", "insert", "Insert.Doc", "1");
        SeriesIdentifier second = new SeriesIdentifier("sys", "perf/linux", "insert", "Insert.Doc", "1");

        assertThat(first).isNotEqualTo(second);
        assertThat(first.key()).isNotEqualTo(second.key());
        assertThat(first.key()).isEqualTo("sys\\/perf/linux/insert/Insert.Doc/1");
    }

    @Test
    @DisplayName("Escaped backslashes should not be confused with escaped slashes")
    void shouldNotCollideOnBackslash() {
        SeriesIdentifier first = new SeriesIdentifier("a\\", "b/c", "t", "x", "1");
        SeriesIdentifier second = new SeriesIdentifier("a/b\\", "c", "t", "x", "1");

        assertThat(first.key()).isEqualTo("a\\\\/b\\/c/t/x/1");
        assertThat(second.key()).isEqualTo("a\\/b\\\\/c/t/x/1");
        assertThat(first.key()).isNotEqualTo(second.key());
    }
}
