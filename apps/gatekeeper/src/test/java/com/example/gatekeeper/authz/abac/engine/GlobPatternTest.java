package com.example.gatekeeper.authz.abac.engine;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class GlobPatternTest {

    @ParameterizedTest(name = "{0} matches {1}: {2}")
    @CsvSource({
            "project:*,        project:42,       true",
            "project:*,        project:,         true",
            "project:*,        projects:1,       false",
            "*,                anything at all,  true",
            "report-?,         report-7,         true",
            "report-?,         report-17,        false",
            "project:secret-*, project:secret-1, true",
            "project:secret-*, project:public,   false",
            "proj,             project,          false",
    })
    @DisplayName("should match whole values")
    void shouldMatch(String pattern, String value, boolean expected) {
        assertThat(GlobPattern.matches(pattern, value)).isEqualTo(expected);
    }

    @Test
    @DisplayName("should treat regex metacharacters literally")
    void shouldQuoteLiterals() {
        assertThat(GlobPattern.matches("a.b", "a.b")).isTrue();
        assertThat(GlobPattern.matches("a.b", "axb")).isFalse();
        assertThat(GlobPattern.matches("(x)+", "(x)+")).isTrue();
        assertThat(GlobPattern.matches("[abc]", "a")).isFalse();
    }
}
