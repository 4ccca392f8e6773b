package de.mirkosertic.archiveindexer.table;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PathPatternMatcher Tests")
class PathPatternMatcherTest {

    @Test
    @DisplayName("Should match files directly inside a directory pattern")
    void shouldMatchSingleLevelWildcard() {
        final PathPatternMatcher matcher = new PathPatternMatcher(List.of("/posts/*.json"));

        assertThat(matcher.matches("/posts/1.json")).isTrue();
        assertThat(matcher.matches("/posts/nested/1.json")).isFalse();
        assertThat(matcher.matches("/posts/1.txt")).isFalse();
    }

    @Test
    @DisplayName("Should match nested files with double wildcard")
    void shouldMatchRecursiveWildcard() {
        final PathPatternMatcher matcher = new PathPatternMatcher(List.of("/comments/**.json"));

        assertThat(matcher.matches("/comments/a.json")).isTrue();
        assertThat(matcher.matches("/comments/2024/01/a.json")).isTrue();
        assertThat(matcher.matches("/posts/a.json")).isFalse();
    }

    @Test
    @DisplayName("Should match if any pattern matches")
    void shouldMatchAnyPattern() {
        final PathPatternMatcher matcher = new PathPatternMatcher(List.of("/posts/*.json", "/profile.json"));

        assertThat(matcher.matches("/profile.json")).isTrue();
        assertThat(matcher.matches("/posts/x.json")).isTrue();
        assertThat(matcher.matches("/other.json")).isFalse();
    }

    @Test
    @DisplayName("Should never match null, empty paths or an empty pattern list")
    void shouldRejectEmptyInput() {
        assertThat(new PathPatternMatcher(List.of("/**")).matches("")).isFalse();
        assertThat(new PathPatternMatcher(List.of("/**")).matches(null)).isFalse();
        assertThat(new PathPatternMatcher(List.of()).matches("/posts/1.json")).isFalse();
    }
}
