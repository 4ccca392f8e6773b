package de.mirkosertic.archiveindexer.table;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;

/**
 * Matches archive file paths such as {@code /posts/1.json} against glob patterns.
 * A path matches if any of the patterns matches the full path.
 */
public class PathPatternMatcher {

    private final List<String> patterns;
    private final List<PathMatcher> matchers;

    public PathPatternMatcher(final List<String> patterns) {
        this.patterns = List.copyOf(patterns);
        this.matchers = patterns.stream()
                .map(pattern -> FileSystems.getDefault().getPathMatcher("glob:" + pattern))
                .toList();
    }

    public boolean matches(final String path) {
        if (path == null || path.isEmpty()) {
            return false;
        }
        final Path candidate = Path.of(path);
        for (final PathMatcher matcher : matchers) {
            if (matcher.matches(candidate)) {
                return true;
            }
        }
        return false;
    }

    public List<String> getPatterns() {
        return patterns;
    }
}
