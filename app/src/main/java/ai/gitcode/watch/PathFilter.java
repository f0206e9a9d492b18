package ai.gitcode.watch;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.jetbrains.annotations.VisibleForTesting;

/**
 * Decides whether a changed path should be ignored, given an ordered list of glob patterns.
 *
 * <p>Pattern semantics (all matching is case-sensitive):
 * <ul>
 *   <li><b>Directory name</b> (trailing {@code /}): matches any path containing a component with that name at any
 *       depth. Example: {@code node_modules/} excludes {@code a/node_modules/b.js}.
 *   <li><b>Extension pattern</b> ({@code *.ext} without further wildcards): matched against the final component.
 *   <li><b>Glob pattern</b>: {@code *}, {@code ?} and {@code [...]} never cross {@code /}, {@code **} does. Matched
 *       against the full relative path or the final component.
 * </ul>
 *
 * <p>Instances are immutable and safe to share between threads.
 */
public final class PathFilter {
    /** Patterns ignored unless the caller opts out: VCS metadata, bytecode caches, logs, temp and OS files. */
    public static final List<String> DEFAULT_PATTERNS =
            List.of(".git/", "__pycache__/", "*.pyc", "*.log", "*.tmp", ".DS_Store", "Thumbs.db");

    private static final PathFilter NONE = new PathFilter(List.of(), List.of());

    private final List<String> patterns;
    private final List<CompiledPattern> compiled;

    private PathFilter(List<String> patterns, List<CompiledPattern> compiled) {
        this.patterns = patterns;
        this.compiled = compiled;
    }

    private sealed interface CompiledPattern {
        boolean matches(String relativePath, String fileName);

        record DirectoryName(String name) implements CompiledPattern {
            @Override
            public boolean matches(String relativePath, String fileName) {
                // only directory components count, so the final component is skipped
                int start = 0;
                int slash;
                while ((slash = relativePath.indexOf('/', start)) >= 0) {
                    if (relativePath.regionMatches(start, name, 0, name.length()) && slash - start == name.length()) {
                        return true;
                    }
                    start = slash + 1;
                }
                return false;
            }
        }

        record Extension(String suffix) implements CompiledPattern {
            @Override
            public boolean matches(String relativePath, String fileName) {
                return fileName.endsWith(suffix);
            }
        }

        record Glob(Pattern regex) implements CompiledPattern {
            @Override
            public boolean matches(String relativePath, String fileName) {
                return regex.matcher(relativePath).matches()
                        || regex.matcher(fileName).matches();
            }
        }
    }

    public static PathFilter none() {
        return NONE;
    }

    /**
     * Compile the given patterns, in order.
     *
     * @throws IllegalArgumentException if a pattern is blank or contains a NUL character
     */
    public static PathFilter of(List<String> patterns) {
        if (patterns.isEmpty()) {
            return NONE;
        }
        var compiled = new ArrayList<CompiledPattern>(patterns.size());
        for (String pattern : patterns) {
            compiled.add(compile(pattern));
        }
        return new PathFilter(List.copyOf(patterns), List.copyOf(compiled));
    }

    /** {@link #DEFAULT_PATTERNS} followed by {@code patterns}. */
    public static PathFilter withDefaults(List<String> patterns) {
        var all = new ArrayList<String>(DEFAULT_PATTERNS.size() + patterns.size());
        all.addAll(DEFAULT_PATTERNS);
        all.addAll(patterns);
        return of(all);
    }

    public boolean shouldIgnore(String relativePath) {
        var normalized = toUnixPath(relativePath);
        while (normalized.startsWith("./")) {
            normalized = normalized.substring(2);
        }
        if (normalized.isEmpty()) {
            return false;
        }
        int lastSlash = normalized.lastIndexOf('/');
        var fileName = lastSlash >= 0 ? normalized.substring(lastSlash + 1) : normalized;
        for (var pattern : compiled) {
            if (pattern.matches(normalized, fileName)) {
                return true;
            }
        }
        return false;
    }

    public List<String> patterns() {
        return patterns;
    }

    @Override
    public String toString() {
        return "PathFilter" + patterns;
    }

    private static CompiledPattern compile(String pattern) {
        if (pattern.isBlank()) {
            throw new IllegalArgumentException("Ignore pattern must not be blank");
        }
        if (pattern.indexOf('\0') >= 0) {
            throw new IllegalArgumentException("Ignore pattern contains a NUL character: " + pattern.replace('\0', '?'));
        }
        var unix = toUnixPath(pattern.trim());

        if (unix.endsWith("/")) {
            var name = unix.substring(0, unix.length() - 1);
            if (name.isEmpty() || name.contains("/")) {
                // "a/b/" is a path prefix, not a directory name
                return new CompiledPattern.Glob(globToRegex(unix + "**"));
            }
            if (hasWildcard(name)) {
                return new CompiledPattern.Glob(globToRegex("**/" + unix + "**"));
            }
            return new CompiledPattern.DirectoryName(name);
        }

        if (unix.startsWith("*.") && !unix.contains("/")) {
            var suffix = unix.substring(1);
            if (!hasWildcard(suffix)) {
                return new CompiledPattern.Extension(suffix);
            }
        }

        return new CompiledPattern.Glob(globToRegex(unix));
    }

    /**
     * Convert a glob pattern to a regex. {@code **} matches anything including {@code /}, {@code *} anything except
     * {@code /}, {@code ?} exactly one character except {@code /}. {@code [abc]}, {@code [a-z]} and {@code [!abc]}
     * match one character from (or not from) the set; a {@code [} without a closing {@code ]} is literal.
     */
    @VisibleForTesting
    static Pattern globToRegex(String glob) {
        var regex = new StringBuilder();
        int i = 0;
        while (i < glob.length()) {
            char c = glob.charAt(i);
            if (c == '*') {
                if (i + 1 < glob.length() && glob.charAt(i + 1) == '*') {
                    i += 2;
                    if (i < glob.length() && glob.charAt(i) == '/') {
                        // zero or more whole directories
                        regex.append("(?:.*/)?");
                        i++;
                    } else {
                        regex.append(".*");
                    }
                } else {
                    regex.append("[^/]*");
                    i++;
                }
            } else if (c == '?') {
                regex.append("[^/]");
                i++;
            } else if (c == '[' && closingBracket(glob, i) > 0) {
                int close = closingBracket(glob, i);
                appendCharClass(regex, glob.substring(i + 1, close));
                i = close + 1;
            } else if (".^$+[]{}()|\\".indexOf(c) >= 0) {
                regex.append('\\').append(c);
                i++;
            } else {
                regex.append(c);
                i++;
            }
        }
        return Pattern.compile(regex.toString());
    }

    /** Index of the {@code ]} closing the class opened at {@code open}, or -1. A leading {@code ]} is a member. */
    private static int closingBracket(String glob, int open) {
        int i = open + 1;
        if (i < glob.length() && glob.charAt(i) == '!') {
            i++;
        }
        if (i < glob.length() && glob.charAt(i) == ']') {
            i++;
        }
        return glob.indexOf(']', i);
    }

    private static void appendCharClass(StringBuilder regex, String body) {
        regex.append('[');
        int start = 0;
        if (body.startsWith("!")) {
            regex.append("^/");
            start = 1;
        }
        for (int i = start; i < body.length(); i++) {
            char c = body.charAt(i);
            if ("\\[]&^".indexOf(c) >= 0) {
                regex.append('\\');
            }
            regex.append(c);
        }
        regex.append(']');
    }

    private static boolean hasWildcard(String pattern) {
        return pattern.contains("*") || pattern.contains("?") || pattern.contains("[");
    }

    private static String toUnixPath(String path) {
        return path.replace('\\', '/');
    }
}
