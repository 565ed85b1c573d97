package com.libragraph.unlock.formats.scheme;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Shell-style wildcard pattern matched against a whole file name.
 *
 * <ul>
 *   <li>{@code *} matches any run of characters, including none</li>
 *   <li>{@code ?} matches exactly one character</li>
 *   <li>{@code [abc]}, {@code [a-z]} match one character of the class;
 *       {@code [!...]} negates it</li>
 *   <li>a {@code ]} right after {@code [} or {@code [!} is a class member,
 *       and a {@code [} that is never closed is a literal</li>
 * </ul>
 *
 * Characters are Unicode code points, so a surrogate pair is one character.
 * Matching is case-sensitive and anchored at both ends. Unlike
 * {@code PathMatcher} globs, {@code /} and braces have no special meaning.
 */
public final class GlobPattern {

    private interface Token {
        boolean matches(int codePoint);
    }

    private record Literal(int value) implements Token {
        @Override
        public boolean matches(int codePoint) {
            return codePoint == value;
        }
    }

    private record AnyChar() implements Token {
        @Override
        public boolean matches(int codePoint) {
            return true;
        }
    }

    private record AnyRun() implements Token {
        @Override
        public boolean matches(int codePoint) {
            return true;
        }
    }

    private record CharClass(int[] lows, int[] highs, boolean negated) implements Token {
        @Override
        public boolean matches(int codePoint) {
            boolean member = false;
            for (int i = 0; i < lows.length; i++) {
                if (codePoint >= lows[i] && codePoint <= highs[i]) {
                    member = true;
                    break;
                }
            }
            return member != negated;
        }
    }

    private final String pattern;
    private final List<Token> tokens;

    private GlobPattern(String pattern, List<Token> tokens) {
        this.pattern = pattern;
        this.tokens = tokens;
    }

    public static GlobPattern compile(String pattern) {
        Objects.requireNonNull(pattern, "pattern cannot be null");
        int[] cps = pattern.codePoints().toArray();
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        while (i < cps.length) {
            int c = cps[i++];
            switch (c) {
                case '*' -> {
                    // Consecutive stars are equivalent to one
                    if (tokens.isEmpty() || !(tokens.get(tokens.size() - 1) instanceof AnyRun)) {
                        tokens.add(new AnyRun());
                    }
                }
                case '?' -> tokens.add(new AnyChar());
                case '[' -> {
                    int end = findClassEnd(cps, i);
                    if (end < 0) {
                        tokens.add(new Literal('['));
                    } else {
                        tokens.add(parseClass(cps, i, end));
                        i = end + 1;
                    }
                }
                default -> tokens.add(new Literal(c));
            }
        }
        return new GlobPattern(pattern, List.copyOf(tokens));
    }

    /**
     * Index of the {@code ]} closing a class whose body starts at {@code start}, or -1.
     */
    private static int findClassEnd(int[] cps, int start) {
        int j = start;
        int n = cps.length;
        if (j < n && cps[j] == '!') j++;
        if (j < n && cps[j] == ']') j++;
        while (j < n && cps[j] != ']') j++;
        return j < n ? j : -1;
    }

    private static CharClass parseClass(int[] cps, int start, int end) {
        boolean negated = cps[start] == '!';
        int i = negated ? start + 1 : start;

        List<int[]> ranges = new ArrayList<>();
        while (i < end) {
            int lo = cps[i];
            if (i + 2 < end && cps[i + 1] == '-') {
                int hi = cps[i + 2];
                // A reversed range matches nothing
                if (lo <= hi) {
                    ranges.add(new int[]{lo, hi});
                }
                i += 3;
            } else {
                ranges.add(new int[]{lo, lo});
                i++;
            }
        }

        int[] lows = new int[ranges.size()];
        int[] highs = new int[ranges.size()];
        for (int r = 0; r < ranges.size(); r++) {
            lows[r] = ranges.get(r)[0];
            highs[r] = ranges.get(r)[1];
        }
        return new CharClass(lows, highs, negated);
    }

    /**
     * Checks whether the whole of {@code name} matches this pattern.
     */
    public boolean matches(String name) {
        if (name == null) {
            return false;
        }
        int[] cps = name.codePoints().toArray();
        int t = 0;
        int s = 0;
        int starToken = -1;
        int starPos = -1;
        int size = tokens.size();

        while (s < cps.length) {
            if (t < size && tokens.get(t) instanceof AnyRun) {
                starToken = t++;
                starPos = s;
            } else if (t < size && tokens.get(t).matches(cps[s])) {
                t++;
                s++;
            } else if (starToken >= 0) {
                // Let the last star swallow one more character and retry
                t = starToken + 1;
                s = ++starPos;
            } else {
                return false;
            }
        }
        while (t < size && tokens.get(t) instanceof AnyRun) {
            t++;
        }
        return t == size;
    }

    public String pattern() {
        return pattern;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof GlobPattern other)) return false;
        return pattern.equals(other.pattern);
    }

    @Override
    public int hashCode() {
        return pattern.hashCode();
    }

    @Override
    public String toString() {
        return pattern;
    }
}
