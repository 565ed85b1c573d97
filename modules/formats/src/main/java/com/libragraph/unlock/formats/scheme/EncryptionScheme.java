package com.libragraph.unlock.formats.scheme;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * An encryption/container scheme and the file-name patterns that select it.
 *
 * @param name     scheme name handed to downstream decoders, e.g. "ncm"
 * @param patterns glob patterns in match order
 */
public record EncryptionScheme(String name, List<GlobPattern> patterns) {

    public static final String NCM = "ncm";
    public static final String QMC = "qmc";

    public EncryptionScheme {
        Objects.requireNonNull(name, "scheme name cannot be null");
        patterns = List.copyOf(patterns);
        if (patterns.isEmpty()) {
            throw new IllegalArgumentException("Scheme " + name + " needs at least one pattern");
        }
    }

    public static EncryptionScheme of(String name, String... globs) {
        return new EncryptionScheme(name, Arrays.stream(globs).map(GlobPattern::compile).toList());
    }

    /**
     * Built-in schemes in resolution order.
     */
    public static List<EncryptionScheme> defaults() {
        return List.of(
                of(NCM, "*.ncm"),
                of(QMC,
                        "*.qmc[023468]", "*.qmcflac", "*.qmcogg",
                        "*.tkm",
                        "*.mflac", "*.mflac[0]", "*.mgg", "*.mgg[01l]",
                        "*.bkcmp3", "*.bkcm4a", "*.bkcflac", "*.bkcwav", "*.bkcape", "*.bkcogg", "*.bkcwma")
        );
    }

    /**
     * Returns the first pattern (in declaration order) that matches {@code fileName}.
     */
    public Optional<GlobPattern> matchingPattern(String fileName) {
        return patterns.stream().filter(p -> p.matches(fileName)).findFirst();
    }

    public boolean matches(String fileName) {
        return matchingPattern(fileName).isPresent();
    }
}
