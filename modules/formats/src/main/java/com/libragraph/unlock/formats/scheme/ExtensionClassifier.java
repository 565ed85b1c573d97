package com.libragraph.unlock.formats.scheme;

import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Picks the encryption/container scheme of a file from its name.
 *
 * <p>Schemes are tried in declaration order, and within a scheme its patterns
 * in declaration order; the first scheme with a matching pattern wins.
 */
@ApplicationScoped
public class ExtensionClassifier {

    private static final Logger log = Logger.getLogger(ExtensionClassifier.class);

    private final List<EncryptionScheme> schemes;

    public ExtensionClassifier() {
        this(EncryptionScheme.defaults());
    }

    public ExtensionClassifier(List<EncryptionScheme> schemes) {
        this.schemes = List.copyOf(schemes);
        log.debugf("ExtensionClassifier initialized with %d schemes", this.schemes.size());
    }

    public List<EncryptionScheme> schemes() {
        return schemes;
    }

    /**
     * Returns the name of the first scheme whose patterns match the whole of {@code name}.
     */
    public Optional<String> classifyByName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (EncryptionScheme scheme : schemes) {
            if (scheme.matches(name)) {
                return Optional.of(scheme.name());
            }
        }
        return Optional.empty();
    }

    /**
     * Classifies the file name component of {@code path}.
     */
    public Optional<String> classifyByName(Path path) {
        Path fileName = path.getFileName();
        return fileName == null ? Optional.empty() : classifyByName(fileName.toString());
    }

    /**
     * Returns the last dot suffix of the final path component, including the dot,
     * or "" if there is none. Leading dots of the component do not start an
     * extension, so ".bashrc" has none.
     */
    public static String fileExtension(String name) {
        int sepIndex = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        int dotIndex = name.lastIndexOf('.');
        if (dotIndex <= sepIndex) {
            return "";
        }
        for (int i = sepIndex + 1; i < dotIndex; i++) {
            if (name.charAt(i) != '.') {
                return name.substring(dotIndex);
            }
        }
        return "";
    }
}
