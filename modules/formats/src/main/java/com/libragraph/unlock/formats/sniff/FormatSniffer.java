package com.libragraph.unlock.formats.sniff;

import com.libragraph.unlock.formats.registry.HeaderRegistry;
import com.libragraph.unlock.types.MediaDomain;
import com.libragraph.unlock.util.buffer.BinaryData;
import jakarta.enterprise.context.ApplicationScoped;

import java.nio.channels.SeekableByteChannel;
import java.util.Objects;
import java.util.Optional;

/**
 * Names the actual content format of a buffer from its leading magic bytes.
 *
 * <p>Pure over its inputs and safe for concurrent use. An empty result means
 * "unsupported" and is not an error: callers decide whether to reject the
 * file or try something else.
 */
@ApplicationScoped
public class FormatSniffer {

    private final HeaderRegistry registry;

    public FormatSniffer() {
        this(new HeaderRegistry());
    }

    public FormatSniffer(HeaderRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
    }

    public HeaderRegistry registry() {
        return registry;
    }

    /**
     * Returns the label of the first registered entry (declaration order) whose
     * magic bytes prefix {@code data}. Empty, short or null data yields empty.
     */
    public Optional<String> identifyFormat(byte[] data, MediaDomain domain) {
        if (data == null) {
            return Optional.empty();
        }
        return registry.labelFor(data, domain);
    }

    /**
     * Identifies the format of a channel's content from offset 0.
     * Reads only as many bytes as the longest magic sequence and leaves the
     * channel position where it was.
     *
     * @throws java.io.UncheckedIOException if the header cannot be read
     */
    public Optional<String> identifyFormat(SeekableByteChannel channel, MediaDomain domain) {
        byte[] header = BinaryData.wrap(channel).readHeader(registry.maxHeaderLength(domain));
        return identifyFormat(header, domain);
    }

    /**
     * Returns the magic bytes registered for {@code label}. A single leading dot
     * is ignored, so "flac" and ".flac" are equivalent.
     */
    public Optional<byte[]> headerForFormat(String label, MediaDomain domain) {
        if (label == null) {
            return Optional.empty();
        }
        return registry.headerFor(normalizeLabel(label), domain);
    }

    public Optional<String> audioFormat(byte[] data) {
        return identifyFormat(data, MediaDomain.AUDIO);
    }

    public Optional<String> imageMime(byte[] data) {
        return identifyFormat(data, MediaDomain.IMAGE);
    }

    public Optional<byte[]> audioHeader(String format) {
        return headerForFormat(format, MediaDomain.AUDIO);
    }

    public Optional<byte[]> imageHeader(String mime) {
        return headerForFormat(mime, MediaDomain.IMAGE);
    }

    static String normalizeLabel(String label) {
        return label.startsWith(".") ? label.substring(1) : label;
    }
}
