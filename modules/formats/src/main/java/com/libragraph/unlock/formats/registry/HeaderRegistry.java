package com.libragraph.unlock.formats.registry;

import com.libragraph.unlock.formats.api.HeaderEntry;
import com.libragraph.unlock.types.MediaDomain;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Magic-byte tables for audio and image formats.
 *
 * <p>Each domain has one canonical list of {@link HeaderEntry} in declaration order.
 * Both lookup directions are derived from that list when the registry is built:
 * header → label scans the list (first match wins), label → header uses a map.
 * A list that would break the one-to-one mapping is rejected.
 */
public class HeaderRegistry {

    private static final Logger log = Logger.getLogger(HeaderRegistry.class);

    private final Map<MediaDomain, List<HeaderEntry>> entries = new EnumMap<>(MediaDomain.class);
    private final Map<MediaDomain, Map<String, HeaderEntry>> byLabel = new EnumMap<>(MediaDomain.class);

    /**
     * Creates the registry with the built-in audio and image tables.
     */
    public HeaderRegistry() {
        this(defaultAudioEntries(), defaultImageEntries());
    }

    /**
     * Creates a registry over caller-supplied tables, kept in the given order.
     *
     * @throws IllegalStateException if a table repeats a label or a magic sequence
     */
    public HeaderRegistry(List<HeaderEntry> audio, List<HeaderEntry> image) {
        register(MediaDomain.AUDIO, audio);
        register(MediaDomain.IMAGE, image);
        log.debugf("HeaderRegistry initialized with %d audio and %d image entries",
                audio.size(), image.size());
    }

    public static List<HeaderEntry> defaultAudioEntries() {
        return List.of(
                HeaderEntry.ofAscii("fLaC", "flac"),
                HeaderEntry.ofAscii("ID3", "mp3"),
                HeaderEntry.ofAscii("OggS", "ogg"),
                HeaderEntry.ofAscii("ftyp", "m4a"),
                // ASF header object GUID
                HeaderEntry.ofHex("3026b2758e66cf11a6d900aa0062ce6c", "wma"),
                HeaderEntry.ofAscii("RIFF", "wav"),
                HeaderEntry.ofHex("fff1", "aac"),
                HeaderEntry.ofAscii("FRM8", "dff"),
                HeaderEntry.ofAscii("MAC ", "ape")
        );
    }

    public static List<HeaderEntry> defaultImageEntries() {
        return List.of(
                HeaderEntry.ofHex("89504e470d0a1a0a", "image/png"),
                HeaderEntry.ofHex("ffd8ff", "image/jpeg"),
                HeaderEntry.ofAscii("BM", "image/bmp")
        );
    }

    private void register(MediaDomain domain, List<HeaderEntry> table) {
        List<HeaderEntry> ordered = new ArrayList<>(table.size());
        Map<String, HeaderEntry> labels = new LinkedHashMap<>();

        for (HeaderEntry entry : table) {
            for (HeaderEntry existing : ordered) {
                if (existing.hasMagic(entry.magicBytes())) {
                    throw new IllegalStateException("Duplicate " + domain.label()
                            + " magic bytes for labels '" + existing.label() + "' and '" + entry.label() + "'");
                }
            }
            if (labels.putIfAbsent(entry.label(), entry) != null) {
                throw new IllegalStateException("Duplicate " + domain.label() + " label: " + entry.label());
            }
            ordered.add(entry);
        }

        entries.put(domain, Collections.unmodifiableList(ordered));
        byLabel.put(domain, Collections.unmodifiableMap(labels));
    }

    /**
     * Entries of the domain in declaration order.
     */
    public List<HeaderEntry> entries(MediaDomain domain) {
        return entries.get(domain);
    }

    /**
     * Labels of the domain in declaration order.
     */
    public List<String> labels(MediaDomain domain) {
        return List.copyOf(byLabel.get(domain).keySet());
    }

    /**
     * Length of the longest magic sequence in the domain, i.e. how many
     * bytes a caller must read to be able to match every entry.
     */
    public int maxHeaderLength(MediaDomain domain) {
        int max = 0;
        for (HeaderEntry entry : entries.get(domain)) {
            max = Math.max(max, entry.length());
        }
        return max;
    }

    /**
     * Returns the label of the first entry whose magic bytes prefix {@code data}.
     */
    public Optional<String> labelFor(byte[] data, MediaDomain domain) {
        for (HeaderEntry entry : entries.get(domain)) {
            if (entry.matches(data)) {
                return Optional.of(entry.label());
            }
        }
        return Optional.empty();
    }

    /**
     * Returns a copy of the magic bytes registered for {@code label}.
     * The label is matched exactly; see {@code FormatSniffer} for normalisation.
     */
    public Optional<byte[]> headerFor(String label, MediaDomain domain) {
        return Optional.ofNullable(byLabel.get(domain).get(label))
                .map(HeaderEntry::magicBytes);
    }
}
