package com.libragraph.unlock.util.buffer;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;

/**
 * Binary data behind a seekable channel, in RAM or wrapping a caller's channel.
 *
 * Implements SeekableByteChannel for direct channel-based access.
 * Provides header reads for format detection.
 *
 * Design principles:
 * - Size is always available
 * - Header reads never move the caller's cursor
 */
public abstract class BinaryData implements SeekableByteChannel {

    /** Hard upper bound for {@link #readHeader(int)}. */
    public static final int MAX_HEADER_SIZE = 64 * 1024;

    /**
     * Wraps an existing SeekableByteChannel as BinaryData.
     * The channel is not copied; closing the wrapper closes the channel.
     */
    public static BinaryData wrap(SeekableByteChannel channel) {
        if (channel instanceof BinaryData data) {
            return data;
        }
        return new WrappedBinaryData(channel);
    }

    /**
     * Total size in bytes.
     */
    public abstract long size();

    /**
     * Reads the first N bytes as a header (for format detection).
     * Does not advance the channel position.
     *
     * Hard limit: min(maxBytes, 64KB) to prevent unbounded reads.
     *
     * @param maxBytes maximum bytes to read
     * @return header bytes (may be shorter than maxBytes if the data is smaller)
     */
    public byte[] readHeader(int maxBytes) {
        if (maxBytes < 0) {
            throw new IllegalArgumentException("Negative header size: " + maxBytes);
        }
        int limit = Math.min(maxBytes, MAX_HEADER_SIZE);
        int toRead = (int) Math.min(limit, size());

        try {
            long originalPos = position();
            ByteBuffer buffer = ByteBuffer.allocate(toRead);
            try {
                position(0);
                // Channels may return short reads
                while (buffer.hasRemaining()) {
                    if (read(buffer) == -1) break;
                }
            } finally {
                position(originalPos);
            }

            byte[] header = new byte[buffer.position()];
            buffer.flip();
            buffer.get(header);
            return header;

        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read header", e);
        }
    }
}
