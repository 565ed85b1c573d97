package com.libragraph.unlock.util.buffer;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.NonWritableChannelException;
import java.nio.channels.SeekableByteChannel;
import java.util.Arrays;

/**
 * BinaryData implementation using in-memory byte array.
 * Suitable for decrypted blocks and small files.
 *
 * Supports simultaneous read/write operations with automatic growth,
 * unless created with {@link #readOnly(byte[])}.
 */
public class RamBuffer extends BinaryData {
    private byte[] data;
    private long position;
    private long size;  // Logical size (may be less than data.length)
    private final boolean writable;
    private boolean open = true;

    /**
     * Creates empty buffer with initial capacity.
     */
    public RamBuffer(int initialCapacity) {
        this(new byte[initialCapacity], 0, true);
    }

    /**
     * Creates buffer over existing data. The array is not copied.
     */
    public RamBuffer(byte[] data) {
        this(data, data.length, true);
    }

    private RamBuffer(byte[] data, long size, boolean writable) {
        this.data = data;
        this.position = 0;
        this.size = size;
        this.writable = writable;
    }

    /**
     * Creates a buffer whose writes fail with {@link NonWritableChannelException},
     * like a file channel opened for reading only.
     */
    public static RamBuffer readOnly(byte[] data) {
        return new RamBuffer(data, data.length, false);
    }

    public boolean isWritable() {
        return writable;
    }

    @Override
    public long size() {
        return size;
    }

    @Override
    public int read(ByteBuffer dst) throws IOException {
        ensureOpen();
        if (position >= size) {
            return -1;  // EOF
        }

        int remaining = (int) (size - position);
        int toRead = Math.min(remaining, dst.remaining());
        dst.put(data, (int) position, toRead);
        position += toRead;
        return toRead;
    }

    @Override
    public int write(ByteBuffer src) throws IOException {
        ensureOpen();
        if (!writable) {
            throw new NonWritableChannelException();
        }
        int toWrite = src.remaining();
        long endPosition = position + toWrite;

        // Grow array if needed
        if (endPosition > data.length) {
            grow(endPosition);
        }

        src.get(data, (int) position, toWrite);
        position += toWrite;

        // Update logical size if we wrote past end
        if (position > size) {
            size = position;
        }

        return toWrite;
    }

    @Override
    public SeekableByteChannel truncate(long newSize) throws IOException {
        ensureOpen();
        if (!writable) {
            throw new NonWritableChannelException();
        }
        if (newSize < size) {
            size = newSize;
            if (position > size) {
                position = size;
            }
        }
        return this;
    }

    @Override
    public long position() throws IOException {
        ensureOpen();
        return position;
    }

    @Override
    public SeekableByteChannel position(long newPosition) throws IOException {
        ensureOpen();
        if (newPosition < 0) {
            throw new IllegalArgumentException("Negative position: " + newPosition);
        }
        this.position = newPosition;
        return this;
    }

    /**
     * Returns a copy of the logical contents.
     */
    public byte[] toByteArray() {
        return Arrays.copyOf(data, (int) size);
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void close() {
        open = false;
    }

    private void ensureOpen() throws ClosedChannelException {
        if (!open) {
            throw new ClosedChannelException();
        }
    }

    /**
     * Grows the internal array to accommodate the requested size.
     * Doubles capacity each time to amortize growth cost.
     */
    private void grow(long minCapacity) {
        long newCapacity = Math.max(
            data.length * 2L,
            minCapacity
        );

        // Cap at Integer.MAX_VALUE (array size limit)
        if (newCapacity > Integer.MAX_VALUE) {
            newCapacity = Integer.MAX_VALUE;
        }

        data = Arrays.copyOf(data, (int) newCapacity);
    }
}
