package com.libragraph.unlock.formats.stream;

import com.libragraph.unlock.formats.api.NamedStream;
import com.libragraph.unlock.types.Capability;
import com.libragraph.unlock.types.CapabilityFault;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.RandomAccessFile;
import java.io.Reader;
import java.io.Writer;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.ReadableByteChannel;
import java.nio.channels.SeekableByteChannel;
import java.nio.channels.WritableByteChannel;
import java.nio.file.Path;

/**
 * Checks that a caller-supplied stream handle supports what a decoder needs
 * before the handle is passed on.
 *
 * <p>Whether a handle exposes an operation is decided by its type:
 * <ul>
 *   <li>read: {@link ReadableByteChannel}, {@link InputStream}, {@link RandomAccessFile};
 *       a {@link Reader} exposes read but yields text, which is a fault</li>
 *   <li>seek: {@link SeekableByteChannel}, {@link RandomAccessFile},
 *       {@link FileInputStream}, {@link FileOutputStream}</li>
 *   <li>write: {@link WritableByteChannel}, {@link OutputStream}, {@link RandomAccessFile};
 *       a {@link Writer} exposes write but takes text, which is a fault</li>
 * </ul>
 * An exposed operation is then exercised for real: a zero-length read, a seek to
 * end of stream, a zero-length write. File-backed handles are checked through their
 * {@link FileChannel}, so a file opened read-only fails the write check.
 *
 * <p>The seek check leaves the cursor at end of stream unless
 * {@code unlock.stream.restore-position} is enabled. Validation never closes the
 * handle, and validating one handle from several threads must be serialised by the caller.
 */
@ApplicationScoped
public class StreamCapabilityValidator {

    private static final Logger log = Logger.getLogger(StreamCapabilityValidator.class);

    private final boolean restorePosition;

    public StreamCapabilityValidator() {
        this(false);
    }

    @Inject
    public StreamCapabilityValidator(
            @ConfigProperty(name = "unlock.stream.restore-position", defaultValue = "false")
            boolean restorePosition) {
        this.restorePosition = restorePosition;
    }

    public boolean restoresPosition() {
        return restorePosition;
    }

    /**
     * Validates read and seek support.
     *
     * @throws CapabilityException at the first capability that is missing or faulty
     */
    public void validate(Object stream) {
        validate(stream, CapabilityCheck.DEFAULT);
    }

    public void validate(Object stream, boolean read, boolean seek, boolean write) {
        validate(stream, new CapabilityCheck(read, seek, write));
    }

    /**
     * Runs the enabled checks in order read, seek, write and stops at the first failure.
     *
     * @throws CapabilityException naming the failed capability and whether it is
     *                             missing or faulty
     */
    public void validate(Object stream, CapabilityCheck check) {
        if (check.read()) {
            checkRead(stream);
        }
        if (check.seek()) {
            checkSeek(stream);
        }
        if (check.write()) {
            checkWrite(stream);
        }
    }

    private void checkRead(Object stream) {
        if (stream instanceof Reader reader) {
            try {
                reader.read(new char[0], 0, 0);
            } catch (IOException | RuntimeException e) {
                throw fail(Capability.READ, CapabilityFault.FAULTY, stream, "cannot read from stream %s", e);
            }
            throw fail(Capability.READ, CapabilityFault.FAULTY, stream, "stream %s is not opened in binary mode", null);
        }
        if (!(stream instanceof ReadableByteChannel
                || stream instanceof InputStream
                || stream instanceof RandomAccessFile)) {
            throw fail(Capability.READ, CapabilityFault.MISSING, stream, "%s is not a valid stream: no read operation", null);
        }

        try {
            FileChannel channel = fileChannel(stream);
            if (channel != null) {
                channel.read(ByteBuffer.allocate(0));
            } else if (stream instanceof ReadableByteChannel readable) {
                readable.read(ByteBuffer.allocate(0));
            } else {
                ((InputStream) stream).read(new byte[0], 0, 0);
            }
        } catch (IOException | RuntimeException e) {
            throw fail(Capability.READ, CapabilityFault.FAULTY, stream, "cannot read from stream %s", e);
        }
    }

    private void checkSeek(Object stream) {
        SeekableByteChannel channel = fileChannel(stream);
        if (channel == null && stream instanceof SeekableByteChannel seekable) {
            channel = seekable;
        }
        if (channel == null) {
            throw fail(Capability.SEEK, CapabilityFault.MISSING, stream, "%s is not a valid stream: no seek operation", null);
        }

        try {
            if (restorePosition) {
                long prior = channel.position();
                channel.position(channel.size());
                channel.position(prior);
            } else {
                channel.position(channel.size());
            }
        } catch (IOException | RuntimeException e) {
            throw fail(Capability.SEEK, CapabilityFault.FAULTY, stream, "cannot seek in stream %s", e);
        }
    }

    private void checkWrite(Object stream) {
        if (stream instanceof Writer writer) {
            try {
                writer.write(new char[0], 0, 0);
            } catch (IOException | RuntimeException e) {
                throw fail(Capability.WRITE, CapabilityFault.FAULTY, stream, "cannot write to stream %s", e);
            }
            throw fail(Capability.WRITE, CapabilityFault.FAULTY, stream, "stream %s is not opened in binary mode", null);
        }
        if (!(stream instanceof WritableByteChannel
                || stream instanceof OutputStream
                || stream instanceof RandomAccessFile)) {
            throw fail(Capability.WRITE, CapabilityFault.MISSING, stream, "%s is not a valid stream: no write operation", null);
        }

        try {
            FileChannel channel = fileChannel(stream);
            if (channel != null) {
                channel.write(ByteBuffer.allocate(0));
            } else if (stream instanceof WritableByteChannel writable) {
                writable.write(ByteBuffer.allocate(0));
            } else {
                ((OutputStream) stream).write(new byte[0]);
            }
        } catch (IOException | RuntimeException e) {
            throw fail(Capability.WRITE, CapabilityFault.FAULTY, stream, "cannot write to stream %s", e);
        }
    }

    /**
     * The file channel behind a file-backed handle, or null for other handles.
     */
    private static FileChannel fileChannel(Object stream) {
        if (stream instanceof RandomAccessFile file) {
            return file.getChannel();
        }
        if (stream instanceof FileInputStream in) {
            return in.getChannel();
        }
        if (stream instanceof FileOutputStream out) {
            return out.getChannel();
        }
        return null;
    }

    private static CapabilityException fail(Capability capability, CapabilityFault fault,
                                            Object stream, String format, Throwable cause) {
        String message = String.format(format, describe(stream));
        log.debugf("%s check failed (%s): %s", capability.label(), fault, message);
        return new CapabilityException(capability, fault, message, cause);
    }

    private static String describe(Object stream) {
        String name = displayName(stream);
        if (!name.isEmpty()) {
            return name;
        }
        // toString() of buffering handles renders their contents
        return stream == null ? "null" : stream.getClass().getName();
    }

    /**
     * Tells an already-open handle apart from data or a path that still needs opening.
     * Text, raw bytes, {@link Path} and {@link File} values are not stream-like; null is not either.
     */
    public static boolean isStreamLike(Object value) {
        return value != null
                && !(value instanceof CharSequence)
                && !(value instanceof byte[])
                && !(value instanceof Path)
                && !(value instanceof File);
    }

    /**
     * Name of a {@link NamedStream} for diagnostics; non-textual names are rendered
     * with {@code toString()}. Other handles, and null names, give "".
     */
    public static String displayName(Object stream) {
        if (!(stream instanceof NamedStream named)) {
            return "";
        }
        Object name = named.name();
        if (name == null) {
            return "";
        }
        return name instanceof CharSequence text ? text.toString() : name.toString();
    }
}
