package com.libragraph.unlock.util.buffer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

import static org.assertj.core.api.Assertions.*;

class BinaryDataTest {

    @Test
    void shouldReadHeaderWithoutMovingPosition() throws Exception {
        RamBuffer buf = new RamBuffer("OggS....payload".getBytes());
        buf.position(7);

        byte[] header = buf.readHeader(4);

        assertThat(new String(header)).isEqualTo("OggS");
        assertThat(buf.position()).isEqualTo(7);
    }

    @Test
    void shouldReturnShortHeaderForSmallData() {
        RamBuffer buf = new RamBuffer("ID".getBytes());

        assertThat(buf.readHeader(16)).containsExactly('I', 'D');
    }

    @Test
    void shouldReturnEmptyHeaderForEmptyData() {
        assertThat(new RamBuffer(0).readHeader(16)).isEmpty();
    }

    @Test
    void shouldRejectNegativeHeaderSize() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> new RamBuffer(0).readHeader(-1));
    }

    @Test
    void shouldWrapFileChannel(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("track.flac");
        Files.write(file, "fLaC\0\0\0\"".getBytes());

        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
            channel.position(3);
            BinaryData data = BinaryData.wrap(channel);

            assertThat(data.size()).isEqualTo(8);
            assertThat(new String(data.readHeader(4))).isEqualTo("fLaC");
            assertThat(channel.position()).isEqualTo(3);
        }
    }

    @Test
    void shouldNotDoubleWrapBinaryData() {
        RamBuffer buf = new RamBuffer(4);

        assertThat(BinaryData.wrap(buf)).isSameAs(buf);
    }
}
