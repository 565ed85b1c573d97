package com.libragraph.unlock.formats.api;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class HeaderEntryTest {

    @Test
    void shouldMatchPrefix() {
        var entry = HeaderEntry.ofAscii("OggS", "ogg");

        assertThat(entry.matches("OggS\0\2rest".getBytes())).isTrue();
        assertThat(entry.matches("OggS".getBytes())).isTrue();
    }

    @Test
    void shouldNotMatchShortOrEmptyData() {
        var entry = HeaderEntry.ofAscii("fLaC", "flac");

        assertThat(entry.matches("fLa".getBytes())).isFalse();
        assertThat(entry.matches(new byte[0])).isFalse();
        assertThat(entry.matches(null)).isFalse();
    }

    @Test
    void shouldNotMatchMagicAtLaterOffset() {
        var entry = HeaderEntry.ofAscii("ID3", "mp3");

        assertThat(entry.matches("xID3".getBytes())).isFalse();
    }

    @Test
    void shouldParseHexMagic() {
        var entry = HeaderEntry.ofHex("fff1", "aac");

        assertThat(entry.magicBytes()).containsExactly(0xFF, 0xF1);
        assertThat(entry.length()).isEqualTo(2);
        assertThat(entry).hasToString("aac=fff1");
    }

    @Test
    void shouldDefensiveCopyMagicBytes() {
        byte[] magic = {'B', 'M'};
        var entry = new HeaderEntry(magic, "image/bmp");

        magic[0] = 'X';
        assertThat(entry.magicBytes()).containsExactly('B', 'M');

        entry.magicBytes()[1] = 'X';
        assertThat(entry.magicBytes()).containsExactly('B', 'M');
    }

    @Test
    void shouldRejectEmptyMagic() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> new HeaderEntry(new byte[0], "none"))
                .withMessageContaining("none");
    }

    @Test
    void shouldCompareByContent() {
        assertThat(HeaderEntry.ofAscii("RIFF", "wav"))
                .isEqualTo(HeaderEntry.ofHex("52494646", "wav"))
                .hasSameHashCodeAs(HeaderEntry.ofHex("52494646", "wav"))
                .isNotEqualTo(HeaderEntry.ofAscii("RIFF", "avi"));
    }
}
