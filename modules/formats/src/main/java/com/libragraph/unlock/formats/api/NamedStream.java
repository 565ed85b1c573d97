package com.libragraph.unlock.formats.api;

/**
 * A stream handle that carries an identifying name, usually the file it was opened from.
 * Used only for diagnostics.
 */
public interface NamedStream {

    /**
     * The identifying name, or null if the handle has none.
     * Non-textual names are rendered with {@code toString()}.
     */
    Object name();
}
