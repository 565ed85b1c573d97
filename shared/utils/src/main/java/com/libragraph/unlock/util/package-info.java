/**
 * Shared utilities for all media-unlock modules.
 *
 * <p>Contains {@link com.libragraph.unlock.util.ByteXor} and the
 * {@link com.libragraph.unlock.util.buffer buffer layer} (BinaryData, RamBuffer).
 * No framework dependencies, pure Java.
 */
package com.libragraph.unlock.util;
