/**
 * Classification front end for the media decoders.
 *
 * <p>{@link com.libragraph.unlock.formats.sniff.FormatSniffer} names the content format of
 * a buffer from its magic bytes, {@link com.libragraph.unlock.formats.scheme.ExtensionClassifier}
 * picks the encryption scheme of a file from its name, and
 * {@link com.libragraph.unlock.formats.stream.StreamCapabilityValidator} checks a stream handle
 * before it is handed to a decoder. An empty result from either classifier means
 * "unsupported", never an error.
 */
package com.libragraph.unlock.formats;
