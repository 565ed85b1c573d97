/**
 * Pure Java value types shared across all media-unlock modules.
 *
 * <p>Media domains and stream capabilities live here so that both the
 * format registry and downstream decoders can refer to them without
 * pulling in {@code modules/formats}. No framework dependencies.
 */
package com.libragraph.unlock.types;
