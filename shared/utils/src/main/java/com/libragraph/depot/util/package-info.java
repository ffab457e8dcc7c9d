/**
 * Shared utilities for all Depot modules.
 *
 * <p>Contains {@link com.libragraph.depot.util.ContentHash} (SHA-256), the
 * {@link com.libragraph.depot.util.ChunkPlanner} used for multipart uploads and the
 * {@link com.libragraph.depot.util.buffer buffer layer} (BinaryData, Buffer, RamBuffer, FileBuffer).
 * No framework dependencies.
 */
package com.libragraph.depot.util;
