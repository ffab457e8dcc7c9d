package com.libragraph.depot.formats.archive;

/**
 * How archive payloads are paired with manifest items.
 */
public enum PayloadMatching {
    /** A payload belongs to a manifest item only when its SHA-256 equals the declared hash. */
    STRICT,
    /**
     * Hash first, then a payload named after the binary id or target, then the first
     * payload nobody has claimed. Every fallback is logged as a warning.
     */
    LENIENT
}
