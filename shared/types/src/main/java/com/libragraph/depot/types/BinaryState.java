package com.libragraph.depot.types;

/**
 * Lifecycle of a binary in the registry.
 *
 * <p>Forward order: {@code UPLOADABLE → HASHABLE → HASHING → SIGNABLE → SIGNED}. No step may be
 * skipped. {@code DESTROYED} is terminal and reachable from any state before {@code SIGNED}.
 * A binary that is not yet signed may also be reset to {@code UPLOADABLE} when its content changes.
 * {@code UNRECOGNIZED} stands for any state name this client does not know; it permits nothing.
 */
public enum BinaryState {
    UPLOADABLE("uploadable"),
    HASHABLE("hashable"),
    HASHING("hashing"),
    SIGNABLE("signable"),
    SIGNED("signed"),
    DESTROYED("destroyed"),
    UNRECOGNIZED("unrecognized");

    private final String wireName;

    BinaryState(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static BinaryState fromWireName(String name) {
        if (name == null) return UNRECOGNIZED;
        for (BinaryState s : values()) {
            if (s.wireName.equalsIgnoreCase(name)) return s;
        }
        return UNRECOGNIZED;
    }

    /** True while the binary can still move through the pipeline. */
    public boolean isLive() {
        return this != SIGNED && this != DESTROYED && this != UNRECOGNIZED;
    }

    public boolean canTransitionTo(BinaryState next) {
        if (!isLive()) return false;
        if (next == DESTROYED || next == UPLOADABLE) return true;
        return next.ordinal() == ordinal() + 1;
    }

    /**
     * @throws InvalidStateTransitionException when {@code next} is not reachable from this state
     */
    public BinaryState requireTransition(BinaryState next) {
        if (!canTransitionTo(next)) {
            throw new InvalidStateTransitionException(this, next);
        }
        return next;
    }
}
