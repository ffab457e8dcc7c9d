package com.libragraph.depot.types;

public class InvalidStateTransitionException extends IllegalStateException {

    private final BinaryState from;
    private final BinaryState to;

    public InvalidStateTransitionException(BinaryState from, BinaryState to) {
        super("Binary cannot move from " + from.wireName() + " to " + to.wireName());
        this.from = from;
        this.to = to;
    }

    public BinaryState from() {
        return from;
    }

    public BinaryState to() {
        return to;
    }
}
