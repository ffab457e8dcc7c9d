package com.libragraph.depot.types;

/**
 * Raised when a resource name cannot be parsed or built.
 */
public class PrnException extends IllegalArgumentException {

    public enum Kind {
        INVALID_FORMAT("Invalid PRN format"),
        INVALID_PREFIX("Invalid PRN prefix"),
        UNSUPPORTED_VERSION("Unsupported PRN version"),
        INVALID_ORGANIZATION_ID("Invalid organization ID"),
        INVALID_RESOURCE_ID("Invalid resource ID");

        private final String label;

        Kind(String label) {
            this.label = label;
        }
    }

    private final Kind kind;

    public PrnException(Kind kind, String detail) {
        super(kind.label + ": " + detail);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }
}
