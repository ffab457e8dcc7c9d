package com.libragraph.depot.types;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A parsed resource name: {@code prn:1:<organization-uuid>:<type>:<resource-uuid>}.
 *
 * <p>Organization names carry only the first three parts ({@code prn:1:<organization-uuid>})
 * and are parsed with {@link #parseOrganizationId(String)}.
 */
public record Prn(String organizationId, String resourceType, String resourceId) {

    public static final String PREFIX = "prn";
    public static final String VERSION = "1";

    private static final Pattern UUID_PATTERN = Pattern.compile(
            "[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");

    public Prn {
        Objects.requireNonNull(organizationId, "organizationId cannot be null");
        Objects.requireNonNull(resourceType, "resourceType cannot be null");
        Objects.requireNonNull(resourceId, "resourceId cannot be null");
    }

    /**
     * Parses a five-part resource name.
     *
     * @throws PrnException if the name is malformed
     */
    public static Prn parse(String prn) {
        Objects.requireNonNull(prn, "prn cannot be null");
        String[] parts = prn.split(":", -1);
        if (parts.length != 5) {
            throw new PrnException(PrnException.Kind.INVALID_FORMAT,
                    "PRN must have 5 parts separated by colons, got " + parts.length + " parts");
        }
        checkHeader(parts);
        if (!isUuid(parts[4])) {
            throw new PrnException(PrnException.Kind.INVALID_RESOURCE_ID, parts[4]);
        }
        return new Prn(parts[2], parts[3], parts[4]);
    }

    /**
     * Parses an organization name ({@code prn:1:<uuid>}) and returns its organization id.
     */
    public static String parseOrganizationId(String prn) {
        Objects.requireNonNull(prn, "prn cannot be null");
        String[] parts = prn.split(":", -1);
        if (parts.length != 3) {
            throw new PrnException(PrnException.Kind.INVALID_FORMAT,
                    "Organization PRN must have 3 parts separated by colons, got " + parts.length + " parts");
        }
        checkHeader(parts);
        return parts[2];
    }

    public static boolean isUuid(String value) {
        return value != null && UUID_PATTERN.matcher(value).matches();
    }

    public boolean isType(ResourceType type) {
        return type.label().equals(resourceType);
    }

    public String organizationPrn() {
        return PREFIX + ":" + VERSION + ":" + organizationId;
    }

    @Override
    public String toString() {
        return PREFIX + ":" + VERSION + ":" + organizationId + ":" + resourceType + ":" + resourceId;
    }

    private static void checkHeader(String[] parts) {
        if (!PREFIX.equals(parts[0])) {
            throw new PrnException(PrnException.Kind.INVALID_PREFIX, parts[0]);
        }
        if (!VERSION.equals(parts[1])) {
            throw new PrnException(PrnException.Kind.UNSUPPORTED_VERSION, parts[1]);
        }
        if (!isUuid(parts[2])) {
            throw new PrnException(PrnException.Kind.INVALID_ORGANIZATION_ID, parts[2]);
        }
    }
}
