package com.libragraph.depot.types;

/**
 * Builds deterministic resource names scoped to one organization.
 */
public final class PrnBuilder {

    private final String organizationId;

    public PrnBuilder(String organizationId) {
        if (!Prn.isUuid(organizationId)) {
            throw new PrnException(PrnException.Kind.INVALID_ORGANIZATION_ID, String.valueOf(organizationId));
        }
        this.organizationId = organizationId;
    }

    /**
     * Creates a builder from an organization name (3 parts) or any resource name (5 parts)
     * in the same organization.
     */
    public static PrnBuilder fromPrn(String prn) {
        int parts = prn.split(":", -1).length;
        return switch (parts) {
            case 3 -> new PrnBuilder(Prn.parseOrganizationId(prn));
            case 5 -> new PrnBuilder(Prn.parse(prn).organizationId());
            default -> throw new PrnException(PrnException.Kind.INVALID_FORMAT,
                    "PRN must have 3 or 5 parts separated by colons, got " + parts + " parts");
        };
    }

    public String organizationId() {
        return organizationId;
    }

    public String artifact(String artifactId) {
        return build(ResourceType.ARTIFACT, artifactId);
    }

    public String artifactVersion(String versionId) {
        return build(ResourceType.ARTIFACT_VERSION, versionId);
    }

    public String binary(String binaryId) {
        return build(ResourceType.BINARY, binaryId);
    }

    public String bundle(String bundleId) {
        return build(ResourceType.BUNDLE, bundleId);
    }

    public String build(ResourceType type, String resourceId) {
        if (!Prn.isUuid(resourceId)) {
            throw new PrnException(PrnException.Kind.INVALID_RESOURCE_ID, String.valueOf(resourceId));
        }
        return new Prn(organizationId, type.label(), resourceId).toString();
    }
}
