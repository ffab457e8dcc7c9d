package com.libragraph.depot.core.registry;

/**
 * A resource that must exist is missing from the registry.
 */
public class ResourceNotFoundException extends RegistryException {

    public ResourceNotFoundException(String resourceType, String prn) {
        super(resourceType + " not found: " + prn, 404, null);
    }
}
