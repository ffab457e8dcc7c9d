package com.libragraph.depot.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.libragraph.depot.core.registry.RegistryJson;
import io.quarkus.jackson.ObjectMapperCustomizer;
import jakarta.inject.Singleton;

/**
 * Makes the application's {@link ObjectMapper} print registry resources the way the registry
 * spells them.
 */
@Singleton
public class RegistryObjectMapperCustomizer implements ObjectMapperCustomizer {

    @Override
    public void customize(ObjectMapper mapper) {
        RegistryJson.configure(mapper).enable(SerializationFeature.INDENT_OUTPUT);
    }
}
