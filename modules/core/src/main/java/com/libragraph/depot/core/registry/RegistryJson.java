package com.libragraph.depot.core.registry;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.libragraph.depot.types.BinaryState;
import com.libragraph.depot.types.PartState;

import java.io.IOException;

/**
 * Jackson setup for the registry wire format: lifecycle states travel as their lowercase names
 * and unknown fields are ignored.
 */
public final class RegistryJson {

    private RegistryJson() {
    }

    public static ObjectMapper configure(ObjectMapper mapper) {
        SimpleModule module = new SimpleModule("depot-registry");
        module.addSerializer(BinaryState.class, new JsonSerializer<>() {
            @Override
            public void serialize(BinaryState value, JsonGenerator gen, SerializerProvider provider) throws IOException {
                gen.writeString(value.wireName());
            }
        });
        module.addDeserializer(BinaryState.class, new JsonDeserializer<>() {
            @Override
            public BinaryState deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
                return BinaryState.fromWireName(p.getValueAsString());
            }
        });
        module.addSerializer(PartState.class, new JsonSerializer<>() {
            @Override
            public void serialize(PartState value, JsonGenerator gen, SerializerProvider provider) throws IOException {
                gen.writeString(value.wireName());
            }
        });
        module.addDeserializer(PartState.class, new JsonDeserializer<>() {
            @Override
            public PartState deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
                return PartState.fromWireName(p.getValueAsString());
            }
        });
        return mapper.registerModule(module)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public static ObjectMapper newMapper() {
        return configure(new ObjectMapper());
    }
}
