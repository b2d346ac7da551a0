package com.marker.tree.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.marker.exception.MarkerParseException;
import com.marker.tree.MarkerTree;

import java.io.IOException;

/**
 * Jackson module that writes a {@link MarkerTree} as its marker string and reads it back by parsing.
 * <p>
 * Usage:
 * <pre>
 * ObjectMapper mapper = new ObjectMapper().registerModule(new MarkerTreeModule());
 * </pre>
 */
public class MarkerTreeModule extends SimpleModule {

    public MarkerTreeModule() {
        super("MarkerTreeModule");
        addSerializer(MarkerTree.class, new Serializer());
        addDeserializer(MarkerTree.class, new Deserializer());
    }

    static class Serializer extends JsonSerializer<MarkerTree> {
        @Override
        public void serialize(MarkerTree value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
            gen.writeString(value.toString());
        }
    }

    static class Deserializer extends JsonDeserializer<MarkerTree> {
        @Override
        public MarkerTree deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            if (p.currentToken() != JsonToken.VALUE_STRING) {
                return (MarkerTree) ctxt.handleUnexpectedToken(MarkerTree.class, p);
            }
            String text = p.getText();
            try {
                return MarkerTree.parse(text);
            } catch (MarkerParseException e) {
                throw JsonMappingException.from(p, e.getMessage(), e);
            }
        }
    }
}
