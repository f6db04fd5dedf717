package com.embeddingstudio.vectordb.common.serialization;

import com.embeddingstudio.vectordb.common.payload.Payload;
import com.embeddingstudio.vectordb.common.payload.PayloadValue;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;

/**
 * Reads a JSON object into a {@link Payload}. Top-level JSON null maps to an empty payload.
 */
public class PayloadDeserializer extends StdDeserializer<Payload> {

    public PayloadDeserializer() {
        super(Payload.class);
    }

    @Override
    public Payload deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        JsonNode node = parser.getCodec().readTree(parser);
        if (node == null || node.isNull()) {
            return Payload.empty();
        }
        if (!node.isObject()) {
            return (Payload) context.handleUnexpectedToken(Payload.class, parser);
        }
        PayloadValue.MapValue map = (PayloadValue.MapValue) PayloadValueDeserializer.fromNode(node);
        return Payload.ofValues(map.values());
    }

    @Override
    public Payload getNullValue(DeserializationContext context) {
        return Payload.empty();
    }
}
