package com.embeddingstudio.vectordb.common.serialization;

import com.embeddingstudio.vectordb.common.payload.PayloadValue;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads any JSON value into the closed {@link PayloadValue} union.
 */
public class PayloadValueDeserializer extends StdDeserializer<PayloadValue> {

    public PayloadValueDeserializer() {
        super(PayloadValue.class);
    }

    @Override
    public PayloadValue deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        JsonNode node = parser.getCodec().readTree(parser);
        return fromNode(node);
    }

    @Override
    public PayloadValue getNullValue(DeserializationContext context) {
        return PayloadValue.NullValue.INSTANCE;
    }

    static PayloadValue fromNode(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return PayloadValue.NullValue.INSTANCE;
        }
        if (node.isTextual()) {
            return new PayloadValue.StringValue(node.textValue());
        }
        if (node.isBoolean()) {
            return new PayloadValue.BoolValue(node.booleanValue());
        }
        if (node.isNumber()) {
            return new PayloadValue.NumberValue(node.decimalValue());
        }
        if (node.isArray()) {
            List<PayloadValue> values = new ArrayList<>(node.size());
            for (JsonNode element : node) {
                values.add(fromNode(element));
            }
            return new PayloadValue.ListValue(values);
        }
        if (node.isObject()) {
            Map<String, PayloadValue> values = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                values.put(field.getKey(), fromNode(field.getValue()));
            }
            return new PayloadValue.MapValue(values);
        }
        throw new IllegalArgumentException("Unsupported JSON node in payload: " + node.getNodeType());
    }
}
