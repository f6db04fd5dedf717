package com.embeddingstudio.vectordb.common.serialization;

import com.embeddingstudio.vectordb.common.payload.PayloadValue;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;
import java.util.Map;

/**
 * Writes a {@link PayloadValue} as the plain JSON value it stands for.
 */
public class PayloadValueSerializer extends StdSerializer<PayloadValue> {

    public PayloadValueSerializer() {
        super(PayloadValue.class);
    }

    @Override
    public void serialize(PayloadValue value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        write(value, gen);
    }

    static void write(PayloadValue value, JsonGenerator gen) throws IOException {
        if (value instanceof PayloadValue.StringValue s) {
            gen.writeString(s.value());
        } else if (value instanceof PayloadValue.NumberValue n) {
            gen.writeNumber(n.value().toPlainString());
        } else if (value instanceof PayloadValue.BoolValue b) {
            gen.writeBoolean(b.value());
        } else if (value instanceof PayloadValue.ListValue list) {
            gen.writeStartArray();
            for (PayloadValue element : list.values()) {
                write(element, gen);
            }
            gen.writeEndArray();
        } else if (value instanceof PayloadValue.MapValue map) {
            gen.writeStartObject();
            for (Map.Entry<String, PayloadValue> entry : map.values().entrySet()) {
                gen.writeFieldName(entry.getKey());
                write(entry.getValue(), gen);
            }
            gen.writeEndObject();
        } else {
            gen.writeNull();
        }
    }
}
