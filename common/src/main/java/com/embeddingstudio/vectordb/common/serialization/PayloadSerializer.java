package com.embeddingstudio.vectordb.common.serialization;

import com.embeddingstudio.vectordb.common.payload.Payload;
import com.embeddingstudio.vectordb.common.payload.PayloadValue;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;
import java.util.Map;

public class PayloadSerializer extends StdSerializer<Payload> {

    public PayloadSerializer() {
        super(Payload.class);
    }

    @Override
    public void serialize(Payload payload, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeStartObject();
        for (Map.Entry<String, PayloadValue> entry : payload.entries().entrySet()) {
            gen.writeFieldName(entry.getKey());
            PayloadValueSerializer.write(entry.getValue(), gen);
        }
        gen.writeEndObject();
    }
}
