package com.gt.quranquest.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.gt.quranquest.model.ConfidenceLevel;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
public class ConfidenceLevelSerializer extends JsonSerializer<ConfidenceLevel> {
    @Override
    public void serialize(ConfidenceLevel confidenceLevel, JsonGenerator jsonGenerator, SerializerProvider serializerProvider) throws IOException {
        jsonGenerator.writeString(confidenceLevel.getWireName());
    }
}
