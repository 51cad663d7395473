package com.gt.quranquest.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.gt.quranquest.alignment.model.WordStatus;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
public class WordStatusSerializer extends JsonSerializer<WordStatus> {
    @Override
    public void serialize(WordStatus wordStatus, JsonGenerator jsonGenerator, SerializerProvider serializerProvider) throws IOException {
        jsonGenerator.writeString(wordStatus.getWireName());
    }
}
