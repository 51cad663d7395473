package com.gt.quranquest.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.gt.quranquest.model.VerseStatus;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
public class VerseStatusSerializer extends JsonSerializer<VerseStatus> {
    @Override
    public void serialize(VerseStatus verseStatus, JsonGenerator jsonGenerator, SerializerProvider serializerProvider) throws IOException {
        jsonGenerator.writeString(verseStatus.getWireName());
    }
}
