package com.gt.quranquest.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.gt.quranquest.lesson.model.ExerciseType;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
public class ExerciseTypeSerializer extends JsonSerializer<ExerciseType> {
    @Override
    public void serialize(ExerciseType exerciseType, JsonGenerator jsonGenerator, SerializerProvider serializerProvider) throws IOException {
        jsonGenerator.writeString(exerciseType.getWireName());
    }
}
