package com.gt.chamlang.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.gt.chamlang.model.PracticeMode;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
public class PracticeModeSerializer extends JsonSerializer<PracticeMode> {
    @Override
    public void serialize(PracticeMode practiceMode, JsonGenerator jsonGenerator, SerializerProvider serializerProvider) throws IOException {
        jsonGenerator.writeString(practiceMode.getTag());
    }
}
