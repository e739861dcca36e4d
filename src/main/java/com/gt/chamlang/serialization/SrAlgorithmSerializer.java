package com.gt.chamlang.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.gt.chamlang.model.SrAlgorithm;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
public class SrAlgorithmSerializer extends JsonSerializer<SrAlgorithm> {
    @Override
    public void serialize(SrAlgorithm srAlgorithm, JsonGenerator jsonGenerator, SerializerProvider serializerProvider) throws IOException {
        jsonGenerator.writeString(srAlgorithm.getTag());
    }
}
