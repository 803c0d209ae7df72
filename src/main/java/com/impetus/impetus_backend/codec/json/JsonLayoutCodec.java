package com.impetus.impetus_backend.codec.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.impetus.impetus_backend.codec.LayoutCodec;
import com.impetus.impetus_backend.codec.LayoutFormat;
import com.impetus.impetus_backend.exception.LayoutFormatException;
import com.impetus.impetus_backend.model.dto.LayoutDto;
import org.springframework.stereotype.Component;

/**
 * JSON layout documents: {@code {version, graph:{nodes, edges, vx, vy}}}.
 * Reading is lenient about comments, trailing commas and unknown properties.
 */
@Component
public class JsonLayoutCodec implements LayoutCodec {

    static final String FORMAT = "JSON";

    private final ObjectMapper mapper;

    public JsonLayoutCodec(ObjectMapper objectMapper) {
        this.mapper = objectMapper.copy()
                .enable(JsonParser.Feature.ALLOW_COMMENTS)
                .enable(JsonReadFeature.ALLOW_TRAILING_COMMA.mappedFeature())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public LayoutFormat supportedFormat() {
        return LayoutFormat.JSON;
    }

    @Override
    public boolean recognizes(String content) {
        return content.startsWith("{");
    }

    @Override
    public String write(LayoutDto layout) {
        try {
            return mapper.writeValueAsString(layout);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize layout", e);
        }
    }

    @Override
    public LayoutDto read(String content) {
        LayoutDto layout;
        try {
            layout = mapper.readValue(content, LayoutDto.class);
        } catch (JsonProcessingException e) {
            throw new LayoutFormatException(FORMAT, "Invalid JSON layout: " + e.getOriginalMessage(), e);
        }
        if (layout == null) {
            throw new LayoutFormatException(FORMAT, "Empty JSON layout document");
        }
        return layout;
    }
}
