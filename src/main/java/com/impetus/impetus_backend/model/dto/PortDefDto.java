package com.impetus.impetus_backend.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.impetus.impetus_backend.codec.json.PortDefDeserializer;
import com.impetus.impetus_backend.model.domain.Port;

/**
 * A port entry. Exactly one of {@code bitLength} / {@code userType} is meaningful; when
 * {@code userType} is set it wins. Reads legacy shapes through {@link PortDefDeserializer}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonDeserialize(using = PortDefDeserializer.class)
public record PortDefDto(
    @JsonProperty("name") String name,
    @JsonProperty("bitLength") Integer bitLength,
    @JsonProperty("userType") String userType,
    @JsonProperty("width") Double width
) {
    public String name() {
        return name != null ? name : "";
    }

    /** Null only for user-typed ports; an absent length otherwise means a single bit. */
    public Integer bitLength() {
        if (bitLength != null) return bitLength;
        return userType != null ? null : 1;
    }

    public Double width() {
        return width != null ? width : Port.DEFAULT_WIDTH;
    }
}
