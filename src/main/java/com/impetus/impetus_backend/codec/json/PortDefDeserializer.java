package com.impetus.impetus_backend.codec.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.impetus.impetus_backend.model.domain.Port;
import com.impetus.impetus_backend.model.domain.PortType;
import com.impetus.impetus_backend.model.dto.PortDefDto;

import java.io.IOException;
import java.util.Locale;

/**
 * Accepts {@code {"name":"In","bitLength":8,"width":108}} as well as the older shapes:
 * a bare {@code "In"} (single bit, default width) and {@code {"name":"In","type":"bool"}},
 * where the legacy type string goes through a fixed alias table.
 */
public class PortDefDeserializer extends StdDeserializer<PortDefDto> {

    public PortDefDeserializer() {
        super(PortDefDto.class);
    }

    @Override
    public PortDefDto deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode node = p.readValueAsTree();
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            return new PortDefDto(node.asText(), 1, null, Port.DEFAULT_WIDTH);
        }
        if (!node.isObject()) {
            throw JsonMappingException.from(p, "Invalid port entry: " + node);
        }

        String name = node.path("name").asText("");
        String userType = node.hasNonNull("userType") && !node.get("userType").asText().isBlank()
                ? node.get("userType").asText()
                : null;
        Integer bitLength = null;
        if (userType == null) {
            if (node.hasNonNull("bitLength")) {
                bitLength = node.get("bitLength").asInt(1);
            } else if (node.hasNonNull("type")) {
                bitLength = legacyBitLength(node.get("type").asText());
            } else {
                bitLength = 1;
            }
        }
        double width = node.hasNonNull("width") ? node.get("width").asDouble(Port.DEFAULT_WIDTH) : Port.DEFAULT_WIDTH;
        return new PortDefDto(name, bitLength, userType, width);
    }

    /** bit / bool / boolean map to one bit, any to the any-length sentinel, everything else to one bit. */
    static int legacyBitLength(String legacyType) {
        if (legacyType == null) return 1;
        return switch (legacyType.trim().toLowerCase(Locale.ROOT)) {
            case "any" -> PortType.ANY_LENGTH;
            case "bit", "bool", "boolean" -> 1;
            default -> 1;
        };
    }
}
