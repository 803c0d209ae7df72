package com.impetus.impetus_backend.codec;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.impetus.impetus_backend.codec.json.JsonLayoutCodec;
import com.impetus.impetus_backend.codec.sexpr.SExpressionLayoutCodec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Choosing a layout codec")
class LayoutCodecRegistryTest {

    private final SExpressionLayoutCodec sexpr = new SExpressionLayoutCodec();
    private final JsonLayoutCodec json = new JsonLayoutCodec(new ObjectMapper());
    private final LayoutCodecRegistry registry = new LayoutCodecRegistry(List.of(sexpr, json));

    @Test
    @DisplayName("Codecs are looked up by format")
    void codecFor() {
        assertThat(registry.codecFor(LayoutFormat.SEXPR)).isSameAs(sexpr);
        assertThat(registry.codecFor(LayoutFormat.JSON)).isSameAs(json);
    }

    @Test
    @DisplayName("A format without a codec is a configuration error")
    void missingCodec() {
        LayoutCodecRegistry jsonOnly = new LayoutCodecRegistry(List.of(json));

        assertThatThrownBy(() -> jsonOnly.codecFor(LayoutFormat.SEXPR))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("SEXPR");
    }

    @Test
    @DisplayName("Two codecs for one format are refused")
    void duplicateCodec() {
        assertThatThrownBy(() -> new LayoutCodecRegistry(List.of(json, new JsonLayoutCodec(new ObjectMapper()))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("JSON");
    }

    @Test
    @DisplayName("The file extension names the format")
    void formatOfPath() {
        assertThat(registry.formatOf(Path.of("dir", "a.bcanvas"))).contains(LayoutFormat.SEXPR);
        assertThat(registry.formatOf(Path.of("A.JSON"))).contains(LayoutFormat.JSON);
        assertThat(registry.formatOf(Path.of("a.bcanvas.json"))).contains(LayoutFormat.JSON);
        assertThat(registry.formatOf(Path.of("notes.txt"))).isEmpty();
    }

    @Test
    @DisplayName("Content is recognized by its first meaningful characters")
    void detect() {
        assertThat(registry.detect("  \n{\"version\": 2}")).contains(LayoutFormat.JSON);
        assertThat(registry.detect("\uFEFF(schema ImpetusProject)")).contains(LayoutFormat.SEXPR);
        assertThat(registry.detect(";; saved layout\n(schema ImpetusProject)")).contains(LayoutFormat.SEXPR);
        assertThat(registry.detect("hello")).isEmpty();
        assertThat(registry.detect("")).isEmpty();
    }
}
