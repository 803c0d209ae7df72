package com.impetus.impetus_backend.config;

import com.impetus.impetus_backend.codec.LayoutFormat;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Engine tunables, bound from {@code impetus.canvas.*} in application.yml.
 * All geometry values are in canvas world units.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "impetus.canvas")
public class CanvasProperties {

    /** Space kept around the selection's bounding box when a composite block is created. */
    @Min(0)
    private double groupMargin = 10;

    // Nominal editor viewport the grouped nodes are centered in
    @Positive
    private double innerViewportWidth = 1100;
    @Positive
    private double innerViewportHeight = 740;
    @Min(0)
    private double innerPadding = 8;

    /** How far a duplicate is shifted right and down from its source. */
    private double duplicateOffset = 30;

    /** Directory that layout paths sent over HTTP are resolved against and confined to. */
    @NotBlank
    private String layoutDir = "layouts";

    @NotNull
    private LayoutFormat defaultFormat = LayoutFormat.SEXPR;

    @Positive
    private int layoutVersion = 2;
}
