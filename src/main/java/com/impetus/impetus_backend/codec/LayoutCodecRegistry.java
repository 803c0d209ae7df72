package com.impetus.impetus_backend.codec;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * The layout codecs of the application and the rules for picking one: by explicit format,
 * by file name, or by what a document starts with.
 */
@Slf4j
@Component
public class LayoutCodecRegistry {

    private final Map<LayoutFormat, LayoutCodec> byFormat = new EnumMap<>(LayoutFormat.class);

    public LayoutCodecRegistry(List<LayoutCodec> codecs) {
        for (LayoutCodec codec : codecs) {
            LayoutCodec previous = byFormat.put(codec.supportedFormat(), codec);
            if (previous != null) {
                throw new IllegalStateException("Layout format " + codec.supportedFormat() + " is claimed by both "
                        + previous.getClass().getSimpleName() + " and " + codec.getClass().getSimpleName());
            }
        }
        log.debug("Layout codecs: {}", byFormat.keySet());
    }

    public LayoutCodec codecFor(LayoutFormat format) {
        LayoutCodec codec = byFormat.get(format);
        if (codec == null) {
            throw new IllegalStateException("No codec for layout format " + format);
        }
        return codec;
    }

    /** The format whose extension ends the file name ({@code x.bcanvas.json} is JSON). */
    public Optional<LayoutFormat> formatOf(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) return Optional.empty();
        String name = fileName.toString().toLowerCase(Locale.ROOT);
        return byFormat.keySet().stream()
                .filter(format -> name.endsWith(format.extension()))
                .findFirst();
    }

    /** The format of the first codec that recognizes the document, ignoring leading whitespace and a BOM. */
    public Optional<LayoutFormat> detect(String content) {
        String head = content.stripLeading();
        if (head.startsWith("\uFEFF")) head = head.substring(1).stripLeading();
        for (LayoutCodec codec : byFormat.values()) {
            if (codec.recognizes(head)) return Optional.of(codec.supportedFormat());
        }
        return Optional.empty();
    }
}
