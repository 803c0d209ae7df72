package com.impetus.impetus_backend.service;

import com.impetus.impetus_backend.codec.LayoutCodecRegistry;
import com.impetus.impetus_backend.codec.LayoutFormat;
import com.impetus.impetus_backend.codec.LayoutMapper;
import com.impetus.impetus_backend.config.CanvasProperties;
import com.impetus.impetus_backend.model.domain.Graph;
import com.impetus.impetus_backend.model.dto.LayoutDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes whole diagram hierarchies as layout files.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LayoutStore {

    private final LayoutCodecRegistry codecs;
    private final LayoutMapper mapper;
    private final CanvasProperties properties;

    /**
     * Resolves a caller-supplied location against the configured layout directory.
     * Relative paths are taken from that directory; anything that ends up outside it is refused.
     */
    public Path resolveInLayoutDir(String location) {
        if (location == null || location.isBlank()) {
            throw new IllegalArgumentException("Layout path is required");
        }
        Path base = Path.of(properties.getLayoutDir()).toAbsolutePath().normalize();
        Path target = base.resolve(location.trim()).normalize();
        if (!target.startsWith(base) || target.equals(base)) {
            throw new IllegalArgumentException("Layout path must stay inside the layout directory: " + location);
        }
        return target;
    }

    public String serialize(Graph root, LayoutFormat format) {
        LayoutDto dto = mapper.toDto(root, properties.getLayoutVersion());
        return codecs.codecFor(format).write(dto);
    }

    /** Parses and maps {@code content}; nothing is returned unless the whole document was valid. */
    public Graph deserialize(String content, LayoutFormat format) {
        LayoutDto dto = codecs.codecFor(format).read(content);
        return mapper.toGraph(dto);
    }

    /** With no explicit format the file extension decides, then {@code impetus.canvas.default-format}. */
    public void save(Graph root, Path path, LayoutFormat format) {
        LayoutFormat target = format != null ? format : codecs.formatOf(path).orElse(properties.getDefaultFormat());
        String text = serialize(root, target);
        try {
            Path dir = path.toAbsolutePath().getParent();
            if (dir != null) Files.createDirectories(dir);
            Files.writeString(path, text, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write layout " + path, e);
        }
        log.info("Saved layout to {} as {} ({} top-level node(s))", path, target, root.getNodes().size());
    }

    /** Detects the format from the content, falling back to the file extension and then the default format. */
    public Graph load(Path path) {
        String text;
        try {
            text = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read layout " + path, e);
        }
        if (text.startsWith("\uFEFF")) text = text.substring(1);
        LayoutFormat format = codecs.detect(text)
                .or(() -> codecs.formatOf(path))
                .orElse(properties.getDefaultFormat());
        Graph root = deserialize(text, format);
        log.info("Loaded layout from {} as {} ({} top-level node(s))", path, format, root.getNodes().size());
        return root;
    }
}
