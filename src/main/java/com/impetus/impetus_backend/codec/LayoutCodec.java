package com.impetus.impetus_backend.codec;

import com.impetus.impetus_backend.model.dto.LayoutDto;

public interface LayoutCodec {

    LayoutFormat supportedFormat();

    /** Whether {@code content}, with leading whitespace already stripped, looks like this format. */
    boolean recognizes(String content);

    String write(LayoutDto layout);

    // Throws LayoutFormatException when the text is not a valid document of this format
    LayoutDto read(String content);
}
