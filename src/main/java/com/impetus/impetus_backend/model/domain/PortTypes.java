package com.impetus.impetus_backend.model.domain;

/**
 * Wire legality and display colors for {@link PortType}s.
 */
public final class PortTypes {

    /** RGB triple, each channel 0-255. */
    public record TypeColor(int red, int green, int blue) {}

    private static final TypeColor BIT_COLOR   = new TypeColor(100, 200, 140);
    private static final TypeColor BYTE_COLOR  = new TypeColor(200, 120, 220);
    private static final TypeColor WORD_COLOR  = new TypeColor(255, 165, 90);
    private static final TypeColor DWORD_COLOR = new TypeColor(90, 170, 255);
    private static final TypeColor ANY_COLOR   = new TypeColor(180, 180, 180);

    private PortTypes() {
    }

    /**
     * Whether a wire may run from an output of type {@code output} into an input of type {@code input}.
     * No implicit widening or narrowing.
     */
    public static boolean compatible(PortType output, PortType input) {
        if (input.isAny()) return true;
        if (output.isUserType() && input.isUserType()) {
            return output.userType().equals(input.userType());
        }
        if (output.isUserType() || input.isUserType()) return false;
        return output.bitLength().equals(input.bitLength());
    }

    public static TypeColor color(PortType type) {
        if (type.isUserType()) return hashColor(type.userType());
        if (type.isAny()) return ANY_COLOR;
        return switch (type.bitLength()) {
            case 1  -> BIT_COLOR;
            case 8  -> BYTE_COLOR;
            case 32 -> WORD_COLOR;
            case 64 -> DWORD_COLOR;
            default -> hashColor(type.bitLength());
        };
    }

    static TypeColor hashColor(String name) {
        int h = 23;
        for (int i = 0; i < name.length(); i++) {
            h = h * 31 + name.charAt(i);
        }
        return split(h);
    }

    static TypeColor hashColor(int bitLength) {
        return split(23 * 31 + bitLength);
    }

    private static TypeColor split(int h) {
        return new TypeColor(
                100 + (h & 0x7F),
                100 + ((h >> 7) & 0x7F),
                100 + ((h >> 14) & 0x7F));
    }
}
