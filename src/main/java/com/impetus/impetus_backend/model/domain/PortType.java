package com.impetus.impetus_backend.model.domain;

/**
 * Type descriptor carried by a port: either a bit length (positive, or {@link #ANY_LENGTH})
 * or the name of a user-defined composite type. Never both.
 */
public record PortType(Integer bitLength, String userType) {

    /** Sentinel bit length accepted by inputs that take impetuses of any length. */
    public static final int ANY_LENGTH = -1;

    public static final PortType BIT = new PortType(1, null);
    public static final PortType ANY = new PortType(ANY_LENGTH, null);

    public PortType {
        if ((bitLength == null) == (userType == null)) {
            throw new IllegalArgumentException("Port type must be either a bit length or a user type");
        }
        if (bitLength != null && bitLength != ANY_LENGTH && bitLength <= 0) {
            throw new IllegalArgumentException("Bit length must be positive: " + bitLength);
        }
        if (userType != null && userType.isBlank()) {
            throw new IllegalArgumentException("User type name must not be blank");
        }
    }

    public static PortType bits(int length) {
        if (length == 1) return BIT;
        if (length == ANY_LENGTH) return ANY;
        return new PortType(length, null);
    }

    public static PortType user(String name) {
        return new PortType(null, name);
    }

    public boolean isUserType() {
        return userType != null;
    }

    public boolean isAny() {
        return bitLength != null && bitLength == ANY_LENGTH;
    }

    /** Short label used in port captions: "Bit", "Any", "[8]" or the user type name. */
    public String displayName() {
        if (isUserType()) return userType;
        if (isAny()) return "Any";
        if (bitLength == 1) return "Bit";
        return "[" + bitLength + "]";
    }

    @Override
    public String toString() {
        return displayName();
    }
}
