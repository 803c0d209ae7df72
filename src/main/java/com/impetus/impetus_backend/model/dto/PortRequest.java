package com.impetus.impetus_backend.model.dto;

/**
 * Port to add or change. {@code userType} wins over {@code bitLength}; with neither set a
 * new port is a single bit.
 */
public record PortRequest(String side, String name, Integer bitLength, String userType) {}
