package com.impetus.impetus_backend.engine;

import com.impetus.impetus_backend.model.domain.Port;

import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;

public final class PortNaming {

    private PortNaming() {
    }

    /**
     * First unused of {@code base}, {@code base1}, {@code base2}, ... compared case-insensitively
     * against {@code existing}.
     */
    public static String unique(Collection<String> existing, String base) {
        Set<String> taken = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        taken.addAll(existing);
        if (!taken.contains(base)) return base;
        int i = 1;
        while (taken.contains(base + i)) i++;
        return base + i;
    }

    public static String uniqueAmong(Collection<Port> ports, String base) {
        return unique(ports.stream().map(Port::getName).toList(), base);
    }

    public static boolean isTaken(Collection<Port> ports, String name, Port except) {
        return ports.stream().anyMatch(p -> p != except && p.getName().equalsIgnoreCase(name));
    }
}
