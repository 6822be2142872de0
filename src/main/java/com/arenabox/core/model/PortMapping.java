package com.arenabox.core.model;

import com.arenabox.core.error.ValidationException;

import java.util.ArrayList;
import java.util.List;

/**
 * A host-side (or swarm-published) port routed to a container port.
 *
 * @param publishedPort port reachable on the orchestrator host
 * @param target        container-side port declaration
 */
public record PortMapping(int publishedPort, PortSpec target) {

    private static final String ARROW = "->";

    public static PortMapping parse(String value) {
        int idx = value.indexOf(ARROW);
        if (idx <= 0) {
            throw new ValidationException("Invalid port mapping: '" + value + "'");
        }
        try {
            int published = Integer.parseInt(value.substring(0, idx).trim());
            return new PortMapping(published, PortSpec.parse(value.substring(idx + ARROW.length())));
        } catch (NumberFormatException e) {
            throw new ValidationException("Invalid port mapping: '" + value + "'");
        }
    }

    public static List<PortMapping> parseList(String value) {
        var result = new ArrayList<PortMapping>();
        if (value == null || value.isBlank()) {
            return result;
        }
        for (String entry : value.split(",")) {
            if (!entry.isBlank()) {
                result.add(parse(entry.trim()));
            }
        }
        return result;
    }

    public static String join(List<PortMapping> mappings) {
        return String.join(",", mappings.stream().map(PortMapping::toString).toList());
    }

    @Override
    public String toString() {
        return publishedPort + ARROW + target;
    }
}
