package com.arenabox.core.model;

import com.arenabox.core.error.ValidationException;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A container-side port declaration such as {@code 80/tcp}.
 *
 * @param port     port number, 1-65535
 * @param protocol {@code tcp} or {@code udp}, always lower case
 */
public record PortSpec(int port, String protocol) {

    private static final Pattern PORT_PATTERN = Pattern.compile("^(\\d+)/(tcp|udp)$", Pattern.CASE_INSENSITIVE);

    public PortSpec {
        if (port < 1 || port > 65535) {
            throw new ValidationException("Port number " + port + " is out of valid range. "
                    + "Port numbers must be between 1 and 65535.");
        }
        if (protocol == null) {
            throw new ValidationException("Port protocol is required");
        }
        protocol = protocol.toLowerCase(Locale.ROOT);
        if (!protocol.equals("tcp") && !protocol.equals("udp")) {
            throw new ValidationException("Unsupported protocol '" + protocol + "', expected tcp or udp");
        }
    }

    public static PortSpec parse(String value) {
        String trimmed = value == null ? "" : value.trim();
        Matcher m = PORT_PATTERN.matcher(trimmed);
        if (!m.matches()) {
            throw new ValidationException("Invalid port format: '" + trimmed + "'. "
                    + "Expected format: port/protocol (e.g., 80/tcp, 443/tcp, 53/udp)");
        }
        int port;
        try {
            port = Integer.parseInt(m.group(1));
        } catch (NumberFormatException e) {
            throw new ValidationException("Port number " + m.group(1) + " is out of valid range. "
                    + "Port numbers must be between 1 and 65535.");
        }
        return new PortSpec(port, m.group(2));
    }

    /**
     * Parses a comma-joined declaration. Blank entries are skipped; at least one valid entry is required.
     */
    public static List<PortSpec> parseList(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("At least one exposed port must be configured. "
                    + "Please add a port in the format: port/protocol (e.g., 80/tcp)");
        }
        var ports = new LinkedHashSet<PortSpec>();
        for (String entry : value.split(",")) {
            if (entry.isBlank()) {
                continue;
            }
            ports.add(parse(entry));
        }
        if (ports.isEmpty()) {
            throw new ValidationException("At least one valid port must be configured. "
                    + "Ports must be in the format: port/protocol (e.g., 80/tcp)");
        }
        return new ArrayList<>(ports);
    }

    public static String join(List<PortSpec> ports) {
        return String.join(",", ports.stream().map(PortSpec::toString).toList());
    }

    @Override
    public String toString() {
        return port + "/" + protocol;
    }
}
