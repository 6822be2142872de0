package com.arenabox.dispatch.api;

import com.arenabox.core.error.ValidationException;
import com.arenabox.core.model.Participant;
import com.arenabox.core.model.ParticipantKind;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Component;

/**
 * Reads the caller's identity from the forwarded headers.
 */
@Component
public class ParticipantResolver {

    private static final String UNKNOWN_ADMIN = "unknown";

    private final IdentityProperties properties;

    public ParticipantResolver(IdentityProperties properties) {
        this.properties = properties;
    }

    public Participant participant(HttpServletRequest request) {
        String kind = request.getHeader(properties.getParticipantKindHeader());
        String id = request.getHeader(properties.getParticipantIdHeader());
        if (kind == null || kind.isBlank() || id == null || id.isBlank()) {
            throw new ValidationException("Participant identity headers are missing");
        }
        String trimmedId = id.trim();
        if (trimmedId.length() > Participant.MAX_ID_LENGTH) {
            throw new ValidationException("Participant id exceeds " + Participant.MAX_ID_LENGTH + " characters");
        }
        try {
            return new Participant(ParticipantKind.parse(kind), trimmedId);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown participant kind: " + kind);
        }
    }

    public String admin(HttpServletRequest request) {
        String admin = request.getHeader(properties.getAdminHeader());
        return admin == null || admin.isBlank() ? UNKNOWN_ADMIN : admin.trim();
    }
}
