package com.arenabox.core.logging;

import com.arenabox.core.model.Participant;
import com.arenabox.core.model.SandboxKind;
import org.slf4j.MDC;

/**
 * Utility for managing sandbox-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setParticipant(Participant participant) {
        MDC.put("participant", participant.key());
    }

    public static void setInstance(Participant participant, long challengeId, SandboxKind kind) {
        MDC.put("participant", participant.key());
        MDC.put("challengeId", String.valueOf(challengeId));
        MDC.put("sandboxKind", kind.name());
    }

    public static void clear() {
        MDC.remove("participant");
        MDC.remove("challengeId");
        MDC.remove("sandboxKind");
    }
}
