package com.arenabox.core.logging;

import com.arenabox.core.model.Participant;
import com.arenabox.core.model.SandboxKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    void setInstancePopulatesAllKeys() {
        MdcContext.setInstance(Participant.team("5"), 42, SandboxKind.MULTI_PART);

        assertEquals("team-5", MDC.get("participant"));
        assertEquals("42", MDC.get("challengeId"));
        assertEquals("MULTI_PART", MDC.get("sandboxKind"));
    }

    @Test
    void clearRemovesOnlySandboxKeys() {
        MDC.put("requestId", "r-1");
        MdcContext.setParticipant(Participant.user("9"));

        MdcContext.clear();

        assertNull(MDC.get("participant"));
        assertEquals("r-1", MDC.get("requestId"));
    }
}
