package com.arenabox.sandbox;

import com.arenabox.core.model.Participant;
import com.arenabox.core.model.SandboxKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SandboxNamesTest {

    @Test
    void namesAreStablePerKey() {
        String a = SandboxNames.forInstance(SandboxKind.SINGLE, Participant.team("5"), 42, "nginx:alpine");
        String b = SandboxNames.forInstance(SandboxKind.SINGLE, Participant.team("5"), 42, "nginx:alpine");
        String other = SandboxNames.forInstance(SandboxKind.SINGLE, Participant.team("6"), 42, "nginx:alpine");

        assertEquals(a, b);
        assertNotEquals(a, other);
        assertTrue(a.matches("nginx_alpine_[0-9a-f]{10}"), a);
    }

    @Test
    void serviceNamesAreDnsLabels() {
        String name = SandboxNames.forInstance(SandboxKind.MULTI_PART, Participant.user("9"), 7,
                "Registry.local:5000/CTF/pwn_box:1");
        assertTrue(name.matches("svc-[a-z0-9-]+-[0-9a-f]{10}"), name);
        assertTrue(name.length() <= 63);
    }

    @Test
    void sanitizeCollapsesSeparators() {
        assertEquals("ctf_web_1", SandboxNames.sanitize("ctf//web::1", '_'));
        assertEquals("sandbox", SandboxNames.sanitize("///", '-'));
    }
}
