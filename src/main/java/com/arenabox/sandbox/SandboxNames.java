package com.arenabox.sandbox;

import com.arenabox.core.model.Participant;
import com.arenabox.core.model.SandboxKind;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Derives orchestrator-side names. A name is stable for a given (participant, challenge, image) so a
 * retried creation finds the sandbox an earlier attempt left behind.
 */
final class SandboxNames {

    private static final int HASH_LENGTH = 10;
    private static final int MAX_IMAGE_PART = 40;

    private SandboxNames() {}

    static String forInstance(SandboxKind kind, Participant participant, long challengeId, String image) {
        String hash = shortHash(participant.key() + "/" + challengeId + "/" + image);
        if (kind == SandboxKind.MULTI_PART) {
            // service names must be DNS labels
            return "svc-" + sanitize(image, '-') + "-" + hash;
        }
        return sanitize(image, '_') + "_" + hash;
    }

    static String sanitize(String image, char separator) {
        String lower = image.toLowerCase(Locale.ROOT);
        var sb = new StringBuilder();
        for (char c : lower.toCharArray()) {
            boolean alnum = (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9');
            if (alnum) {
                sb.append(c);
            } else if (sb.length() > 0 && sb.charAt(sb.length() - 1) != separator) {
                sb.append(separator);
            }
            if (sb.length() >= MAX_IMAGE_PART) {
                break;
            }
        }
        while (sb.length() > 0 && sb.charAt(sb.length() - 1) == separator) {
            sb.setLength(sb.length() - 1);
        }
        return sb.length() > 0 ? sb.toString() : "sandbox";
    }

    private static String shortHash(String value) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).substring(0, HASH_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
