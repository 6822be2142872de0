package com.arenabox.core.validation;

import com.arenabox.core.error.ValidationException;

import java.util.regex.Pattern;

/**
 * Boundary checks for identifiers that end up in orchestrator API paths or names.
 */
public final class InputValidator {

    /** Docker secret names: leading alphanumeric, then alphanumerics, dot, dash or underscore. */
    private static final Pattern SECRET_NAME = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9_.-]{0,63}$");

    private static final Pattern SECRET_ID = Pattern.compile("^[A-Za-z0-9_-]{1,128}$");

    /** Image references are stored in 255-character columns. */
    public static final int MAX_IMAGE_LENGTH = 255;

    private static final Pattern IMAGE_REFERENCE = Pattern.compile(
            "^[A-Za-z0-9][A-Za-z0-9._/:-]{0,254}(@sha256:[a-f0-9]{64})?$");

    private InputValidator() {}

    public static String requireSecretName(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Secret name is required");
        }
        if (!SECRET_NAME.matcher(name).matches()) {
            throw new ValidationException("Invalid secret name '" + name + "'. Names must start with a letter or digit "
                    + "and contain only letters, digits, '.', '_' or '-' (max 64 characters)");
        }
        return name;
    }

    public static String requireSecretId(String id) {
        if (id == null || !SECRET_ID.matcher(id).matches()) {
            throw new ValidationException("Invalid secret id format");
        }
        return id;
    }

    public static String requireImageReference(String image) {
        if (image == null || image.isBlank()) {
            throw new ValidationException("Image reference is required");
        }
        String trimmed = image.trim();
        if (trimmed.length() > MAX_IMAGE_LENGTH) {
            throw new ValidationException("Image reference exceeds " + MAX_IMAGE_LENGTH + " characters");
        }
        if (!IMAGE_REFERENCE.matcher(trimmed).matches()
                || trimmed.contains("//") || trimmed.contains("..") || trimmed.endsWith(":") || trimmed.endsWith("/")) {
            throw new ValidationException("Invalid image reference '" + image + "'");
        }
        return trimmed;
    }
}
