package com.arenabox.dispatch.api;

import com.arenabox.core.error.ConflictException;
import com.arenabox.core.error.NotFoundException;
import com.arenabox.core.error.PolicyViolationException;
import com.arenabox.core.error.PortExhaustionException;
import com.arenabox.core.error.SandboxException;
import com.arenabox.core.error.TransportException;
import com.arenabox.core.error.ValidationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps lifecycle exceptions to {@code {"success": false, "error": ...}} responses.
 */
final class ErrorResponses {

    private ErrorResponses() {}

    static ResponseEntity<Map<String, Object>> of(SandboxException e) {
        return of(statusOf(e), e.getMessage());
    }

    static ResponseEntity<Map<String, Object>> of(HttpStatus status, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", message);
        return ResponseEntity.status(status).body(body);
    }

    static HttpStatus statusOf(SandboxException e) {
        if (e instanceof ValidationException || e instanceof PolicyViolationException) {
            return HttpStatus.BAD_REQUEST;
        }
        if (e instanceof NotFoundException) {
            return HttpStatus.NOT_FOUND;
        }
        if (e instanceof ConflictException) {
            return HttpStatus.CONFLICT;
        }
        if (e instanceof TransportException || e instanceof PortExhaustionException) {
            return HttpStatus.SERVICE_UNAVAILABLE;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
}
