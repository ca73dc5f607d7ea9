package com.incidents.adapter.security;

import com.incidents.adapter.config.IncidentProperties;
import com.incidents.adapter.exception.UnauthorizedException;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Checks the shared secrets sent by feed readers and operators.
 * A request is refused outright when the matching secret is not configured on this side.
 */
@Component
public class SecretGuard {

    private final IncidentProperties properties;

    public SecretGuard(IncidentProperties properties) {
        this.properties = properties;
    }

    public void requireApiKey(String provided) {
        check(properties.getApiKey(), provided, "API key");
    }

    public void requireAdminPassword(String provided) {
        check(properties.getAdminPassword(), provided, "admin password");
    }

    private static void check(String expected, String provided, String what) {
        if (expected == null || expected.isBlank()) {
            throw new UnauthorizedException("No " + what + " configured on the server", true);
        }
        if (provided == null || !MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8), provided.getBytes(StandardCharsets.UTF_8))) {
            throw new UnauthorizedException("Missing or wrong " + what, false);
        }
    }
}
