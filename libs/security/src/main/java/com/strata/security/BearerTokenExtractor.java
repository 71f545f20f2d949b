package com.strata.security;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the token out of an {@code Authorization: Bearer <token>} header.
 */
public final class BearerTokenExtractor {

    // scheme is case-insensitive (RFC 7235) and must be followed by whitespace
    private static final Pattern BEARER = Pattern.compile("^\\s*bearer\\s+(\\S+)\\s*$", Pattern.CASE_INSENSITIVE);

    private BearerTokenExtractor() {
        // utility class
    }

    /**
     * @param authorizationHeader raw header value, may be null
     * @return the token, or empty when the header is missing or not a bearer credential
     */
    public static Optional<String> extract(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            return Optional.empty();
        }
        Matcher matcher = BEARER.matcher(authorizationHeader);
        return matcher.matches() ? Optional.of(matcher.group(1)) : Optional.empty();
    }
}
