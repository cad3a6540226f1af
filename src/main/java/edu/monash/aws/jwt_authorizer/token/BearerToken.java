package edu.monash.aws.jwt_authorizer.token;

import edu.monash.aws.jwt_authorizer.DenyReason;
import edu.monash.aws.jwt_authorizer.TokenRejectedException;

/**
 * Pulls the raw token out of an {@code Authorization} header value.
 */
public final class BearerToken {
    protected static String tokenPrefix = "Bearer ";

    private BearerToken() {
    }

    /**
     * @param authHeader the header value, may be {@code null}
     * @return everything after the case-sensitive {@code "Bearer "} prefix
     * @throws TokenRejectedException if the header is absent, has another scheme or carries no token
     */
    public static String extract(String authHeader) throws TokenRejectedException {
        if (authHeader == null) {
            throw new TokenRejectedException(DenyReason.MALFORMED_REQUEST, "Missing authorization header");
        }
        if (!authHeader.startsWith(tokenPrefix) || authHeader.length() == tokenPrefix.length()) {
            throw new TokenRejectedException(DenyReason.MALFORMED_REQUEST,
                    "Authorization header must start with '" + tokenPrefix + "' followed by a token");
        }
        return authHeader.substring(tokenPrefix.length());
    }
}
