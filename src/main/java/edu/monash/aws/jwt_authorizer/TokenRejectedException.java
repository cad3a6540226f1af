package edu.monash.aws.jwt_authorizer;

import lombok.Getter;

public class TokenRejectedException extends Exception {
    @Getter
    private final DenyReason reason;

    public TokenRejectedException(DenyReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public TokenRejectedException(DenyReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }
}
