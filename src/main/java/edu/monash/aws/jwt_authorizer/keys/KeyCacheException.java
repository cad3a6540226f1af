package edu.monash.aws.jwt_authorizer.keys;

import edu.monash.aws.jwt_authorizer.DenyReason;
import edu.monash.aws.jwt_authorizer.TokenRejectedException;

/**
 * A key lookup that produced no key: either the key id is unknown
 * ({@link DenyReason#KEY_NOT_FOUND}) or the key set could not be refreshed
 * ({@link DenyReason#UPSTREAM_FETCH_FAILED}).
 */
public class KeyCacheException extends TokenRejectedException {
    public KeyCacheException(DenyReason reason, String message) {
        super(reason, message);
    }

    public KeyCacheException(DenyReason reason, String message, Throwable cause) {
        super(reason, message, cause);
    }
}
