package edu.monash.aws.jwt_authorizer;

// only ever logged, API Gateway sees the same Deny for every reason
public enum DenyReason {
    MALFORMED_REQUEST,
    UNSUPPORTED_ALGORITHM,
    KEY_NOT_FOUND,
    UPSTREAM_FETCH_FAILED,
    SIGNATURE_INVALID,
    TOKEN_EXPIRED,
    TOKEN_NOT_YET_VALID,
    ISSUER_REJECTED,
    AUDIENCE_REJECTED,
    POLICY_REJECTED
}
