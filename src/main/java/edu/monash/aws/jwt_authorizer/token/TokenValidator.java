package edu.monash.aws.jwt_authorizer.token;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jwt.JWTClaimNames;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import edu.monash.aws.jwt_authorizer.DenyReason;
import edu.monash.aws.jwt_authorizer.TokenRejectedException;
import edu.monash.aws.jwt_authorizer.keys.KeyFamily;
import edu.monash.aws.jwt_authorizer.keys.KeyRecord;

import java.text.ParseException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;

/**
 * Checks the signature and the validity window ({@code exp}, {@code nbf}) of a token.
 * Issuer and audience are left to {@link AcceptedClaims}.
 */
public class TokenValidator {
    private final Clock clock;
    private final Duration leeway;

    public TokenValidator(Clock clock, Duration leeway) {
        this.clock = clock;
        this.leeway = leeway;
    }

    public JWTClaimsSet validate(String token, KeyRecord key, JWSAlgorithm algorithm) throws TokenRejectedException {
        SignedJWT jwt;
        try {
            jwt = SignedJWT.parse(token);
        } catch (ParseException e) {
            throw new TokenRejectedException(DenyReason.MALFORMED_REQUEST, "Not a valid JWT: " + e.getMessage(), e);
        }
        if (!algorithm.equals(jwt.getHeader().getAlgorithm())) {
            throw new TokenRejectedException(DenyReason.SIGNATURE_INVALID, "Token algorithm changed between checks");
        }

        Optional<KeyFamily> family = KeyFamily.forAlgorithm(algorithm);
        if (family.isEmpty() || family.get() != key.getFamily()) {
            throw new TokenRejectedException(DenyReason.SIGNATURE_INVALID,
                    "Algorithm " + algorithm + " cannot be verified with " + key);
        }
        if (key.getJwk().getAlgorithm() != null && !algorithm.getName().equals(key.getJwk().getAlgorithm().getName())) {
            throw new TokenRejectedException(DenyReason.SIGNATURE_INVALID,
                    "Key '" + key.getKeyId() + "' is restricted to " + key.getJwk().getAlgorithm());
        }

        try {
            if (!jwt.verify(key.verifier())) {
                throw new TokenRejectedException(DenyReason.SIGNATURE_INVALID, "Invalid token signature");
            }
        } catch (JOSEException e) {
            throw new TokenRejectedException(DenyReason.SIGNATURE_INVALID,
                    "Failed to verify token signature: " + e.getMessage(), e);
        }

        JWTClaimsSet claims;
        try {
            claims = jwt.getJWTClaimsSet();
            checkValidityWindow(claims);
        } catch (ParseException e) {
            throw new TokenRejectedException(DenyReason.MALFORMED_REQUEST,
                    "Failed to parse token claims: " + e.getMessage(), e);
        }
        return claims;
    }

    private void checkValidityWindow(JWTClaimsSet claims) throws ParseException, TokenRejectedException {
        Instant now = clock.instant();

        Date expires = claims.getDateClaim(JWTClaimNames.EXPIRATION_TIME);
        if (expires != null && !now.isBefore(expires.toInstant().plus(leeway))) {
            throw new TokenRejectedException(DenyReason.TOKEN_EXPIRED, "Token expired at " + expires.toInstant());
        }

        Date notBefore = claims.getDateClaim(JWTClaimNames.NOT_BEFORE);
        if (notBefore != null && now.isBefore(notBefore.toInstant().minus(leeway))) {
            throw new TokenRejectedException(DenyReason.TOKEN_NOT_YET_VALID,
                    "Token not valid before " + notBefore.toInstant());
        }
    }
}
