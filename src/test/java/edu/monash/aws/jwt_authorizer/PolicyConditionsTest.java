package edu.monash.aws.jwt_authorizer;

import com.nimbusds.jwt.JWTClaimsSet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Date;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("PolicyConditions")
class PolicyConditionsTest {

    private static final Instant ISSUED = Instant.parse("2026-03-01T12:00:00Z");

    @Test
    @DisplayName("should bound the policy by nbf and exp")
    void shouldUseNotBeforeAndExpiry() {
        JWTClaimsSet claims = new JWTClaimsSet.Builder()
                .issueTime(Date.from(ISSUED))
                .notBeforeTime(Date.from(ISSUED.plusSeconds(60)))
                .expirationTime(Date.from(ISSUED.plusSeconds(3600)))
                .build();

        assertEquals(Map.of(
                "DateGreaterThan", Map.of("aws:CurrentTime", "2026-03-01T12:01:00Z"),
                "DateLessThan", Map.of("aws:CurrentTime", "2026-03-01T13:00:00Z")),
                PolicyConditions.forClaims(claims));
    }

    @Test
    @DisplayName("should fall back to iat when nbf is missing")
    void shouldFallBackToIssueTime() {
        JWTClaimsSet claims = new JWTClaimsSet.Builder().issueTime(Date.from(ISSUED)).build();

        assertEquals(Map.of("DateGreaterThan", Map.of("aws:CurrentTime", "2026-03-01T12:00:00Z")),
                PolicyConditions.forClaims(claims));
    }

    @Test
    @DisplayName("should add no conditions without time claims")
    void shouldBeEmptyWithoutTimes() {
        assertTrue(PolicyConditions.forClaims(new JWTClaimsSet.Builder().subject("x").build()).isEmpty());
        assertTrue(PolicyConditions.forClaims(null).isEmpty());
    }
}
