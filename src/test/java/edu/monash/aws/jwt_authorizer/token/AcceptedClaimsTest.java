package edu.monash.aws.jwt_authorizer.token;

import com.nimbusds.jwt.JWTClaimsSet;
import edu.monash.aws.jwt_authorizer.DenyReason;
import edu.monash.aws.jwt_authorizer.TokenRejectedException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("AcceptedClaims")
class AcceptedClaimsTest {

    private static final JWTClaimsSet NO_CLAIMS = new JWTClaimsSet.Builder().build();

    @Test
    @DisplayName("should trim comma separated values")
    void shouldParseValues() {
        AcceptedClaims issuers = AcceptedClaims.issuers(" https://a.example.com , ,https://b.example.com");

        assertEquals(List.of("https://a.example.com", "https://b.example.com"),
                List.copyOf(issuers.getAcceptedValues()));
        assertEquals("iss", issuers.getClaimName());
    }

    @Nested
    @DisplayName("issuers")
    class Issuers {

        @Test
        @DisplayName("should accept any issuer, even a missing one, when none is configured")
        void shouldAcceptAnyWhenEmpty() {
            AcceptedClaims issuers = AcceptedClaims.issuers("");

            assertTrue(issuers.isAccepted("https://whatever.example.com"));
            assertDoesNotThrow(() -> issuers.check(NO_CLAIMS));
            assertDoesNotThrow(() -> issuers.check(new JWTClaimsSet.Builder().issuer("x").build()));
        }

        @Test
        @DisplayName("should accept a configured issuer")
        void shouldAcceptConfigured() {
            AcceptedClaims issuers = AcceptedClaims.issuers("https://a.example.com,https://b.example.com");

            assertDoesNotThrow(() -> issuers.check(new JWTClaimsSet.Builder().issuer("https://b.example.com").build()));
        }

        @Test
        @DisplayName("should reject another issuer")
        void shouldRejectOther() {
            AcceptedClaims issuers = AcceptedClaims.issuers("https://a.example.com");

            TokenRejectedException e = assertThrows(TokenRejectedException.class,
                    () -> issuers.check(new JWTClaimsSet.Builder().issuer("https://evil.example.com").build()));
            assertEquals(DenyReason.ISSUER_REJECTED, e.getReason());
        }

        @Test
        @DisplayName("should reject a missing issuer when issuers are configured")
        void shouldRejectMissing() {
            AcceptedClaims issuers = AcceptedClaims.issuers("https://a.example.com");

            assertThrows(TokenRejectedException.class, () -> issuers.check(NO_CLAIMS));
        }
    }

    @Nested
    @DisplayName("audiences")
    class Audiences {

        @Test
        @DisplayName("should accept a single audience")
        void shouldAcceptSingle() {
            AcceptedClaims audiences = AcceptedClaims.audiences("api");

            assertDoesNotThrow(() -> audiences.check(new JWTClaimsSet.Builder().audience("api").build()));
        }

        @Test
        @DisplayName("should accept when one of several audiences matches")
        void shouldAcceptIntersection() {
            AcceptedClaims audiences = AcceptedClaims.audiences("api, admin");

            assertDoesNotThrow(() -> audiences.check(
                    new JWTClaimsSet.Builder().audience(List.of("web", "admin")).build()));
        }

        @Test
        @DisplayName("should reject when no audience matches")
        void shouldRejectDisjoint() {
            AcceptedClaims audiences = AcceptedClaims.audiences("api");

            TokenRejectedException e = assertThrows(TokenRejectedException.class, () -> audiences.check(
                    new JWTClaimsSet.Builder().audience(List.of("web", "mobile")).build()));
            assertEquals(DenyReason.AUDIENCE_REJECTED, e.getReason());
        }

        @Test
        @DisplayName("should accept any audience when none is configured")
        void shouldAcceptAnyWhenEmpty() {
            AcceptedClaims audiences = AcceptedClaims.audiences("");

            assertDoesNotThrow(() -> audiences.check(NO_CLAIMS));
            assertDoesNotThrow(() -> audiences.check(new JWTClaimsSet.Builder().audience("web").build()));
        }
    }
}
