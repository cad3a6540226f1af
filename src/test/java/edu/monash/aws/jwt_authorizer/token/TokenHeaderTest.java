package edu.monash.aws.jwt_authorizer.token;

import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.util.Base64URL;
import com.nimbusds.jwt.JWTClaimsSet;
import edu.monash.aws.jwt_authorizer.DenyReason;
import edu.monash.aws.jwt_authorizer.TestTokens;
import edu.monash.aws.jwt_authorizer.TokenRejectedException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("TokenHeader")
class TokenHeaderTest {

    private static String withHeader(String headerJson) {
        return Base64URL.encode(headerJson) + "." + Base64URL.encode("{}") + ".c2ln";
    }

    @Test
    @DisplayName("should decode alg, kid and typ without verifying the signature")
    void shouldDecodeHeader() throws Exception {
        String token = TestTokens.sign(TestTokens.rsaKey("key-1"), JWSAlgorithm.RS256,
                new JWTClaimsSet.Builder().subject("alice").build());
        // break the signature, decoding must not care
        token = token.substring(0, token.lastIndexOf('.') + 1) + "AAAA";

        TokenHeader header = TokenHeader.decode(token);

        assertEquals(JWSAlgorithm.RS256, header.getAlgorithm());
        assertEquals("key-1", header.getKeyId());
        assertEquals("JWT", header.getType());
        assertEquals("RS256", header.getFields().get("alg"));
        assertEquals("key-1", header.getFields().get("kid"));
    }

    @Test
    @DisplayName("should keep unknown algorithms for the algorithm gate to reject")
    void shouldDecodeUnknownAlgorithm() throws Exception {
        TokenHeader header = TokenHeader.decode(withHeader("{\"alg\":\"HS256\",\"kid\":\"k\"}"));

        assertEquals(JWSAlgorithm.HS256, header.getAlgorithm());
    }

    @Test
    @DisplayName("should reject a header without kid")
    void shouldRejectMissingKid() {
        TokenRejectedException e = assertThrows(TokenRejectedException.class,
                () -> TokenHeader.decode(withHeader("{\"alg\":\"RS256\"}")));
        assertEquals(DenyReason.MALFORMED_REQUEST, e.getReason());
    }

    @Test
    @DisplayName("should reject a header with an empty kid")
    void shouldRejectEmptyKid() {
        assertThrows(TokenRejectedException.class,
                () -> TokenHeader.decode(withHeader("{\"alg\":\"RS256\",\"kid\":\"\"}")));
    }

    @Test
    @DisplayName("should reject a header without alg")
    void shouldRejectMissingAlg() {
        assertThrows(TokenRejectedException.class, () -> TokenHeader.decode(withHeader("{\"kid\":\"k\"}")));
    }

    @Test
    @DisplayName("should reject unsigned tokens")
    void shouldRejectAlgNone() {
        assertThrows(TokenRejectedException.class,
                () -> TokenHeader.decode(withHeader("{\"alg\":\"none\",\"kid\":\"k\"}")));
    }

    @Test
    @DisplayName("should reject a header that is not JSON")
    void shouldRejectGarbage() {
        assertThrows(TokenRejectedException.class, () -> TokenHeader.decode("bm90IGpzb24.e30.c2ln"));
    }

    @Test
    @DisplayName("should reject tokens without three segments")
    void shouldRejectWrongSegmentCount() {
        assertThrows(TokenRejectedException.class, () -> TokenHeader.decode("sometoken"));
        assertThrows(TokenRejectedException.class, () -> TokenHeader.decode("a.b"));
        assertThrows(TokenRejectedException.class, () -> TokenHeader.decode("a.b.c.d.e"));
    }
}
