package edu.monash.aws.jwt_authorizer;

import com.nimbusds.jwt.JWTClaimsSet;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of authorizing one request.
 *
 * <p>An Allow always covers every resource ({@code *}) rather than the one that was
 * requested, so API Gateway can cache the decision for a principal and reuse it across
 * all the routes the authorizer protects.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Decision {
    public static final String ANY_RESOURCE = "*";
    public static final String CONTEXT_PRINCIPAL_ID = "principalId";
    public static final String CONTEXT_CLAIMS = "jwtClaims";

    private final boolean allowed;
    private final String resource;
    private final String principalId;
    private final Map<String, Object> context;
    private final JWTClaimsSet claims;
    private final DenyReason denyReason;

    public static Decision allow(String principalId, String serializedClaims, JWTClaimsSet claims) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put(CONTEXT_PRINCIPAL_ID, principalId);
        context.put(CONTEXT_CLAIMS, serializedClaims);
        return new Decision(true, ANY_RESOURCE, principalId, context, claims, null);
    }

    public static Decision deny(DenyReason reason) {
        return new Decision(false, ANY_RESOURCE, null, Map.of(), null, reason);
    }
}
