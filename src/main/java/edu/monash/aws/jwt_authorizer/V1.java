package edu.monash.aws.jwt_authorizer;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.amazonaws.services.lambda.runtime.events.APIGatewayCustomAuthorizerEvent;
import com.amazonaws.services.lambda.runtime.events.IamPolicyResponseV1;
import com.amazonaws.services.lambda.runtime.events.IamPolicyResponseV1.PolicyDocument;
import com.amazonaws.services.lambda.runtime.events.IamPolicyResponseV1.Statement;

import java.util.List;
import java.util.Map;

/**
 * Authorizer for REST APIs (payload format 1.0). Works as a TOKEN authorizer, or as a
 * REQUEST authorizer reading the {@code Authorization} header.
 */
public class V1 implements RequestHandler<APIGatewayCustomAuthorizerEvent, IamPolicyResponseV1> {
    protected static String authorizationHeader = "Authorization";
    protected static String deniedPrincipalId = "none";

    private final TokenProcessor tokenProcessor;

    public V1() {
        this(TokenProcessor.fromEnvironment());
    }

    public V1(TokenProcessor tokenProcessor) {
        this.tokenProcessor = tokenProcessor;
    }

    @Override
    public IamPolicyResponseV1 handleRequest(APIGatewayCustomAuthorizerEvent event, Context context) {
        String authHeader = event.getAuthorizationToken() != null
                ? event.getAuthorizationToken()
                : headerValue(event.getHeaders(), authorizationHeader);

        Decision decision = tokenProcessor.process(authHeader, context.getLogger());
        if (decision.isAllowed()) {
            return buildResponse(decision.getPrincipalId(), IamPolicyResponseV1.ALLOW, decision.getResource(),
                    decision.getContext(), PolicyConditions.forClaims(decision.getClaims()));
        }
        return buildResponse(deniedPrincipalId, IamPolicyResponseV1.DENY, decision.getResource(),
                Map.of(), Map.of());
    }

    protected IamPolicyResponseV1 buildResponse(String principalId, String effect, String resource,
                                                Map<String, Object> context,
                                                Map<String, Map<String, Object>> conditions) {
        return IamPolicyResponseV1.builder()
                .withPrincipalId(principalId)
                .withPolicyDocument(PolicyDocument.builder()
                        .withVersion(IamPolicyResponseV1.VERSION_2012_10_17)
                        .withStatement(List.of(Statement.builder()
                                .withAction(IamPolicyResponseV1.EXECUTE_API_INVOKE)
                                .withEffect(effect)
                                .withResource(List.of(resource))
                                .withCondition(conditions)
                                .build()))
                        .build())
                .withContext(context)
                .build();
    }

    static String headerValue(Map<String, String> headers, String name) {
        if (headers == null) {
            return null;
        }
        return headers.entrySet().stream()
                .filter(header -> name.equalsIgnoreCase(header.getKey()))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElse(null);
    }
}
