package edu.monash.aws.jwt_authorizer;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.amazonaws.services.lambda.runtime.events.APIGatewayV2CustomAuthorizerEvent;
import com.amazonaws.services.lambda.runtime.events.IamPolicyResponse;

import java.util.List;
import java.util.Map;

/**
 * Authorizer for HTTP APIs (payload format 2.0) returning an IAM policy. The token is
 * taken from the first identity source, normally {@code $request.header.Authorization}.
 */
public class V2 implements RequestHandler<APIGatewayV2CustomAuthorizerEvent, IamPolicyResponse> {
    protected static String authorizationHeader = "Authorization";
    protected static String deniedPrincipalId = "none";

    private final TokenProcessor tokenProcessor;

    public V2() {
        this(TokenProcessor.fromEnvironment());
    }

    public V2(TokenProcessor tokenProcessor) {
        this.tokenProcessor = tokenProcessor;
    }

    @Override
    public IamPolicyResponse handleRequest(APIGatewayV2CustomAuthorizerEvent event, Context context) {
        List<String> identitySource = event.getIdentitySource();
        String authHeader = identitySource != null && !identitySource.isEmpty()
                ? identitySource.get(0)
                : V1.headerValue(event.getHeaders(), authorizationHeader);

        Decision decision = tokenProcessor.process(authHeader, context.getLogger());
        if (decision.isAllowed()) {
            return buildResponse(decision.getPrincipalId(), IamPolicyResponse.ALLOW, decision.getResource(),
                    decision.getContext(), PolicyConditions.forClaims(decision.getClaims()));
        }
        return buildResponse(deniedPrincipalId, IamPolicyResponse.DENY, decision.getResource(),
                Map.of(), Map.of());
    }

    protected IamPolicyResponse buildResponse(String principalId, String effect, String resource,
                                              Map<String, Object> context,
                                              Map<String, Map<String, Object>> conditions) {
        return IamPolicyResponse.builder()
                .withPrincipalId(principalId)
                .withPolicyDocument(IamPolicyResponse.PolicyDocument.builder()
                        .withVersion(IamPolicyResponse.VERSION_2012_10_17)
                        .withStatement(List.of(IamPolicyResponse.Statement.builder()
                                .withAction(IamPolicyResponse.EXECUTE_API_INVOKE)
                                .withEffect(effect)
                                .withResource(List.of(resource))
                                .withCondition(conditions)
                                .build()))
                        .build())
                .withContext(context)
                .build();
    }
}
