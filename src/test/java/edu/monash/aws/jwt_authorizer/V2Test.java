package edu.monash.aws.jwt_authorizer;

import com.amazonaws.services.lambda.runtime.events.APIGatewayV2CustomAuthorizerEvent;
import com.amazonaws.services.lambda.runtime.events.IamPolicyResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("V2 handler")
class V2Test {

    private AuthorizerHandlerFixture fixture;
    private V2 handler;

    @BeforeEach
    void setUp() throws Exception {
        fixture = new AuthorizerHandlerFixture();
        handler = new V2(fixture.processor);
    }

    private IamPolicyResponse handle(APIGatewayV2CustomAuthorizerEvent event) {
        return handler.handleRequest(event, fixture.context);
    }

    @Test
    @DisplayName("should allow a token from the identity source")
    void shouldAllowIdentitySource() {
        APIGatewayV2CustomAuthorizerEvent event = new APIGatewayV2CustomAuthorizerEvent();
        event.setIdentitySource(List.of(fixture.validHeader()));
        event.setRouteArn("arn:aws:execute-api:eu-west-1:123456789012:abc/$default/GET/pets");

        IamPolicyResponse response = handle(event);

        assertEquals("user-1", response.getPrincipalId());
        assertEquals("user-1", response.getContext().get(Decision.CONTEXT_PRINCIPAL_ID));
        assertTrue(response.getContext().containsKey(Decision.CONTEXT_CLAIMS));
    }

    @Test
    @DisplayName("should fall back to the Authorization header")
    void shouldFallBackToHeader() {
        APIGatewayV2CustomAuthorizerEvent event = new APIGatewayV2CustomAuthorizerEvent();
        event.setHeaders(Map.of("authorization", fixture.validHeader()));

        assertEquals("user-1", handle(event).getPrincipalId());
    }

    @Test
    @DisplayName("should deny an expired token")
    void shouldDenyExpired() {
        APIGatewayV2CustomAuthorizerEvent event = new APIGatewayV2CustomAuthorizerEvent();
        event.setIdentitySource(List.of(fixture.expiredHeader()));

        IamPolicyResponse response = handle(event);

        assertEquals("none", response.getPrincipalId());
        assertTrue(response.getContext().isEmpty());
    }

    @Test
    @DisplayName("should deny a request without identity source")
    void shouldDenyMissingToken() {
        IamPolicyResponse response = handle(new APIGatewayV2CustomAuthorizerEvent());

        assertEquals("none", response.getPrincipalId());
    }
}
