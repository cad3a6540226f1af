package edu.monash.aws.jwt_authorizer;

import com.amazonaws.services.lambda.runtime.LambdaLogger;
import com.amazonaws.services.lambda.runtime.LambdaRuntime;
import com.amazonaws.services.lambda.runtime.logging.LogLevel;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nimbusds.jwt.JWTClaimsSet;
import edu.monash.aws.jwt_authorizer.keys.KeyCache;
import edu.monash.aws.jwt_authorizer.keys.KeyRecord;
import edu.monash.aws.jwt_authorizer.policy.PolicyEvaluator;
import edu.monash.aws.jwt_authorizer.token.AcceptedAlgorithms;
import edu.monash.aws.jwt_authorizer.token.AcceptedClaims;
import edu.monash.aws.jwt_authorizer.token.BearerToken;
import edu.monash.aws.jwt_authorizer.token.PrincipalIdClaims;
import edu.monash.aws.jwt_authorizer.token.TokenHeader;
import edu.monash.aws.jwt_authorizer.token.TokenValidator;

import java.time.Clock;
import java.util.Map;

/**
 * Runs an {@code Authorization} header through every validation stage and turns the
 * outcome into a {@link Decision}. Cheap local checks run before the key lookup, which
 * may hit the network, and the key lookup runs before any cryptography. The first
 * failing stage denies the request.
 *
 * <p>One instance is built per function instance and shared by all its invocations.
 */
public class TokenProcessor {
    private final ObjectMapper mapper = new ObjectMapper();

    private final AcceptedAlgorithms acceptedAlgorithms;
    private final KeyCache keyCache;
    private final TokenValidator tokenValidator;
    private final AcceptedClaims acceptedIssuers;
    private final AcceptedClaims acceptedAudiences;
    private final PolicyEvaluator policy;
    private final PrincipalIdClaims principalIdClaims;

    public TokenProcessor(AuthorizerConfig config, KeyCache keyCache, Clock clock) {
        this.acceptedAlgorithms = config.getAcceptedAlgorithms();
        this.keyCache = keyCache;
        this.tokenValidator = new TokenValidator(clock, config.getClockSkewLeeway());
        this.acceptedIssuers = config.getAcceptedIssuers();
        this.acceptedAudiences = config.getAcceptedAudiences();
        this.policy = config.getPolicy();
        this.principalIdClaims = config.getPrincipalIdClaims();
    }

    public static TokenProcessor fromConfig(AuthorizerConfig config, LambdaLogger logger) {
        Clock clock = Clock.systemUTC();
        return new TokenProcessor(config, KeyCache.create(config, clock, logger), clock);
    }

    /**
     * Reads the configuration from the process environment.
     *
     * @throws ConfigurationException if the environment holds an invalid configuration
     */
    public static TokenProcessor fromEnvironment() {
        LambdaLogger logger = LambdaRuntime.getLogger();
        AuthorizerConfig config = AuthorizerConfig.fromEnvironment(System.getenv());
        logger.log("Config read successfully (jwks_uri='" + config.getJwksUri() + "', accepted_issuers="
                + config.getAcceptedIssuers().getAcceptedValues() + ", accepted_audiences="
                + config.getAcceptedAudiences().getAcceptedValues() + ", accepted_algorithms="
                + config.getAcceptedAlgorithms().getAccepted() + ", cel_validation="
                + config.getPolicy().isEnabled() + ")", LogLevel.INFO);
        return fromConfig(config, logger);
    }

    public Decision process(String authHeader, LambdaLogger logger) {
        try {
            return authorize(authHeader, logger);
        } catch (TokenRejectedException e) {
            logger.log("Denied (" + e.getReason() + "): " + e.getMessage(), LogLevel.INFO);
            return Decision.deny(e.getReason());
        } catch (RuntimeException e) {
            logger.log("Denied after unexpected failure: " + e, LogLevel.ERROR);
            return Decision.deny(DenyReason.MALFORMED_REQUEST);
        }
    }

    private Decision authorize(String authHeader, LambdaLogger logger) throws TokenRejectedException {
        String token = BearerToken.extract(authHeader);
        logger.log("Encoded token has correct prefix.", LogLevel.DEBUG);

        TokenHeader header = TokenHeader.decode(token);
        logger.log("Token header decoded: " + header, LogLevel.DEBUG);

        acceptedAlgorithms.check(header.getAlgorithm());

        KeyRecord key = keyCache.lookup(header.getKeyId());
        logger.log("Found verification key: " + key, LogLevel.DEBUG);

        JWTClaimsSet claims = tokenValidator.validate(token, key, header.getAlgorithm());
        acceptedIssuers.check(claims);
        acceptedAudiences.check(claims);

        Map<String, Object> claimsObject = claims.toJSONObject();
        policy.evaluate(header.getFields(), claimsObject);

        String principalId = principalIdClaims.resolve(claimsObject);
        String serializedClaims;
        try {
            serializedClaims = mapper.writeValueAsString(claimsObject);
        } catch (JsonProcessingException e) {
            throw new TokenRejectedException(DenyReason.MALFORMED_REQUEST,
                    "Failed to serialize token claims: " + e.getMessage(), e);
        }
        logger.log("Allowed principal '" + principalId + "'", LogLevel.INFO);
        return Decision.allow(principalId, serializedClaims, claims);
    }
}
