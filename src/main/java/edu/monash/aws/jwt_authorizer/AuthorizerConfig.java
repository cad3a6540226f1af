package edu.monash.aws.jwt_authorizer;

import edu.monash.aws.jwt_authorizer.policy.PolicyEvaluator;
import edu.monash.aws.jwt_authorizer.token.AcceptedAlgorithms;
import edu.monash.aws.jwt_authorizer.token.AcceptedClaims;
import edu.monash.aws.jwt_authorizer.token.PrincipalIdClaims;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.time.Duration;
import java.util.Map;

/**
 * Validation policy of the authorizer, read once from the environment when the
 * function starts.
 *
 * <table>
 *   <caption>Environment variables</caption>
 *   <tr><td>{@code JWKS_URI}</td><td>required, URL of the provider key set</td></tr>
 *   <tr><td>{@code ACCEPTED_ISSUERS}</td><td>comma separated, empty accepts any issuer</td></tr>
 *   <tr><td>{@code ACCEPTED_AUDIENCES}</td><td>comma separated, empty accepts any audience</td></tr>
 *   <tr><td>{@code ACCEPTED_ALGORITHMS}</td><td>comma separated, empty accepts every supported algorithm</td></tr>
 *   <tr><td>{@code MIN_REFRESH_RATE}</td><td>seconds between key set refreshes, default 900</td></tr>
 *   <tr><td>{@code PRINCIPAL_ID_CLAIMS}</td><td>claims tried in order, default {@code preferred_username, sub}</td></tr>
 *   <tr><td>{@code DEFAULT_PRINCIPAL_ID}</td><td>default {@code unknown}</td></tr>
 *   <tr><td>{@code TOKEN_VALIDATION_CEL}</td><td>optional CEL expression</td></tr>
 *   <tr><td>{@code CLOCK_SKEW_LEEWAY}</td><td>seconds tolerated on {@code exp}/{@code nbf}, default 0</td></tr>
 *   <tr><td>{@code JWKS_CONNECT_TIMEOUT}, {@code JWKS_READ_TIMEOUT}</td><td>milliseconds, default 2000</td></tr>
 * </table>
 */
@Getter
@Builder
public class AuthorizerConfig {
    public static final String JWKS_URI = "JWKS_URI";
    public static final String ACCEPTED_ISSUERS = "ACCEPTED_ISSUERS";
    public static final String ACCEPTED_AUDIENCES = "ACCEPTED_AUDIENCES";
    public static final String ACCEPTED_ALGORITHMS = "ACCEPTED_ALGORITHMS";
    public static final String MIN_REFRESH_RATE = "MIN_REFRESH_RATE";
    public static final String PRINCIPAL_ID_CLAIMS = "PRINCIPAL_ID_CLAIMS";
    public static final String DEFAULT_PRINCIPAL_ID = "DEFAULT_PRINCIPAL_ID";
    public static final String TOKEN_VALIDATION_CEL = "TOKEN_VALIDATION_CEL";
    public static final String CLOCK_SKEW_LEEWAY = "CLOCK_SKEW_LEEWAY";
    public static final String JWKS_CONNECT_TIMEOUT = "JWKS_CONNECT_TIMEOUT";
    public static final String JWKS_READ_TIMEOUT = "JWKS_READ_TIMEOUT";

    protected static String defaultMinRefreshRate = "900";
    protected static String defaultPrincipalIdClaims = "preferred_username, sub";
    protected static String defaultPrincipalId = "unknown";
    protected static String defaultJwksTimeout = "2000";

    @NonNull
    private final URL jwksUri;
    @Builder.Default
    private final AcceptedClaims acceptedIssuers = AcceptedClaims.issuers("");
    @Builder.Default
    private final AcceptedClaims acceptedAudiences = AcceptedClaims.audiences("");
    @Builder.Default
    private final AcceptedAlgorithms acceptedAlgorithms = AcceptedAlgorithms.acceptAll();
    @Builder.Default
    private final Duration minRefreshRate = Duration.ofSeconds(900);
    @Builder.Default
    private final PrincipalIdClaims principalIdClaims =
            PrincipalIdClaims.fromCommaSeparatedValues(defaultPrincipalIdClaims, defaultPrincipalId);
    @Builder.Default
    private final PolicyEvaluator policy = PolicyEvaluator.permitAll();
    @Builder.Default
    private final Duration clockSkewLeeway = Duration.ZERO;
    @Builder.Default
    private final int jwksConnectTimeout = 2000;
    @Builder.Default
    private final int jwksReadTimeout = 2000;

    /**
     * @throws ConfigurationException if a variable is missing or invalid
     */
    public static AuthorizerConfig fromEnvironment(Map<String, String> env) {
        String jwksUri = env.get(JWKS_URI);
        if (jwksUri == null || jwksUri.isBlank()) {
            throw new ConfigurationException("Missing required environment variable " + JWKS_URI);
        }

        return AuthorizerConfig.builder()
                .jwksUri(parseUrl(jwksUri.trim()))
                .acceptedIssuers(AcceptedClaims.issuers(env.getOrDefault(ACCEPTED_ISSUERS, "")))
                .acceptedAudiences(AcceptedClaims.audiences(env.getOrDefault(ACCEPTED_AUDIENCES, "")))
                .acceptedAlgorithms(AcceptedAlgorithms.fromCommaSeparatedValues(
                        env.getOrDefault(ACCEPTED_ALGORITHMS, "")))
                .minRefreshRate(Duration.ofSeconds(
                        parseNonNegative(env, MIN_REFRESH_RATE, defaultMinRefreshRate)))
                .principalIdClaims(PrincipalIdClaims.fromCommaSeparatedValues(
                        env.getOrDefault(PRINCIPAL_ID_CLAIMS, defaultPrincipalIdClaims),
                        env.getOrDefault(DEFAULT_PRINCIPAL_ID, defaultPrincipalId)))
                .policy(PolicyEvaluator.compile(env.getOrDefault(TOKEN_VALIDATION_CEL, "")))
                .clockSkewLeeway(Duration.ofSeconds(parseNonNegative(env, CLOCK_SKEW_LEEWAY, "0")))
                .jwksConnectTimeout(Math.toIntExact(parseNonNegative(env, JWKS_CONNECT_TIMEOUT, defaultJwksTimeout)))
                .jwksReadTimeout(Math.toIntExact(parseNonNegative(env, JWKS_READ_TIMEOUT, defaultJwksTimeout)))
                .build();
    }

    private static URL parseUrl(String value) {
        try {
            return new URI(value).toURL();
        } catch (URISyntaxException | MalformedURLException | IllegalArgumentException e) {
            throw new ConfigurationException("Invalid " + JWKS_URI + " value '" + value + "'", e);
        }
    }

    private static long parseNonNegative(Map<String, String> env, String name, String defaultValue) {
        String value = env.getOrDefault(name, defaultValue).trim();
        try {
            long parsed = Long.parseLong(value);
            if (parsed < 0) {
                throw new ConfigurationException("Invalid " + name + " value '" + value + "', must not be negative");
            }
            if (parsed > Integer.MAX_VALUE) {
                throw new ConfigurationException("Invalid " + name + " value '" + value + "', too large");
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid " + name + " value '" + value + "', expected a number", e);
        }
    }
}
