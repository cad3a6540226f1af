package edu.monash.aws.jwt_authorizer.token;

import com.nimbusds.jose.JWSAlgorithm;
import edu.monash.aws.jwt_authorizer.ConfigurationException;
import edu.monash.aws.jwt_authorizer.DenyReason;
import edu.monash.aws.jwt_authorizer.TokenRejectedException;
import lombok.Getter;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Signing algorithms a token may use. Only asymmetric algorithms are supported; an
 * empty accepted set means any of them.
 */
public class AcceptedAlgorithms {
    public static final Set<JWSAlgorithm> SUPPORTED_ALGORITHMS = Collections.unmodifiableSet(new LinkedHashSet<>(List.of(
            JWSAlgorithm.ES256,
            JWSAlgorithm.ES384,
            JWSAlgorithm.RS256,
            JWSAlgorithm.RS384,
            JWSAlgorithm.RS512,
            JWSAlgorithm.PS256,
            JWSAlgorithm.PS384,
            JWSAlgorithm.PS512,
            JWSAlgorithm.EdDSA)));

    @Getter
    private final Set<JWSAlgorithm> accepted;

    public AcceptedAlgorithms(Set<JWSAlgorithm> accepted) {
        for (JWSAlgorithm algorithm : accepted) {
            if (!SUPPORTED_ALGORITHMS.contains(algorithm)) {
                throw new ConfigurationException("Unsupported algorithm '" + algorithm
                        + "'. Only public-key algorithms are supported: " + SUPPORTED_ALGORITHMS);
            }
        }
        this.accepted = Collections.unmodifiableSet(new LinkedHashSet<>(accepted));
    }

    public static AcceptedAlgorithms acceptAll() {
        return new AcceptedAlgorithms(Set.of());
    }

    public static AcceptedAlgorithms fromCommaSeparatedValues(String commaSeparatedValues) {
        Set<JWSAlgorithm> algorithms = Arrays.stream(commaSeparatedValues.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(JWSAlgorithm::parse)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        return new AcceptedAlgorithms(algorithms);
    }

    public boolean isAccepted(JWSAlgorithm algorithm) {
        return SUPPORTED_ALGORITHMS.contains(algorithm) && (accepted.isEmpty() || accepted.contains(algorithm));
    }

    public void check(JWSAlgorithm algorithm) throws TokenRejectedException {
        if (!isAccepted(algorithm)) {
            throw new TokenRejectedException(DenyReason.UNSUPPORTED_ALGORITHM,
                    "Unsupported algorithm (found='" + algorithm + "', accepted="
                            + (accepted.isEmpty() ? SUPPORTED_ALGORITHMS : accepted) + ")");
        }
    }
}
