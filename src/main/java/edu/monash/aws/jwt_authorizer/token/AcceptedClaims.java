package edu.monash.aws.jwt_authorizer.token;

import com.nimbusds.jwt.JWTClaimsSet;
import edu.monash.aws.jwt_authorizer.DenyReason;
import edu.monash.aws.jwt_authorizer.TokenRejectedException;
import lombok.Getter;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Values accepted for a single claim, such as {@code iss} or {@code aud}. The claim may
 * hold one string or a list of strings; at least one of them has to be accepted. No
 * accepted values means any value, or none, passes.
 */
public class AcceptedClaims {
    @Getter
    private final Set<String> acceptedValues;
    @Getter
    private final String claimName;
    private final DenyReason rejection;

    public AcceptedClaims(Collection<String> acceptedValues, String claimName, DenyReason rejection) {
        this.acceptedValues = Collections.unmodifiableSet(new LinkedHashSet<>(acceptedValues));
        this.claimName = claimName;
        this.rejection = rejection;
    }

    public static AcceptedClaims issuers(String commaSeparatedValues) {
        return new AcceptedClaims(split(commaSeparatedValues), "iss", DenyReason.ISSUER_REJECTED);
    }

    public static AcceptedClaims audiences(String commaSeparatedValues) {
        return new AcceptedClaims(split(commaSeparatedValues), "aud", DenyReason.AUDIENCE_REJECTED);
    }

    static List<String> split(String commaSeparatedValues) {
        return Arrays.stream(commaSeparatedValues.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    public boolean isAccepted(String claimValue) {
        return acceptedValues.isEmpty() || acceptedValues.contains(claimValue);
    }

    public void check(JWTClaimsSet claims) throws TokenRejectedException {
        if (acceptedValues.isEmpty()) {
            return;
        }

        List<String> values = claimValues(claims.getClaim(claimName));
        if (values.isEmpty()) {
            throw new TokenRejectedException(rejection, "Missing claim '" + claimName + "'");
        }
        for (String value : values) {
            if (acceptedValues.contains(value)) {
                return;
            }
        }
        throw new TokenRejectedException(rejection, "Unsupported value for claim '" + claimName
                + "' (found=" + values + ", supported=" + acceptedValues + ")");
    }

    private static List<String> claimValues(Object claim) {
        if (claim instanceof String) {
            return List.of((String) claim);
        } else if (claim instanceof Collection) {
            return ((Collection<?>) claim).stream()
                    .filter(String.class::isInstance)
                    .map(String.class::cast)
                    .collect(Collectors.toList());
        }
        return List.of();
    }
}
