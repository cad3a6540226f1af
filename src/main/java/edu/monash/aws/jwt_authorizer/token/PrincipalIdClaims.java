package edu.monash.aws.jwt_authorizer.token;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Getter;

import java.util.List;
import java.util.Map;

/**
 * Picks the principal id from the first configured claim that has a value.
 */
public class PrincipalIdClaims {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Getter
    private final List<String> fields;
    @Getter
    private final String defaultValue;

    public PrincipalIdClaims(List<String> fields, String defaultValue) {
        this.fields = List.copyOf(fields);
        this.defaultValue = defaultValue;
    }

    public static PrincipalIdClaims fromCommaSeparatedValues(String commaSeparatedValues, String defaultValue) {
        return new PrincipalIdClaims(AcceptedClaims.split(commaSeparatedValues), defaultValue);
    }

    /**
     * Strings are used as they are, other values in their compact JSON form. Claims that
     * are missing, {@code null} or empty are skipped.
     */
    public String resolve(Map<String, Object> claims) {
        for (String field : fields) {
            String principalId = asString(claims.get(field));
            if (principalId != null && !principalId.isEmpty()) {
                return principalId;
            }
        }
        return defaultValue;
    }

    private static String asString(Object value) {
        if (value == null) {
            return null;
        } else if (value instanceof String) {
            return (String) value;
        }
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Claim value cannot be rendered as JSON: " + value, e);
        }
    }
}
