package edu.monash.aws.jwt_authorizer;

import com.nimbusds.jwt.JWTClaimsSet;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * IAM policy conditions that keep a cached Allow from outliving the token's validity
 * window.
 */
final class PolicyConditions {
    static String dateGreaterThan = "DateGreaterThan";
    static String dateLessThan = "DateLessThan";
    static String currentTime = "aws:CurrentTime";

    private PolicyConditions() {
    }

    static Map<String, Map<String, Object>> forClaims(JWTClaimsSet claims) {
        Map<String, Map<String, Object>> conditions = new LinkedHashMap<>();
        if (claims == null) {
            return conditions;
        }

        Date notBefore = claims.getNotBeforeTime() != null ? claims.getNotBeforeTime() : claims.getIssueTime();
        if (notBefore != null) {
            conditions.put(dateGreaterThan, timedCondition(notBefore));
        }
        if (claims.getExpirationTime() != null) {
            conditions.put(dateLessThan, timedCondition(claims.getExpirationTime()));
        }
        return conditions;
    }

    private static Map<String, Object> timedCondition(Date epoch) {
        return Map.of(currentTime, ZonedDateTime
                .ofInstant(epoch.toInstant(), ZoneId.of("UTC"))
                .format(DateTimeFormatter.ISO_INSTANT));
    }
}
