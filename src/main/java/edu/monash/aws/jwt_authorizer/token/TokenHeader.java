package edu.monash.aws.jwt_authorizer.token;

import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.util.Base64URL;
import edu.monash.aws.jwt_authorizer.DenyReason;
import edu.monash.aws.jwt_authorizer.TokenRejectedException;
import lombok.Getter;

import java.text.ParseException;
import java.util.Map;

/**
 * The JOSE header of a token, decoded without looking at the signature. Nothing in
 * here can be trusted until the token has been verified.
 */
@Getter
public class TokenHeader {
    private final JWSAlgorithm algorithm;
    private final String keyId;
    private final String type;
    private final Map<String, Object> fields;

    private TokenHeader(JWSHeader header) {
        this.algorithm = header.getAlgorithm();
        this.keyId = header.getKeyID();
        this.type = header.getType() != null ? header.getType().toString() : null;
        this.fields = header.toJSONObject();
    }

    public static TokenHeader decode(String token) throws TokenRejectedException {
        String[] segments = token.split("\\.", -1);
        if (segments.length != 3) {
            throw new TokenRejectedException(DenyReason.MALFORMED_REQUEST,
                    "Token must have 3 segments, found " + segments.length);
        }

        JWSHeader header;
        try {
            header = JWSHeader.parse(new Base64URL(segments[0]));
        } catch (ParseException e) {
            throw new TokenRejectedException(DenyReason.MALFORMED_REQUEST,
                    "Failed to parse token header: " + e.getMessage(), e);
        }

        if (header.getAlgorithm() == null || header.getAlgorithm().getName().isEmpty()) {
            throw new TokenRejectedException(DenyReason.MALFORMED_REQUEST, "Missing alg in token header");
        }
        if (header.getKeyID() == null || header.getKeyID().isEmpty()) {
            throw new TokenRejectedException(DenyReason.MALFORMED_REQUEST, "Missing kid in token header");
        }
        return new TokenHeader(header);
    }

    @Override
    public String toString() {
        return "TokenHeader(alg=" + algorithm + ", kid=" + keyId + ", typ=" + type + ")";
    }
}
