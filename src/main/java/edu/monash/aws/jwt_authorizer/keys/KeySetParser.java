package edu.monash.aws.jwt_authorizer.keys;

import com.amazonaws.services.lambda.runtime.LambdaLogger;
import com.amazonaws.services.lambda.runtime.logging.LogLevel;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.jwk.Curve;
import com.nimbusds.jose.jwk.ECKey;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.KeyUse;
import com.nimbusds.jose.jwk.OctetKeyPair;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jose.util.JSONObjectUtils;

import java.text.ParseException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Turns a JWKS document into verification keys indexed by key id.
 *
 * <p>Only the document structure is mandatory: {@code keys} has to be an array of JSON
 * objects. A single key that cannot be used for verification (no {@code kid},
 * encryption key, symmetric key, unsupported curve or broken key material) is logged
 * and left out rather than failing the whole set.
 */
public class KeySetParser {
    protected static String keysMember = "keys";

    private final LambdaLogger logger;

    public KeySetParser(LambdaLogger logger) {
        this.logger = logger;
    }

    public Map<String, KeyRecord> parse(String document) throws ParseException {
        if (document == null) {
            throw new ParseException("Empty JWKS document", 0);
        }
        Map<String, Object> json = JSONObjectUtils.parse(document);
        Map<String, Object>[] keys = JSONObjectUtils.getJSONObjectArray(json, keysMember);
        if (keys == null) {
            throw new ParseException("Missing '" + keysMember + "' member in JWKS document", 0);
        }

        Map<String, KeyRecord> records = new LinkedHashMap<>();
        for (Map<String, Object> entry : keys) {
            toKeyRecord(entry).ifPresent(record -> {
                if (records.putIfAbsent(record.getKeyId(), record) != null) {
                    logger.log("Duplicate key id '" + record.getKeyId() + "' in JWKS, keeping the first one",
                            LogLevel.WARN);
                }
            });
        }
        return Collections.unmodifiableMap(records);
    }

    private Optional<KeyRecord> toKeyRecord(Map<String, Object> entry) {
        JWK jwk;
        try {
            jwk = JWK.parse(entry);
        } catch (ParseException e) {
            logger.log("Failed to parse JWK: " + e.getMessage() + ". This key will be ignored", LogLevel.WARN);
            return Optional.empty();
        }

        String keyId = jwk.getKeyID();
        if (keyId == null || keyId.isEmpty()) {
            logger.log("Ignoring JWK without kid", LogLevel.DEBUG);
            return Optional.empty();
        }
        if (KeyUse.ENCRYPTION.equals(jwk.getKeyUse())) {
            logger.log("Ignoring encryption key '" + keyId + "'", LogLevel.DEBUG);
            return Optional.empty();
        }

        Optional<KeyFamily> family = KeyFamily.forKeyType(jwk.getKeyType());
        if (family.isEmpty()) {
            logger.log("Ignoring key '" + keyId + "' with unsupported key type " + jwk.getKeyType(), LogLevel.WARN);
            return Optional.empty();
        }

        JWK publicJwk = jwk.toPublicJWK();
        try {
            checkKeyMaterial(publicJwk, family.get());
        } catch (JOSEException e) {
            logger.log("Failed to create a verification key from JWK '" + keyId + "': " + e.getMessage()
                    + ". This key will be ignored", LogLevel.WARN);
            return Optional.empty();
        }
        return Optional.of(new KeyRecord(keyId, publicJwk, family.get()));
    }

    private void checkKeyMaterial(JWK jwk, KeyFamily family) throws JOSEException {
        switch (family) {
            case RSA:
                ((RSAKey) jwk).toRSAPublicKey();
                break;
            case EC:
                ((ECKey) jwk).toECPublicKey();
                break;
            case OKP:
                if (!Curve.Ed25519.equals(((OctetKeyPair) jwk).getCurve())) {
                    throw new JOSEException("Unsupported OKP curve " + ((OctetKeyPair) jwk).getCurve());
                }
                break;
            default:
                throw new JOSEException("Unsupported key family " + family);
        }
    }
}
