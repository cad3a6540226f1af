package edu.monash.aws.jwt_authorizer.keys;

import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.jwk.KeyType;

import java.util.Optional;

public enum KeyFamily {
    RSA,
    EC,
    OKP;

    public static Optional<KeyFamily> forAlgorithm(JWSAlgorithm algorithm) {
        if (JWSAlgorithm.Family.RSA.contains(algorithm)) {
            return Optional.of(RSA);
        } else if (JWSAlgorithm.Family.EC.contains(algorithm)) {
            return Optional.of(EC);
        } else if (JWSAlgorithm.Family.ED.contains(algorithm)) {
            return Optional.of(OKP);
        }
        return Optional.empty();
    }

    public static Optional<KeyFamily> forKeyType(KeyType keyType) {
        if (KeyType.RSA.equals(keyType)) {
            return Optional.of(RSA);
        } else if (KeyType.EC.equals(keyType)) {
            return Optional.of(EC);
        } else if (KeyType.OKP.equals(keyType)) {
            return Optional.of(OKP);
        }
        return Optional.empty();
    }
}
