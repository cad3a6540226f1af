package edu.monash.aws.jwt_authorizer.keys;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.ECDSAVerifier;
import com.nimbusds.jose.crypto.Ed25519Verifier;
import com.nimbusds.jose.crypto.RSASSAVerifier;
import com.nimbusds.jose.jwk.ECKey;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.OctetKeyPair;
import com.nimbusds.jose.jwk.RSAKey;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class KeyRecord {
    private final String keyId;
    private final JWK jwk;
    private final KeyFamily family;

    public JWSVerifier verifier() throws JOSEException {
        switch (family) {
            case RSA:
                return new RSASSAVerifier((RSAKey) jwk);
            case EC:
                return new ECDSAVerifier((ECKey) jwk);
            case OKP:
                return new Ed25519Verifier((OctetKeyPair) jwk);
            default:
                throw new JOSEException("Unsupported key family " + family);
        }
    }

    @Override
    public String toString() {
        return "KeyRecord(kid=" + keyId + ", family=" + family + ")";
    }
}
