package io.lightclient.core.protocol;

import java.security.PublicKey;

/**
 * Returns true iff {@code signature} verifies over {@code message} under {@code publicKey}.
 * Implementations must not throw for bad signatures or mismatched key types.
 */
@FunctionalInterface
public interface SignatureVerifier {
    boolean verify(PublicKey publicKey, byte[] message, byte[] signature);

    /** JCA-backed verifier; the algorithm follows the key type (Ed25519, EC). */
    static SignatureVerifier jca() {
        return (publicKey, message, signature) -> SignatureUtil.verify(message, signature, publicKey);
    }
}
