package io.lightclient.core.protocol;

import java.security.*;

public final class SignatureUtil {
    public static final int ADDRESS_LENGTH = 20;

    private SignatureUtil() {}

    public static byte[] sign(byte[] data, PrivateKey priv) {
        try {
            Signature sig = Signature.getInstance(algorithmFor(priv.getAlgorithm()));
            sig.initSign(priv);
            sig.update(data);
            return sig.sign();
        } catch (Exception e) {
            throw new RuntimeException("Signing failed", e);
        }
    }

    public static boolean verify(byte[] data, byte[] signature, PublicKey pub) {
        if (pub == null || data == null || signature == null) {
            return false;
        }
        try {
            Signature sig = Signature.getInstance(algorithmFor(pub.getAlgorithm()));
            sig.initVerify(pub);
            sig.update(data);
            return sig.verify(signature);
        } catch (Exception e) {
            return false;
        }
    }

    /** Validator address: first 20 bytes of SHA-256 over the X.509 key encoding, hex. */
    public static String deriveAddress(PublicKey pub) {
        byte[] hash = Hashes.sha256(pub.getEncoded());
        byte[] addr = new byte[ADDRESS_LENGTH];
        System.arraycopy(hash, 0, addr, 0, ADDRESS_LENGTH);
        return Hex.encode(addr);
    }

    static String algorithmFor(String keyAlgorithm) {
        switch (keyAlgorithm) {
            case "EdDSA":
            case "Ed25519":
                return "Ed25519";
            case "EC":
                return "SHA256withECDSA";
            default:
                throw new IllegalArgumentException("Unsupported key algorithm: " + keyAlgorithm);
        }
    }
}
