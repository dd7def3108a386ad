package io.lightclient.core.protocol;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public final class Hashes {
    public static final int SHA256_LENGTH = 32;

    /** SHA-256, the digest Tendermint-family chains use for headers and validator sets. */
    public static final Hasher SHA256 = Hashes::sha256;

    private Hashes(){}

    public static byte[] sha256(byte[] in){
        try {
            return MessageDigest.getInstance("SHA-256").digest(in);
        } catch (NoSuchAlgorithmException e) {
            throw new RuntimeException("SHA-256 not available", e);
        }
    }
}
