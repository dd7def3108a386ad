package io.lightclient.core;

import io.lightclient.core.protocol.SignatureVerifier;

import java.security.PublicKey;
import java.util.concurrent.atomic.AtomicInteger;

/** JCA verifier that counts how often the signature path runs. */
public final class CountingSignatureVerifier implements SignatureVerifier {
    private final SignatureVerifier delegate = SignatureVerifier.jca();
    private final AtomicInteger calls = new AtomicInteger();

    @Override
    public boolean verify(PublicKey publicKey, byte[] message, byte[] signature) {
        calls.incrementAndGet();
        return delegate.verify(publicKey, message, signature);
    }

    public int calls() {
        return calls.get();
    }
}
