/*
 * Copyright (c) 2025 KGraph Eligibility
 * Licensed under the Apache License, Version 2.0
 */
package com.kgraph.eligibility.runtime.masking;

import com.kgraph.eligibility.api.spi.ValueMasker;
import com.kgraph.eligibility.runtime.model.ValueNode;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Replaces sensitive values with an opaque token.
 *
 * <p>A sensitive value renders as {@code CATEGORY=[REDACTED:xxxxxxxx]} where the token is a
 * truncated HMAC-SHA256 of the canonical {@code CATEGORY=VALUE} pair under this masker's key.
 * Equal values get equal tokens, so reasons that mention the same value can be correlated
 * without revealing it.
 * Non-sensitive values render in clear text.
 */
public final class OpaqueTokenMasker implements ValueMasker {

    private static final String ALGORITHM = "HmacSHA256";
    private static final int TOKEN_BYTES = 4;
    private static final int KEY_BYTES = 32;

    private final SecretKeySpec key;
    private final ThreadLocal<Mac> macs;

    /**
     * Creates a masker with a random key. Tokens are stable for the lifetime of the instance.
     */
    public OpaqueTokenMasker() {
        this(randomKey());
    }

    public OpaqueTokenMasker(byte[] key) {
        if (key == null || key.length == 0) {
            throw new IllegalArgumentException("Masking key must not be empty");
        }
        this.key = new SecretKeySpec(key.clone(), ALGORITHM);
        this.macs = ThreadLocal.withInitial(this::newMac);
    }

    @Override
    public String render(ValueNode node) {
        if (!node.sensitive()) {
            return node.value().toString();
        }
        return node.value().category() + "=[REDACTED:" + token(node.value().toString()) + "]";
    }

    String token(String value) {
        Mac mac = macs.get();
        byte[] digest = mac.doFinal(value.getBytes(StandardCharsets.UTF_8));
        return HexFormat.of().formatHex(digest, 0, TOKEN_BYTES);
    }

    private Mac newMac() {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(key);
            return mac;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 is not available", e);
        }
    }

    private static byte[] randomKey() {
        byte[] key = new byte[KEY_BYTES];
        new SecureRandom().nextBytes(key);
        return key;
    }
}
