/*
 * Copyright (c) 2025 KGraph Eligibility
 * Licensed under the Apache License, Version 2.0
 */
package com.kgraph.eligibility.api.model;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Content fingerprint of a {@link RuleConfiguration}.
 *
 * <p>Two FNV-1a lanes with different seeds are mixed into a 128-bit value and hex encoded.
 * Everything that influences the compiled graph is hashed: the revision, rule order, rule ids,
 * preconditions, consequences, value references (canonical form plus sensitivity) and the
 * enabled flag. Descriptions are ignored. Values are hashed in canonical form, so a
 * configuration that differs only in case or whitespace of its values has the same fingerprint.
 */
public final class ConfigurationFingerprint {

    private static final long FNV_OFFSET = 0xcbf29ce484222325L;
    private static final long FNV_PRIME = 0x100000001b3L;
    private static final long LANE2_SEED = 0x9E3779B185EBCA87L;
    private static final long MIX_1 = 0xff51afd7ed558ccdL;
    private static final long MIX_2 = 0xc4ceb9fe1a85ec53L;

    // Field separators, so that ("ab","c") and ("a","bc") never collide.
    private static final byte NULL_MARKER = 0x00;
    private static final byte FIELD_MARKER = 0x1F;
    private static final byte RULE_MARKER = 0x1E;

    private long lane1 = FNV_OFFSET;
    private long lane2 = FNV_OFFSET ^ LANE2_SEED;

    private ConfigurationFingerprint() {
    }

    public static String of(RuleConfiguration configuration) {
        ConfigurationFingerprint fp = new ConfigurationFingerprint();
        fp.string(configuration.revision());
        List<RuleDefinition> rules = configuration.rules();
        if (rules == null) {
            fp.marker(NULL_MARKER);
            return fp.hex();
        }
        fp.integer(rules.size());
        for (RuleDefinition rule : rules) {
            fp.marker(RULE_MARKER);
            if (rule == null) {
                fp.marker(NULL_MARKER);
                continue;
            }
            fp.string(rule.ruleId());
            fp.bool(rule.enabled());
            if (rule.when() == null) {
                fp.marker(NULL_MARKER);
            } else {
                fp.string(rule.when().match() != null ? rule.when().match().name() : null);
                fp.values(rule.when().values());
            }
            if (rule.then() == null) {
                fp.marker(NULL_MARKER);
            } else {
                fp.string(rule.then().type() != null ? rule.then().type().name() : null);
                fp.values(rule.then().values());
            }
        }
        return fp.hex();
    }

    private void values(List<ValueRef> values) {
        if (values == null) {
            marker(NULL_MARKER);
            return;
        }
        integer(values.size());
        for (ValueRef ref : values) {
            if (ref == null) {
                marker(NULL_MARKER);
                continue;
            }
            string(ref.category() != null ? DomainValue.canonicalCategory(ref.category()) : null);
            string(ref.value() != null ? DomainValue.canonicalValue(ref.value()) : null);
            bool(ref.sensitive());
        }
    }

    private void string(String s) {
        if (s == null) {
            marker(NULL_MARKER);
            return;
        }
        for (byte b : s.getBytes(StandardCharsets.UTF_8)) {
            update(b);
        }
        marker(FIELD_MARKER);
    }

    private void integer(int value) {
        update((byte) (value >>> 24));
        update((byte) (value >>> 16));
        update((byte) (value >>> 8));
        update((byte) value);
    }

    private void bool(boolean value) {
        update(value ? (byte) 1 : (byte) 2);
    }

    private void marker(byte marker) {
        update(marker);
    }

    private void update(byte b) {
        lane1 ^= (b & 0xFF);
        lane1 *= FNV_PRIME;
        lane2 ^= (b & 0xFF);
        lane2 *= FNV_PRIME;
        lane2 = Long.rotateLeft(lane2, 5);
    }

    private String hex() {
        long h1 = finalizeHash(lane1);
        long h2 = finalizeHash(lane2 ^ h1);
        return String.format("%016x%016x", h1, h2);
    }

    private static long finalizeHash(long hash) {
        hash ^= hash >>> 33;
        hash *= MIX_1;
        hash ^= hash >>> 33;
        hash *= MIX_2;
        hash ^= hash >>> 33;
        return hash;
    }
}
