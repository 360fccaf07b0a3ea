/*
 * Copyright (c) 2025 KGraph Eligibility
 * Licensed under the Apache License, Version 2.0
 */
package com.kgraph.eligibility.api.spi;

import com.kgraph.eligibility.api.model.DomainValue;

/**
 * Source of the recognised (category, value) pairs.
 *
 * <p>A fixed category is a closed enumeration (countries, currencies, payment methods). An open
 * category accepts any value introduced by configuration (connector labels, metadata keys).
 */
public interface DomainCatalog {

    enum Lookup {
        RECOGNIZED_FIXED,
        RECOGNIZED_OPEN,
        UNKNOWN_CATEGORY,
        UNKNOWN_VALUE;

        public boolean isRecognized() {
            return this == RECOGNIZED_FIXED || this == RECOGNIZED_OPEN;
        }
    }

    Lookup lookup(DomainValue value);

    /**
     * Whether values of the category must be masked whenever they are rendered.
     */
    boolean isSensitive(String category);

    /**
     * A catalog that treats every category as open and nothing as sensitive.
     */
    static DomainCatalog permissive() {
        return new DomainCatalog() {
            @Override
            public Lookup lookup(DomainValue value) {
                return Lookup.RECOGNIZED_OPEN;
            }

            @Override
            public boolean isSensitive(String category) {
                return false;
            }
        };
    }
}
