/*
 * Copyright (c) 2025 KGraph Eligibility
 * Licensed under the Apache License, Version 2.0
 */
package com.kgraph.eligibility.compiler.catalog;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kgraph.eligibility.api.exceptions.ConfigurationReadException;
import com.kgraph.eligibility.api.model.DomainValue;
import com.kgraph.eligibility.api.spi.DomainCatalog;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Currency;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Immutable in-memory {@link DomainCatalog}.
 *
 * <p>Category and value names are canonicalised the same way {@link DomainValue} does, so the
 * catalog can be declared in any spelling.
 */
public final class StaticDomainCatalog implements DomainCatalog {
    private static final Logger logger = Logger.getLogger(StaticDomainCatalog.class.getName());

    private final Map<String, Set<String>> fixedCategories;
    private final Set<String> openCategories;
    private final Set<String> sensitiveCategories;

    private StaticDomainCatalog(Builder builder) {
        Map<String, Set<String>> fixed = new HashMap<>();
        builder.fixed.forEach((category, values) -> fixed.put(category, Set.copyOf(values)));
        this.fixedCategories = Map.copyOf(fixed);
        this.openCategories = Set.copyOf(builder.open);
        this.sensitiveCategories = Set.copyOf(builder.sensitive);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Payment attribute defaults: ISO countries and currencies as known to the JDK, the common
     * payment method, capture method and card network enumerations, and open categories for
     * connector-specific labels. Card BINs are open and sensitive.
     */
    public static StaticDomainCatalog paymentDefaults() {
        Builder builder = builder()
                .fixedCategory("COUNTRY", List.of(Locale.getISOCountries()))
                .fixedCategory("PAYMENT_METHOD", List.of(
                        "CARD", "WALLET", "BANK_TRANSFER", "BANK_REDIRECT", "BANK_DEBIT",
                        "PAY_LATER", "CRYPTO", "UPI", "VOUCHER", "GIFT_CARD", "REWARD"))
                .fixedCategory("CAPTURE_METHOD", List.of(
                        "AUTOMATIC", "MANUAL", "MANUAL_MULTIPLE", "SCHEDULED"))
                .fixedCategory("CARD_NETWORK", List.of(
                        "VISA", "MASTERCARD", "AMERICAN_EXPRESS", "DISCOVER", "JCB",
                        "DINERS_CLUB", "UNIONPAY", "MAESTRO", "CARTES_BANCAIRES", "INTERAC", "RUPAY"))
                .openCategory("CONNECTOR")
                .openCategory("PAYMENT_METHOD_TYPE")
                .openCategory("METADATA")
                .openCategory("CARD_BIN")
                .sensitiveCategory("CARD_BIN");

        Set<String> currencies = new HashSet<>();
        for (Currency currency : Currency.getAvailableCurrencies()) {
            currencies.add(currency.getCurrencyCode());
        }
        return builder.fixedCategory("CURRENCY", currencies).build();
    }

    public static StaticDomainCatalog fromJson(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return fromJson(in);
        } catch (IOException e) {
            throw new ConfigurationReadException("Failed to read domain catalog " + path, e);
        }
    }

    /**
     * Reads {@code {"fixed":{"CATEGORY":["V1",...]},"open":[...],"sensitive":[...]}}.
     */
    public static StaticDomainCatalog fromJson(InputStream in) {
        CatalogDocument document;
        try {
            document = new ObjectMapper().readValue(in, CatalogDocument.class);
        } catch (JsonProcessingException e) {
            throw new ConfigurationReadException("Malformed domain catalog: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConfigurationReadException("Failed to read domain catalog: " + e.getMessage(), e);
        }
        if (document == null) {
            throw new ConfigurationReadException("Domain catalog document is empty");
        }
        Builder builder = builder();
        if (document.fixed() != null) {
            document.fixed().forEach(builder::fixedCategory);
        }
        if (document.open() != null) {
            document.open().forEach(builder::openCategory);
        }
        if (document.sensitive() != null) {
            document.sensitive().forEach(builder::sensitiveCategory);
        }
        StaticDomainCatalog catalog = builder.build();
        logger.info("Loaded domain catalog: " + catalog.fixedCategories.size() + " fixed categories, "
                + catalog.openCategories.size() + " open categories");
        return catalog;
    }

    @Override
    public Lookup lookup(DomainValue value) {
        Set<String> members = fixedCategories.get(value.category());
        if (members != null) {
            return members.contains(value.value()) ? Lookup.RECOGNIZED_FIXED : Lookup.UNKNOWN_VALUE;
        }
        return openCategories.contains(value.category()) ? Lookup.RECOGNIZED_OPEN : Lookup.UNKNOWN_CATEGORY;
    }

    @Override
    public boolean isSensitive(String category) {
        return sensitiveCategories.contains(DomainValue.canonicalCategory(category));
    }

    public Set<String> fixedCategories() {
        return fixedCategories.keySet();
    }

    public Set<String> openCategories() {
        return openCategories;
    }

    public static final class Builder {
        private final Map<String, Set<String>> fixed = new HashMap<>();
        private final Set<String> open = new HashSet<>();
        private final Set<String> sensitive = new HashSet<>();

        private Builder() {
        }

        public Builder fixedCategory(String category, Collection<String> values) {
            Set<String> members = fixed.computeIfAbsent(DomainValue.canonicalCategory(category), k -> new HashSet<>());
            for (String value : values) {
                members.add(DomainValue.canonicalValue(value));
            }
            return this;
        }

        public Builder openCategory(String category) {
            open.add(DomainValue.canonicalCategory(category));
            return this;
        }

        public Builder sensitiveCategory(String category) {
            sensitive.add(DomainValue.canonicalCategory(category));
            return this;
        }

        public StaticDomainCatalog build() {
            for (String category : open) {
                if (fixed.containsKey(category)) {
                    throw new IllegalStateException("Category " + category + " is declared both fixed and open");
                }
            }
            return new StaticDomainCatalog(this);
        }
    }

    record CatalogDocument(
            @JsonProperty("fixed") Map<String, List<String>> fixed,
            @JsonProperty("open") List<String> open,
            @JsonProperty("sensitive") List<String> sensitive
    ) {
    }
}
