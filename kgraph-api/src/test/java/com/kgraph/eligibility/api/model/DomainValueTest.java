package com.kgraph.eligibility.api.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DomainValueTest {

    @Test
    @DisplayName("Category and value are canonicalised on construction")
    void shouldCanonicalise() {
        DomainValue value = DomainValue.of(" payment-method ", " wallet");

        assertThat(value.category()).isEqualTo("PAYMENT_METHOD");
        assertThat(value.value()).isEqualTo("WALLET");
        assertThat(value).hasToString("PAYMENT_METHOD=WALLET");
    }

    @Test
    @DisplayName("Differently spelled values are equal after canonicalisation")
    void shouldTreatSpellingVariantsAsEqual() {
        assertThat(DomainValue.of("payment-method", "wallet"))
                .isEqualTo(DomainValue.of("PAYMENT_METHOD", "WALLET"))
                .hasSameHashCodeAs(DomainValue.of("Payment_Method", "Wallet"));
    }

    @Test
    @DisplayName("Values sort by category, then by value")
    void shouldSortByCategoryThenValue() {
        TreeSet<DomainValue> sorted = new TreeSet<>(List.of(
                DomainValue.of("country", "US"),
                DomainValue.of("currency", "EUR"),
                DomainValue.of("country", "DE")));

        assertThat(sorted).containsExactly(
                DomainValue.of("country", "DE"),
                DomainValue.of("country", "US"),
                DomainValue.of("currency", "EUR"));
    }

    @Test
    @DisplayName("Null parts are rejected")
    void shouldRejectNulls() {
        assertThatThrownBy(() -> DomainValue.of(null, "US")).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> DomainValue.of("country", null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("Candidate builder de-duplicates canonical values")
    void candidateBuilderShouldDeduplicate() {
        CandidateAssignment candidate = CandidateAssignment.builder()
                .with("country", "us")
                .with("COUNTRY", " US ")
                .with("currency", "usd")
                .build();

        assertThat(candidate.size()).isEqualTo(2);
        assertThat(candidate.contains(DomainValue.of("country", "US"))).isTrue();
        assertThat(candidate.values()).isEqualTo(Set.of(
                DomainValue.of("country", "US"), DomainValue.of("currency", "USD")));
    }

    @Test
    @DisplayName("Identity renders version only when present")
    void identityShouldRenderVersion() {
        assertThat(ConfigurationIdentity.of("m1", "stripe")).hasToString("m1/stripe");
        assertThat(ConfigurationIdentity.of("m1", "stripe", "v2")).hasToString("m1/stripe@v2");
        assertThat(new ConfigurationIdentity("m1", "stripe", null))
                .isEqualTo(ConfigurationIdentity.of("m1", "stripe"));
    }
}
