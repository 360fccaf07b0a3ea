package com.kgraph.eligibility.api.model;

import com.kgraph.eligibility.api.model.RuleDefinition.Consequence;
import com.kgraph.eligibility.api.model.RuleDefinition.Precondition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ConfigurationFingerprintTest {

    private static final ConfigurationIdentity IDENTITY = ConfigurationIdentity.of("merchant", "adyen");

    private static RuleConfiguration walletRequiresUs() {
        return RuleConfiguration.builder(IDENTITY)
                .revision("1")
                .rule("wallet-us",
                        Precondition.allOf(ValueRef.of("payment_method", "wallet")),
                        Consequence.requires(ValueRef.of("country", "US")))
                .rule("card-not-eur",
                        Precondition.allOf(ValueRef.of("payment_method", "card")),
                        Consequence.excludes(ValueRef.of("currency", "EUR")))
                .build();
    }

    @Test
    @DisplayName("Fingerprint is a stable 128-bit hex string")
    void shouldBeStableHex() {
        String first = ConfigurationFingerprint.of(walletRequiresUs());
        String second = ConfigurationFingerprint.of(walletRequiresUs());

        assertThat(first).hasSize(32).matches("[0-9a-f]{32}").isEqualTo(second);
    }

    @Test
    @DisplayName("Spelling variants of the same values share a fingerprint")
    void shouldIgnoreSpellingVariants() {
        RuleConfiguration lowerCase = RuleConfiguration.builder(IDENTITY)
                .revision("1")
                .rule("wallet-us",
                        Precondition.allOf(ValueRef.of("payment-method", " Wallet ")),
                        Consequence.requires(ValueRef.of("country", "us")))
                .rule("card-not-eur",
                        Precondition.allOf(ValueRef.of("PAYMENT_METHOD", "card")),
                        Consequence.excludes(ValueRef.of("currency", "eur")))
                .build();

        assertThat(ConfigurationFingerprint.of(lowerCase))
                .isEqualTo(ConfigurationFingerprint.of(walletRequiresUs()));
    }

    @Test
    @DisplayName("Descriptions do not influence the fingerprint")
    void shouldIgnoreDescriptions() {
        RuleConfiguration base = walletRequiresUs();
        RuleDefinition first = base.rules().get(0);
        RuleConfiguration described = base.withRules(List.of(
                new RuleDefinition(first.ruleId(), first.when(), first.then(), "only in the US", true),
                base.rules().get(1)));

        assertThat(ConfigurationFingerprint.of(described)).isEqualTo(ConfigurationFingerprint.of(base));
    }

    @Test
    @DisplayName("Every graph-relevant change produces a new fingerprint")
    void shouldChangeWithContent() {
        RuleConfiguration base = walletRequiresUs();
        RuleDefinition first = base.rules().get(0);
        RuleDefinition second = base.rules().get(1);
        String original = ConfigurationFingerprint.of(base);

        List<RuleConfiguration> variants = List.of(
                new RuleConfiguration(IDENTITY, "2", base.rules()),
                base.withRules(List.of(second, first)),
                base.withRules(List.of(first)),
                base.withRules(List.of(new RuleDefinition("renamed", first.when(), first.then(), null, true), second)),
                base.withRules(List.of(new RuleDefinition(first.ruleId(), first.when(), first.then(), null, false), second)),
                base.withRules(List.of(RuleDefinition.of(first.ruleId(), first.when(),
                        Consequence.excludes(ValueRef.of("country", "US"))), second)),
                base.withRules(List.of(RuleDefinition.of(first.ruleId(),
                        Precondition.anyOf(ValueRef.of("payment_method", "wallet")), first.then()), second)),
                base.withRules(List.of(RuleDefinition.of(first.ruleId(), first.when(),
                        Consequence.requires(ValueRef.sensitive("country", "US"))), second)));

        assertThat(variants)
                .extracting(ConfigurationFingerprint::of)
                .doesNotContain(original)
                .doesNotHaveDuplicates();
    }

    @Test
    @DisplayName("Field boundaries are part of the hash")
    void shouldSeparateFields() {
        RuleConfiguration ab = RuleConfiguration.builder(IDENTITY)
                .rule("r", Precondition.allOf(ValueRef.of("ab", "c")), Consequence.requires(ValueRef.of("x", "y")))
                .build();
        RuleConfiguration bc = RuleConfiguration.builder(IDENTITY)
                .rule("r", Precondition.allOf(ValueRef.of("a", "bc")), Consequence.requires(ValueRef.of("x", "y")))
                .build();

        assertThat(ConfigurationFingerprint.of(ab)).isNotEqualTo(ConfigurationFingerprint.of(bc));
    }

    @Test
    @DisplayName("Malformed configurations can still be fingerprinted")
    void shouldTolerateMissingParts() {
        RuleConfiguration malformed = new RuleConfiguration(IDENTITY, null,
                java.util.Arrays.asList(new RuleDefinition(null, null, null, null, null), null));

        assertThat(ConfigurationFingerprint.of(malformed)).hasSize(32);
        assertThat(ConfigurationFingerprint.of(new RuleConfiguration(IDENTITY, null, null))).hasSize(32);
    }
}
