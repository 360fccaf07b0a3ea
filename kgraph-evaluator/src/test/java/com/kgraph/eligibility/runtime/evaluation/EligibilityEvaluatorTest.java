package com.kgraph.eligibility.runtime.evaluation;

import com.kgraph.eligibility.api.model.CandidateAssignment;
import com.kgraph.eligibility.api.model.ConfigurationIdentity;
import com.kgraph.eligibility.api.model.EligibilityResult;
import com.kgraph.eligibility.api.model.RuleConfiguration;
import com.kgraph.eligibility.api.model.ValueRef;
import com.kgraph.eligibility.api.model.Violation;
import com.kgraph.eligibility.api.spi.DomainCatalog;
import com.kgraph.eligibility.api.spi.ValueMasker;
import com.kgraph.eligibility.compiler.RuleCompiler;
import com.kgraph.eligibility.runtime.engine.DefaultConstraintGraphEngine;
import com.kgraph.eligibility.runtime.masking.OpaqueTokenMasker;
import com.kgraph.eligibility.runtime.model.CompiledGraph;
import com.kgraph.eligibility.runtime.model.RelationKind;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.kgraph.eligibility.api.model.RuleDefinition.Consequence.excludes;
import static com.kgraph.eligibility.api.model.RuleDefinition.Consequence.oneOf;
import static com.kgraph.eligibility.api.model.RuleDefinition.Consequence.requires;
import static com.kgraph.eligibility.api.model.RuleDefinition.Precondition.allOf;
import static com.kgraph.eligibility.api.model.RuleDefinition.Precondition.always;
import static com.kgraph.eligibility.api.model.RuleDefinition.Precondition.noneOf;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EligibilityEvaluatorTest {

    private static final ConfigurationIdentity IDENTITY = ConfigurationIdentity.of("merchant-1", "stripe");

    private final RuleCompiler compiler =
            new RuleCompiler(DomainCatalog.permissive(), OpenTelemetry.noop().getTracer("test"));
    private final EligibilityEvaluator evaluator = new EligibilityEvaluator();

    private static ValueRef v(String category, String value) {
        return ValueRef.of(category, value);
    }

    private static CandidateAssignment candidate(String... pairs) {
        CandidateAssignment.Builder builder = CandidateAssignment.builder();
        for (int i = 0; i < pairs.length; i += 2) {
            builder.with(pairs[i], pairs[i + 1]);
        }
        return builder.build();
    }

    private CompiledGraph walletRequiresUs() {
        return compiler.compile(RuleConfiguration.builder(IDENTITY)
                .rule("wallet-us", allOf(v("payment_method", "wallet")), requires(v("country", "US")))
                .build());
    }

    @Nested
    @DisplayName("Requirements")
    class Requirements {

        @Test
        @DisplayName("Wallet outside the US is rejected with the requiring rule")
        void shouldRejectUnmetRequirement() {
            CompiledGraph graph = walletRequiresUs();

            EligibilityResult result = evaluator.evaluate(graph,
                    candidate("payment_method", "wallet", "country", "DE"), true);

            assertThat(result.eligible()).isFalse();
            assertThat(result.explained()).isTrue();
            assertThat(result.graphFingerprint()).isEqualTo(graph.fingerprint());
            assertThat(result.reasons()).singleElement().satisfies(violation -> {
                assertThat(violation.relation()).isEqualTo(RelationKind.REQUIRES);
                assertThat(violation.ruleIds()).containsExactly("wallet-us");
                assertThat(violation.source()).isEqualTo("PAYMENT_METHOD=WALLET");
                assertThat(violation.target()).isEqualTo("COUNTRY=US");
                assertThat(violation.describe())
                        .isEqualTo("PAYMENT_METHOD=WALLET requires COUNTRY=US, which is not satisfied (rule wallet-us)");
            });
        }

        @Test
        @DisplayName("Wallet in the US and unrelated methods are eligible")
        void shouldAcceptSatisfiedOrUnrelatedCandidates() {
            CompiledGraph graph = walletRequiresUs();

            assertThat(evaluator.evaluate(graph, candidate("payment_method", "wallet", "country", "US"), true).eligible())
                    .isTrue();
            assertThat(evaluator.evaluate(graph, candidate("payment_method", "card"), true).eligible()).isTrue();
            assertThat(evaluator.evaluate(graph, candidate("country", "US"), true).eligible()).isTrue();
        }

        @Test
        @DisplayName("One-of requirement accepts any listed option")
        void shouldEvaluateOneOf() {
            CompiledGraph graph = compiler.compile(RuleConfiguration.builder(IDENTITY)
                    .rule("wallet-markets", allOf(v("payment_method", "wallet")),
                            oneOf(v("country", "US"), v("country", "DE")))
                    .build());

            assertThat(evaluator.isEligible(graph, candidate("payment_method", "wallet", "country", "DE"))).isTrue();

            EligibilityResult result = evaluator.evaluate(graph,
                    candidate("payment_method", "wallet", "country", "FR"), true);
            assertThat(result.reasons()).extracting(Violation::target)
                    .containsExactly("ANY(COUNTRY=DE, COUNTRY=US)");
        }
    }

    @Nested
    @DisplayName("Exclusions")
    class Exclusions {

        @Test
        @DisplayName("Mutual exclusion declared twice yields one reason citing both rules")
        void shouldReportSymmetricExclusionOnce() {
            CompiledGraph graph = compiler.compile(RuleConfiguration.builder(IDENTITY)
                    .rule("no-jpy-klarna", allOf(v("payment_method_type", "klarna")), excludes(v("currency", "JPY")))
                    .rule("no-klarna-jpy", allOf(v("currency", "JPY")), excludes(v("payment_method_type", "klarna")))
                    .build());

            EligibilityResult both = evaluator.evaluate(graph,
                    candidate("payment_method_type", "klarna", "currency", "jpy"), true);

            assertThat(both.eligible()).isFalse();
            assertThat(both.reasons()).singleElement().satisfies(violation -> {
                assertThat(violation.relation()).isEqualTo(RelationKind.EXCLUDES);
                assertThat(violation.ruleIds()).containsExactly("no-jpy-klarna", "no-klarna-jpy");
                assertThat(violation.describe()).contains("excludes", "which is present");
            });
            assertThat(evaluator.isEligible(graph, candidate("payment_method_type", "klarna"))).isTrue();
            assertThat(evaluator.isEligible(graph, candidate("currency", "JPY"))).isTrue();
        }

        @Test
        @DisplayName("Unconditional exclusions apply once the candidate touches the graph")
        void shouldApplyAlwaysRules() {
            CompiledGraph graph = compiler.compile(RuleConfiguration.builder(IDENTITY)
                    .rule("no-jpy", always(), excludes(v("currency", "JPY")))
                    .build());

            EligibilityResult result = evaluator.evaluate(graph, candidate("currency", "JPY", "country", "JP"), true);

            assertThat(result.reasons()).singleElement()
                    .extracting(Violation::describe)
                    .isEqualTo("ALWAYS excludes CURRENCY=JPY, which is present (rule no-jpy)");
            assertThat(evaluator.isEligible(graph, candidate("currency", "EUR"))).isTrue();
        }

        @Test
        @DisplayName("NONE precondition holds until one of its values is present")
        void shouldEvaluateNegatedPreconditions() {
            CompiledGraph graph = compiler.compile(RuleConfiguration.builder(IDENTITY)
                    .rule("auto-capture", noneOf(v("payment_method", "wallet"), v("payment_method", "pay_later")),
                            requires(v("capture_method", "automatic")))
                    .rule("manual-not-jp", allOf(v("capture_method", "manual")), excludes(v("country", "JP")))
                    .build());

            EligibilityResult manual = evaluator.evaluate(graph, candidate("capture_method", "manual"), true);
            assertThat(manual.reasons()).singleElement().satisfies(violation -> {
                assertThat(violation.source()).isEqualTo("NONE(PAYMENT_METHOD=PAY_LATER, PAYMENT_METHOD=WALLET)");
                assertThat(violation.target()).isEqualTo("CAPTURE_METHOD=AUTOMATIC");
            });

            assertThat(evaluator.isEligible(graph,
                    candidate("capture_method", "manual", "payment_method", "wallet"))).isTrue();
            assertThat(evaluator.isEligible(graph, candidate("capture_method", "automatic"))).isTrue();
        }
    }

    @Nested
    @DisplayName("Results")
    class Results {

        @Test
        @DisplayName("Every violation is reported, ordered by edge id")
        void shouldCollectAllViolationsInEdgeOrder() {
            CompiledGraph graph = compiler.compile(RuleConfiguration.builder(IDENTITY)
                    .rule("wallet-us", allOf(v("payment_method", "wallet")), requires(v("country", "US")))
                    .rule("wallet-not-eur", allOf(v("payment_method", "wallet")), excludes(v("currency", "EUR")))
                    .build());

            EligibilityResult result = evaluator.evaluate(graph,
                    candidate("payment_method", "wallet", "country", "DE", "currency", "EUR"), true);

            assertThat(result.violationCount()).isEqualTo(2);
            assertThat(result.reasons()).extracting(Violation::ruleIds)
                    .containsExactly(List.of("wallet-us"), List.of("wallet-not-eur"));
            assertThat(result.reasons()).extracting(Violation::edgeId).isSorted();
            assertThat(result.toDetailedString()).startsWith("INELIGIBLE:\n  - ");
        }

        @Test
        @DisplayName("Fast path reports the decision without reasons")
        void shouldSkipReasonsWithoutExplain() {
            CompiledGraph graph = walletRequiresUs();

            EligibilityResult denied = evaluator.evaluate(graph, candidate("payment_method", "wallet"), false);
            EligibilityResult allowed = evaluator.evaluate(graph,
                    candidate("payment_method", "wallet", "country", "US"), false);

            assertThat(denied.eligible()).isFalse();
            assertThat(denied.explained()).isFalse();
            assertThat(denied.reasons()).isEmpty();
            assertThat(denied.toDetailedString()).isEqualTo("INELIGIBLE");
            assertThat(allowed.eligible()).isTrue();
            assertThat(allowed.explained()).isFalse();
        }

        @Test
        @DisplayName("Candidates that touch no node are eligible")
        void shouldBePermissiveOnOmission() {
            CompiledGraph graph = compiler.compile(RuleConfiguration.builder(IDENTITY)
                    .rule("no-jpy", always(), excludes(v("currency", "JPY")))
                    .build());

            assertThat(evaluator.evaluate(graph, CandidateAssignment.empty(), true).eligible()).isTrue();
            assertThat(evaluator.evaluate(graph, candidate("connector", "adyen"), true).toDetailedString())
                    .isEqualTo("ELIGIBLE");
        }

        @Test
        @DisplayName("Null arguments are rejected")
        void shouldRejectNulls() {
            CompiledGraph graph = walletRequiresUs();

            assertThatThrownBy(() -> evaluator.evaluate(null, CandidateAssignment.empty(), true))
                    .isInstanceOf(NullPointerException.class);
            assertThatThrownBy(() -> evaluator.evaluate(graph, null, true))
                    .isInstanceOf(NullPointerException.class);
        }

        @Test
        @DisplayName("Pooled context is reset between graphs of different sizes")
        void shouldReuseContextAcrossGraphs() {
            CompiledGraph small = walletRequiresUs();
            CompiledGraph large = compiler.compile(RuleConfiguration.builder(IDENTITY)
                    .rule("r1", allOf(v("payment_method", "wallet")), oneOf(v("country", "US"), v("country", "CA")))
                    .rule("r2", allOf(v("payment_method", "card"), v("country", "DE")), requires(v("capture_method", "manual")))
                    .rule("r3", noneOf(v("currency", "EUR"), v("currency", "USD")), excludes(v("country", "DE")))
                    .build());

            for (int round = 0; round < 3; round++) {
                assertThat(evaluator.isEligible(large, candidate("payment_method", "card", "country", "DE"))).isFalse();
                assertThat(evaluator.isEligible(small, candidate("payment_method", "wallet", "country", "US"))).isTrue();
                assertThat(evaluator.isEligible(large,
                        candidate("payment_method", "card", "country", "DE", "capture_method", "manual", "currency", "EUR")))
                        .isTrue();
                assertThat(evaluator.isEligible(small, candidate("payment_method", "wallet"))).isFalse();
            }
        }
    }

    @Nested
    @DisplayName("Masking")
    class Masking {

        private CompiledGraph binGraph() {
            return compiler.compile(RuleConfiguration.builder(IDENTITY)
                    .rule("bin-visa", allOf(ValueRef.sensitive("card_bin", "424242")), requires(v("card_network", "visa")))
                    .build());
        }

        @Test
        @DisplayName("Sensitive values are replaced by an opaque token")
        void shouldTokenizeSensitiveValues() {
            EligibilityResult result = evaluator.evaluate(binGraph(),
                    candidate("card_bin", "424242", "card_network", "mastercard"), true);

            Violation violation = result.reasons().get(0);
            assertThat(violation.source()).matches("CARD_BIN=\\[REDACTED:[0-9a-f]{8}]");
            assertThat(violation.describe()).doesNotContain("424242").contains("CARD_NETWORK=VISA");
        }

        @Test
        @DisplayName("Masker is pluggable")
        void shouldUseConfiguredMasker() {
            EligibilityEvaluator redacting =
                    new EligibilityEvaluator(new DefaultConstraintGraphEngine(), ValueMasker.redacting());

            EligibilityResult result = redacting.evaluate(binGraph(), candidate("card_bin", "424242"), true);

            assertThat(result.reasons()).extracting(Violation::source).containsExactly("CARD_BIN=[REDACTED]");
        }

        @Test
        @DisplayName("Equal sensitive values get equal tokens under one masker")
        void shouldKeepTokensStable() {
            EligibilityEvaluator keyed = new EligibilityEvaluator(new DefaultConstraintGraphEngine(),
                    new OpaqueTokenMasker(new byte[]{1, 2, 3, 4}));
            CompiledGraph graph = binGraph();

            String first = keyed.evaluate(graph, candidate("card_bin", "424242"), true).reasons().get(0).source();
            String second = keyed.evaluate(graph, candidate("card_bin", "424242"), true).reasons().get(0).source();

            assertThat(first).isEqualTo(second);
        }
    }
}
