package com.kgraph.eligibility.compiler.layering;

import com.kgraph.eligibility.api.model.DomainValue;
import com.kgraph.eligibility.api.model.RuleDefinition;
import com.kgraph.eligibility.api.model.RuleDefinition.Consequence;
import com.kgraph.eligibility.api.model.RuleDefinition.MatchMode;
import com.kgraph.eligibility.api.model.RuleDefinition.Precondition;
import com.kgraph.eligibility.api.model.ValueRef;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;

class RelationLayeringTest {

    private static final ValueRef WALLET = ValueRef.of("payment_method", "wallet");
    private static final ValueRef CARD = ValueRef.of("payment_method", "card");
    private static final ValueRef US = ValueRef.of("country", "US");
    private static final ValueRef DE = ValueRef.of("country", "DE");
    private static final ValueRef EUR = ValueRef.of("currency", "EUR");

    private final RelationLayering layering = new RelationLayering();

    @Test
    @DisplayName("REQUIRE and EXCLUDE split per target, ONE_OF stays whole")
    void shouldSplitPerTarget() {
        LayeringResult result = layering.layer(List.of(
                RuleDefinition.of("r1", Precondition.allOf(WALLET), Consequence.requires(US, EUR)),
                RuleDefinition.of("r2", Precondition.allOf(CARD, US), Consequence.oneOf(EUR, ValueRef.of("currency", "usd")))));

        assertThat(result.derivedStatements()).isEqualTo(3);
        assertThat(result.statements())
                .extracting(Statement::kind)
                .containsExactly(StatementKind.REQUIRES, StatementKind.REQUIRES, StatementKind.ONE_OF);
        assertThat(result.statements().get(2).targets())
                .containsExactly(DomainValue.of("currency", "EUR"), DomainValue.of("currency", "USD"));
    }

    @Test
    @DisplayName("A requirement in the mirrored direction also loses to a later pairwise exclusion")
    void exclusionShouldOverrideBothDirections() {
        LayeringResult result = layering.layer(List.of(
                RuleDefinition.of("wallet-needs-us", Precondition.allOf(WALLET), Consequence.requires(US)),
                RuleDefinition.of("us-needs-wallet", Precondition.allOf(US), Consequence.requires(WALLET)),
                RuleDefinition.of("apart", Precondition.allOf(WALLET), Consequence.excludes(US))));

        assertThat(result.statements()).singleElement().satisfies(statement -> {
            assertThat(statement.kind()).isEqualTo(StatementKind.EXCLUDES);
            assertThat(statement.symmetric()).isTrue();
            assertThat(statement.ruleIds()).containsExactly("apart");
        });
        assertThat(result.overriddenStatements()).isEqualTo(2);
    }

    @Test
    @DisplayName("Pairwise exclusions are stored under the lower value whichever side declared them")
    void shouldCanonicaliseExclusionDirection() {
        Statement forward = layering.layer(List.of(
                RuleDefinition.of("r", Precondition.allOf(WALLET), Consequence.excludes(US)))).statements().get(0);
        Statement backward = layering.layer(List.of(
                RuleDefinition.of("r", Precondition.allOf(US), Consequence.excludes(WALLET)))).statements().get(0);

        assertThat(forward).isEqualTo(backward);
        assertThat(forward.precondition().singleValue()).isEqualTo(US.toDomainValue());
        assertThat(forward.target()).isEqualTo(WALLET.toDomainValue());
    }

    @Test
    @DisplayName("Exclusions under compound preconditions are directed and never folded")
    void compoundExclusionsShouldStayDirected() {
        LayeringResult result = layering.layer(List.of(
                RuleDefinition.of("r1", Precondition.allOf(WALLET, DE), Consequence.excludes(EUR)),
                RuleDefinition.of("r2", Precondition.noneOf(WALLET), Consequence.excludes(EUR))));

        assertThat(result.statements())
                .hasSize(2)
                .noneMatch(Statement::symmetric);
        assertThat(result.statements().get(1).precondition().match()).isEqualTo(MatchMode.NONE);
    }

    @Test
    @DisplayName("Later statements on the same key replace earlier ones, different keys coexist")
    void shouldOnlyOverrideSameKey() {
        LayeringResult result = layering.layer(List.of(
                RuleDefinition.of("general", Precondition.allOf(WALLET), Consequence.requires(US)),
                RuleDefinition.of("specific", Precondition.allOf(WALLET, EUR), Consequence.excludes(US))));

        assertThat(result.overriddenStatements()).isZero();
        assertThat(result.statements()).hasSize(2);
    }

    @Test
    @DisplayName("Precondition keys ignore value order, duplicates and spelling")
    void preconditionKeysShouldBeCanonical() {
        PreconditionKey first = PreconditionKey.of(Precondition.anyOf(WALLET, CARD, WALLET));
        PreconditionKey second = PreconditionKey.of(Precondition.anyOf(
                ValueRef.of("PAYMENT-METHOD", "Card"), ValueRef.of("payment_method", "WALLET")));

        assertThat(first).isEqualTo(second);
        assertThat(first.values()).hasSize(2);
        assertThat(PreconditionKey.of(Precondition.anyOf(WALLET)))
                .isEqualTo(PreconditionKey.single(WALLET.toDomainValue()));
        assertThat(first).hasToString("ANY(PAYMENT_METHOD=CARD, PAYMENT_METHOD=WALLET)");
    }

    @Test
    @DisplayName("An unconditional exclusion overrides an earlier unconditional requirement of the same value")
    void unconditionalExclusionShouldOverrideRequirement() {
        LayeringResult result = layering.layer(List.of(
                RuleDefinition.of("always-eur", Precondition.always(), Consequence.requires(EUR)),
                RuleDefinition.of("never-eur", Precondition.always(), Consequence.excludes(EUR))));

        assertThat(result.statements()).singleElement().satisfies(statement -> {
            assertThat(statement.precondition()).isEqualTo(PreconditionKey.always());
            assertThat(statement.kind()).isEqualTo(StatementKind.EXCLUDES);
            assertThat(statement.symmetric()).isFalse();
            assertThat(statement.ruleIds()).containsExactly("never-eur");
        });
        assertThat(result.overriddenStatements()).isEqualTo(1);
    }

    @Test
    @DisplayName("Statements render sensitive values through the supplied renderer")
    void shouldRenderStatementsWithRenderer() {
        ValueRef bin = ValueRef.of("card_bin", "424242");
        Statement statement = RelationLayering.split(
                RuleDefinition.of("r1", Precondition.anyOf(bin, WALLET), Consequence.oneOf(US, DE))).get(0);

        String rendered = statement.render(value -> value.category().equals("CARD_BIN") ? "CARD_BIN=*" : value.toString());

        assertThat(rendered).isEqualTo("ANY(CARD_BIN=*, PAYMENT_METHOD=WALLET) ONE_OF [COUNTRY=DE, COUNTRY=US] [r1]");
    }

    @Test
    @DisplayName("Override and merge logs never carry sensitive values")
    void shouldRedactSensitiveValuesInLogs() {
        ValueRef bin = ValueRef.sensitive("card_bin", "424242");
        RelationLayering sensitiveLayering = new RelationLayering(value -> value.equals(bin.toDomainValue()));
        List<LogRecord> records = new ArrayList<>();
        Handler handler = new Handler() {
            @Override
            public void publish(LogRecord record) {
                records.add(record);
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };
        Logger logger = Logger.getLogger(RelationLayering.class.getName());
        Level previousLevel = logger.getLevel();
        logger.setLevel(Level.FINE);
        logger.addHandler(handler);
        try {
            sensitiveLayering.layer(List.of(
                    RuleDefinition.of("r1", Precondition.allOf(bin), Consequence.requires(US)),
                    RuleDefinition.of("r2", Precondition.allOf(bin), Consequence.requires(US)),
                    RuleDefinition.of("r3", Precondition.allOf(bin), Consequence.excludes(US))));
        } finally {
            logger.removeHandler(handler);
            logger.setLevel(previousLevel);
        }

        assertThat(records).extracting(LogRecord::getMessage)
                .hasSize(2)
                .allSatisfy(message -> assertThat(message)
                        .contains("CARD_BIN=[REDACTED]")
                        .doesNotContain("424242"));
    }
}
