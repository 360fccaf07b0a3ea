package com.kgraph.eligibility.service;

import com.kgraph.eligibility.api.IEligibilityEvaluator;
import com.kgraph.eligibility.api.IGraphCache;
import com.kgraph.eligibility.api.exceptions.CompileException;
import com.kgraph.eligibility.api.exceptions.ConfigurationNotFoundException;
import com.kgraph.eligibility.api.model.CandidateAssignment;
import com.kgraph.eligibility.api.model.ConfigurationIdentity;
import com.kgraph.eligibility.api.model.EligibilityResult;
import com.kgraph.eligibility.api.model.RuleConfiguration;
import com.kgraph.eligibility.api.model.ValueRef;
import com.kgraph.eligibility.api.spi.ConfigurationProvider;
import com.kgraph.eligibility.api.spi.DomainCatalog;
import com.kgraph.eligibility.cache.CaffeineGraphCache;
import com.kgraph.eligibility.cache.GraphCacheConfig;
import com.kgraph.eligibility.compiler.RuleCompiler;
import com.kgraph.eligibility.runtime.evaluation.EligibilityEvaluator;
import com.kgraph.eligibility.runtime.model.CompiledGraph;
import com.kgraph.eligibility.runtime.model.GraphStats;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static com.kgraph.eligibility.api.model.RuleDefinition.Consequence.requires;
import static com.kgraph.eligibility.api.model.RuleDefinition.Precondition.allOf;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class EligibilityServiceTest {

    private static final ConfigurationIdentity IDENTITY = ConfigurationIdentity.of("merchant-1", "stripe");
    private static final Tracer TRACER = OpenTelemetry.noop().getTracer("test");

    private static RuleConfiguration walletRequiresUs() {
        return RuleConfiguration.builder(IDENTITY)
                .revision("1")
                .rule("wallet-us", allOf(ValueRef.of("payment_method", "wallet")), requires(ValueRef.of("country", "US")))
                .build();
    }

    private static CandidateAssignment wallet(String country) {
        return CandidateAssignment.builder().with("payment_method", "wallet").with("country", country).build();
    }

    @Nested
    @ExtendWith(MockitoExtension.class)
    @DisplayName("Collaboration")
    class Collaboration {

        @Mock
        private ConfigurationProvider provider;
        @Mock
        private IGraphCache cache;
        @Mock
        private IEligibilityEvaluator evaluator;

        private final CompiledGraph graph = CompiledGraph.builder(IDENTITY, "fp").build(GraphStats.empty());

        private EligibilityService service() {
            return new EligibilityService(provider, cache, evaluator, TRACER);
        }

        @Test
        @DisplayName("Resolves configuration, fetches the graph and evaluates")
        void shouldEvaluateThroughCache() {
            RuleConfiguration configuration = walletRequiresUs();
            CandidateAssignment candidate = wallet("US");
            EligibilityResult expected = EligibilityResult.eligible("fp", true);
            when(provider.find(IDENTITY)).thenReturn(Optional.of(configuration));
            when(cache.getOrCompile(IDENTITY, configuration)).thenReturn(graph);
            when(evaluator.evaluate(graph, candidate, true)).thenReturn(expected);

            assertThat(service().evaluate(IDENTITY, candidate, true)).isSameAs(expected);
        }

        @Test
        @DisplayName("Unknown identity is reported without touching the cache")
        void shouldRejectUnknownIdentity() {
            when(provider.find(IDENTITY)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> service().evaluate(IDENTITY, wallet("US"), true))
                    .isInstanceOf(ConfigurationNotFoundException.class)
                    .hasMessageContaining("merchant-1/stripe");
            verifyNoInteractions(cache, evaluator);
        }

        @Test
        @DisplayName("Batch evaluation uses one graph snapshot")
        void shouldEvaluateBatchAgainstOneGraph() {
            RuleConfiguration configuration = walletRequiresUs();
            CandidateAssignment us = wallet("US");
            CandidateAssignment de = wallet("DE");
            EligibilityResult eligible = EligibilityResult.eligible("fp", false);
            EligibilityResult denied = EligibilityResult.ineligibleUnexplained("fp");
            when(provider.find(IDENTITY)).thenReturn(Optional.of(configuration));
            when(cache.getOrCompile(IDENTITY, configuration)).thenReturn(graph);
            when(evaluator.evaluate(graph, us, false)).thenReturn(eligible);
            when(evaluator.evaluate(graph, de, false)).thenReturn(denied);

            List<EligibilityResult> results = service().evaluateBatch(IDENTITY, List.of(us, de, us), false);

            assertThat(results).containsExactly(eligible, denied, eligible);
            verify(cache, times(1)).getOrCompile(IDENTITY, configuration);
        }

        @Test
        @DisplayName("Compilation errors propagate to the caller")
        void shouldPropagateCompileErrors() {
            RuleConfiguration configuration = walletRequiresUs();
            when(cache.getOrCompile(IDENTITY, configuration))
                    .thenThrow(CompileException.malformedRule("wallet-us", "broken"));

            assertThatThrownBy(() -> service().evaluate(configuration, wallet("US"), true))
                    .isInstanceOf(CompileException.class)
                    .hasMessageContaining("wallet-us");
            verifyNoInteractions(provider, evaluator);
        }
    }

    @Nested
    @DisplayName("End to end")
    class EndToEnd {

        private final InMemoryConfigurationProvider provider = new InMemoryConfigurationProvider();
        private final CaffeineGraphCache cache = new CaffeineGraphCache(
                new RuleCompiler(DomainCatalog.permissive(), TRACER), GraphCacheConfig.forDevelopment(), TRACER);
        private final EligibilityService service =
                new EligibilityService(provider, cache, new EligibilityEvaluator(), TRACER);

        @Test
        @DisplayName("Configuration updates are picked up on the next query")
        void shouldFollowConfigurationUpdates() {
            provider.put(walletRequiresUs());

            EligibilityResult before = service.evaluate(IDENTITY, wallet("DE"), true);
            assertThat(before.eligible()).isFalse();
            assertThat(before.reasons()).singleElement()
                    .satisfies(violation -> assertThat(violation.ruleIds()).containsExactly("wallet-us"));

            provider.put(walletRequiresUs().withRules(List.of()));

            EligibilityResult after = service.evaluate(IDENTITY, wallet("DE"), true);
            assertThat(after.eligible()).isTrue();
            assertThat(after.graphFingerprint()).isNotEqualTo(before.graphFingerprint());
            assertThat(cache.getMetrics().staleReplacementCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Removed configurations are no longer served")
        void shouldForgetRemovedConfigurations() {
            provider.put(walletRequiresUs());
            assertThat(service.evaluate(IDENTITY, wallet("US"), false).eligible()).isTrue();

            assertThat(provider.remove(IDENTITY)).isTrue();

            assertThatThrownBy(() -> service.evaluate(IDENTITY, wallet("US"), false))
                    .isInstanceOf(ConfigurationNotFoundException.class);
        }

        @Test
        @DisplayName("Callers holding a configuration can skip the provider")
        void shouldEvaluateGivenConfiguration() {
            RuleConfiguration configuration = walletRequiresUs();

            assertThat(service.evaluate(configuration, wallet("US"), true).eligible()).isTrue();
            assertThat(service.evaluate(configuration, wallet("DE"), true).eligible()).isFalse();
            assertThat(cache.getMetrics().compileCount()).isEqualTo(1);
            assertThat(provider.size()).isZero();
        }
    }
}
