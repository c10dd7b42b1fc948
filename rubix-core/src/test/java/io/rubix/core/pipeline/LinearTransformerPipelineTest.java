package io.rubix.core.pipeline;

import static io.rubix.core.StageFixtures.DATA;
import static io.rubix.core.StageFixtures.X;
import static io.rubix.core.StageFixtures.contextOf;
import static io.rubix.core.StageFixtures.doubling;
import static io.rubix.core.StageFixtures.failingIfNegative;
import static io.rubix.core.StageFixtures.incrementing;
import static io.rubix.core.StageFixtures.x;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import io.rubix.core.config.FailureSnapshot;
import io.rubix.core.config.PipelineOptions;
import io.rubix.core.config.RubixConfig;
import io.rubix.core.context.ArrayAttribute;
import io.rubix.core.context.Component;
import io.rubix.core.context.Context;
import io.rubix.core.exception.ConfigurationException;
import io.rubix.core.exception.ContractViolationException;
import io.rubix.core.exception.StageExecutionException;
import io.rubix.core.stage.AttributeContract;
import io.rubix.core.stage.Stage;
import io.rubix.core.transformer.StageExpression;
import io.rubix.core.transformer.Transformers;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("LinearTransformerPipeline")
class LinearTransformerPipelineTest {

    @Nested
    @DisplayName("registration")
    class Registration {

        @Test
        @DisplayName("rejects an empty stage list")
        void shouldRejectEmptyList() {
            assertThatThrownBy(() -> new LinearTransformerPipeline(List.of()))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("at least one stage");
        }

        @Test
        @DisplayName("rejects a null stage list")
        void shouldRejectNullList() {
            assertThatThrownBy(() -> new LinearTransformerPipeline(null))
                    .isInstanceOf(ConfigurationException.class);
        }

        @Test
        @DisplayName("rejects two stages sharing a name")
        void shouldRejectDuplicateNames() throws Exception {
            Stage first = Transformers.bound("double", doubling(), Map.of());
            Stage second = Transformers.bound("double", incrementing(), Map.of());

            assertThatThrownBy(() -> new LinearTransformerPipeline(List.of(first, second)))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("Duplicate stage name 'double'");
        }

        @Test
        @DisplayName("rejects a second registration")
        void shouldRejectSecondRegistration() throws Exception {
            var pipeline =
                    new LinearTransformerPipeline(
                            List.of(Transformers.bound("double", doubling(), Map.of())));

            assertThatThrownBy(
                            () ->
                                    pipeline.register(
                                            List.of(
                                                    Transformers.bound(
                                                            "increment", incrementing(), Map.of()))))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("already registered");
            assertThat(pipeline.describe().stageNames()).containsExactly("double");
        }

        @Test
        @DisplayName("is unaffected by later changes to the caller's list")
        void shouldCopyStageList() throws Exception {
            List<Stage> stages = new ArrayList<>();
            stages.add(Transformers.bound("double", doubling(), Map.of()));
            var pipeline = new LinearTransformerPipeline(stages);

            stages.add(Transformers.bound("increment", incrementing(), Map.of()));

            assertThat(x(pipeline.run(contextOf(3)))).isEqualTo(6.0);
        }
    }

    @Nested
    @DisplayName("run")
    class Run {

        @Test
        @DisplayName("doubles then increments {x: 3} into {x: 7}")
        void shouldRunStagesInOrder() throws Exception {
            var pipeline = new LinearTransformerPipeline(doubleThenIncrement());

            Context result = pipeline.run(contextOf(3));

            assertThat(result).isEqualTo(contextOf(7));
        }

        @Test
        @DisplayName("equals the left fold of the stage transforms")
        void shouldEqualLeftFold() throws Exception {
            List<Stage> stages =
                    List.of(
                            Transformers.bound("increment", incrementing(), Map.of()),
                            Transformers.bound("double", doubling(), Map.of()),
                            Transformers.bound("increment-again", incrementing(), Map.of()));

            Context folded = contextOf(5);
            for (Stage stage : stages) {
                folded = stage.apply(folded);
            }

            assertThat(new LinearTransformerPipeline(stages).run(contextOf(5)))
                    .isEqualTo(folded)
                    .isEqualTo(contextOf(13));
        }

        @Test
        @DisplayName("produces identical contexts on repeated runs")
        void shouldBeDeterministic() throws Exception {
            var pipeline = new LinearTransformerPipeline(doubleThenIncrement());

            assertThat(pipeline.run(contextOf(1.5))).isEqualTo(pipeline.run(contextOf(1.5)));
        }

        @Test
        @DisplayName("hands each stage exactly the context returned by the previous one")
        void shouldThreadReturnedContext() throws Exception {
            Context replacement = contextOf(100);
            List<Context> seen = new ArrayList<>();
            Stage swap = Transformers.bound("swap", (c, l) -> ctx -> replacement, Map.of());
            Stage record =
                    Transformers.bound(
                            "record",
                            (c, l) ->
                                    ctx -> {
                                        seen.add(ctx);
                                        return ctx;
                                    },
                            Map.of());

            Context result = new LinearTransformerPipeline(List.of(swap, record)).run(contextOf(1));

            assertThat(seen).singleElement().isSameAs(replacement);
            assertThat(result).isSameAs(replacement);
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("names stage 1 and carries the original input when the first stage fails")
        void shouldReportFirstStageFailure() throws Exception {
            var pipeline =
                    new LinearTransformerPipeline(
                            List.of(
                                    Transformers.bound(
                                            "fail_if_negative", failingIfNegative(), Map.of()),
                                    Transformers.bound("double", doubling(), Map.of())));

            StageExecutionException error =
                    catchThrowableOfType(
                            () -> pipeline.run(contextOf(-1)), StageExecutionException.class);

            assertThat(error.stageName()).hasValue("fail_if_negative");
            assertThat(error.stageIndex()).hasValue(0);
            assertThat(error.getMessage()).startsWith("Stage #1 'fail_if_negative' failed");
            assertThat(error.getCause()).isInstanceOf(IllegalArgumentException.class);
            assertThat(error.lastGoodContext()).isEqualTo(contextOf(-1));
        }

        @Test
        @DisplayName("carries the previous stage's output when a later stage fails")
        void shouldCarryPreviousOutput() throws Exception {
            var pipeline =
                    new LinearTransformerPipeline(
                            List.of(
                                    Transformers.bound("increment", incrementing(), Map.of()),
                                    Transformers.bound(
                                            "fail_if_negative", failingIfNegative(), Map.of()),
                                    Transformers.bound("double", doubling(), Map.of())));

            StageExecutionException error =
                    catchThrowableOfType(
                            () -> pipeline.run(contextOf(-3)), StageExecutionException.class);

            assertThat(error.stageIndex()).hasValue(1);
            assertThat(error.lastGoodContext()).isEqualTo(contextOf(-2));
            assertThat(error.sequenceId()).isEqualTo(pipeline.describe().sequenceId());
        }

        @Test
        @DisplayName("never runs the stages after a failure")
        void shouldHaltOnFirstFailure() throws Exception {
            int[] calls = {0};
            Stage counting =
                    Transformers.bound(
                            "count",
                            (c, l) ->
                                    ctx -> {
                                        calls[0]++;
                                        return ctx;
                                    },
                            Map.of());
            var pipeline =
                    new LinearTransformerPipeline(
                            List.of(
                                    Transformers.bound(
                                            "fail_if_negative", failingIfNegative(), Map.of()),
                                    counting));

            assertThatThrownBy(() -> pipeline.run(contextOf(-1)))
                    .isInstanceOf(StageExecutionException.class);
            assertThat(calls[0]).isZero();
        }

        @Test
        @DisplayName("wraps an Error thrown by a stage, such as a failed assert")
        void shouldWrapAssertionError() throws Exception {
            Stage asserting =
                    Transformers.bound(
                            "rotate",
                            (c, l) ->
                                    ctx -> {
                                        throw new AssertionError("coords not found");
                                    },
                            Map.of());
            var pipeline =
                    new LinearTransformerPipeline(
                            List.of(
                                    Transformers.bound("increment", incrementing(), Map.of()),
                                    asserting));

            StageExecutionException error =
                    catchThrowableOfType(
                            () -> pipeline.run(contextOf(1)), StageExecutionException.class);

            assertThat(error.stageName()).hasValue("rotate");
            assertThat(error.stageIndex()).hasValue(1);
            assertThat(error.getCause())
                    .isInstanceOf(AssertionError.class)
                    .hasMessage("coords not found");
            assertThat(error.lastGoodContext()).isEqualTo(contextOf(2));
        }

        @Test
        @DisplayName("reports the mutated reference under the REFERENCE snapshot policy")
        void shouldCarryReferenceWithoutSnapshot() throws Exception {
            var options =
                    PipelineOptions.builder().failureSnapshot(FailureSnapshot.REFERENCE).build();
            var pipeline =
                    new LinearTransformerPipeline(
                            List.of(
                                    Transformers.bound(
                                            "fail_if_negative", failingIfNegative(), Map.of())),
                            options);
            Context input = contextOf(-1);

            StageExecutionException error =
                    catchThrowableOfType(() -> pipeline.run(input), StageExecutionException.class);

            assertThat(error.lastGoodContext()).isSameAs(input);
            assertThat(x(error.lastGoodContext())).isEqualTo(-999.0);
        }
    }

    @Nested
    @DisplayName("contract checks")
    class ContractChecks {

        @Test
        @DisplayName("rejects a stage whose declared read is missing")
        void shouldReportMissingRead() throws Exception {
            Stage needsMass =
                    Transformers.bound(
                            "needs_mass",
                            doubling(),
                            RubixConfig.empty(),
                            AttributeContract.builder().reads(DATA, "mass").build());
            var pipeline =
                    new LinearTransformerPipeline(
                            List.of(Transformers.bound("double", doubling(), Map.of()), needsMass));

            ContractViolationException error =
                    catchThrowableOfType(
                            () -> pipeline.run(contextOf(2)), ContractViolationException.class);

            assertThat(error.stageIndex()).hasValue(1);
            assertThat(error.component()).hasValue(DATA);
            assertThat(error.attribute()).hasValue("mass");
            assertThat(error.lastGoodContext()).isEqualTo(contextOf(4));
        }

        @Test
        @DisplayName("accepts a read produced by an earlier stage")
        void shouldAcceptReadWrittenEarlier() throws Exception {
            Stage writesMass =
                    Transformers.bound(
                            "write_mass",
                            (c, l) ->
                                    ctx -> {
                                        ctx.require(DATA).put("mass", ArrayAttribute.of(1.0));
                                        return ctx;
                                    },
                            RubixConfig.empty(),
                            AttributeContract.builder().writes(DATA, "mass").build());
            Stage readsMass =
                    Transformers.bound(
                            "read_mass",
                            doubling(),
                            RubixConfig.empty(),
                            AttributeContract.builder().reads(DATA, "mass", X).build());

            Context result =
                    new LinearTransformerPipeline(List.of(writesMass, readsMass)).run(contextOf(1));

            assertThat(result.require(DATA).has("mass")).isTrue();
            assertThat(x(result)).isEqualTo(2.0);
        }

        @Test
        @DisplayName("rejects an attribute written outside the declared contract")
        void shouldReportUndeclaredWrite() throws Exception {
            Stage sneaky =
                    Transformers.bound(
                            "sneaky",
                            (c, l) ->
                                    ctx -> {
                                        ctx.require(DATA).put("extra", ArrayAttribute.of(0));
                                        return ctx;
                                    },
                            RubixConfig.empty(),
                            AttributeContract.builder().writes(DATA, X).build());

            ContractViolationException error =
                    catchThrowableOfType(
                            () -> new LinearTransformerPipeline(List.of(sneaky)).run(contextOf(1)),
                            ContractViolationException.class);

            assertThat(error.attribute()).hasValue("extra");
            assertThat(error.lastGoodContext()).isEqualTo(contextOf(1));
        }

        @Test
        @DisplayName("rejects a stage that changes the component set")
        void shouldReportChangedComponents() throws Exception {
            Stage replacing =
                    Transformers.bound(
                            "replace", (c, l) -> ctx -> Context.of(new Component("other")), Map.of());

            assertThatThrownBy(
                            () -> new LinearTransformerPipeline(List.of(replacing)).run(contextOf(1)))
                    .isInstanceOf(ContractViolationException.class)
                    .hasMessageContaining("changed components");
        }

        @Test
        @DisplayName("rejects a stage returning null even without contract checks")
        void shouldReportNullResult() throws Exception {
            var options = PipelineOptions.builder().validateContracts(false).build();
            Stage returnsNull = Transformers.bound("null", (c, l) -> ctx -> null, Map.of());

            assertThatThrownBy(
                            () ->
                                    new LinearTransformerPipeline(List.of(returnsNull), options)
                                            .run(contextOf(1)))
                    .isInstanceOf(ContractViolationException.class)
                    .hasMessageContaining("returned no context");
        }

        @Test
        @DisplayName("skips contract checks when disabled")
        void shouldSkipChecksWhenDisabled() throws Exception {
            var options = PipelineOptions.builder().validateContracts(false).build();
            Stage needsMass =
                    Transformers.bound(
                            "needs_mass",
                            doubling(),
                            RubixConfig.empty(),
                            AttributeContract.builder().reads(DATA, "mass").build());

            Context result = new LinearTransformerPipeline(List.of(needsMass), options).run(contextOf(2));

            assertThat(x(result)).isEqualTo(4.0);
        }
    }

    @Nested
    @DisplayName("describe")
    class Describe {

        @Test
        @DisplayName("lists stage names and empty configurations in order")
        void shouldDescribeStages() throws Exception {
            var pipeline = new LinearTransformerPipeline(doubleThenIncrement());

            List<StageExpression> stages = pipeline.describe().stages();

            assertThat(stages).extracting(StageExpression::name).containsExactly("double", "increment");
            assertThat(stages).extracting(StageExpression::config).containsOnly(Map.of());
            assertThat(stages).extracting(StageExpression::index).containsExactly(0, 1);
        }

        @Test
        @DisplayName("executes nothing")
        void shouldNotExecute() throws Exception {
            int[] calls = {0};
            var pipeline =
                    new LinearTransformerPipeline(
                            List.of(
                                    Transformers.bound(
                                            "count",
                                            (c, l) ->
                                                    ctx -> {
                                                        calls[0]++;
                                                        return ctx;
                                                    },
                                            Map.of())));

            pipeline.describe();
            pipeline.describe();

            assertThat(calls[0]).isZero();
        }
    }

    private static List<Stage> doubleThenIncrement() throws ConfigurationException {
        return List.of(
                Transformers.bound("double", doubling(), Map.of()),
                Transformers.bound("increment", incrementing(), Map.of()));
    }
}
