/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.kinkernel.cells;

import com.phonepe.kinkernel.config.EnvSource;
import com.phonepe.kinkernel.config.EnvVar;
import com.phonepe.kinkernel.errors.CellException;
import com.phonepe.kinkernel.errors.ConfigResolutionError;
import com.phonepe.kinkernel.errors.ErrorType;
import com.phonepe.kinkernel.schema.ValidationFailure;
import jakarta.validation.constraints.Min;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link Cell}
 */
class CellTest {

    record Input(int value1, String value2) {
    }

    record Output(@Min(0) int processedValue) {
    }

    private static final CellDefinition<Input, Output> DEFINITION = CellDefinition.builder(Input.class, Output.class)
            .role("Processor")
            .description("Processes input data")
            .build();

    private static final class TestCell extends Cell<Input, Output> {
        private final AtomicInteger calls = new AtomicInteger();
        private final BiFunction<Input, CellRunContext, CompletionStage<Output>> logic;

        TestCell(BiFunction<Input, CellRunContext, CompletionStage<Output>> logic) {
            this(DEFINITION, CellSetup.builder().build(), logic);
        }

        TestCell(
                CellDefinition<Input, Output> definition,
                CellSetup setup,
                BiFunction<Input, CellRunContext, CompletionStage<Output>> logic) {
            super(definition, setup);
            this.logic = logic;
        }

        @Override
        protected CompletionStage<Output> process(Input input, CellRunContext context) {
            calls.incrementAndGet();
            return logic.apply(input, context);
        }
    }

    record Strict(int value1, String value2) {
        Strict {
            if (value2.isBlank()) {
                throw new IllegalStateException();
            }
        }
    }

    record TreeNode(String name, List<TreeNode> children) {
    }

    private static final class StrictCell extends Cell<Strict, Output> {
        StrictCell() {
            super(CellDefinition.builder(Strict.class, Output.class)
                          .role("Strict Processor")
                          .description("Rejects blank values")
                          .build());
        }

        @Override
        protected CompletionStage<Output> process(Strict input, CellRunContext context) {
            return CompletableFuture.completedFuture(new Output(input.value1()));
        }
    }

    private static final class TreeCell extends Cell<TreeNode, Output> {
        TreeCell() {
            super(CellDefinition.builder(TreeNode.class, Output.class)
                          .role("Tree Counter")
                          .description("Counts nodes of a tree")
                          .build());
        }

        @Override
        protected CompletionStage<Output> process(TreeNode input, CellRunContext context) {
            return CompletableFuture.completedFuture(new Output(count(input)));
        }

        private static int count(TreeNode node) {
            return 1 + node.children().stream().mapToInt(TreeCell::count).sum();
        }
    }

    private static TestCell doublingCell() {
        return new TestCell((input, context) -> CompletableFuture.completedFuture(new Output(input.value1() * 2)));
    }

    @Test
    void testProcessesValidInput() {
        final var cell = doublingCell();
        final var response = cell.execute("{\"value1\": 10, \"value2\": \"example\"}");
        assertTrue(response.isSuccessful());
        assertEquals(new Output(20), response.getData());
        assertEquals(ErrorType.SUCCESS, response.getError().getErrorType());
        assertNotNull(response.getRunId());
        assertEquals(1, cell.calls.get());
    }

    @Test
    void testAcceptsMapsAndTypedValues() {
        final var cell = doublingCell();
        assertEquals(new Output(4), cell.execute(Map.of("value1", 2, "value2", "x")).orThrow());
        assertEquals(new Output(6), cell.execute(new Input(3, "y")).orThrow());
        assertEquals(2, cell.calls.get());
    }

    @Test
    void testRejectsWrongTypeWithoutRunningLogic() {
        final var cell = doublingCell();
        final var response = cell.execute("{\"value1\": \"ten\", \"value2\": \"example\"}");
        assertFalse(response.isSuccessful());
        final var error = response.getError();
        assertEquals(ErrorType.INPUT_VALIDATION_FAILURE, error.getErrorType());
        assertTrue(error.isValidationError());
        assertEquals(1, error.getFailures().size());
        final var failure = error.getFailures().get(0);
        assertEquals("$.value1", failure.getPath());
        assertEquals("type", failure.getRule());
        assertTrue(failure.getMessage().contains("integer"));
        assertTrue(error.getMessage().contains("$.value1"));
        assertEquals(0, cell.calls.get());
    }

    @Test
    void testRejectsMissingField() {
        final var cell = doublingCell();
        final var response = cell.execute("{\"value2\": \"example\"}");
        assertEquals(ErrorType.INPUT_VALIDATION_FAILURE, response.getError().getErrorType());
        assertEquals(List.of(new ValidationFailure("$.value1", "required", "Field required")),
                     response.getError().getFailures());
        assertEquals(0, cell.calls.get());
    }

    @Test
    void testRejectsNullField() {
        final var cell = doublingCell();
        final var response = cell.execute("{\"value1\": 10, \"value2\": null}");
        assertEquals(ErrorType.INPUT_VALIDATION_FAILURE, response.getError().getErrorType());
        assertEquals(List.of(new ValidationFailure("$.value2", "not_null", "Input should not be null")),
                     response.getError().getFailures());
        assertEquals(0, cell.calls.get());
    }

    @Test
    void testRejectsScalarsForText() {
        final var cell = doublingCell();
        for (final var value : List.of("5", "5.5", "true")) {
            final var response = cell.execute("{\"value1\": 10, \"value2\": %s}".formatted(value));
            assertEquals(ErrorType.INPUT_VALIDATION_FAILURE, response.getError().getErrorType());
            final var failure = response.getError().getFailures().get(0);
            assertEquals("$.value2", failure.getPath());
            assertEquals("type", failure.getRule());
            assertEquals("Input should be a valid string", failure.getMessage());
        }
        assertEquals(0, cell.calls.get());
    }

    @Test
    void testReportsConstructorFailureWithoutMessage() {
        final var cell = new StrictCell();
        final var response = assertDoesNotThrow(() -> cell.execute("{\"value1\": 10, \"value2\": \" \"}"));
        assertEquals(ErrorType.INPUT_VALIDATION_FAILURE, response.getError().getErrorType());
        final var failure = response.getError().getFailures().get(0);
        assertEquals("value", failure.getRule());
        assertEquals("IllegalStateException", failure.getMessage());
        assertEquals(new Output(10), cell.execute("{\"value1\": 10, \"value2\": \"x\"}").orThrow());
    }

    @Test
    void testRecursiveInputType() {
        final var cell = new TreeCell();
        assertTrue(cell.getInputSchema().toString().contains("$ref"));
        assertEquals("TreeNode", cell.getInputSchema().get("title").asText());
        final var response = cell.execute(
                "{\"name\": \"root\", \"children\": [{\"name\": \"leaf\", \"children\": []}]}");
        assertEquals(new Output(2), response.orThrow());
    }

    @Test
    void testRejectsMalformedJsonAndNull() {
        final var cell = doublingCell();
        final var malformed = cell.execute("{\"value1\": 10,");
        assertEquals(ErrorType.INPUT_VALIDATION_FAILURE, malformed.getError().getErrorType());
        assertEquals("json_invalid", malformed.getError().getFailures().get(0).getRule());

        final var missing = cell.execute(null);
        assertEquals(ErrorType.INPUT_VALIDATION_FAILURE, missing.getError().getErrorType());
        assertEquals(ValidationFailure.ROOT, missing.getError().getFailures().get(0).getPath());
        assertEquals(0, cell.calls.get());
    }

    @Test
    void testRejectsInvalidOutputAfterLogicRan() {
        final var cell = new TestCell((input, context) -> CompletableFuture.completedFuture(new Output(-1)));
        final var response = cell.execute(new Input(1, "x"));
        assertEquals(ErrorType.OUTPUT_VALIDATION_FAILURE, response.getError().getErrorType());
        assertEquals("$.processedValue", response.getError().getFailures().get(0).getPath());
        assertEquals("min", response.getError().getFailures().get(0).getRule());
        assertNull(response.getData());
        assertEquals(1, cell.calls.get());
    }

    @Test
    void testRejectsNullOutput() {
        final var cell = new TestCell((input, context) -> CompletableFuture.completedFuture(null));
        final var response = cell.execute(new Input(1, "x"));
        assertEquals(ErrorType.OUTPUT_VALIDATION_FAILURE, response.getError().getErrorType());
        assertEquals(1, cell.calls.get());
    }

    @Test
    void testReportsLogicFailure() {
        final var cell = new TestCell((input, context) -> {
            throw new IllegalStateException("General error");
        });
        final var response = cell.execute(new Input(1, "x"));
        final var error = response.getError();
        assertEquals(ErrorType.EXECUTION_FAILURE, error.getErrorType());
        assertTrue(error.isExecutionError());
        assertFalse(error.isValidationError());
        assertEquals("Cell execution failed with error: General error", error.getMessage());
        assertInstanceOf(IllegalStateException.class, error.getCause());
        final var thrown = assertThrows(CellException.class, response::orThrow);
        assertSame(error, thrown.getError());
    }

    @Test
    void testReportsFailedStage() {
        final var cell = new TestCell(
                (input, context) -> CompletableFuture.failedFuture(new IllegalArgumentException("Upstream failed")));
        final var response = cell.execute(new Input(1, "x"));
        assertEquals(ErrorType.EXECUTION_FAILURE, response.getError().getErrorType());
        assertInstanceOf(IllegalArgumentException.class, response.getError().getCause());
    }

    @Test
    void testReportsMissingStage() {
        final var cell = new TestCell((input, context) -> null);
        final var response = cell.execute(new Input(1, "x"));
        assertEquals(ErrorType.EXECUTION_FAILURE, response.getError().getErrorType());
    }

    @Test
    void testWaitsForAsynchronousLogic() {
        final var cell = new TestCell((input, context) -> CompletableFuture.supplyAsync(
                () -> new Output(input.value1() + 1),
                CompletableFuture.delayedExecutor(50, TimeUnit.MILLISECONDS)));
        final var response = cell.executeAsync(new Input(41, "x")).join();
        assertEquals(new Output(42), response.orThrow());
    }

    @Test
    void testReportsCancelledLogic() {
        final var cell = new TestCell((input, context) -> {
            final var future = new CompletableFuture<Output>();
            future.cancel(true);
            return future;
        });
        final var response = cell.execute(new Input(1, "x"));
        assertEquals(ErrorType.EXECUTION_CANCELLED, response.getError().getErrorType());
        assertTrue(response.getError().isExecutionError());
    }

    @Test
    void testTimesOutAndCancelsLogic() {
        final var pending = new CompletableFuture<Output>();
        final var seenContext = new CompletableFuture<CellRunContext>();
        final var cell = new TestCell((input, context) -> {
            seenContext.complete(context);
            return pending;
        });
        final var response = cell.executeAsync(new Input(1, "x"), Duration.ofMillis(100)).join();
        assertEquals(ErrorType.EXECUTION_TIMEOUT, response.getError().getErrorType());
        assertTrue(response.getError().getMessage().contains("PT0.1S"));
        assertThrows(CancellationException.class, pending::join);
        assertTrue(seenContext.join().isCancelled());
    }

    @Test
    void testTimedRunFinishingEarly() {
        final var seenContext = new CompletableFuture<CellRunContext>();
        final var cell = new TestCell((input, context) -> {
            seenContext.complete(context);
            return CompletableFuture.completedFuture(new Output(input.value1()));
        });
        final var response = cell.executeAsync(new Input(7, "x"), Duration.ofMillis(50)).join();
        assertEquals(new Output(7), response.orThrow());
        assertDoesNotThrow(() -> Thread.sleep(100));
        assertFalse(seenContext.join().isCancelled());
    }

    @Test
    void testCallerCancellationReachesLogic() {
        final var pending = new CompletableFuture<Output>();
        final var seenContext = new CompletableFuture<CellRunContext>();
        final var cell = new TestCell((input, context) -> {
            seenContext.complete(context);
            return pending;
        });
        final var response = cell.executeAsync(new Input(1, "x"));
        final var context = seenContext.join();
        assertFalse(context.isCancelled());
        assertTrue(response.cancel(true));
        assertTrue(context.isCancelled());
        assertThrows(CancellationException.class, pending::join);
    }

    @Test
    void testRejectsNonPositiveTimeout() {
        final var cell = doublingCell();
        final var input = new Input(1, "x");
        assertThrows(IllegalArgumentException.class, () -> cell.executeAsync(input, Duration.ZERO));
    }

    @Test
    void testConcurrentExecutions() {
        final var cell = doublingCell();
        final var futures = IntStream.range(0, 50)
                .mapToObj(i -> cell.executeAsync(new Input(i, "x")))
                .toList();
        IntStream.range(0, 50)
                .forEach(i -> assertEquals(new Output(i * 2), futures.get(i).join().orThrow()));
        assertEquals(50, cell.calls.get());
    }

    @Test
    void testSchemasAreStable() {
        final var cell = doublingCell();
        final var inputSchema = cell.getInputSchema();
        assertEquals("object", inputSchema.get("type").asText());
        assertEquals("integer", inputSchema.at("/properties/value1/type").asText());
        assertEquals("string", inputSchema.at("/properties/value2/type").asText());
        assertEquals("Input", inputSchema.get("title").asText());
        assertEquals("integer", cell.getOutputSchema().at("/properties/processedValue/type").asText());
        assertEquals(0, cell.getOutputSchema().at("/properties/processedValue/minimum").asInt());

        inputSchema.withObject("/properties").remove("value1");
        cell.execute(new Input(1, "x"));
        assertEquals(cell.getInputSchema(), cell.getInputSchema());
        assertTrue(cell.getInputSchema().at("/properties").has("value1"));
        assertEquals(DEFINITION.inputSchema(), cell.getInputSchema());
        assertEquals(cell.getInputFormat(), cell.getInputFormat());
    }

    @Test
    void testDescribe() {
        final var cell = new TestCell(DEFINITION.withEnvVars(List.of(EnvVar.withDefault("MODE", "fast"))),
                                      CellSetup.builder().envSource(EnvSource.of(Map.of())).build(),
                                      (input, context) -> CompletableFuture.completedFuture(new Output(0)));
        final var description = cell.describe();
        assertEquals("Processor", description.getRole());
        assertEquals("Processes input data", description.getDescription());
        assertEquals(cell.getInputSchema(), description.getInputSchema());
        assertEquals(cell.getOutputSchema(), description.getOutputSchema());
        assertEquals(List.of("MODE"), description.getConfigKeys());
    }

    @Test
    void testResolvesConfigAtConstruction() {
        final var definition = DEFINITION.withEnvVars(List.of(EnvVar.required("A"),
                                                              EnvVar.withDefault("B", "default-b")));
        final var cell = new TestCell(
                definition,
                CellSetup.builder().envSource(EnvSource.of(Map.of("A", "from-env"))).build(),
                (input, context) -> CompletableFuture.completedFuture(
                        new Output(context.getConfig().orElseThrow().get("A").length())));
        final var config = cell.getConfig().orElseThrow();
        assertEquals("from-env", config.get("A"));
        assertEquals("default-b", config.get("B"));
        assertEquals(new Output(8), cell.execute(new Input(1, "x")).orThrow());
    }

    @Test
    void testFailsConstructionOnMissingConfig() {
        final var definition = DEFINITION.withEnvVars(List.of(EnvVar.required("A"), EnvVar.required("B")));
        final var setup = CellSetup.builder().envSource(EnvSource.of(Map.of())).build();
        final var error = assertThrows(ConfigResolutionError.class,
                                       () -> new TestCell(definition, setup, (input, context) -> null));
        assertEquals(List.of("A", "B"), error.getMissingKeys());
    }

    @Test
    void testCellWithoutConfig() {
        final var cell = doublingCell();
        assertTrue(cell.getConfig().isEmpty());
        assertEquals("Processor", cell.getRole());
        assertEquals("Processes input data", cell.getDescription());
        assertEquals(Input.class, cell.getInputType());
        assertEquals(Output.class, cell.getOutputType());
    }

    @Test
    void testRequiresMetadata() {
        final var setup = CellSetup.builder().build();
        final var noRole = DEFINITION.withRole("");
        assertThrows(IllegalArgumentException.class, () -> new TestCell(noRole, setup, (input, context) -> null));
        final var noDescription = DEFINITION.withDescription("");
        assertThrows(IllegalArgumentException.class,
                     () -> new TestCell(noDescription, setup, (input, context) -> null));
        assertThrows(NullPointerException.class, () -> DEFINITION.withRole(null));
    }
}
