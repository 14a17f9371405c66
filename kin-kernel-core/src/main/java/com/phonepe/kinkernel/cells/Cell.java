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

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.phonepe.kinkernel.config.ConfigModel;
import com.phonepe.kinkernel.config.EnvVar;
import com.phonepe.kinkernel.errors.CellError;
import com.phonepe.kinkernel.errors.ErrorType;
import com.phonepe.kinkernel.schema.SchemaBinding;
import com.phonepe.kinkernel.utils.JsonUtils;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Base class for all cells. Derive this to create own cells.
 * <p>
 * A cell is bound to exactly one input type and one output type. Every execution parses the raw input into the
 * input type, runs {@link #process(Object, CellRunContext)}, and parses the returned value against the output type.
 * Invalid data on either side is reported as a validation error; failures of the business logic are reported as
 * execution errors. Configuration declared in the {@link CellDefinition} is resolved once, in the constructor.
 * <p>
 * {@link #process(Object, CellRunContext)} is the only extension point. It returns a {@link CompletionStage} so
 * that logic doing asynchronous work can return its pending result directly. Synchronous logic returns
 * {@link CompletableFuture#completedFuture(Object)}; it is always started on the setup's executor, never on the
 * caller's thread.
 *
 * @param <I> Input type
 * @param <O> Output type
 */
@Slf4j
public abstract class Cell<I, O> {

    private static final class ExecutionTimedOut extends TimeoutException {
        private ExecutionTimedOut(Duration timeout) {
            super("Timed out after " + timeout);
        }
    }

    @Getter
    private final CellDefinition<I, O> definition;
    @Getter
    private final CellSetup setup;
    private final ConfigModel config;
    private final SchemaBinding<I> inputBinding;
    private final SchemaBinding<O> outputBinding;

    protected Cell(@NonNull final CellDefinition<I, O> definition) {
        this(definition, CellSetup.builder().build());
    }

    protected Cell(@NonNull final CellDefinition<I, O> definition, @NonNull final CellSetup setup) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(definition.getRole()), "Please provide a valid role");
        Preconditions.checkArgument(!Strings.isNullOrEmpty(definition.getDescription()),
                                    "Please provide a valid description");
        this.definition = definition;
        this.setup = setup;
        this.config = definition.getEnvVars().isEmpty()
                      ? null
                      : new ConfigModel(definition.getEnvVars(), setup.getEnvSource());
        this.inputBinding = new SchemaBinding<>(definition.getInputType(), setup.getMapper(), setup.getValidator());
        this.outputBinding = new SchemaBinding<>(definition.getOutputType(), setup.getMapper(), setup.getValidator());
        log.info("Created cell {}: {} -> {}",
                 definition.getRole(),
                 definition.getInputType().getSimpleName(),
                 definition.getOutputType().getSimpleName());
    }

    /**
     * Business logic of the cell. Called only with validated input.
     *
     * @param input   Validated input
     * @param context Context for this run
     * @return Stage completing with the output. The output is validated before it is handed to the caller.
     */
    protected abstract CompletionStage<O> process(I input, CellRunContext context);

    public String getRole() {
        return definition.getRole();
    }

    public String getDescription() {
        return definition.getDescription();
    }

    public Class<I> getInputType() {
        return definition.getInputType();
    }

    public Class<O> getOutputType() {
        return definition.getOutputType();
    }

    /**
     * @return Configuration resolved at construction, empty if the cell declares no environment variables
     */
    public Optional<ConfigModel> getConfig() {
        return Optional.ofNullable(config);
    }

    /**
     * JSON schema of the input type. Generated once, every call returns an equal copy.
     */
    public JsonNode getInputSchema() {
        return inputBinding.getSchema();
    }

    /**
     * JSON schema of the output type. Generated once, every call returns an equal copy.
     */
    public JsonNode getOutputSchema() {
        return outputBinding.getSchema();
    }

    public String getInputFormat() {
        return JsonUtils.prettyPrint(setup.getMapper(), getInputSchema());
    }

    public String getOutputFormat() {
        return JsonUtils.prettyPrint(setup.getMapper(), getOutputSchema());
    }

    public CellDescription describe() {
        return new CellDescription(getRole(),
                                   getDescription(),
                                   getInputSchema(),
                                   getOutputSchema(),
                                   definition.getEnvVars().stream().map(EnvVar::getKey).toList());
    }

    /**
     * Execute the cell synchronously.
     *
     * @param input Raw input: JSON text, a {@link JsonNode}, a map or any object convertible to the input type
     * @return The output or the error
     */
    public final CellOutput<O> execute(final Object input) {
        return executeAsync(input).join();
    }

    /**
     * Execute the cell asynchronously.
     *
     * @param input Raw input: JSON text, a {@link JsonNode}, a map or any object convertible to the input type
     * @return Future completing with the output or the error. Cancelling it cancels the running business logic.
     */
    public final CompletableFuture<CellOutput<O>> executeAsync(final Object input) {
        return executeAsync(input, null);
    }

    /**
     * Execute the cell asynchronously, with a bound on the time the business logic may take.
     *
     * @param input   Raw input: JSON text, a {@link JsonNode}, a map or any object convertible to the input type
     * @param timeout Maximum time for the business logic. Null for no bound.
     * @return Future completing with the output or the error. Cancelling it cancels the running business logic.
     */
    public final CompletableFuture<CellOutput<O>> executeAsync(final Object input, final Duration timeout) {
        Preconditions.checkArgument(timeout == null || !(timeout.isNegative() || timeout.isZero()),
                                    "Timeout must be positive");
        final var runId = UUID.randomUUID().toString();
        final var parsedInput = inputBinding.parse(input);
        if (!parsedInput.isSuccessful()) {
            log.debug("Cell {} run {}: input rejected: {}", getRole(), runId, parsedInput.getFailures());
            return CompletableFuture.completedFuture(
                    CellOutput.error(runId, CellError.validation(ErrorType.INPUT_VALIDATION_FAILURE,
                                                                 parsedInput.getFailures())));
        }
        final var stopped = new AtomicBoolean(false);
        final var running = new AtomicReference<CompletableFuture<O>>();
        final var context = new CellRunContext(runId, getRole(), config, stopped::get);
        final CompletableFuture<O> logic;
        try {
            logic = CompletableFuture.supplyAsync(() -> startProcessing(parsedInput.getValue(), context, running),
                                                  setup.getExecutorService())
                    .thenCompose(Function.identity());
        }
        catch (RejectedExecutionException e) {
            log.error("Cell {} run {}: could not be scheduled", getRole(), runId, e);
            return CompletableFuture.completedFuture(
                    CellOutput.error(runId, CellError.error(ErrorType.EXECUTION_FAILURE, e)));
        }
        if (timeout != null) {
            final var deadline = new CompletableFuture<Boolean>()
                    .completeOnTimeout(true, timeout.toMillis(), TimeUnit.MILLISECONDS);
            deadline.thenAccept(expired -> {
                if (Boolean.TRUE.equals(expired)) {
                    logic.completeExceptionally(new ExecutionTimedOut(timeout));
                }
            });
            // Normal completion of the deadline unschedules the pending expiry
            logic.whenComplete((output, error) -> deadline.complete(false));
        }
        final var result = new CompletableFuture<CellOutput<O>>();
        logic.whenComplete((output, error) -> {
            try {
                if (error != null) {
                    stopped.set(true);
                    cancel(running.get());
                    result.complete(CellOutput.error(runId, toExecutionError(runId, error, timeout)));
                }
                else {
                    result.complete(toCellOutput(runId, output));
                }
            }
            catch (RuntimeException e) {
                log.error("Cell {} run {}: error handling result", getRole(), runId, e);
                result.completeExceptionally(e);
            }
        });
        result.whenComplete((output, error) -> {
            if (result.isCancelled()) {
                log.debug("Cell {} run {}: cancelled by caller", getRole(), runId);
                stopped.set(true);
                logic.cancel(true);
                cancel(running.get());
            }
        });
        return result;
    }

    private CompletableFuture<O> startProcessing(
            I input,
            CellRunContext context,
            AtomicReference<CompletableFuture<O>> running) {
        if (context.isCancelled()) {
            return CompletableFuture.failedFuture(new CancellationException("Run stopped before processing started"));
        }
        log.debug("Cell {} run {}: processing", getRole(), context.getRunId());
        final var stage = process(input, context);
        if (stage == null) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("Cell %s returned no result stage".formatted(getRole())));
        }
        final var future = stage.toCompletableFuture();
        running.set(future);
        if (context.isCancelled()) {
            future.cancel(true);
        }
        return future;
    }

    private CellOutput<O> toCellOutput(String runId, O output) {
        final var parsedOutput = outputBinding.parse(output);
        if (!parsedOutput.isSuccessful()) {
            log.warn("Cell {} run {}: output rejected: {}", getRole(), runId, parsedOutput.getFailures());
            return CellOutput.error(runId, CellError.validation(ErrorType.OUTPUT_VALIDATION_FAILURE,
                                                                parsedOutput.getFailures()));
        }
        log.debug("Cell {} run {}: completed", getRole(), runId);
        return CellOutput.success(runId, parsedOutput.getValue());
    }

    private CellError toExecutionError(String runId, Throwable error, Duration timeout) {
        final var cause = unwrap(error);
        if (cause instanceof ExecutionTimedOut) {
            log.warn("Cell {} run {}: timed out after {}", getRole(), runId, timeout);
            return CellError.execution(ErrorType.EXECUTION_TIMEOUT, cause, timeout);
        }
        if (cause instanceof CancellationException) {
            log.warn("Cell {} run {}: processing was cancelled", getRole(), runId);
            return CellError.execution(ErrorType.EXECUTION_CANCELLED, cause);
        }
        log.error("Cell {} run {}: processing failed", getRole(), runId, cause);
        return CellError.error(ErrorType.EXECUTION_FAILURE, cause);
    }

    private static Throwable unwrap(Throwable error) {
        var current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static void cancel(CompletableFuture<?> future) {
        if (future != null && !future.isDone()) {
            future.cancel(true);
        }
    }
}
