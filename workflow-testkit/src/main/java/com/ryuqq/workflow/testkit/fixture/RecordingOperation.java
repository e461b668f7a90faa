package com.ryuqq.workflow.testkit.fixture;

import com.ryuqq.workflow.core.outcome.OperationResult;
import com.ryuqq.workflow.core.spi.Operation;
import com.ryuqq.workflow.core.spi.OperationContext;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiFunction;

/**
 * {@link Operation} test double that records every invocation.
 *
 * <p>Each call captures the {@link OperationContext} and a copy of the dispatched
 * parameters, then delegates to a configurable responder.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * RecordingOperation getSheets = RecordingOperation.returning(OperationResult.success(Map.of("sheetId", 7)));
 * // ... run workflow ...
 * assertThat(getSheets.lastParameters()).containsEntry("viewId", 3);
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RecordingOperation implements Operation {

    private final BiFunction<OperationContext, Map<String, Object>, OperationResult> responder;
    private final List<Invocation> invocations = new CopyOnWriteArrayList<>();

    private RecordingOperation(BiFunction<OperationContext, Map<String, Object>, OperationResult> responder) {
        this.responder = responder;
    }

    /**
     * Always returns the given result.
     */
    public static RecordingOperation returning(OperationResult result) {
        return new RecordingOperation((context, parameters) -> result);
    }

    /**
     * Always succeeds with no output fields.
     */
    public static RecordingOperation succeeding() {
        return returning(OperationResult.success());
    }

    /**
     * Always fails with the given error.
     */
    public static RecordingOperation failing(String error) {
        return returning(OperationResult.failure(error));
    }

    /**
     * Always throws the given fault.
     */
    public static RecordingOperation throwing(RuntimeException fault) {
        return new RecordingOperation((context, parameters) -> {
            throw fault;
        });
    }

    /**
     * Computes the result from the invocation.
     */
    public static RecordingOperation answering(
            BiFunction<OperationContext, Map<String, Object>, OperationResult> responder) {
        if (responder == null) {
            throw new IllegalArgumentException("responder cannot be null");
        }
        return new RecordingOperation(responder);
    }

    @Override
    public OperationResult invoke(OperationContext context, Map<String, Object> parameters) {
        invocations.add(new Invocation(context, new LinkedHashMap<>(parameters)));
        return responder.apply(context, parameters);
    }

    public List<Invocation> invocations() {
        return List.copyOf(invocations);
    }

    public int invocationCount() {
        return invocations.size();
    }

    /**
     * Parameters of the most recent invocation.
     *
     * @throws IllegalStateException if never invoked
     */
    public Map<String, Object> lastParameters() {
        if (invocations.isEmpty()) {
            throw new IllegalStateException("operation was never invoked");
        }
        return invocations.get(invocations.size() - 1).parameters();
    }

    /**
     * A single recorded call.
     *
     * @param context the operation context
     * @param parameters copy of the dispatched parameters (may contain null values)
     */
    public record Invocation(OperationContext context, Map<String, Object> parameters) {
    }
}
