package com.ryuqq.resumable.testkit.extraction;

import com.ryuqq.resumable.core.extraction.ExtractionOperation;
import com.ryuqq.resumable.core.extraction.ExtractionResult;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Scripted Extraction Operation for tests.
 *
 * <p>Succeeds for every identifier unless told otherwise, and records every call so tests
 * can assert which identifiers were extracted and how often.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * ScriptedExtractionOperation operation = ScriptedExtractionOperation.succeeding()
 *     .failOn("https://example.com/3", "Empty content")
 *     .throwOn("https://example.com/42", new IllegalStateException("page crashed"));
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ScriptedExtractionOperation implements ExtractionOperation {

    private final Map<String, String> failures = new ConcurrentHashMap<>();
    private final Map<String, Exception> faults = new ConcurrentHashMap<>();
    private final List<String> calls = new CopyOnWriteArrayList<>();

    private ScriptedExtractionOperation() {
    }

    /**
     * Creates an operation that succeeds for every identifier.
     *
     * @return a new scripted operation
     */
    public static ScriptedExtractionOperation succeeding() {
        return new ScriptedExtractionOperation();
    }

    /**
     * Makes extraction of the given identifier return a failure result.
     *
     * @param id the identifier
     * @param error the failure reason
     * @return this operation
     */
    public ScriptedExtractionOperation failOn(String id, String error) {
        failures.put(id, error);
        return this;
    }

    /**
     * Makes extraction of the given identifier throw.
     *
     * @param id the identifier
     * @param fault the exception to throw
     * @return this operation
     */
    public ScriptedExtractionOperation throwOn(String id, Exception fault) {
        faults.put(id, fault);
        return this;
    }

    @Override
    public ExtractionResult extract(String id) throws Exception {
        calls.add(id);
        Exception fault = faults.get(id);
        if (fault != null) {
            throw fault;
        }
        String error = failures.get(id);
        if (error != null) {
            return ExtractionResult.failure(error);
        }
        Map<String, Object> payload = new HashMap<>();
        payload.put("id", id);
        payload.put("title", "Title of " + id);
        return ExtractionResult.success(payload);
    }

    /**
     * Returns every identifier passed to {@link #extract(String)}, in call order.
     *
     * @return an unmodifiable view of the calls
     */
    public List<String> calls() {
        return Collections.unmodifiableList(calls);
    }

    /**
     * Counts how many times an identifier was extracted.
     *
     * @param id the identifier
     * @return the call count
     */
    public int callCount(String id) {
        int count = 0;
        for (String call : calls) {
            if (call.equals(id)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Forgets recorded calls, keeping the script.
     */
    public void resetCalls() {
        calls.clear();
    }
}
