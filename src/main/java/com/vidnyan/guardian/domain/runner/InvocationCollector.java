package com.vidnyan.guardian.domain.runner;

import com.vidnyan.guardian.domain.analyzer.InvocationResult;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Append-only sink shared by runner workers. The first result recorded for an
 * invocation wins; later ones are ignored. Order carries no meaning.
 */
public class InvocationCollector {

    private final Map<String, InvocationResult> results = new ConcurrentHashMap<>();

    /**
     * @return false if a result for this invocation was already recorded
     */
    public boolean record(InvocationResult result) {
        return results.putIfAbsent(result.invocation().id(), result) == null;
    }

    public boolean contains(String invocationId) {
        return results.containsKey(invocationId);
    }

    public InvocationResult get(String invocationId) {
        return results.get(invocationId);
    }
}
