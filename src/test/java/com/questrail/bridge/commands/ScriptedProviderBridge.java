package com.questrail.bridge.commands;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.questrail.bridge.api.BridgeRemoteException;
import com.questrail.bridge.core.AbstractProviderBridge;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Test-only bridge that answers each method from a script and records the
 * calls it receives. Unscripted methods succeed with {@code null}.
 */
final class ScriptedProviderBridge extends AbstractProviderBridge {

    record Call(String method, JsonNode params) {}

    private final Map<String, JsonNode> results = new HashMap<>();
    private final Map<String, String> errors = new HashMap<>();
    private final List<Call> calls = new ArrayList<>();
    private long nextId = 1;

    ScriptedProviderBridge answer(String method, JsonNode result) {
        results.put(method, result);
        return this;
    }

    ScriptedProviderBridge fail(String method, String error) {
        errors.put(method, error);
        return this;
    }

    List<Call> calls() {
        return calls;
    }

    List<String> methods() {
        return calls.stream().map(Call::method).toList();
    }

    @Override
    public synchronized CompletableFuture<JsonNode> sendRequest(String method, JsonNode params) {
        calls.add(new Call(method, params));
        long id = nextId++;
        if (errors.containsKey(method)) {
            return CompletableFuture.failedFuture(new BridgeRemoteException(id, errors.get(method)));
        }
        return CompletableFuture.completedFuture(results.getOrDefault(method, NullNode.getInstance()));
    }

    @Override
    public boolean isAlive() {
        return true;
    }

    @Override
    public void shutdown() {
    }
}
