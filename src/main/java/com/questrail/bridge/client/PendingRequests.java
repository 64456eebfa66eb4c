package com.questrail.bridge.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.bridge.api.BridgeRemoteException;
import com.questrail.bridge.model.BridgeResponse;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * PendingRequests
 * -----------------------------------------------------------------------------
 * Registry of in-flight request ids and the single-use completion handle each
 * caller is waiting on.
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>An id is registered before its request line is written.</li>
 *   <li>An id is removed exactly once: by its response
 *       ({@link #complete(BridgeResponse)}) or by a failed write
 *       ({@link #remove(long)}).</li>
 *   <li>Completing a handle whose caller has cancelled is a no-op.</li>
 * </ul>
 *
 * <p>Every operation is a single map insert or remove; the registry is never
 * iterated.</p>
 */
public final class PendingRequests
{
    private final ConcurrentMap<Long, CompletableFuture<JsonNode>> pending = new ConcurrentHashMap<>();

    /**
     * Registers a fresh completion handle.
     *
     * @throws IllegalStateException if the id is already pending
     */
    public CompletableFuture<JsonNode> register(long id)
    {
        CompletableFuture<JsonNode> handle = new CompletableFuture<>();
        if (pending.putIfAbsent(id, handle) != null) {
            throw new IllegalStateException("Request id already pending: " + id);
        }
        return handle;
    }

    /**
     * Removes an entry without completing it (the caller is told about the
     * failure directly).
     */
    public Optional<CompletableFuture<JsonNode>> remove(long id)
    {
        return Optional.ofNullable(pending.remove(id));
    }

    /**
     * Removes the entry for {@code response.id()} and resolves it: a present
     * {@code error} fails it with a {@link BridgeRemoteException} carrying that
     * exact text; otherwise it completes with the result.
     *
     * @return {@code false} if no request with that id was pending
     */
    public boolean complete(BridgeResponse response)
    {
        CompletableFuture<JsonNode> handle = pending.remove(response.id());
        if (handle == null) {
            return false;
        }
        if (response.isError()) {
            handle.completeExceptionally(new BridgeRemoteException(response.id(), response.error()));
        }
        else {
            handle.complete(response.result());
        }
        return true;
    }

    public boolean contains(long id)
    {
        return pending.containsKey(id);
    }

    public int size()
    {
        return pending.size();
    }
}
