package com.questrail.bridge.api;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.concurrent.CompletableFuture;

/**
 * ProviderBridge
 * -----------------------------------------------------------------------------
 * {@code ProviderBridge} is the request/response façade over the bridge
 * service, the long-running child process that manages AI-provider sessions
 * and profiles on behalf of the desktop UI.
 *
 * <h2>Core Responsibilities</h2>
 * <ul>
 *   <li>Issue typed requests and deliver the matching result to each caller</li>
 *   <li>Report liveness (process running <b>and</b> readiness observed)</li>
 *   <li>Tear the service down, idempotently</li>
 * </ul>
 *
 * It is explicitly <b>not</b> responsible for:
 * <ul>
 *   <li>Ordering independent requests (only ids correlate)</li>
 *   <li>Per-request timeouts</li>
 *   <li>Restarting a dead service</li>
 * </ul>
 *
 * <h2>Results</h2>
 * Every operation returns a {@link CompletableFuture}. It completes with the
 * service's {@code result} payload ({@code NullNode} when none was sent) or
 * fails with a {@link BridgeException}:
 * <ul>
 *   <li>{@link BridgeNotRunningException}: the bridge was not alive; nothing sent</li>
 *   <li>{@link BridgeTransportException}: the request could not be written</li>
 *   <li>{@link BridgeRemoteException}: the service answered with an error</li>
 * </ul>
 *
 * Callers may cancel a returned future; the eventual response is then discarded.
 */
public interface ProviderBridge extends AutoCloseable
{
    /**
     * Sends an arbitrary request. The typed operations below are thin wrappers.
     *
     * @param method wire method name
     * @param params request parameters, serialized as the {@code params} field
     */
    CompletableFuture<JsonNode> sendRequest(String method, JsonNode params);

    /** Starts or reuses a provider session for a profile. */
    CompletableFuture<JsonNode> launch(String profile, String provider, JsonNode config);

    CompletableFuture<JsonNode> sendMessage(String profile, String message);

    CompletableFuture<JsonNode> stop(String profile);

    CompletableFuture<JsonNode> listProviders();

    CompletableFuture<JsonNode> checkAuth(String provider, String profileName);

    CompletableFuture<JsonNode> listProfiles();

    CompletableFuture<JsonNode> createProfile(String name, String provider);

    CompletableFuture<JsonNode> switchProfile(String profileId);

    CompletableFuture<JsonNode> deleteProfile(String profileId);

    CompletableFuture<JsonNode> getCurrentProfile();

    /**
     * @param metadata optional extra credential metadata; omitted from the
     *                 request when {@code null}
     */
    CompletableFuture<JsonNode> loginWithApiKey(String profileName, String provider, String apiKey, JsonNode metadata);

    CompletableFuture<JsonNode> getAuthOptions(String profileName, String provider);

    CompletableFuture<JsonNode> linkExistingCredential(String profileName, String provider);

    /**
     * @return {@code true} only when the service process is running, its stdin
     *         is open, and it has announced readiness
     */
    boolean isAlive();

    /**
     * Kills the service process and waits for it to exit. A second call is a
     * no-op.
     */
    void shutdown();

    /** Equivalent to {@link #shutdown()}. */
    @Override
    default void close() {
        shutdown();
    }
}
