package com.questrail.bridge.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.bridge.api.ProviderBridge;
import com.questrail.bridge.model.BridgeMethod;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * AbstractProviderBridge
 * -----------------------------------------------------------------------------
 * A transport-neutral base implementation of {@link ProviderBridge} that maps
 * every typed operation onto {@link #sendRequest(String, JsonNode)} with a
 * fixed parameter shape.
 *
 * <h2>What this class does</h2>
 * <ul>
 *   <li>Chooses the wire method name ({@link BridgeMethod})</li>
 *   <li>Builds the {@code params} object with the field names the bridge
 *       service expects</li>
 * </ul>
 *
 * <h2>What this class does NOT do</h2>
 * It does not allocate ids, write lines, correlate responses or track
 * liveness. Those responsibilities live in concrete subclasses.
 */
public abstract class AbstractProviderBridge implements ProviderBridge
{
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    /**
     * Convenience for subclasses and typed wrappers.
     */
    protected final CompletableFuture<JsonNode> send(BridgeMethod method, ObjectNode params) {
        return sendRequest(method.wireName(), params);
    }

    @Override
    public final CompletableFuture<JsonNode> launch(String profile, String provider, JsonNode config) {
        ObjectNode params = NODES.objectNode();
        params.put("profile", profile);
        params.put("provider", provider);
        params.set("config", Objects.requireNonNullElse(config, NullNode.getInstance()));
        return send(BridgeMethod.LAUNCH, params);
    }

    @Override
    public final CompletableFuture<JsonNode> sendMessage(String profile, String message) {
        ObjectNode params = NODES.objectNode();
        params.put("profile", profile);
        params.put("message", message);
        return send(BridgeMethod.SEND_MESSAGE, params);
    }

    @Override
    public final CompletableFuture<JsonNode> stop(String profile) {
        ObjectNode params = NODES.objectNode();
        params.put("profile", profile);
        return send(BridgeMethod.STOP, params);
    }

    @Override
    public final CompletableFuture<JsonNode> listProviders() {
        return send(BridgeMethod.LIST_PROVIDERS, NODES.objectNode());
    }

    @Override
    public final CompletableFuture<JsonNode> checkAuth(String provider, String profileName) {
        ObjectNode params = NODES.objectNode();
        params.put("provider", provider);
        params.put("profileName", profileName);
        return send(BridgeMethod.CHECK_AUTH, params);
    }

    @Override
    public final CompletableFuture<JsonNode> listProfiles() {
        return send(BridgeMethod.LIST_PROFILES, NODES.objectNode());
    }

    @Override
    public final CompletableFuture<JsonNode> createProfile(String name, String provider) {
        ObjectNode params = NODES.objectNode();
        params.put("name", name);
        params.put("provider", provider);
        return send(BridgeMethod.CREATE_PROFILE, params);
    }

    @Override
    public final CompletableFuture<JsonNode> switchProfile(String profileId) {
        ObjectNode params = NODES.objectNode();
        params.put("profileId", profileId);
        return send(BridgeMethod.SWITCH_PROFILE, params);
    }

    @Override
    public final CompletableFuture<JsonNode> deleteProfile(String profileId) {
        ObjectNode params = NODES.objectNode();
        params.put("profileId", profileId);
        return send(BridgeMethod.DELETE_PROFILE, params);
    }

    @Override
    public final CompletableFuture<JsonNode> getCurrentProfile() {
        return send(BridgeMethod.GET_CURRENT_PROFILE, NODES.objectNode());
    }

    @Override
    public final CompletableFuture<JsonNode> loginWithApiKey(String profileName, String provider,
                                                             String apiKey, JsonNode metadata) {
        ObjectNode params = NODES.objectNode();
        params.put("profileName", profileName);
        params.put("provider", provider);
        params.put("apiKey", apiKey);
        if (metadata != null) {
            params.set("metadata", metadata);
        }
        return send(BridgeMethod.LOGIN_WITH_API_KEY, params);
    }

    @Override
    public final CompletableFuture<JsonNode> getAuthOptions(String profileName, String provider) {
        ObjectNode params = NODES.objectNode();
        params.put("profileName", profileName);
        params.put("provider", provider);
        return send(BridgeMethod.GET_AUTH_OPTIONS, params);
    }

    @Override
    public final CompletableFuture<JsonNode> linkExistingCredential(String profileName, String provider) {
        ObjectNode params = NODES.objectNode();
        params.put("profileName", profileName);
        params.put("provider", provider);
        return send(BridgeMethod.LINK_EXISTING_CREDENTIAL, params);
    }
}
