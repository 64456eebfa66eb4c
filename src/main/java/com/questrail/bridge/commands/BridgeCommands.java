package com.questrail.bridge.commands;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.bridge.api.ProviderBridge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * BridgeCommands
 * =============================================================================
 * The operations the UI invokes. Most forward one bridge request and hand back
 * its result; a few add behavior of their own:
 *
 * <ul>
 *   <li>{@link #sendMessage} launches (or reuses) the provider session before
 *       sending.</li>
 *   <li>{@link #stopMessageStream()} targets the profile selected in
 *       {@link AppState}.</li>
 *   <li>{@link #switchProfile} records the selection on success.</li>
 *   <li>{@link #checkProviderAuth} reduces the result to a boolean and never
 *       fails.</li>
 *   <li>{@link #addContextPaths} and {@link #readFile} are local file system
 *       operations that do not involve the bridge.</li>
 * </ul>
 */
public final class BridgeCommands
{
    private static final Logger log = LoggerFactory.getLogger(BridgeCommands.class);
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    static final String PERMISSION_MODE_ASK = "ask";

    private final ProviderBridge bridge;
    private final AppState appState;
    private final Path workingDirectory;

    public BridgeCommands(ProviderBridge bridge, AppState appState)
    {
        this(bridge, appState, Path.of(System.getProperty("user.dir")));
    }

    /**
     * @param workingDirectory the directory provider sessions operate in
     */
    public BridgeCommands(ProviderBridge bridge, AppState appState, Path workingDirectory)
    {
        this.bridge = Objects.requireNonNull(bridge, "bridge");
        this.appState = Objects.requireNonNull(appState, "appState");
        this.workingDirectory = Objects.requireNonNull(workingDirectory, "workingDirectory");
    }

    // -------------------------------------------------------------------------
    // Messaging
    // -------------------------------------------------------------------------

    /**
     * Launches the provider session for {@code profile} and sends
     * {@code message} to it. A failed launch is logged and ignored since the
     * session usually exists already; a failed send fails the result.
     *
     * @param context attached paths; not forwarded yet
     */
    public CompletableFuture<JsonNode> sendMessage(String profile, String provider, String message,
                                                   List<String> context)
    {
        log.debug("sendMessage profile={} provider={} length={} context={}",
                profile, provider, message.length(), context == null ? 0 : context.size());

        ObjectNode config = NODES.objectNode();
        config.put("profileName", profile);
        config.put("workingDir", workingDirectory.toString());
        config.put("permissionMode", PERMISSION_MODE_ASK);

        return bridge.launch(profile, provider, config)
                .handle((result, error) -> {
                    if (error != null) {
                        log.info("Launch for profile {} not completed ({}), sending anyway",
                                profile, rootMessage(error));
                    }
                    return null;
                })
                .thenCompose(ignored -> bridge.sendMessage(profile, message));
    }

    /**
     * Stops the session of the currently selected profile.
     */
    public CompletableFuture<JsonNode> stopMessageStream()
    {
        return appState.currentProfileId()
                .map(bridge::stop)
                .orElseGet(() -> CompletableFuture.failedFuture(new CommandException("No profile selected")));
    }

    // -------------------------------------------------------------------------
    // Profiles
    // -------------------------------------------------------------------------

    public CompletableFuture<JsonNode> listProviders() {
        return bridge.listProviders();
    }

    public CompletableFuture<JsonNode> listProfiles() {
        return bridge.listProfiles();
    }

    public CompletableFuture<JsonNode> createProfile(String name, String provider) {
        return bridge.createProfile(name, provider);
    }

    public CompletableFuture<JsonNode> switchProfile(String profileId)
    {
        return bridge.switchProfile(profileId)
                .thenApply(result -> {
                    appState.selectProfile(profileId);
                    return result;
                });
    }

    public CompletableFuture<JsonNode> deleteProfile(String profileId) {
        return bridge.deleteProfile(profileId);
    }

    public CompletableFuture<JsonNode> getCurrentProfile() {
        return bridge.getCurrentProfile();
    }

    // -------------------------------------------------------------------------
    // Auth
    // -------------------------------------------------------------------------

    /**
     * @return the {@code valid} flag of the auth check; {@code false} if the
     *         check failed or the flag is missing
     */
    public CompletableFuture<Boolean> checkProviderAuth(String provider, String profileName)
    {
        return bridge.checkAuth(provider, profileName)
                .handle((result, error) -> {
                    if (error != null) {
                        log.warn("Auth check for {} / {} failed: {}", provider, profileName, rootMessage(error));
                        return false;
                    }
                    JsonNode valid = result.get("valid");
                    return valid != null && valid.isBoolean() && valid.booleanValue();
                });
    }

    public CompletableFuture<JsonNode> loginWithApiKey(String profileName, String provider, String apiKey,
                                                       JsonNode metadata) {
        return bridge.loginWithApiKey(profileName, provider, apiKey, metadata);
    }

    public CompletableFuture<JsonNode> getAuthOptions(String profileName, String provider) {
        return bridge.getAuthOptions(profileName, provider);
    }

    public CompletableFuture<JsonNode> linkExistingCredential(String profileName, String provider) {
        return bridge.linkExistingCredential(profileName, provider);
    }

    // -------------------------------------------------------------------------
    // Local files
    // -------------------------------------------------------------------------

    /**
     * Describes each path. Fails on the first path that cannot be read.
     *
     * @throws CommandException "Failed to read &lt;path&gt;: &lt;cause&gt;"
     */
    public List<ContextItem> addContextPaths(List<String> paths)
    {
        List<ContextItem> items = new ArrayList<>(paths.size());
        for (String path : paths) {
            BasicFileAttributes attributes;
            try {
                attributes = Files.readAttributes(Path.of(path), BasicFileAttributes.class);
            }
            catch (IOException | RuntimeException e) {
                throw new CommandException("Failed to read " + path + ": " + describe(e), e);
            }
            items.add(new ContextItem(
                    UUID.randomUUID().toString(),
                    path,
                    attributes.isDirectory() ? ContextItem.DIRECTORY : ContextItem.FILE,
                    attributes.size()));
        }
        return items;
    }

    /**
     * @throws CommandException "Failed to read &lt;path&gt;: &lt;cause&gt;"
     */
    public String readFile(String path)
    {
        try {
            return Files.readString(Path.of(path), StandardCharsets.UTF_8);
        }
        catch (IOException | RuntimeException e) {
            throw new CommandException("Failed to read " + path + ": " + describe(e), e);
        }
    }

    private static String describe(Exception e)
    {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static String rootMessage(Throwable error)
    {
        Throwable t = error;
        while (t.getCause() != null && t != t.getCause()) {
            t = t.getCause();
        }
        return t.getMessage();
    }
}
