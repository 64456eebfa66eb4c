package com.questrail.bridge.transport.process;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * FakeBridgeService
 * -----------------------------------------------------------------------------
 * Scripted stand-in for the bridge service, run in a child JVM by the
 * end-to-end tests.
 *
 * <p>The last argument is the "script" path the launcher appends. Its content
 * selects the mode: {@code ready} announces readiness at startup,
 * {@code silent} never does.</p>
 *
 * <p>Methods understood:</p>
 * <ul>
 *   <li>{@code listProviders}: {@code ["claude","codex","gemini"]}</li>
 *   <li>{@code switchProfile}: error {@code invalid profile} for
 *       {@code missing}, otherwise {@code {"profileId":..}}</li>
 *   <li>{@code sendMessage}: two {@code message} events, then
 *       {@code {"ok":true}}</li>
 *   <li>{@code workingDirectory}: the process's working directory</li>
 *   <li>{@code crash}: exits without answering</li>
 * </ul>
 * Anything else is answered with an {@code Unknown method} error.
 */
public final class FakeBridgeService {

    public static final String MODE_READY = "ready";
    public static final String MODE_SILENT = "silent";

    private static final ObjectMapper JSON = new ObjectMapper();

    private FakeBridgeService() {
    }

    /**
     * Interpreter command that runs this class in a fresh JVM with the current
     * test classpath.
     */
    public static List<String> interpreterCommand() {
        List<String> command = new ArrayList<>();
        command.add(Path.of(System.getProperty("java.home"), "bin", "java").toString());
        command.add("-cp");
        command.add(System.getProperty("java.class.path"));
        command.add(FakeBridgeService.class.getName());
        return command;
    }

    /**
     * Writes a script file at {@code root/relativePath} holding the mode.
     */
    public static Path writeScript(Path root, Path relativePath, String mode) throws IOException {
        Path script = root.resolve(relativePath);
        Files.createDirectories(script.getParent());
        Files.writeString(script, mode, StandardCharsets.UTF_8);
        return script;
    }

    public static void main(String[] args) throws IOException {
        String mode = args.length == 0 ? MODE_READY : Files.readString(Path.of(args[args.length - 1])).trim();
        PrintStream out = new PrintStream(System.out, true, StandardCharsets.UTF_8);

        System.err.println("[fake-bridge] starting in " + System.getProperty("user.dir"));
        out.println("fake bridge banner, not a protocol message");
        if (MODE_READY.equals(mode)) {
            out.println("{\"event\":\"ready\",\"data\":{}}");
        }

        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        String line;
        while ((line = in.readLine()) != null) {
            JsonNode request = JSON.readTree(line);
            long id = request.get("id").asLong();
            String method = request.get("method").asText();
            JsonNode params = request.get("params");

            switch (method) {
                case "listProviders" -> out.println(result(id, JSON.createArrayNode().add("claude").add("codex").add("gemini")));
                case "switchProfile" -> {
                    String profileId = params.get("profileId").asText();
                    if ("missing".equals(profileId)) {
                        out.println(error(id, "invalid profile"));
                    } else {
                        out.println(result(id, JSON.createObjectNode().put("profileId", profileId)));
                    }
                }
                case "sendMessage" -> {
                    out.println(event("message", JSON.createObjectNode()
                            .put("type", "text")
                            .put("content", "echo: " + params.get("message").asText())));
                    out.println(event("message", JSON.createObjectNode().put("type", "done")));
                    out.println(result(id, JSON.createObjectNode().put("ok", true)));
                }
                case "workingDirectory" -> out.println(result(id, JSON.getNodeFactory().textNode(System.getProperty("user.dir"))));
                case "crash" -> {
                    System.err.println("[fake-bridge] crashing on request " + id);
                    System.exit(3);
                }
                default -> out.println(error(id, "Unknown method: " + method));
            }
        }
    }

    private static String result(long id, JsonNode result) {
        ObjectNode response = JSON.createObjectNode();
        response.put("id", id);
        response.set("result", result);
        return response.toString();
    }

    private static String error(long id, String message) {
        ObjectNode response = JSON.createObjectNode();
        response.put("id", id);
        response.put("error", message);
        return response.toString();
    }

    private static String event(String name, JsonNode data) {
        ObjectNode event = JSON.createObjectNode();
        event.put("event", name);
        event.set("data", data);
        return event.toString();
    }
}
