package com.example.investigator.tools;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/** Calls a tool hosted on one of the MCP servers through its {@code /api/call} REST bridge. */
public class McpBridgeTool implements ToolCapability {

    private static final Logger log = LoggerFactory.getLogger(McpBridgeTool.class);

    private final String name;
    private final ToolServer server;
    private final RestClient restClient;

    /**
     * @param restClient client whose base URL points at the tool server, or null when the server is
     *     not configured; every call then fails fast
     */
    public McpBridgeTool(String name, ToolServer server, RestClient restClient) {
        this.name = name;
        this.server = server;
        this.restClient = restClient;
    }

    public record BridgeRequest(String tool, Map<String, Object> arguments) {}

    public record BridgeResponse(String status, JsonNode output, String error) {}

    @Override
    public String name() {
        return name;
    }

    public ToolServer server() {
        return server;
    }

    @Override
    public ToolResult call(Map<String, Object> params) throws ToolCallException {
        log.info(">>> TOOL EXECUTION: {}/{} with {}", server.id(), name, params);
        if (restClient == null) {
            throw new ToolCallException(name, server.id() + " tool server is not configured");
        }

        BridgeResponse response;
        try {
            response =
                    restClient
                            .post()
                            .uri("/api/call")
                            .contentType(MediaType.APPLICATION_JSON)
                            .body(new BridgeRequest(name, params == null ? Map.of() : params))
                            .retrieve()
                            .body(BridgeResponse.class);
        } catch (RestClientResponseException e) {
            int status = e.getStatusCode().value();
            if (status == HttpStatus.UNAUTHORIZED.value()) {
                throw new ToolCallException(name, "unauthorized, check the bridge token", e);
            }
            if (status == HttpStatus.FORBIDDEN.value()) {
                throw new ToolCallException(name, "forbidden, bridge token rejected", e);
            }
            throw new ToolCallException(name, "bridge returned HTTP " + status, e);
        } catch (ResourceAccessException e) {
            throw new ToolCallException(name, "bridge unreachable: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new ToolCallException(name, "bridge call failed: " + e.getMessage(), e);
        }

        if (response == null) {
            throw new ToolCallException(name, "empty bridge response");
        }
        if (!"success".equalsIgnoreCase(response.status())) {
            String error = response.error() != null ? response.error() : "status " + response.status();
            throw new ToolCallException(name, error);
        }
        return new ToolResult(name, render(response.output()));
    }

    private static String render(JsonNode output) {
        if (output == null || output.isNull()) {
            return "";
        }
        return output.isTextual() ? output.asText() : output.toString();
    }
}
