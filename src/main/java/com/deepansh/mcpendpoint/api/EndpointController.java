package com.deepansh.mcpendpoint.api;

import com.deepansh.mcpendpoint.config.EndpointProperties;
import com.deepansh.mcpendpoint.observability.StatsReporter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP surface next to the WebSocket endpoints.
 *
 * GET /                               redirect to /mcp_endpoint/
 * GET /mcp_endpoint/                  service banner
 * GET /mcp_endpoint/health?key=...    connection statistics, key-protected
 */
@RestController
@RequiredArgsConstructor
public class EndpointController {

    private final StatsReporter statsReporter;
    private final EndpointProperties properties;

    @GetMapping("/")
    public ResponseEntity<Void> redirectRoot() {
        return ResponseEntity.status(HttpStatus.TEMPORARY_REDIRECT)
                .header(HttpHeaders.LOCATION, "/mcp_endpoint/")
                .build();
    }

    @GetMapping({"/mcp_endpoint", "/mcp_endpoint/"})
    public ResponseEntity<Map<String, Object>> info() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "MCP Endpoint Server");
        body.put("version", properties.getVersion());
        body.put("status", "running");
        return ResponseEntity.ok(body);
    }

    @GetMapping("/mcp_endpoint/health")
    public ResponseEntity<Map<String, Object>> health(@RequestParam(required = false) String key) {
        Map<String, Object> body = new LinkedHashMap<>();
        if (!keyMatches(key)) {
            body.put("status", "key_error");
            return ResponseEntity.ok(body);
        }
        body.put("status", "success");
        body.put("connections", statsReporter.snapshot());
        return ResponseEntity.ok(body);
    }

    private boolean keyMatches(String key) {
        String expected = properties.getKey();
        if (key == null || key.isEmpty() || expected == null || expected.isEmpty()) {
            return false;
        }
        return MessageDigest.isEqual(
                key.getBytes(StandardCharsets.UTF_8),
                expected.getBytes(StandardCharsets.UTF_8));
    }
}
