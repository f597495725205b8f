package com.cloudimages.controller;

import com.cloudimages.dto.ProviderRequest;
import com.cloudimages.dto.ProviderResponse;
import com.cloudimages.entity.ProviderType;
import com.cloudimages.service.StorageProviderService;
import com.cloudimages.storage.ConnectionTestResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * REST controller for storage provider management.
 *
 * Endpoints:
 * GET /api/providers: list the caller's providers
 * POST /api/providers: register a provider
 * GET /api/providers/types: supported provider types and their required keys
 * GET /api/providers/{id}: provider details (credentials never returned)
 * PUT /api/providers/{id}: partial update
 * DELETE /api/providers/{id}: delete (subject to the delete policy)
 * POST /api/providers/{id}/set-default: make it the default upload target
 * POST /api/providers/{id}/test-connection: read-only connectivity check
 *
 * The caller is identified by the X-User-Id header set by the auth layer.
 */
@RestController
@RequestMapping("/api/providers")
public class StorageProviderController {

    static final String USER_HEADER = "X-User-Id";

    private final StorageProviderService providerService;

    public StorageProviderController(StorageProviderService providerService) {
        this.providerService = providerService;
    }

    @GetMapping
    public ResponseEntity<List<ProviderResponse>> list(@RequestHeader(USER_HEADER) String userId) {
        return ResponseEntity.ok(providerService.list(userId).stream()
                .map(ProviderResponse::from)
                .collect(Collectors.toList()));
    }

    @PostMapping
    public ResponseEntity<ProviderResponse> create(@RequestHeader(USER_HEADER) String userId,
            @RequestBody ProviderRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ProviderResponse.from(providerService.create(userId, request)));
    }

    @GetMapping("/types")
    public ResponseEntity<List<Map<String, Object>>> types() {
        List<Map<String, Object>> result = new ArrayList<>();
        for (ProviderType type : ProviderType.values()) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("type", type.name());
            m.put("code", type.getCode());
            m.put("displayName", type.getDisplayName());
            m.put("requiredCredentials", type.getRequiredCredentials());
            m.put("requiredConfig", type.getRequiredConfig());
            result.add(m);
        }
        return ResponseEntity.ok(result);
    }

    @GetMapping("/{id}")
    public ResponseEntity<ProviderResponse> get(@RequestHeader(USER_HEADER) String userId, @PathVariable Long id) {
        return ResponseEntity.ok(ProviderResponse.from(providerService.get(id, userId)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ProviderResponse> update(@RequestHeader(USER_HEADER) String userId,
            @PathVariable Long id,
            @RequestBody ProviderRequest request) {
        return ResponseEntity.ok(ProviderResponse.from(providerService.update(id, userId, request)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, Object>> delete(@RequestHeader(USER_HEADER) String userId,
            @PathVariable Long id) {
        providerService.delete(id, userId);
        return ResponseEntity.ok(Map.of("status", "deleted", "id", id));
    }

    @PostMapping("/{id}/set-default")
    public ResponseEntity<ProviderResponse> setDefault(@RequestHeader(USER_HEADER) String userId,
            @PathVariable Long id) {
        return ResponseEntity.ok(ProviderResponse.from(providerService.setDefault(id, userId)));
    }

    /**
     * Always answers 200; the outcome is in the body.
     */
    @PostMapping("/{id}/test-connection")
    public ResponseEntity<Map<String, Object>> testConnection(@RequestHeader(USER_HEADER) String userId,
            @PathVariable Long id) {
        ConnectionTestResult result = providerService.testConnection(id, userId);
        return ResponseEntity.ok(Map.of(
                "status", result.getStatus().name().toLowerCase(Locale.ROOT),
                "message", result.getMessage()));
    }
}
