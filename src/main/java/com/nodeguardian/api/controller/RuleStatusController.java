package com.nodeguardian.api.controller;

import com.nodeguardian.api.dto.response.ApiResponse;
import com.nodeguardian.exception.ResourceNotFoundException;
import com.nodeguardian.status.RuleStatus;
import com.nodeguardian.status.RuleStatusCache;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only view of rule status.
 *
 * <ul>
 *   <li>GET /api/rules/status -- latest status of every rule, ordered by rule id</li>
 *   <li>GET /api/rules/{ruleId}/status -- one rule, 404 if it has never reported</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/rules")
public class RuleStatusController {

    private final RuleStatusCache ruleStatusCache;

    public RuleStatusController(RuleStatusCache ruleStatusCache) {
        this.ruleStatusCache = ruleStatusCache;
    }

    @GetMapping("/status")
    public ResponseEntity<ApiResponse<List<RuleStatus>>> listStatuses() {
        return ResponseEntity.ok(ApiResponse.of(ruleStatusCache.findAll()));
    }

    @GetMapping("/{ruleId}/status")
    public ResponseEntity<ApiResponse<RuleStatus>> getStatus(@PathVariable String ruleId) {
        RuleStatus status =
                ruleStatusCache.find(ruleId).orElseThrow(() -> new ResourceNotFoundException("Rule status", ruleId));
        return ResponseEntity.ok(ApiResponse.of(status));
    }
}
