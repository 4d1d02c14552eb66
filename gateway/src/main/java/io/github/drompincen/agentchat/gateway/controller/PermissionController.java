package io.github.drompincen.agentchat.gateway.controller;

import io.github.drompincen.agentchat.protocol.api.PermissionPatternEntry;
import io.github.drompincen.agentchat.runtime.permission.PermissionPatternCache;
import io.github.drompincen.agentchat.runtime.session.TabScheduler;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/permissions")
public class PermissionController {

    private final PermissionPatternCache patternCache;
    private final TabScheduler scheduler;

    public PermissionController(PermissionPatternCache patternCache, TabScheduler scheduler) {
        this.patternCache = patternCache;
        this.scheduler = scheduler;
    }

    @GetMapping
    public List<PermissionPatternEntry> list() {
        return patternCache.list();
    }

    @PostMapping
    public ResponseEntity<?> add(@RequestBody PermissionPatternEntry body) {
        if (isBlank(body.toolName()) || isBlank(body.pattern())) {
            return ResponseEntity.badRequest().body(Map.of("error", "toolName and pattern are required"));
        }
        boolean added = patternCache.add(body.toolName(), body.pattern().trim());
        return ResponseEntity.status(added ? HttpStatus.CREATED : HttpStatus.OK).body(patternCache.list());
    }

    @DeleteMapping
    public ResponseEntity<Void> remove(@RequestParam String toolName, @RequestParam String pattern) {
        return patternCache.remove(toolName, pattern)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    @DeleteMapping("/all")
    public ResponseEntity<Void> clear() {
        patternCache.clear();
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/auto-approve")
    public Map<String, Boolean> autoApprove() {
        return Map.of("enabled", scheduler.isAutoApprove());
    }

    @PutMapping("/auto-approve")
    public Map<String, Boolean> setAutoApprove(@RequestBody Map<String, Boolean> body) {
        scheduler.setAutoApprove(Boolean.TRUE.equals(body.get("enabled")));
        return Map.of("enabled", scheduler.isAutoApprove());
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
