package io.github.drompincen.agentchat.runtime.permission;

import io.github.drompincen.agentchat.persistence.store.PermissionStore;
import io.github.drompincen.agentchat.protocol.api.PermissionPatternEntry;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * User-approved tool patterns, shared by every conversation. Mutations are applied in
 * memory first and then written through to the {@link PermissionStore}.
 * Patterns are not scoped to a working directory.
 */
@Service
public class PermissionPatternCache {

    private static final Logger log = LoggerFactory.getLogger(PermissionPatternCache.class);

    private final PermissionStore permissionStore;
    private final Clock clock;
    private List<PermissionPatternEntry> patterns;

    @Autowired
    public PermissionPatternCache(PermissionStore permissionStore) {
        this(permissionStore, Clock.systemUTC());
    }

    PermissionPatternCache(PermissionStore permissionStore, Clock clock) {
        this.permissionStore = permissionStore;
        this.clock = clock;
    }

    /**
     * The string a pattern is matched against: the command for Bash, the file path for
     * file tools, the search pattern for Glob and Grep. Other tools have none.
     */
    public static Optional<String> subjectOf(String toolName, JsonNode input) {
        if (toolName == null || input == null) {
            return Optional.empty();
        }
        String field;
        switch (toolName) {
            case "Bash":
                field = "command";
                break;
            case "Read":
            case "Write":
            case "Edit":
            case "MultiEdit":
                field = "file_path";
                break;
            case "Glob":
            case "Grep":
                field = "pattern";
                break;
            default:
                return Optional.empty();
        }
        JsonNode value = input.get(field);
        if (value == null || !value.isTextual()) {
            return Optional.empty();
        }
        return Optional.of(value.asText());
    }

    /** Pattern offered when the user picks "always allow" for this invocation. */
    public static Optional<String> suggestPattern(String toolName, JsonNode input) {
        return subjectOf(toolName, input)
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(s -> "Bash".equals(toolName) ? CommandPatternGeneralizer.generalize(s) : s);
    }

    public synchronized boolean isPreApproved(String toolName, JsonNode input) {
        Optional<String> subject = subjectOf(toolName, input);
        if (subject.isEmpty()) {
            return false;
        }
        for (PermissionPatternEntry entry : loaded()) {
            if (entry.toolName().equals(toolName) && matches(entry.pattern(), subject.get())) {
                log.debug("{} pre-approved by pattern '{}'", toolName, entry.pattern());
                return true;
            }
        }
        return false;
    }

    public synchronized boolean add(String toolName, String pattern) {
        boolean exists = loaded().stream().anyMatch(e -> e.sameRule(toolName, pattern));
        if (exists) {
            return false;
        }
        patterns.add(new PermissionPatternEntry(toolName, pattern, clock.instant()));
        permissionStore.save(List.copyOf(patterns));
        log.info("Always allowing {} for '{}'", toolName, pattern);
        return true;
    }

    public synchronized boolean remove(String toolName, String pattern) {
        boolean removed = loaded().removeIf(e -> e.sameRule(toolName, pattern));
        if (removed) {
            permissionStore.save(List.copyOf(patterns));
            log.info("Revoked {} pattern '{}'", toolName, pattern);
        }
        return removed;
    }

    public synchronized void clear() {
        loaded().clear();
        permissionStore.save(List.of());
        log.info("Cleared all permission patterns");
    }

    public synchronized List<PermissionPatternEntry> list() {
        return List.copyOf(loaded());
    }

    /** {@code *} matches any run of characters within a line, never a line break. */
    static boolean matches(String pattern, String subject) {
        if (pattern.equals(subject)) {
            return true;
        }
        StringBuilder regex = new StringBuilder("^");
        String[] parts = pattern.split("\\*", -1);
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                regex.append(".*");
            }
            if (!parts[i].isEmpty()) {
                regex.append(Pattern.quote(parts[i]));
            }
        }
        regex.append('$');
        return Pattern.compile(regex.toString()).matcher(subject).matches();
    }

    private List<PermissionPatternEntry> loaded() {
        if (patterns == null) {
            patterns = new ArrayList<>(permissionStore.load());
        }
        return patterns;
    }
}
