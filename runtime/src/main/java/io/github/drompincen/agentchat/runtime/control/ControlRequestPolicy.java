package io.github.drompincen.agentchat.runtime.control;

import io.github.drompincen.agentchat.runtime.config.EngineSettings;
import io.github.drompincen.agentchat.runtime.permission.PermissionPatternCache;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Decides whether a permission request can be answered without asking the user.
 */
@Component
public class ControlRequestPolicy {

    public enum Decision {
        AUTO_APPROVE,
        PRE_APPROVED,
        ASK_USER
    }

    private final PermissionPatternCache patternCache;
    private final Set<String> exemptTools;

    public ControlRequestPolicy(PermissionPatternCache patternCache, EngineSettings settings) {
        this.patternCache = patternCache;
        this.exemptTools = Set.copyOf(settings.exemptTools());
    }

    public Decision decide(PendingControlRequest request, boolean autoApprove) {
        if (exemptTools.contains(request.toolName())) {
            return Decision.ASK_USER;
        }
        if (autoApprove) {
            return Decision.AUTO_APPROVE;
        }
        if (patternCache.isPreApproved(request.toolName(), request.input())) {
            return Decision.PRE_APPROVED;
        }
        return Decision.ASK_USER;
    }
}
