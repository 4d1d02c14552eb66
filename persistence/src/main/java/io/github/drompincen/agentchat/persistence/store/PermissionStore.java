package io.github.drompincen.agentchat.persistence.store;

import io.github.drompincen.agentchat.protocol.api.PermissionPatternEntry;

import java.util.List;

public interface PermissionStore {

    List<PermissionPatternEntry> load();

    void save(List<PermissionPatternEntry> allowedPatterns);
}
