package io.github.drompincen.agentchat.persistence.store;

import io.github.drompincen.agentchat.persistence.document.PermissionsDocument;
import io.github.drompincen.agentchat.persistence.repository.PermissionsRepository;
import io.github.drompincen.agentchat.protocol.api.PermissionPatternEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps all allowed patterns in a single {@code permissions} document.
 */
@Service
public class MongoPermissionStore implements PermissionStore {

    private static final Logger log = LoggerFactory.getLogger(MongoPermissionStore.class);

    private final PermissionsRepository permissionsRepository;

    public MongoPermissionStore(PermissionsRepository permissionsRepository) {
        this.permissionsRepository = permissionsRepository;
    }

    @Override
    public List<PermissionPatternEntry> load() {
        try {
            return permissionsRepository.findById(PermissionsDocument.DEFAULT_ID)
                    .map(PermissionsDocument::getAllowedPatterns)
                    .map(patterns -> patterns.stream()
                            .filter(p -> p != null && p.toolName() != null && p.pattern() != null)
                            .toList())
                    .orElse(List.of());
        } catch (DataAccessException e) {
            log.warn("Could not read permission patterns, starting empty: {}", e.getMessage());
            return List.of();
        }
    }

    @Override
    public void save(List<PermissionPatternEntry> allowedPatterns) {
        PermissionsDocument doc = new PermissionsDocument();
        doc.setAllowedPatterns(new ArrayList<>(allowedPatterns));
        try {
            permissionsRepository.save(doc);
        } catch (DataAccessException e) {
            log.error("Failed to persist {} permission patterns", allowedPatterns.size(), e);
        }
    }
}
