package io.github.drompincen.agentchat.persistence.document;

import io.github.drompincen.agentchat.protocol.api.PermissionPatternEntry;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.ArrayList;
import java.util.List;

@Document(collection = "permissions")
public class PermissionsDocument {

    public static final String DEFAULT_ID = "default";

    @Id
    private String id = DEFAULT_ID;
    private List<PermissionPatternEntry> allowedPatterns = new ArrayList<>();

    public PermissionsDocument() {}

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public List<PermissionPatternEntry> getAllowedPatterns() { return allowedPatterns; }
    public void setAllowedPatterns(List<PermissionPatternEntry> allowedPatterns) { this.allowedPatterns = allowedPatterns; }
}
