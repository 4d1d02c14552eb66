package io.github.drompincen.agentchat.protocol.log;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum LogEntryType {
    USER_INPUT("userInput"),
    OUTPUT("output"),
    THINKING("thinking"),
    TOOL_USE("toolUse"),
    TOOL_RESULT("toolResult"),
    UPDATE_TOKENS("updateTokens"),
    ERROR("error"),
    SESSION_INFO("sessionInfo"),
    COMPACTING("compacting"),
    COMPACT_BOUNDARY("compactBoundary"),
    PERMISSION_REQUEST("permissionRequest"),
    UNKNOWN("unknown");

    private final String wireName;

    LogEntryType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static LogEntryType fromWire(String value) {
        for (LogEntryType t : values()) {
            if (t.wireName.equals(value)) {
                return t;
            }
        }
        return UNKNOWN;
    }
}
