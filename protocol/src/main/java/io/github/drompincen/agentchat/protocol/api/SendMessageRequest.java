package io.github.drompincen.agentchat.protocol.api;

import java.util.List;

public record SendMessageRequest(
        String content,
        List<ContentPart> parts,
        boolean planMode,
        boolean thinkingMode
) {
    public SendMessageRequest(String content) {
        this(content, null, false, false);
    }

    /** {@code data} holds an image as a {@code data:} URL. */
    public record ContentPart(String type, String text, String mediaType, String data) {}
}
