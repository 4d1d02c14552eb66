package io.github.drompincen.agentchat.protocol.wire;

import java.util.List;

/**
 * The user turn written to the agent's stdin: text plus optional inline images.
 */
public record TurnPayload(String text, List<ImageAttachment> images) {

    public TurnPayload {
        text = text == null ? "" : text;
        images = images == null ? List.of() : List.copyOf(images);
    }

    public static TurnPayload text(String text) {
        return new TurnPayload(text, List.of());
    }

    public boolean isEmpty() {
        return text.isBlank() && images.isEmpty();
    }
}
