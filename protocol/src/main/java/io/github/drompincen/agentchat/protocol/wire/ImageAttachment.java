package io.github.drompincen.agentchat.protocol.wire;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public record ImageAttachment(String mediaType, String base64Data) {

    private static final Pattern DATA_URL = Pattern.compile("^data:(image/\\w+);base64,(.+)$", Pattern.DOTALL);

    public static Optional<ImageAttachment> fromDataUrl(String dataUrl) {
        if (dataUrl == null) {
            return Optional.empty();
        }
        Matcher m = DATA_URL.matcher(dataUrl);
        if (!m.matches()) {
            return Optional.empty();
        }
        return Optional.of(new ImageAttachment(m.group(1), m.group(2)));
    }
}
