package io.github.drompincen.agentchat.runtime.session;

public record TurnOptions(boolean planMode, boolean thinkingMode) {

    public static final TurnOptions DEFAULT = new TurnOptions(false, false);
}
