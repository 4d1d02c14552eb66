package io.github.drompincen.agentchat.persistence.store;

public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
