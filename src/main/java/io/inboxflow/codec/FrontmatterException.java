package io.inboxflow.codec;

public final class FrontmatterException extends RuntimeException {
    public FrontmatterException(String message) {
        super(message);
    }

    public FrontmatterException(String message, Throwable cause) {
        super(message, cause);
    }
}
