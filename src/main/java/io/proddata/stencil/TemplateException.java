package io.proddata.stencil;

import io.proddata.stencil.parsing.LogMessage;

import java.util.List;

public class TemplateException extends Exception {
    private final List<LogMessage> messages;

    public TemplateException(String message) {
        this(message, List.of());
    }

    public TemplateException(String message, Throwable cause) {
        super(message, cause);
        this.messages = List.of();
    }

    public TemplateException(String message, List<LogMessage> messages) {
        super(message);
        this.messages = messages == null ? List.of() : List.copyOf(messages);
    }

    public List<LogMessage> getMessages() {
        return messages;
    }
}
