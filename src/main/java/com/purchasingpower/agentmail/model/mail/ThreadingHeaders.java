package com.purchasingpower.agentmail.model.mail;

import lombok.Value;

import java.util.List;

/**
 * Normalized In-Reply-To and References values of one message.
 */
@Value
public class ThreadingHeaders {

    private static final ThreadingHeaders EMPTY = new ThreadingHeaders(List.of(), List.of());

    List<String> inReplyTo;
    List<String> references;

    public static ThreadingHeaders empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return inReplyTo.isEmpty() && references.isEmpty();
    }
}
