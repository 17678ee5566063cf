package com.purchasingpower.agentmail.service.routing;

import java.security.SecureRandom;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Request tokens correlate a delegation email with the other agent's reply.
 * The token travels in the subject as {@code [REQ-<id>]}; the older {@code [Req: req-<id>]}
 * form is still recognized on inbound mail.
 */
public final class RequestIdToken {

    private static final Pattern TOKEN = Pattern.compile(
            "\\[\\s*REQ\\s*[-:]\\s*([A-Za-z0-9_-]+)\\s*]", Pattern.CASE_INSENSITIVE);
    private static final String ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";
    private static final int LENGTH = 12;
    private static final SecureRandom RANDOM = new SecureRandom();

    private RequestIdToken() {
    }

    public static String generate() {
        StringBuilder id = new StringBuilder(LENGTH);
        for (int i = 0; i < LENGTH; i++) {
            id.append(ALPHABET.charAt(RANDOM.nextInt(ALPHABET.length())));
        }
        return id.toString();
    }

    public static String format(String requestId) {
        return "[REQ-" + requestId + "]";
    }

    /**
     * Subject for a delegation email: the token followed by the original subject.
     */
    public static String tagSubject(String requestId, String subject) {
        String base = subject == null || subject.isBlank() ? "(no subject)" : subject.trim();
        return extract(base) != null ? base : format(requestId) + " " + base;
    }

    /**
     * First request id in the subject, lowercased, or {@code null}.
     */
    public static String extract(String subject) {
        if (subject == null) {
            return null;
        }
        Matcher matcher = TOKEN.matcher(subject);
        return matcher.find() ? matcher.group(1).toLowerCase(Locale.ROOT) : null;
    }
}
