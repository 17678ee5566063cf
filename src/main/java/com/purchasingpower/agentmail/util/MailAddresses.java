package com.purchasingpower.agentmail.util;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Address and subject helpers shared by the inbound adapter, policy engine and flow engine.
 */
public final class MailAddresses {

    private static final Pattern ANGLE_ADDRESS = Pattern.compile("<([^<>\\s]+@[^<>\\s]+)>");
    private static final Pattern BARE_ADDRESS = Pattern.compile("([^\\s<>,;\"']+@[^\\s<>,;\"']+)");
    private static final Pattern SUBJECT_PREFIX = Pattern.compile("^\\s*(re|fwd?|aw|sv)\\s*:\\s*", Pattern.CASE_INSENSITIVE);

    private MailAddresses() {
    }

    /**
     * Extracts the bare address from a header value such as {@code "Alice <alice@x.com>"}.
     * Returns the lowercased address, or {@code null} when none is present.
     */
    public static String extractAddress(String headerValue) {
        if (headerValue == null || headerValue.isBlank()) {
            return null;
        }
        Matcher angle = ANGLE_ADDRESS.matcher(headerValue);
        if (angle.find()) {
            return angle.group(1).trim().toLowerCase(Locale.ROOT);
        }
        Matcher bare = BARE_ADDRESS.matcher(headerValue);
        if (bare.find()) {
            return bare.group(1).trim().toLowerCase(Locale.ROOT);
        }
        return null;
    }

    /**
     * Display name part of a header value, or {@code null} if the header is a bare address.
     */
    public static String displayName(String headerValue) {
        if (headerValue == null) {
            return null;
        }
        int angle = headerValue.indexOf('<');
        if (angle <= 0) {
            return null;
        }
        String name = headerValue.substring(0, angle).replace("\"", "").trim();
        return name.isEmpty() ? null : name;
    }

    public static String localPart(String address) {
        String normalized = extractAddress(address);
        if (normalized == null) {
            return null;
        }
        int at = normalized.lastIndexOf('@');
        return at > 0 ? normalized.substring(0, at) : normalized;
    }

    public static String domain(String address) {
        String normalized = extractAddress(address);
        if (normalized == null) {
            return null;
        }
        int at = normalized.lastIndexOf('@');
        return at >= 0 && at < normalized.length() - 1 ? normalized.substring(at + 1) : null;
    }

    public static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Strips stacked reply and forward prefixes ({@code Re:}, {@code Fw:}, {@code Fwd:}, {@code Aw:},
     * {@code Sv:}) from the start of a subject.
     */
    public static String normalizeSubject(String subject) {
        if (subject == null) {
            return "";
        }
        String base = subject.trim();
        Matcher matcher = SUBJECT_PREFIX.matcher(base);
        while (matcher.lookingAt()) {
            base = base.substring(matcher.end());
            matcher = SUBJECT_PREFIX.matcher(base);
        }
        return base.trim();
    }

    public static String replySubject(String subject) {
        String base = normalizeSubject(subject);
        return "Re: " + (base.isEmpty() ? "(no subject)" : base);
    }
}
