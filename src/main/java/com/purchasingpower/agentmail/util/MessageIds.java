package com.purchasingpower.agentmail.util;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Message-ID normalization. Every id the engine stores or compares goes through
 * {@link #normalize(String)}: angle brackets stripped, trimmed, lowercased.
 */
public final class MessageIds {

    private static final Pattern BRACKETED = Pattern.compile("<([^<>]+)>");
    private static final Pattern SEPARATORS = Pattern.compile("[\\s,]+");

    private MessageIds() {
    }

    public static String normalize(String messageId) {
        if (messageId == null) {
            return "";
        }
        String value = messageId.trim();
        if (value.startsWith("<")) {
            value = value.substring(1);
        }
        if (value.endsWith(">")) {
            value = value.substring(0, value.length() - 1);
        }
        return value.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Splits a raw In-Reply-To or References header into normalized ids, keeping order,
     * dropping blanks and duplicates, and keeping at most {@code limit} entries.
     */
    public static List<String> parseList(String raw, int limit) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        Set<String> ids = new LinkedHashSet<>();
        Matcher matcher = BRACKETED.matcher(raw);
        boolean bracketed = false;
        while (matcher.find() && ids.size() < limit) {
            bracketed = true;
            addNormalized(ids, matcher.group(1));
        }
        if (!bracketed) {
            for (String token : SEPARATORS.split(raw.trim())) {
                if (ids.size() >= limit) {
                    break;
                }
                addNormalized(ids, token);
            }
        }
        return new ArrayList<>(ids);
    }

    /**
     * Normalizes, dedupes and bounds an already split list.
     */
    public static List<String> normalizeAll(List<String> rawIds, int limit) {
        Set<String> ids = new LinkedHashSet<>();
        for (String raw : rawIds) {
            if (ids.size() >= limit) {
                break;
            }
            ids.addAll(parseList(raw, limit - ids.size()));
        }
        return new ArrayList<>(ids);
    }

    /**
     * New RFC 5322 style id for outbound mail, without angle brackets.
     */
    public static String generate(String domain) {
        String host = domain == null || domain.isBlank() ? "agentmail.local" : domain;
        return UUID.randomUUID() + "@" + host.toLowerCase(Locale.ROOT);
    }

    private static void addNormalized(Set<String> ids, String raw) {
        String normalized = normalize(raw);
        if (!normalized.isEmpty()) {
            ids.add(normalized);
        }
    }
}
