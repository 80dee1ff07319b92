package com.deepansh.agentplatform.event;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scrubs error text and context before it reaches a user's channel:
 * credentials are redacted and messages are capped in length.
 */
public class EventPayloadSanitizer {

    private static final Pattern SECRET_ASSIGNMENT = Pattern.compile(
            "(?i)\\b(password|passwd|secret|token|api[_-]?key|authorization)\\s*[=:]\\s*([^\\s,;&]+)");
    private static final Pattern BEARER = Pattern.compile("(?i)bearer\\s+[A-Za-z0-9._\\-]+");
    private static final String REDACTED = "[REDACTED]";
    private static final int MAX_CONTEXT_ENTRIES = 20;

    private final int maxMessageLength;

    public EventPayloadSanitizer(int maxMessageLength) {
        this.maxMessageLength = maxMessageLength;
    }

    public String sanitizeMessage(String message) {
        if (message == null) {
            return "";
        }
        String scrubbed = BEARER.matcher(message).replaceAll("Bearer " + REDACTED);
        Matcher matcher = SECRET_ASSIGNMENT.matcher(scrubbed);
        scrubbed = matcher.replaceAll("$1=" + REDACTED);
        return truncate(scrubbed);
    }

    /** Keys that look like credentials are dropped; string values are scrubbed. */
    public Map<String, Object> sanitizeContext(Map<String, ?> context) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (context == null) {
            return result;
        }
        for (Map.Entry<String, ?> entry : context.entrySet()) {
            if (result.size() >= MAX_CONTEXT_ENTRIES) {
                break;
            }
            String key = entry.getKey();
            if (isSensitiveKey(key)) {
                result.put(key, REDACTED);
            } else if (entry.getValue() instanceof String) {
                result.put(key, sanitizeMessage((String) entry.getValue()));
            } else {
                result.put(key, entry.getValue());
            }
        }
        return result;
    }

    private boolean isSensitiveKey(String key) {
        String lower = key.toLowerCase();
        return lower.contains("password") || lower.contains("secret")
                || lower.contains("token") || lower.contains("apikey") || lower.contains("api_key");
    }

    private String truncate(String s) {
        return s.length() <= maxMessageLength ? s : s.substring(0, maxMessageLength) + "...[truncated]";
    }
}
