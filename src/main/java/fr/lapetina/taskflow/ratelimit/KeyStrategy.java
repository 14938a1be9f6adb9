package fr.lapetina.taskflow.ratelimit;

import java.util.Locale;

/**
 * How the fixed-window limiter derives the client key for a category.
 */
public enum KeyStrategy {
    /** {@code ip} or {@code ip:userId} when authenticated. */
    CLIENT(null),
    /** {@code login:email}, falling back to {@code login:ip}. */
    LOGIN("login"),
    /** {@code reset:email}, falling back to {@code reset:ip}. */
    PASSWORD_RESET("reset"),
    /** {@code verify:email}, falling back to {@code verify:ip}. */
    EMAIL_VERIFICATION("verify");

    private final String prefix;

    KeyStrategy(String prefix) {
        this.prefix = prefix;
    }

    /**
     * Parses the configuration spelling: {@code client}, {@code login},
     * {@code password-reset} or {@code email-verification}.
     */
    public static KeyStrategy fromConfigName(String name) {
        if (name == null || name.isBlank()) {
            return CLIENT;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown key strategy: " + name, e);
        }
    }

    public String deriveKey(String ip, String userId, String email) {
        return prefix == null
                ? ClientKeys.clientKey(ip, userId)
                : ClientKeys.scopedKey(prefix, email, ip);
    }
}
