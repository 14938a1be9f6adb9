package fr.lapetina.taskflow.ratelimit;

import java.util.Locale;

/**
 * Client identity keys shared by the fixed-window limiter and the escalator.
 */
public final class ClientKeys {

    public static final String UNKNOWN_IP = "unknown";

    private ClientKeys() {
    }

    /**
     * {@code ip:userId} for authenticated callers, the bare ip otherwise.
     */
    public static String clientKey(String ip, String userId) {
        String address = escalatorKey(ip);
        return userId == null || userId.isBlank() ? address : address + ":" + userId;
    }

    /**
     * Failed-attempt tracking key: the client address alone, whatever identity the caller claims.
     */
    public static String escalatorKey(String ip) {
        return ip == null || ip.isBlank() ? UNKNOWN_IP : ip;
    }

    /**
     * {@code prefix:email} when an email was supplied, {@code prefix:ip} otherwise.
     * Emails are compared case-insensitively.
     */
    public static String scopedKey(String prefix, String email, String ip) {
        if (email != null && !email.isBlank()) {
            return prefix + ":" + email.trim().toLowerCase(Locale.ROOT);
        }
        return prefix + ":" + (ip == null || ip.isBlank() ? UNKNOWN_IP : ip);
    }
}
