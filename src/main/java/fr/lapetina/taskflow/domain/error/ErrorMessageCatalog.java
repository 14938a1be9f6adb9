package fr.lapetina.taskflow.domain.error;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static fr.lapetina.taskflow.domain.error.Severity.HIGH;
import static fr.lapetina.taskflow.domain.error.Severity.LOW;
import static fr.lapetina.taskflow.domain.error.Severity.MEDIUM;

/**
 * Curated user-facing messages, keyed by error code with an HTTP status fallback.
 *
 * Lookups are pure: the same code always yields the same (shared) message.
 */
public final class ErrorMessageCatalog {

    private static final Map<ErrorCode, UserMessage> BY_CODE;
    private static final Map<Integer, UserMessage> BY_STATUS;

    static {
        Map<ErrorCode, UserMessage> m = new EnumMap<>(ErrorCode.class);

        // Authentication
        m.put(ErrorCode.UNAUTHORIZED, UserMessage.of(
                "Authentication Required",
                "Please sign in to access this feature.",
                "Sign in to your account or create a new one.",
                false, MEDIUM));
        m.put(ErrorCode.INVALID_CREDENTIALS, UserMessage.of(
                "Sign In Failed",
                "The email or password you entered is incorrect.",
                "Check your credentials and try again, or reset your password.",
                false, LOW));
        m.put(ErrorCode.TOKEN_EXPIRED, UserMessage.of(
                "Session Expired",
                "Your session has expired for security reasons.",
                "Please sign in again to continue.",
                false, LOW));
        m.put(ErrorCode.INVALID_TOKEN, UserMessage.of(
                "Invalid Session",
                "Your session is invalid or corrupted.",
                "Please sign out and sign in again.",
                false, MEDIUM));
        m.put(ErrorCode.TOKEN_NOT_ACTIVE, UserMessage.of(
                "Session Not Yet Active",
                "Your session is not valid yet.",
                "Check your device clock and sign in again.",
                false, MEDIUM));
        m.put(ErrorCode.INSUFFICIENT_PERMISSIONS, UserMessage.of(
                "Access Denied",
                "You don't have permission to perform this action.",
                "Contact your administrator if you believe this is an error.",
                false, MEDIUM));

        // Tasks
        m.put(ErrorCode.TASK_NOT_FOUND, UserMessage.of(
                "Task Not Found",
                "The task you're looking for doesn't exist or has been deleted.",
                "Check your task list or search for the task.",
                false, LOW));
        m.put(ErrorCode.TASK_UPDATE_FAILED, UserMessage.of(
                "Update Failed",
                "We couldn't save your changes to the task.",
                "Please try again. If the problem persists, check your internet connection.",
                true, MEDIUM));
        m.put(ErrorCode.TASK_DELETE_FAILED, UserMessage.of(
                "Delete Failed",
                "We couldn't delete the task at this time.",
                "Please try again in a moment.",
                true, MEDIUM));
        m.put(ErrorCode.TASK_CREATION_FAILED, UserMessage.of(
                "Creation Failed",
                "We couldn't create your task right now.",
                "Please try again. Make sure all required fields are filled.",
                true, MEDIUM));

        // Users and other resources
        m.put(ErrorCode.USER_NOT_FOUND, UserMessage.of(
                "User Not Found",
                "The user account you're looking for doesn't exist.",
                "Check the user information or contact support.",
                false, LOW));
        m.put(ErrorCode.CATEGORY_NOT_FOUND, UserMessage.of(
                "Category Not Found",
                "The category you're looking for doesn't exist.",
                "Pick an existing category or create a new one.",
                false, LOW));
        m.put(ErrorCode.TEAM_NOT_FOUND, UserMessage.of(
                "Team Not Found",
                "The team you're looking for doesn't exist.",
                "Check the team list or ask a team owner for an invitation.",
                false, LOW));
        m.put(ErrorCode.NOTIFICATION_NOT_FOUND, UserMessage.of(
                "Notification Not Found",
                "The notification you're looking for doesn't exist.",
                "Refresh your notifications.",
                false, LOW));
        m.put(ErrorCode.EMAIL_ALREADY_EXISTS, UserMessage.of(
                "Email Already Registered",
                "An account with this email address already exists.",
                "Try signing in instead, or use a different email address.",
                false, LOW));
        m.put(ErrorCode.WEAK_PASSWORD, UserMessage.of(
                "Password Too Weak",
                "Your password doesn't meet our security requirements.",
                "Use at least 8 characters with uppercase, lowercase, numbers, and symbols.",
                false, LOW));
        m.put(ErrorCode.INVALID_PASSWORD, UserMessage.of(
                "Incorrect Password",
                "The password you entered is incorrect.",
                "Please try again or reset your password if you've forgotten it.",
                false, LOW));

        // Validation
        m.put(ErrorCode.VALIDATION_ERROR, UserMessage.of(
                "Invalid Information",
                "Some of the information you provided is invalid.",
                "Please check the highlighted fields and try again.",
                false, LOW));
        m.put(ErrorCode.MISSING_REQUIRED_FIELDS, UserMessage.of(
                "Missing Information",
                "Please fill in all required fields.",
                "Check for empty required fields and complete them.",
                false, LOW));
        m.put(ErrorCode.INVALID_FIELD, UserMessage.of(
                "Invalid Field",
                "The request refers to a field that doesn't exist.",
                "Remove unknown fields and try again.",
                false, LOW));

        // Database
        m.put(ErrorCode.DATABASE_ERROR, UserMessage.of(
                "Service Temporarily Unavailable",
                "We're experiencing technical difficulties with our database.",
                "Please try again in a few minutes.",
                "If this problem continues, please contact support.",
                true, HIGH));
        m.put(ErrorCode.DUPLICATE_ENTRY, UserMessage.of(
                "Duplicate Information",
                "This information already exists in the system.",
                "Please use different information or update the existing entry.",
                false, LOW));
        m.put(ErrorCode.FOREIGN_KEY_VIOLATION, UserMessage.of(
                "Related Information Missing",
                "The item you're referencing doesn't exist.",
                "Please select a valid option from the list.",
                false, LOW));

        // Network and dependencies
        m.put(ErrorCode.NETWORK_ERROR, UserMessage.of(
                "Connection Problem",
                "We're having trouble connecting to our services.",
                "Please check your internet connection and try again.",
                true, MEDIUM));
        m.put(ErrorCode.EXTERNAL_SERVICE_ERROR, UserMessage.of(
                "External Service Unavailable",
                "A service we depend on is temporarily unavailable.",
                "Please try again later.",
                "We're working to restore full functionality.",
                true, HIGH));
        m.put(ErrorCode.TIMEOUT_ERROR, UserMessage.of(
                "Request Timeout",
                "The operation took too long to complete.",
                "Please try again with a smaller request or contact support.",
                true, MEDIUM));

        // Throttling
        m.put(ErrorCode.RATE_LIMIT_EXCEEDED, UserMessage.of(
                "Too Many Requests",
                "You've made too many requests in a short time.",
                "Please wait a moment before trying again.",
                true, LOW));
        m.put(ErrorCode.TEMPORARILY_BLOCKED, UserMessage.of(
                "Temporarily Blocked",
                "Too many failed attempts. Please try again later.",
                "Wait a few minutes before trying again.",
                true, MEDIUM));

        // Uploads
        m.put(ErrorCode.FILE_TOO_LARGE, UserMessage.of(
                "File Too Large",
                "The file you're trying to upload is too big.",
                "Please select a smaller file (max 10MB).",
                false, LOW));
        m.put(ErrorCode.INVALID_FILE_TYPE, UserMessage.of(
                "Invalid File Type",
                "This file type is not supported.",
                "Please select a supported file format (JPG, PNG, PDF).",
                false, LOW));

        // Generic
        m.put(ErrorCode.INTERNAL_ERROR, UserMessage.of(
                "Something Went Wrong",
                "We encountered an unexpected error.",
                "Please try again. If the problem persists, contact support.",
                "Include what you were doing when this error occurred.",
                true, HIGH));
        m.put(ErrorCode.NOT_FOUND, UserMessage.of(
                "Page Not Found",
                "The page or resource you're looking for doesn't exist.",
                "Check the URL or navigate back to the main page.",
                false, LOW));
        m.put(ErrorCode.METHOD_NOT_ALLOWED, UserMessage.of(
                "Operation Not Allowed",
                "This operation is not supported.",
                "Please use the correct method for this action.",
                false, LOW));

        BY_CODE = Collections.unmodifiableMap(m);

        Map<Integer, UserMessage> s = new HashMap<>();
        s.put(400, UserMessage.of(
                "Invalid Request",
                "The request contains invalid information.",
                "Please check your input and try again.",
                false, LOW));
        s.put(401, UserMessage.of(
                "Authentication Required",
                "You need to sign in to access this resource.",
                "Please sign in to continue.",
                false, MEDIUM));
        s.put(403, UserMessage.of(
                "Access Forbidden",
                "You don't have permission to access this resource.",
                "Contact your administrator for access.",
                false, MEDIUM));
        s.put(404, UserMessage.of(
                "Not Found",
                "The requested resource could not be found.",
                "Check the URL or go back to the previous page.",
                false, LOW));
        s.put(409, UserMessage.of(
                "Conflict",
                "The request conflicts with existing data.",
                "Please update your information and try again.",
                false, LOW));
        s.put(429, UserMessage.of(
                "Too Many Requests",
                "You've exceeded the request limit.",
                "Please wait before making more requests.",
                true, LOW));
        s.put(500, UserMessage.of(
                "Server Error",
                "We're experiencing technical difficulties.",
                "Please try again later.",
                "If this continues, please contact support.",
                true, HIGH));
        s.put(502, UserMessage.of(
                "Service Unavailable",
                "Our service is temporarily unavailable.",
                "Please try again in a few minutes.",
                true, HIGH));
        s.put(503, UserMessage.of(
                "Service Maintenance",
                "Our service is currently under maintenance.",
                "Please try again later.",
                "Check our status page for updates.",
                true, MEDIUM));
        BY_STATUS = Collections.unmodifiableMap(s);
    }

    private ErrorMessageCatalog() {
    }

    /**
     * Returns the curated entry for a code, if the catalog has one.
     */
    public static Optional<UserMessage> findByCode(ErrorCode code) {
        return Optional.ofNullable(BY_CODE.get(code));
    }

    /**
     * Returns the entry for a code name; unknown names get the INTERNAL_ERROR entry.
     */
    public static UserMessage getByCode(String code) {
        return ErrorCode.fromName(code)
                .flatMap(ErrorMessageCatalog::findByCode)
                .orElse(BY_CODE.get(ErrorCode.INTERNAL_ERROR));
    }

    /**
     * Returns the entry for an HTTP status; unknown statuses get the 500 entry.
     */
    public static UserMessage getByStatusCode(int statusCode) {
        UserMessage message = BY_STATUS.get(statusCode);
        return message != null ? message : BY_STATUS.get(500);
    }

    /**
     * Code entry first, status entry otherwise. Never returns null.
     */
    public static UserMessage resolve(ErrorCode code, int statusCode) {
        return findByCode(code).orElseGet(() -> getByStatusCode(statusCode));
    }

    /**
     * Read-only view of all code entries.
     */
    public static Map<ErrorCode, UserMessage> getAllMessages() {
        return BY_CODE;
    }
}
