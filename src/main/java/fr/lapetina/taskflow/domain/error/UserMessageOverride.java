package fr.lapetina.taskflow.domain.error;

/**
 * Partial user message merged over the catalog defaults when a
 * {@link StructuredError} is built. A null field keeps the default.
 */
public record UserMessageOverride(
        String title,
        String message,
        String action,
        String supportInfo,
        Boolean retryable,
        Severity severity
) {
    private static final UserMessageOverride NONE = new UserMessageOverride(null, null, null, null, null, null);

    public static UserMessageOverride none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the defaults with every non-null field of this override applied.
     */
    public UserMessage applyTo(UserMessage defaults) {
        return new UserMessage(
                title != null ? title : defaults.title(),
                message != null ? message : defaults.message(),
                action != null ? action : defaults.action(),
                supportInfo != null ? supportInfo : defaults.supportInfo(),
                retryable != null ? retryable : defaults.retryable(),
                severity != null ? severity : defaults.severity()
        );
    }

    public static final class Builder {
        private String title;
        private String message;
        private String action;
        private String supportInfo;
        private Boolean retryable;
        private Severity severity;

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder action(String action) {
            this.action = action;
            return this;
        }

        public Builder supportInfo(String supportInfo) {
            this.supportInfo = supportInfo;
            return this;
        }

        public Builder retryable(boolean retryable) {
            this.retryable = retryable;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public UserMessageOverride build() {
            return new UserMessageOverride(title, message, action, supportInfo, retryable, severity);
        }
    }
}
