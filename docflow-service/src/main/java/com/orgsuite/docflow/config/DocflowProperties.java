package com.orgsuite.docflow.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Binds the {@code docflow.*} YAML properties into a typed bean.
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "docflow")
public class DocflowProperties {

    /** Base URL of the web client; used to build invitation links. */
    private String frontendUrl = "http://localhost:4200";

    private Invitation invitation = new Invitation();
    private Identity identity = new Identity();
    private Notification notification = new Notification();

    @Getter
    @Setter
    public static class Invitation {
        private int ttlDays = 7;
        private int tokenBytes = 32;
        private boolean rotateTokenOnResend = false;
        private long sweepIntervalMs = 300_000;
    }

    @Getter
    @Setter
    public static class Identity {
        private String baseUrl;
        private String sessionCookieName = "DOCFLOW_SESSION";
        /** Resolved sessions are cached in Redis for this long. */
        private int sessionCacheSeconds = 60;
        private String adminRole = "platform_admin";

        public String getSessionUrl() {
            return baseUrl + "/internal/sessions/current";
        }

        public String getUserLookupUrl() {
            return baseUrl + "/internal/users/lookup";
        }
    }

    @Getter
    @Setter
    public static class Notification {
        /** Dispatch endpoint; when blank, notifications are only logged. */
        private String endpoint;
    }
}
