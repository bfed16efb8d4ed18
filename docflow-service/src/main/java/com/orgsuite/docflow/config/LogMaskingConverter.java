package com.orgsuite.docflow.config;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

import java.util.regex.Pattern;

/**
 * Logback converter that masks secrets in log messages.
 * <ul>
 * <li>Bearer tokens: first 8 chars + "..."</li>
 * <li>Invitation tokens ({@code token=...}, {@code "token":"..."}): "[REDACTED]"</li>
 * <li>Session cookie values: "[REDACTED]"</li>
 * <li>E-mail addresses: first character + "***@" + domain</li>
 * </ul>
 * <p>
 * Registered in logback-spring.xml as {@code %mask}.
 * </p>
 */
public class LogMaskingConverter extends CompositeConverter<ILoggingEvent> {

    private static final Pattern BEARER_PATTERN = Pattern
            .compile("(Bearer\\s+)([A-Za-z0-9_\\-./+=]{8})[A-Za-z0-9_\\-./+=]+");

    // token=<value>, "token":"<value>", inviteToken=<value>
    private static final Pattern TOKEN_PATTERN = Pattern
            .compile("(?i)([a-z_]*token[\"']?\\s*[=:]\\s*[\"']?)[A-Za-z0-9_\\-.]+");

    private static final Pattern SESSION_COOKIE_PATTERN = Pattern
            .compile("(DOCFLOW_SESSION=)[^;\\s,\"]+");

    private static final Pattern EMAIL_PATTERN = Pattern
            .compile("\\b([A-Za-z0-9])[A-Za-z0-9._%+\\-]*@([A-Za-z0-9.\\-]+\\.[A-Za-z]{2,})\\b");

    @Override
    protected String transform(ILoggingEvent event, String formattedMessage) {
        if (formattedMessage == null || formattedMessage.isEmpty()) {
            return formattedMessage;
        }

        String masked = formattedMessage;
        masked = BEARER_PATTERN.matcher(masked).replaceAll("$1$2...");
        masked = TOKEN_PATTERN.matcher(masked).replaceAll("$1[REDACTED]");
        masked = SESSION_COOKIE_PATTERN.matcher(masked).replaceAll("$1[REDACTED]");
        masked = EMAIL_PATTERN.matcher(masked).replaceAll("$1***@$2");

        return masked;
    }
}
