package com.calmtable.restaurant.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fallback when outbound mail is disabled: records what would have been sent.
 */
public class LoggingEmailSender implements EmailSender {

    private static final Logger logger = LoggerFactory.getLogger(LoggingEmailSender.class);

    @Override
    public void sendHtml(String to, String subject, String htmlBody) {
        logger.info("[LoggingEmailSender] Mail disabled, would send '{}' to {} ({} chars)",
                subject, to, htmlBody == null ? 0 : htmlBody.length());
    }
}
