package com.calmtable.restaurant.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.mail.javamail.JavaMailSender;

@Configuration
public class MailConfig {

    private static final Logger logger = LoggerFactory.getLogger(MailConfig.class);

    @Bean
    public EmailSender emailSender(@Value("${calmtable.mail.enabled:false}") boolean enabled,
                                   @Value("${calmtable.mail.from:reservations@calmtable.local}") String from,
                                   ObjectProvider<JavaMailSender> mailSender) {
        JavaMailSender sender = mailSender.getIfAvailable();
        if (!enabled || sender == null) {
            logger.info("[MailConfig] Outbound mail disabled, reservation e-mails are logged only");
            return new LoggingEmailSender();
        }
        return new SmtpEmailSender(sender, from);
    }
}
