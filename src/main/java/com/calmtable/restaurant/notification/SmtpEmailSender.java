package com.calmtable.restaurant.notification;

import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;

public class SmtpEmailSender implements EmailSender {

    private static final Logger logger = LoggerFactory.getLogger(SmtpEmailSender.class);

    private final JavaMailSender mailSender;
    private final String senderEmail;

    public SmtpEmailSender(JavaMailSender mailSender, String senderEmail) {
        this.mailSender = mailSender;
        this.senderEmail = senderEmail;
    }

    @Override
    public void sendHtml(String to, String subject, String htmlBody) {
        logger.info("[SmtpEmailSender] Sending '{}' to {}", subject, to);
        try {
            MimeMessage message = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(message, true, "UTF-8");
            helper.setTo(to);
            helper.setSubject(subject);
            helper.setText("Please view this email in HTML format.", htmlBody);
            helper.setFrom(senderEmail);
            mailSender.send(message);
        } catch (MessagingException e) {
            throw new IllegalStateException("Could not build e-mail to " + to, e);
        } catch (MailException e) {
            logger.error("[SmtpEmailSender] Delivery to {} failed: {}", to, e.getMessage());
            throw e;
        }
    }
}
