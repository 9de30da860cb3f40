package com.calmtable.restaurant.notification;

public interface EmailSender {

    void sendHtml(String to, String subject, String htmlBody);
}
