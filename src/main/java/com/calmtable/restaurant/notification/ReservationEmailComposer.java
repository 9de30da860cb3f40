package com.calmtable.restaurant.notification;

import com.calmtable.restaurant.model.Reservation;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import java.time.format.DateTimeFormatter;
import java.util.Locale;

@Component
public class ReservationEmailComposer {

    static final String CONFIRMATION_SUBJECT = "Calm Table Reservation Confirmation";
    static final String STATUS_SUBJECT = "Calm Table Reservation Status Update";

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("MMMM d, yyyy", Locale.ENGLISH);
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

    private final String siteBaseUrl;

    public ReservationEmailComposer(@Value("${calmtable.site-base-url:http://localhost:3000}") String siteBaseUrl) {
        this.siteBaseUrl = siteBaseUrl.endsWith("/") ? siteBaseUrl.substring(0, siteBaseUrl.length() - 1) : siteBaseUrl;
    }

    public String reservationUrl(Reservation reservation) {
        return siteBaseUrl + "/reservation/" + reservation.getConfirmationCode();
    }

    public String confirmationBody(Reservation reservation) {
        return render(reservation,
                "Your Reservation Request Is Received",
                "Thank you for booking with Calm Table. Keep your confirmation code for lookup.");
    }

    public String statusBody(Reservation reservation) {
        String status = reservation.getStatus().name().toLowerCase();
        String title = Character.toUpperCase(status.charAt(0)) + status.substring(1);
        return render(reservation, "Your Reservation Status Was Updated", "Current status: " + title + ".");
    }

    private String render(Reservation reservation, String heading, String statusLine) {
        return "<div style='font-family: Arial, sans-serif; background: #FDFBF7; color: #2B1D16; padding: 24px;'>"
                + "<div style='max-width: 620px; margin: 0 auto; border: 1px solid #D2B48C; border-radius: 12px; background: #fff;'>"
                + "<div style='padding: 16px 20px; background: #5C4033; color: #fff;'>"
                + "<h1 style='margin: 0; font-size: 22px;'>Calm Table</h1></div>"
                + "<div style='padding: 20px;'>"
                + "<h2 style='margin-top: 0; color: #5C4033;'>" + heading + "</h2>"
                + "<p>" + HtmlUtils.htmlEscape(statusLine) + "</p>"
                + "<p><strong>Confirmation Code:</strong> " + reservation.getConfirmationCode() + "</p>"
                + "<p><strong>Date:</strong> " + reservation.getDate().format(DATE_FORMAT) + "</p>"
                + "<p><strong>Time:</strong> " + reservation.getTimeSlot().format(TIME_FORMAT) + "</p>"
                + "<p><strong>Party Size:</strong> " + reservation.getPartySize() + "</p>"
                + "<p><a href='" + reservationUrl(reservation) + "'>View Reservation</a></p>"
                + "</div></div></div>";
    }
}
