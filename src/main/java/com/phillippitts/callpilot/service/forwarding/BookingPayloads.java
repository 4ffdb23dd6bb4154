package com.phillippitts.callpilot.service.forwarding;

import com.phillippitts.callpilot.domain.Booking;
import org.json.JSONObject;

/**
 * JSON shape of a booking as sent to the webhook sink.
 *
 * <pre>
 * {"booking_id": "...", "session_id": "...", "provider_name": "...", "date": "2025-02-10",
 *  "time": "14:00", "title": "...", "requester_phone": "...", "received_at": "2025-..."}
 * </pre>
 * Optional fields are omitted when absent.
 */
final class BookingPayloads {

    private BookingPayloads() {
    }

    static JSONObject toJson(Booking booking) {
        JSONObject json = new JSONObject()
                .put("booking_id", booking.getId())
                .put("provider_name", booking.getProviderName())
                .put("date", booking.getDate().toString())
                .put("time", booking.getTime().toString())
                .put("received_at", booking.getReceivedAt().toString());
        if (booking.getSessionId() != null) {
            json.put("session_id", booking.getSessionId());
        }
        if (booking.getTitle() != null) {
            json.put("title", booking.getTitle());
        }
        if (booking.getRequesterPhone() != null) {
            json.put("requester_phone", booking.getRequesterPhone());
        }
        return json;
    }

    /**
     * Title used for the calendar event: the booking's own title, or one naming the provider.
     */
    static String calendarTitle(Booking booking) {
        return booking.getTitle() != null ? booking.getTitle() : "Appointment with " + booking.getProviderName();
    }
}
