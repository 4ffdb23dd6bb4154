package com.phillippitts.callpilot.domain;

/**
 * Raw booking confirmation as delivered by the confirmation source.
 *
 * <p>Fields are kept as received; validation belongs to the consolidator so that a malformed
 * event can be rejected with a precise reason.
 *
 * @param sessionRef     engine session id or collaborator conversation id; may be null when the
 *                       source cannot correlate the confirmation with a call
 * @param providerName   provider the booking was made with
 * @param date           booking date, {@code yyyy-MM-dd}
 * @param time           booking time, {@code HH:mm} (seconds optional)
 * @param title          optional event title
 * @param requesterPhone optional phone of the person the booking is for
 */
public record ConfirmationEvent(
        String sessionRef,
        String providerName,
        String date,
        String time,
        String title,
        String requesterPhone
) {

    public boolean isCorrelated() {
        return sessionRef != null && !sessionRef.isBlank();
    }
}
