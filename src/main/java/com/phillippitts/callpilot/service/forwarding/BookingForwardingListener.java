package com.phillippitts.callpilot.service.forwarding;

import com.phillippitts.callpilot.service.consolidation.event.BookingAcceptedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Starts forwarding for every accepted booking. Returns as soon as the sink attempts are
 * submitted, so the confirmation request is acknowledged without waiting for any sink.
 */
@Component
public class BookingForwardingListener {

    private static final Logger LOG = LogManager.getLogger(BookingForwardingListener.class);

    private final ForwardingFanout fanout;

    public BookingForwardingListener(ForwardingFanout fanout) {
        this.fanout = Objects.requireNonNull(fanout);
    }

    @EventListener
    public void onBookingAccepted(BookingAcceptedEvent event) {
        LOG.debug("Forwarding booking {}", event.booking().getId());
        fanout.forward(event.booking());
    }
}
