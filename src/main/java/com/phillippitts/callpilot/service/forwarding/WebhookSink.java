package com.phillippitts.callpilot.service.forwarding;

import com.phillippitts.callpilot.domain.SinkOutcome;
import org.json.JSONObject;

/**
 * Generic HTTP destination that receives a copy of every accepted booking.
 */
public interface WebhookSink {

    boolean isConfigured();

    /**
     * Delivers one payload. Implementations report failures as {@link SinkOutcome#failed(String)}
     * instead of throwing.
     */
    SinkOutcome deliver(JSONObject payload);
}
