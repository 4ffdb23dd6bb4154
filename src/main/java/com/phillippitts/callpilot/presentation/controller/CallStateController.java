package com.phillippitts.callpilot.presentation.controller;

import com.phillippitts.callpilot.presentation.dto.CallStateRequest;
import com.phillippitts.callpilot.service.dispatch.event.CallStateChangedEvent;
import jakarta.validation.Valid;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;

/**
 * Receives call-state callbacks and hands them to the dispatcher as events.
 */
@RestController
class CallStateController {

    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    CallStateController(ApplicationEventPublisher publisher, Clock clock) {
        this.publisher = publisher;
        this.clock = clock;
    }

    @PostMapping("/api/calls/state")
    @ResponseStatus(HttpStatus.ACCEPTED)
    void callState(@Valid @RequestBody CallStateRequest request) {
        publisher.publishEvent(
                new CallStateChangedEvent(request.sessionRef(), request.state(), request.reason(), clock.instant()));
    }
}
