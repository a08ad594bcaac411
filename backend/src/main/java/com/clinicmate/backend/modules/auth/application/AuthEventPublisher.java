package com.clinicmate.backend.modules.auth.application;

import java.time.Clock;
import java.util.Map;
import java.util.UUID;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

@Component
public class AuthEventPublisher {

    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;

    public AuthEventPublisher(ApplicationEventPublisher applicationEventPublisher, Clock clock) {
        this.applicationEventPublisher = applicationEventPublisher;
        this.clock = clock;
    }

    public void publish(String name, UUID userId, UUID sessionId) {
        publish(name, userId, sessionId, Map.of());
    }

    public void publish(String name, UUID userId, UUID sessionId, Map<String, Object> attributes) {
        applicationEventPublisher.publishEvent(new AuthEvent(name, userId, sessionId, clock.instant(), attributes));
    }
}
