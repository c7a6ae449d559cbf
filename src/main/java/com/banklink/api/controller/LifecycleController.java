package com.banklink.api.controller;

import com.banklink.sync.AppForegroundEvent;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;

/**
 * App lifecycle notifications.
 */
@RestController
@RequestMapping("/api/v1/lifecycle")
@RequiredArgsConstructor
@Tag(name = "Lifecycle", description = "App lifecycle events")
public class LifecycleController {

    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @PostMapping("/foreground")
    @Operation(summary = "Report that the app came to the foreground")
    public ResponseEntity<Void> foreground() {
        eventPublisher.publishEvent(new AppForegroundEvent(clock.instant()));
        return ResponseEntity.accepted().build();
    }
}
