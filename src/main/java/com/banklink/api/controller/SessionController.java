package com.banklink.api.controller;

import com.banklink.api.dto.OpenSessionRequest;
import com.banklink.api.dto.SessionResponse;
import com.banklink.session.SessionContext;
import com.banklink.session.SessionState;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for the signed-in session.
 */
@RestController
@RequestMapping("/api/v1/session")
@RequiredArgsConstructor
@Tag(name = "Session", description = "Sign-in and sign-out")
public class SessionController {

    private final SessionContext session;

    @PostMapping
    @Operation(summary = "Open a session for a user")
    public ResponseEntity<SessionResponse> open(@Valid @RequestBody OpenSessionRequest request) {
        session.open(request.getUserId());
        return ResponseEntity.ok(current());
    }

    @DeleteMapping
    @Operation(summary = "Close the session and purge cached financial data")
    public ResponseEntity<Void> close() {
        session.close();
        return ResponseEntity.noContent().build();
    }

    @GetMapping
    @Operation(summary = "Get session state")
    public ResponseEntity<SessionResponse> get() {
        return ResponseEntity.ok(current());
    }

    private SessionResponse current() {
        SessionState state = session.getState();
        return new SessionResponse(state, state == SessionState.OPEN);
    }
}
