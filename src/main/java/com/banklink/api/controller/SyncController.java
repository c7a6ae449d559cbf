package com.banklink.api.controller;

import com.banklink.sync.SyncOrchestrator;
import com.banklink.sync.SyncReport;
import com.banklink.sync.SyncStatus;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for full syncs.
 */
@RestController
@RequestMapping("/api/v1/sync")
@RequiredArgsConstructor
@Tag(name = "Sync", description = "Full account, transaction and balance sync")
public class SyncController {

    private final SyncOrchestrator syncOrchestrator;

    @PostMapping
    @Operation(summary = "Sync unless one ran recently")
    public ResponseEntity<SyncReport> sync() {
        return ResponseEntity.ok(syncOrchestrator.performSync(false));
    }

    @PostMapping("/force")
    @Operation(summary = "Sync now (pull to refresh)")
    public ResponseEntity<SyncReport> forceSync() {
        return ResponseEntity.ok(syncOrchestrator.performSync(true));
    }

    @GetMapping("/status")
    @Operation(summary = "Get sync status")
    public ResponseEntity<SyncStatus> status() {
        return ResponseEntity.ok(syncOrchestrator.status());
    }
}
