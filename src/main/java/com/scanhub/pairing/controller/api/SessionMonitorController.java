package com.scanhub.pairing.controller.api;

import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.scanhub.pairing.model.dto.IdentitySnapshotDTO;
import com.scanhub.pairing.session.IdentityContext;
import com.scanhub.pairing.session.SessionRegistry;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Read-only view of the connected identities.
 */
@RestController
@RequestMapping("/api/v1/sessions")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Sessions", description = "Connected scanners and dashboards per identity")
public class SessionMonitorController {

    private final SessionRegistry sessionRegistry;

    @GetMapping
    @Operation(summary = "List connected identities")
    public ResponseEntity<List<IdentitySnapshotDTO>> getSessions() {
        log.debug("API: Listing sessions");
        return ResponseEntity.ok(sessionRegistry.snapshots());
    }

    @GetMapping("/{login}")
    @Operation(summary = "Get one connected identity")
    public ResponseEntity<IdentitySnapshotDTO> getSession(@PathVariable String login) {
        return sessionRegistry.snapshot(login)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/platforms/{platform}")
    @Operation(summary = "List identities bound to a platform")
    public ResponseEntity<List<IdentitySnapshotDTO>> getSessionsOnPlatform(@PathVariable int platform) {
        List<IdentitySnapshotDTO> snapshots = sessionRegistry.contextsBoundTo(platform).stream()
                .map(IdentityContext::toSnapshot)
                .toList();
        return ResponseEntity.ok(snapshots);
    }
}
