package com.ascend.modsync.sync.api;

import com.ascend.modsync.sync.model.ApiResponse;
import com.ascend.modsync.sync.model.FetchTicket;
import com.ascend.modsync.sync.model.ModLookup;
import com.ascend.modsync.sync.model.ModRecord;
import com.ascend.modsync.sync.model.RefreshResponse;
import com.ascend.modsync.sync.service.SyncController;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping("/api/curseforge/mods")
public class ModController {
    private final SyncController syncController;

    public ModController(SyncController syncController) {
        this.syncController = syncController;
    }

    @GetMapping("/{modId}")
    public ResponseEntity<ApiResponse<ModLookup>> getMod(@PathVariable("modId") String modId) {
        ModLookup lookup = syncController.getOrRefresh(modId);
        HttpStatus status = lookup.payload() == null ? HttpStatus.ACCEPTED : HttpStatus.OK;
        return ResponseEntity.status(status).body(ApiResponse.ok(lookup));
    }

    @PostMapping("/{modId}/refresh")
    public ResponseEntity<ApiResponse<RefreshResponse>> refresh(@PathVariable("modId") String modId) {
        FetchTicket ticket = syncController.refresh(modId);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
            .body(ApiResponse.ok(new RefreshResponse(ticket.key(), ticket.outcome())));
    }

    @GetMapping("/{modId}/record")
    public ApiResponse<ModRecord> record(@PathVariable("modId") String modId) {
        ModRecord record = syncController.record(modId);
        if (record == null) {
            throw new ResponseStatusException(NOT_FOUND, "mod not tracked: " + modId);
        }
        return ApiResponse.ok(record);
    }
}
