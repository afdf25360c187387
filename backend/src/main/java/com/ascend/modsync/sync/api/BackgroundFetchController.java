package com.ascend.modsync.sync.api;

import com.ascend.modsync.sync.model.ApiResponse;
import com.ascend.modsync.sync.model.BackgroundFetchStatus;
import com.ascend.modsync.sync.service.SyncController;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Locale;

@RestController
@RequestMapping("/api/curseforge/background-fetch")
public class BackgroundFetchController {
    static final String INVALID_ACTION = "Invalid action. Use 'start' or 'stop'";

    private final SyncController syncController;

    public BackgroundFetchController(SyncController syncController) {
        this.syncController = syncController;
    }

    @GetMapping
    public ApiResponse<BackgroundFetchStatus> status() {
        return ApiResponse.ok(BackgroundFetchStatus.from(syncController.status()));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<Void>> control(
        @RequestBody(required = false) BackgroundFetchActionRequest request
    ) {
        String action = request == null || request.action() == null
            ? ""
            : request.action().trim().toLowerCase(Locale.ROOT);
        switch (action) {
            case "start":
                syncController.start();
                return ResponseEntity.ok(ApiResponse.message("Background mod fetching service started"));
            case "stop":
                syncController.stop();
                return ResponseEntity.ok(ApiResponse.message("Background mod fetching service stopped"));
            default:
                return ResponseEntity.badRequest().body(ApiResponse.error(INVALID_ACTION));
        }
    }
}
