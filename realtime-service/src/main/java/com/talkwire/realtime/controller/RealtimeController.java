package com.talkwire.realtime.controller;

import com.talkwire.common.response.ApiResponse;
import com.talkwire.realtime.dto.response.PresenceResponse;
import com.talkwire.realtime.dto.response.RealtimeStatsResponse;
import com.talkwire.realtime.service.RealtimeStatsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Tag(name = "Realtime", description = "Connection and presence statistics")
@RestController
@RequestMapping("/api/v1/realtime")
@RequiredArgsConstructor
public class RealtimeController {

    private final RealtimeStatsService statsService;

    @Operation(summary = "Connection stats",
            description = "Online users, live connections, active rooms and typing signals on this instance")
    @GetMapping("/stats")
    public ApiResponse<RealtimeStatsResponse> getStats() {
        return ApiResponse.ok(statsService.getStats());
    }

    @Operation(summary = "Online users", description = "Ids of users with at least one live connection on this instance")
    @GetMapping("/online")
    public ApiResponse<List<Long>> getOnlineUsers() {
        return ApiResponse.ok(statsService.getOnlineUsers());
    }

    @Operation(summary = "User presence", description = "Online flag, connection count and last-seen of a user")
    @GetMapping("/presence/{userId}")
    public ApiResponse<PresenceResponse> getPresence(
            @Parameter(description = "User id") @PathVariable Long userId
    ) {
        return ApiResponse.ok(statsService.getPresence(userId));
    }
}
