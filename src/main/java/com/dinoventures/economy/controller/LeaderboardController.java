package com.dinoventures.economy.controller;

import com.dinoventures.economy.model.Leaderboard;
import com.dinoventures.economy.service.LeaderboardService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class LeaderboardController {

    private final LeaderboardService leaderboardService;

    /**
     * GET /api/v1/groups/{groupId}/leaderboard?currency_id=3&amp;limit=10
     *
     * Without currency_id the group's primary currency is the ranking unit.
     */
    @GetMapping("/api/v1/groups/{groupId}/leaderboard")
    public ResponseEntity<Leaderboard> leaderboard(
            @PathVariable long groupId,
            @RequestParam(value = "currency_id", required = false) Long currencyId,
            @RequestParam(value = "limit", required = false) Integer limit) {
        return ResponseEntity.ok(leaderboardService.top(groupId, currencyId, limit));
    }
}
