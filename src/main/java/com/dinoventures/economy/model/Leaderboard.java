package com.dinoventures.economy.model;

import lombok.Value;

import java.util.List;

@Value
public class Leaderboard {
    long groupId;
    Currency targetCurrency;
    List<LeaderboardEntry> entries;
}
