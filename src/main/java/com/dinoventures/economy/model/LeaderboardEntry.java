package com.dinoventures.economy.model;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class LeaderboardEntry {
    int rank;
    long accountId;
    String externalId;
    BigDecimal convertedBalance;
}
