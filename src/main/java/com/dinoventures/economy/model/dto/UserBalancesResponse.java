package com.dinoventures.economy.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class UserBalancesResponse {
    private String userId;
    private Long accountId;
    private List<BalanceResponse> balances;
}
