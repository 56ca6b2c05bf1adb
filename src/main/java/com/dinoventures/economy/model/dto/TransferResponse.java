package com.dinoventures.economy.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class TransferResponse {
    private Long fromAccountId;
    private Long toAccountId;
    private Long currencyId;
    private Long amount;
    private Long fromBalance;
    private Long toBalance;
}
