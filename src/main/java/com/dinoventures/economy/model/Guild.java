package com.dinoventures.economy.model;

import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;

@Data
@Builder
public class Guild {
    private Long id;
    private String externalId;
    private OffsetDateTime createdAt;
}
