package com.dinoventures.economy.model;

import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;

@Data
@Builder
public class Currency {
    private Long id;
    private Long groupId;
    private String name;
    private boolean primary;
    private OffsetDateTime createdAt;
}
