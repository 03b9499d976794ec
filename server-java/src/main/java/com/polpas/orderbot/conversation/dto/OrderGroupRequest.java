package com.polpas.orderbot.conversation.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class OrderGroupRequest {
    @NotBlank
    private String sessionId;

    @NotBlank
    private String orderGroup;
}
