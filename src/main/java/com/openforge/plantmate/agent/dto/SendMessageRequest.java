package com.openforge.plantmate.agent.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request body for POST /sessions/{id}/message.
 */
public record SendMessageRequest(

        @NotBlank(message = "content must not be blank")
        @Size(max = 8000, message = "content must not exceed 8000 characters")
        String content
) {}
