package com.deepansh.focus.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class ChatRequest {

    @NotBlank(message = "Input must not be blank")
    @Size(max = 8000, message = "Input must be at most 8000 characters")
    private String input;

    private String sessionId;
}
