package com.syntharb.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Diagnostic broadcast of a free-form message to all interested clients.
 */
@Data
public class BroadcastRequest {

    @NotBlank
    private String type;

    private Object data;
}
