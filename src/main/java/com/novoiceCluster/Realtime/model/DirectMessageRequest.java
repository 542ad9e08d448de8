package com.novoiceCluster.Realtime.model;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DirectMessageRequest {

    @NotBlank(message = "Recipient is required")
    private String recipientId;

    @NotBlank(message = "Message content is required")
    private String content;
}
