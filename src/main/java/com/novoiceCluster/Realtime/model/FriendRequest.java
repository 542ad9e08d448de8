package com.novoiceCluster.Realtime.model;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class FriendRequest {

    @NotBlank(message = "Target user is required")
    private String targetUserId;
}
