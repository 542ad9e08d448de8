package com.novoiceCluster.Realtime.controller;

import com.novoiceCluster.Realtime.model.AuthenticatedUser;
import com.novoiceCluster.Realtime.model.IceConfiguration;
import com.novoiceCluster.Realtime.services.IceServerService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/voice")
@RequiredArgsConstructor
public class IceServerController {

    private final IceServerService iceServerService;

    /**
     * ICE servers (STUN, and TURN with credentials when configured) for the caller.
     */
    @GetMapping("/ice")
    public ResponseEntity<IceConfiguration> iceServers(@AuthenticationPrincipal AuthenticatedUser user) {
        return ResponseEntity.ok(iceServerService.configurationFor(user));
    }
}
