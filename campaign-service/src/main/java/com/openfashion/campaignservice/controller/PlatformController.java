package com.openfashion.campaignservice.controller;

import com.openfashion.campaignservice.dto.FeeRateRequest;
import com.openfashion.campaignservice.dto.PlatformSettingsView;
import com.openfashion.campaignservice.service.PlatformService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/platform")
@RequiredArgsConstructor
public class PlatformController {

    private final PlatformService platformService;

    @GetMapping("/settings")
    public ResponseEntity<PlatformSettingsView> getSettings() {
        return ResponseEntity.ok(platformService.getSettings());
    }

    @PostMapping("/pause")
    public ResponseEntity<PlatformSettingsView> pause(@RequestHeader("X-User-ID") UUID caller) {
        return ResponseEntity.ok(platformService.pause(caller));
    }

    @PostMapping("/unpause")
    public ResponseEntity<PlatformSettingsView> unpause(@RequestHeader("X-User-ID") UUID caller) {
        return ResponseEntity.ok(platformService.unpause(caller));
    }

    @PutMapping("/fee-rate")
    public ResponseEntity<PlatformSettingsView> updateFeeRate(
            @RequestHeader("X-User-ID") UUID caller,
            @RequestBody @Valid FeeRateRequest request
    ) {
        return ResponseEntity.ok(platformService.updateFeeRate(caller, request.basisPoints()));
    }
}
