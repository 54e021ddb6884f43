package com.demanddna.controller;

import com.demanddna.dto.CampaignDefaultRequest;
import com.demanddna.dto.CampaignDefaultResponse;
import com.demanddna.dto.CampaignPreviewRequest;
import com.demanddna.dto.CampaignPreviewResponse;
import com.demanddna.engine.ShockShape;
import com.demanddna.service.CampaignSettingsService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class CampaignController {

    private final CampaignSettingsService campaignService;

    @PostMapping("/campaigns/preview")
    public ResponseEntity<CampaignPreviewResponse> preview(@Valid @RequestBody CampaignPreviewRequest request) {
        return ResponseEntity.ok(campaignService.preview(request));
    }

    @GetMapping("/settings/campaign-defaults")
    public ResponseEntity<List<CampaignDefaultResponse>> list() {
        return ResponseEntity.ok(campaignService.list());
    }

    @GetMapping("/settings/campaign-defaults/effective")
    public ResponseEntity<CampaignDefaultResponse> effective(
            @RequestParam(required = false) String entity, @RequestParam ShockShape shape) {
        return ResponseEntity.ok(campaignService.effective(entity, shape));
    }

    @PutMapping("/settings/campaign-defaults")
    public ResponseEntity<CampaignDefaultResponse> upsert(@Valid @RequestBody CampaignDefaultRequest request) {
        log.info("PUT /settings/campaign-defaults | entity={} | shape={} | liftPercent={}",
                 request.getEntity(), request.getShape(), request.getLiftPercent());
        return ResponseEntity.ok(campaignService.upsert(request));
    }

    @PostMapping("/settings/campaign-defaults/apply-global")
    public ResponseEntity<List<CampaignDefaultResponse>> applyGlobal() {
        return ResponseEntity.ok(campaignService.applyGlobal());
    }
}
