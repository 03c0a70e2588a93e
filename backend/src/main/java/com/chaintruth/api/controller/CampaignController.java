package com.chaintruth.api.controller;

import com.chaintruth.api.dto.CampaignTotalsResponse;
import com.chaintruth.ledger.CampaignTotalsService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * GET /campaigns/{id}/totals.
 */
@RestController
@RequestMapping("/api/v1/campaigns")
@RequiredArgsConstructor
public class CampaignController {

    private final CampaignTotalsService totalsService;

    @GetMapping("/{campaignId}/totals")
    public ResponseEntity<CampaignTotalsResponse> totals(@PathVariable String campaignId) {
        return totalsService.totals(campaignId)
                .map(view -> ResponseEntity.ok(CampaignTotalsResponse.from(view)))
                .orElse(ResponseEntity.notFound().build());
    }
}
