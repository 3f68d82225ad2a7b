package com.openfashion.campaignservice.controller;

import com.openfashion.campaignservice.dto.*;
import com.openfashion.campaignservice.service.CampaignLifecycleService;
import com.openfashion.campaignservice.service.CampaignQueryService;
import com.openfashion.campaignservice.service.CampaignRegistryService;
import com.openfashion.campaignservice.service.ContributionService;
import com.openfashion.campaignservice.service.RefundService;
import com.openfashion.campaignservice.service.WithdrawalService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/campaigns")
@RequiredArgsConstructor
public class CampaignController {

    private static final String USER_HEADER = "X-User-ID";

    private final CampaignRegistryService registryService;
    private final ContributionService contributionService;
    private final CampaignLifecycleService lifecycleService;
    private final RefundService refundService;
    private final WithdrawalService withdrawalService;
    private final CampaignQueryService queryService;

    @PostMapping
    public ResponseEntity<CampaignSummary> createCampaign(
            @RequestHeader(USER_HEADER) UUID creator,
            @RequestBody @Valid CreateCampaignRequest request
    ) {
        Long id = registryService.createCampaign(creator, request);
        return new ResponseEntity<>(queryService.getCampaign(id), HttpStatus.CREATED);
    }

    @GetMapping("/{id}")
    public ResponseEntity<CampaignSummary> getCampaign(@PathVariable Long id) {
        return ResponseEntity.ok(queryService.getCampaign(id));
    }

    @GetMapping("/count")
    public ResponseEntity<Map<String, Long>> getCampaignCount() {
        return ResponseEntity.ok(Map.of("count", queryService.getCampaignCount()));
    }

    @GetMapping("/active")
    public ResponseEntity<List<CampaignSummary>> getActiveCampaigns() {
        return ResponseEntity.ok(queryService.getActiveCampaigns());
    }

    @GetMapping("/successful")
    public ResponseEntity<List<CampaignSummary>> getSuccessfulCampaigns() {
        return ResponseEntity.ok(queryService.getSuccessfulCampaigns());
    }

    @GetMapping("/verified")
    public ResponseEntity<List<CampaignSummary>> getVerifiedCampaigns() {
        return ResponseEntity.ok(queryService.getVerifiedCampaigns());
    }

    @GetMapping("/promoted")
    public ResponseEntity<List<CampaignSummary>> getPromotedCampaigns() {
        return ResponseEntity.ok(queryService.getPromotedCampaigns());
    }

    @GetMapping("/owned/{account}")
    public ResponseEntity<List<Long>> getCampaignsOwnedBy(@PathVariable UUID account) {
        return ResponseEntity.ok(queryService.getCampaignsOwnedBy(account));
    }

    @GetMapping("/{id}/contributors")
    public ResponseEntity<List<ContributionView>> getContributors(@PathVariable Long id) {
        return ResponseEntity.ok(queryService.getContributors(id));
    }

    @GetMapping("/{id}/contributions/{account}")
    public ResponseEntity<Map<String, BigDecimal>> getContribution(@PathVariable Long id, @PathVariable UUID account) {
        return ResponseEntity.ok(Map.of("amount", queryService.getContribution(id, account)));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<CampaignSummary> updateDetails(
            @PathVariable Long id,
            @RequestHeader(USER_HEADER) UUID caller,
            @RequestBody @Valid CampaignDetailsUpdateRequest request
    ) {
        return ResponseEntity.ok(registryService.updateCampaignDetails(id, caller, request));
    }

    @PostMapping("/{id}/ownership")
    public ResponseEntity<CampaignSummary> transferOwnership(
            @PathVariable Long id,
            @RequestHeader(USER_HEADER) UUID caller,
            @RequestBody @Valid OwnershipTransferRequest request
    ) {
        return ResponseEntity.ok(registryService.transferOwnership(id, caller, request.newCreator()));
    }

    @PutMapping("/{id}/funding-asset")
    public ResponseEntity<CampaignSummary> changeFundingAsset(
            @PathVariable Long id,
            @RequestHeader(USER_HEADER) UUID caller,
            @RequestBody FundingAssetRequest request
    ) {
        return ResponseEntity.ok(registryService.changeFundingAsset(id, caller, request.tokenId()));
    }

    @PutMapping("/{id}/verified")
    public ResponseEntity<CampaignSummary> setVerified(
            @PathVariable Long id,
            @RequestHeader(USER_HEADER) UUID caller,
            @RequestBody FlagRequest request
    ) {
        return ResponseEntity.ok(registryService.setVerified(id, caller, request.value()));
    }

    @PutMapping("/{id}/promoted")
    public ResponseEntity<CampaignSummary> setPromoted(
            @PathVariable Long id,
            @RequestHeader(USER_HEADER) UUID caller,
            @RequestBody FlagRequest request
    ) {
        return ResponseEntity.ok(registryService.setPromoted(id, caller, request.value()));
    }

    @PostMapping("/{id}/contributions")
    public ResponseEntity<ContributionReceipt> contribute(
            @PathVariable Long id,
            @RequestHeader(USER_HEADER) UUID contributor,
            @RequestBody @Valid ContributionRequest request
    ) {
        return new ResponseEntity<>(contributionService.contribute(id, contributor, request.amount()), HttpStatus.CREATED);
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<RefundSweepResult> cancelCampaign(
            @PathVariable Long id,
            @RequestHeader(USER_HEADER) UUID caller
    ) {
        return ResponseEntity.ok(lifecycleService.cancelCampaign(id, caller));
    }

    @PostMapping("/{id}/refund-sweep")
    public ResponseEntity<RefundSweepResult> continueRefundSweep(@PathVariable Long id) {
        return ResponseEntity.ok(lifecycleService.continueRefundSweep(id));
    }

    @PutMapping("/{id}/goal")
    public ResponseEntity<CampaignSummary> modifyGoal(
            @PathVariable Long id,
            @RequestHeader(USER_HEADER) UUID caller,
            @RequestBody @Valid GoalUpdateRequest request
    ) {
        return ResponseEntity.ok(lifecycleService.modifyGoal(id, caller, request.newGoal()));
    }

    @PostMapping("/{id}/deadline-extensions")
    public ResponseEntity<CampaignSummary> extendDeadline(
            @PathVariable Long id,
            @RequestHeader(USER_HEADER) UUID caller,
            @RequestBody @Valid DeadlineExtensionRequest request
    ) {
        return ResponseEntity.ok(lifecycleService.extendDeadline(id, caller, request.additionalDays()));
    }

    @PostMapping("/{id}/refunds/enable")
    public ResponseEntity<CampaignSummary> enableRefunds(
            @PathVariable Long id,
            @RequestHeader(USER_HEADER) UUID caller
    ) {
        return ResponseEntity.ok(refundService.enableRefunds(id, caller));
    }

    @PostMapping("/{id}/refunds")
    public ResponseEntity<Map<String, BigDecimal>> requestRefund(
            @PathVariable Long id,
            @RequestHeader(USER_HEADER) UUID contributor
    ) {
        return ResponseEntity.ok(Map.of("refunded", refundService.requestRefund(id, contributor)));
    }

    @PostMapping("/{id}/surplus-withdrawals")
    public ResponseEntity<PayoutResult> withdrawSurplus(
            @PathVariable Long id,
            @RequestHeader(USER_HEADER) UUID caller
    ) {
        return ResponseEntity.ok(withdrawalService.withdrawSurplus(id, caller));
    }

    @PutMapping("/{id}/withdrawal-settings")
    public ResponseEntity<CampaignSummary> configureWithdrawals(
            @PathVariable Long id,
            @RequestHeader(USER_HEADER) UUID caller,
            @RequestBody @Valid WithdrawalSettingsRequest request
    ) {
        return ResponseEntity.ok(withdrawalService.configureWithdrawals(id, caller, request));
    }

    @PostMapping("/{id}/withdrawals")
    public ResponseEntity<PayoutResult> withdrawPartialFunds(
            @PathVariable Long id,
            @RequestHeader(USER_HEADER) UUID caller,
            @RequestBody @Valid WithdrawalRequest request
    ) {
        return ResponseEntity.ok(withdrawalService.withdrawPartialFunds(id, caller, request.amount()));
    }

    @PostMapping("/{id}/milestones")
    public ResponseEntity<CampaignSummary> addMilestone(
            @PathVariable Long id,
            @RequestHeader(USER_HEADER) UUID caller,
            @RequestBody @Valid MilestoneRequest request
    ) {
        return new ResponseEntity<>(
                withdrawalService.addMilestone(id, caller, request.amount(), request.description()),
                HttpStatus.CREATED);
    }

    @PostMapping("/{id}/milestones/{index}/complete")
    public ResponseEntity<PayoutResult> completeMilestone(
            @PathVariable Long id,
            @PathVariable int index,
            @RequestHeader(USER_HEADER) UUID caller
    ) {
        return ResponseEntity.ok(withdrawalService.completeMilestone(id, caller, index));
    }
}
