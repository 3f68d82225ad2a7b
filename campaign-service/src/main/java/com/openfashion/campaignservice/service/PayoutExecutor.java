package com.openfashion.campaignservice.service;

import com.openfashion.campaignservice.client.custody.TransferResult;
import com.openfashion.campaignservice.client.custody.ValueTransferGateway;
import com.openfashion.campaignservice.core.exceptions.TransferFailedException;
import com.openfashion.campaignservice.model.Campaign;
import com.openfashion.campaignservice.model.FundingAsset;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Runs the value movements of an operation. Every call must happen after the ledger
 * has been updated and flushed; a failed transfer throws, which rolls the enclosing
 * transaction back.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PayoutExecutor {

    private final ValueTransferGateway transferGateway;
    private final FeeCalculator feeCalculator;
    private final PlatformService platformService;

    public void pay(Campaign campaign, UUID recipient, BigDecimal amount, String reference) {
        TransferResult result = transferGateway.transfer(campaign.getFundingAsset(), recipient, amount, reference);
        if (!result.success()) {
            log.error("Transfer {} of {} to {} failed: {}", reference, amount, recipient, result.reason());
            throw new TransferFailedException(reference, result.reason());
        }
    }

    /**
     * Pulls tokens from {@code from} into custody. Inside a transaction, a rollback after
     * a successful pull sends the tokens back under {@code reference + ":return"}.
     */
    public void collect(Campaign campaign, UUID from, BigDecimal amount, String reference) {
        FundingAsset asset = campaign.getFundingAsset();
        TransferResult result = transferGateway.pull(asset, from, amount, reference);
        if (!result.success()) {
            log.error("Pull {} of {} from {} failed: {}", reference, amount, from, result.reason());
            throw new TransferFailedException(reference, result.reason());
        }
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCompletion(int status) {
                    if (status == STATUS_ROLLED_BACK) {
                        returnPulledTokens(asset, from, amount, reference);
                    }
                }
            });
        }
    }

    void returnPulledTokens(FundingAsset asset, UUID to, BigDecimal amount, String reference) {
        String returnReference = reference + ":return";
        try {
            TransferResult result = transferGateway.transfer(asset, to, amount, returnReference);
            if (result.success()) {
                log.info("Returned {} {} to {} after rollback of {}", amount, asset, to, reference);
            } else {
                log.error("CRITICAL: Failed to return {} {} to {} for {}: {}", amount, asset, to, reference, result.reason());
            }
        } catch (RuntimeException e) {
            log.error("CRITICAL: Failed to return {} {} to {} for {}", amount, asset, to, reference, e);
        }
    }

    /**
     * Pays {@code gross} to the campaign creator minus the platform fee, which goes to
     * the fee recipient. Zero legs are skipped.
     */
    public FeeSplit payCreatorWithFee(Campaign campaign, BigDecimal gross, String reference) {
        FeeSplit split = feeCalculator.split(gross, platformService.currentFeeBasisPoints());

        if (split.net().signum() > 0) {
            pay(campaign, campaign.getCreatorId(), split.net(), reference + ":net");
        }
        if (split.fee().signum() > 0) {
            pay(campaign, platformService.feeRecipient(), split.fee(), reference + ":fee");
        }
        return split;
    }

    /**
     * Custody reference of a movement. The same campaign and kind always yield the same
     * reference, so a retried operation cannot move value twice.
     */
    public static String reference(Long campaignId, String kind) {
        return "campaign-" + campaignId + ":" + kind;
    }
}
