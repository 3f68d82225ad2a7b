package com.openfashion.campaignservice.client.custody;

import com.openfashion.campaignservice.model.FundingAsset;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Moves value between platform custody and user accounts.
 * <p>
 * Implementations report failure through {@link TransferResult} instead of throwing;
 * callers abort their operation when a result is not successful.
 */
public interface ValueTransferGateway {

    /**
     * Pays {@code amount} of {@code asset} out of custody to {@code recipient}.
     */
    TransferResult transfer(FundingAsset asset, UUID recipient, BigDecimal amount, String reference);

    /**
     * Pulls {@code amount} of a token from {@code from} into custody. Only token assets
     * are pulled; native currency arrives with the contribution itself.
     */
    TransferResult pull(FundingAsset asset, UUID from, BigDecimal amount, String reference);
}
