package com.openfashion.campaignservice.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The single asset a campaign is funded in: the native currency or one allowed token.
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class FundingAsset {

    @Column(name = "asset_type", nullable = false, length = 10)
    @Enumerated(EnumType.STRING)
    private AssetType type;

    @Column(name = "token_id", length = 100)
    private String tokenId;

    public static FundingAsset nativeCurrency() {
        return new FundingAsset(AssetType.NATIVE, null);
    }

    public static FundingAsset token(String tokenId) {
        return new FundingAsset(AssetType.TOKEN, tokenId);
    }

    public boolean isToken() {
        return type == AssetType.TOKEN;
    }

    @Override
    public String toString() {
        return isToken() ? "TOKEN(" + tokenId + ")" : "NATIVE";
    }
}
