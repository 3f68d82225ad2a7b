package com.openfashion.campaignservice.dto.event;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.math.BigDecimal;
import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CampaignEventPayload(
        UUID account,
        BigDecimal amount,
        BigDecimal fee,
        String detail
) {
    public static CampaignEventPayload of(UUID account, BigDecimal amount) {
        return new CampaignEventPayload(account, amount, null, null);
    }

    public static CampaignEventPayload detail(UUID account, String detail) {
        return new CampaignEventPayload(account, null, null, detail);
    }
}
