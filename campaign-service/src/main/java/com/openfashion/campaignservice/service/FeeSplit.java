package com.openfashion.campaignservice.service;

import java.math.BigDecimal;

public record FeeSplit(
        BigDecimal fee,
        BigDecimal net
) {
    public BigDecimal gross() {
        return fee.add(net);
    }
}
