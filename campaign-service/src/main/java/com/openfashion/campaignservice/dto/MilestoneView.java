package com.openfashion.campaignservice.dto;

import com.openfashion.campaignservice.model.Milestone;

import java.math.BigDecimal;

public record MilestoneView(
        int index,
        BigDecimal amount,
        String description,
        boolean completed
) {
    public static MilestoneView from(int index, Milestone milestone) {
        return new MilestoneView(index, milestone.getAmount(), milestone.getDescription(), milestone.isCompleted());
    }
}
