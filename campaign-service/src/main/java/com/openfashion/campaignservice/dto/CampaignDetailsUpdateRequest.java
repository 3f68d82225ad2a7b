package com.openfashion.campaignservice.dto;

import jakarta.validation.constraints.Size;

/**
 * Free-text campaign details. A null or empty field leaves the stored value unchanged.
 */
public record CampaignDetailsUpdateRequest(
        @Size(max = 200) String title,
        @Size(max = 4000) String description,
        @Size(max = 500) String mediaReference,
        @Size(max = 50) String category
) {
}
