package com.openfashion.campaignservice.core.validation;

import com.openfashion.campaignservice.dto.CreateCampaignRequest;
import com.openfashion.campaignservice.dto.WithdrawalSettingsRequest;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

public class CampaignRequestValidator implements ConstraintValidator<ValidCampaignRequest, CreateCampaignRequest> {
    @Override
    public boolean isValid(CreateCampaignRequest request, ConstraintValidatorContext context) {
        if (request == null || request.minContribution() == null || request.maxContribution() == null) {
            return true;
        }

        if (request.maxContribution().compareTo(request.minContribution()) < 0) {
            return buildError(context, "maxContribution", "Maximum contribution must not be below the minimum");
        }

        WithdrawalSettingsRequest withdrawals = request.withdrawals();
        if (withdrawals != null && withdrawals.limitEnabled()
                && (withdrawals.ceiling() == null || withdrawals.ceiling().signum() <= 0)) {
            return buildError(context, "withdrawals.ceiling", "A positive ceiling is required when the withdrawal limit is enabled");
        }

        if (request.tokenId() != null && request.tokenId().isBlank()) {
            return buildError(context, "tokenId", "Token id must not be blank");
        }

        return true;
    }

    private boolean buildError(ConstraintValidatorContext context, String node, String message) {
        context.disableDefaultConstraintViolation();
        context.buildConstraintViolationWithTemplate(message)
                .addPropertyNode(node)
                .addConstraintViolation();
        return false;
    }
}
