package com.openfashion.campaignservice.service.imp;

import com.openfashion.campaignservice.core.exceptions.CampaignNotFoundException;
import com.openfashion.campaignservice.core.exceptions.InvalidParametersException;
import com.openfashion.campaignservice.core.util.MoneyUtil;
import com.openfashion.campaignservice.dto.CampaignDetailsUpdateRequest;
import com.openfashion.campaignservice.dto.CampaignSummary;
import com.openfashion.campaignservice.dto.CreateCampaignRequest;
import com.openfashion.campaignservice.dto.WithdrawalSettingsRequest;
import com.openfashion.campaignservice.dto.event.CampaignEventPayload;
import com.openfashion.campaignservice.dto.event.CampaignEventType;
import com.openfashion.campaignservice.model.Campaign;
import com.openfashion.campaignservice.model.CampaignOwnership;
import com.openfashion.campaignservice.model.FundingAsset;
import com.openfashion.campaignservice.model.WithdrawalPolicy;
import com.openfashion.campaignservice.repository.CampaignOwnershipRepository;
import com.openfashion.campaignservice.repository.CampaignRepository;
import com.openfashion.campaignservice.service.AccessGate;
import com.openfashion.campaignservice.service.CampaignEventPublisher;
import com.openfashion.campaignservice.service.CampaignRegistryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.UUID;

import static com.openfashion.campaignservice.service.imp.CampaignChecks.hasText;
import static com.openfashion.campaignservice.service.imp.CampaignChecks.requireCreator;
import static com.openfashion.campaignservice.service.imp.CampaignChecks.requireOpen;

@Service
@Slf4j
@RequiredArgsConstructor
public class CampaignRegistryServiceImp implements CampaignRegistryService {

    private final CampaignRepository campaignRepository;
    private final CampaignOwnershipRepository ownershipRepository;
    private final CampaignEventPublisher eventPublisher;
    private final AccessGate accessGate;
    private final Clock clock;

    @Value("${app.campaign.max-duration-days:365}")
    private int maxDurationDays;

    @Value("${app.platform.allowed-tokens:}")
    private Set<String> allowedTokens;

    @Override
    @Transactional
    public Long createCampaign(UUID creator, CreateCampaignRequest request) {
        accessGate.requireNotPaused();
        validateCreation(creator, request);

        Instant now = clock.instant();
        Campaign campaign = Campaign.builder()
                .creatorId(creator)
                .title(request.title().trim())
                .description(request.description())
                .mediaReference(request.mediaReference())
                .category(request.category())
                .goal(MoneyUtil.format(request.goal()))
                .minContribution(MoneyUtil.format(request.minContribution()))
                .maxContribution(MoneyUtil.format(request.maxContribution()))
                .deadline(now.plus(Duration.ofDays(request.durationDays())))
                .fundingAsset(hasText(request.tokenId())
                        ? FundingAsset.token(request.tokenId())
                        : FundingAsset.nativeCurrency())
                .withdrawalPolicy(toPolicy(request.withdrawals()))
                .build();

        Campaign saved = campaignRepository.save(campaign);
        ownershipRepository.save(CampaignOwnership.builder()
                .accountId(creator)
                .campaignId(saved.getId())
                .build());

        eventPublisher.publish(CampaignEventType.CAMPAIGN_CREATED, saved.getId(),
                CampaignEventPayload.of(creator, saved.getGoal()));

        log.info("Campaign {} created by {} with goal {} {}", saved.getId(), creator, saved.getGoal(), saved.getFundingAsset());
        return saved.getId();
    }

    @Override
    @Transactional(readOnly = true)
    public boolean exists(Long campaignId) {
        return campaignId != null && campaignId > 0 && campaignRepository.existsById(campaignId);
    }

    @Override
    @Transactional
    public Campaign mustExist(Long campaignId) {
        if (campaignId == null || campaignId < 1) {
            throw new CampaignNotFoundException(campaignId);
        }
        return campaignRepository.findByIdForUpdate(campaignId)
                .orElseThrow(() -> new CampaignNotFoundException(campaignId));
    }

    @Override
    @Transactional
    public CampaignSummary updateCampaignDetails(Long campaignId, UUID caller, CampaignDetailsUpdateRequest request) {
        Campaign campaign = mustExist(campaignId);
        requireCreator(campaign, caller);

        if (hasText(request.title())) campaign.setTitle(request.title().trim());
        if (hasText(request.description())) campaign.setDescription(request.description());
        if (hasText(request.mediaReference())) campaign.setMediaReference(request.mediaReference());
        if (hasText(request.category())) campaign.setCategory(request.category());

        campaignRepository.save(campaign);
        eventPublisher.publish(CampaignEventType.CAMPAIGN_UPDATED, campaignId, CampaignEventPayload.detail(caller, null));

        log.info("Campaign {} details updated", campaignId);
        return CampaignSummary.from(campaign);
    }

    @Override
    @Transactional
    public CampaignSummary transferOwnership(Long campaignId, UUID caller, UUID newCreator) {
        Campaign campaign = mustExist(campaignId);
        requireCreator(campaign, caller);

        if (newCreator == null || newCreator.equals(campaign.getCreatorId())) {
            throw new InvalidParametersException("New creator must be a different account");
        }

        campaign.setCreatorId(newCreator);
        campaignRepository.save(campaign);

        CampaignOwnership ownership = ownershipRepository.findByCampaignId(campaignId)
                .orElseGet(() -> CampaignOwnership.builder().campaignId(campaignId).build());
        ownership.setAccountId(newCreator);
        ownershipRepository.save(ownership);

        eventPublisher.publish(CampaignEventType.OWNERSHIP_TRANSFERRED, campaignId,
                CampaignEventPayload.detail(newCreator, "from " + caller));

        log.info("Campaign {} ownership moved from {} to {}", campaignId, caller, newCreator);
        return CampaignSummary.from(campaign);
    }

    @Override
    @Transactional
    public CampaignSummary changeFundingAsset(Long campaignId, UUID caller, String tokenId) {
        Campaign campaign = mustExist(campaignId);
        requireCreator(campaign, caller);
        requireOpen(campaign);

        if (campaign.getBackerCount() > 0) {
            throw new InvalidParametersException("Funding asset cannot change after the first contribution");
        }

        FundingAsset asset;
        if (hasText(tokenId)) {
            requireAllowedToken(tokenId);
            asset = FundingAsset.token(tokenId);
        } else {
            asset = FundingAsset.nativeCurrency();
        }

        campaign.setFundingAsset(asset);
        campaignRepository.save(campaign);
        eventPublisher.publish(CampaignEventType.FUNDING_ASSET_CHANGED, campaignId,
                CampaignEventPayload.detail(caller, asset.toString()));

        log.info("Campaign {} now funded in {}", campaignId, asset);
        return CampaignSummary.from(campaign);
    }

    @Override
    @Transactional
    public CampaignSummary setVerified(Long campaignId, UUID caller, boolean verified) {
        accessGate.requireOwner(caller);
        Campaign campaign = mustExist(campaignId);
        campaign.setVerified(verified);
        campaignRepository.save(campaign);

        log.info("Campaign {} verified flag set to {}", campaignId, verified);
        return CampaignSummary.from(campaign);
    }

    @Override
    @Transactional
    public CampaignSummary setPromoted(Long campaignId, UUID caller, boolean promoted) {
        accessGate.requireOwner(caller);
        Campaign campaign = mustExist(campaignId);
        campaign.setPromoted(promoted);
        campaignRepository.save(campaign);

        log.info("Campaign {} promoted flag set to {}", campaignId, promoted);
        return CampaignSummary.from(campaign);
    }

    private void validateCreation(UUID creator, CreateCampaignRequest request) {
        if (creator == null) {
            throw new InvalidParametersException("Creator is required");
        }
        if (!MoneyUtil.isValidAmount(request.goal())) {
            throw new InvalidParametersException("Goal must be a positive amount with at most 4 decimals");
        }
        if (!MoneyUtil.isValidAmount(request.minContribution()) || !MoneyUtil.isValidAmount(request.maxContribution())) {
            throw new InvalidParametersException("Contribution bounds must be positive amounts with at most 4 decimals");
        }
        if (request.maxContribution().compareTo(request.minContribution()) < 0) {
            throw new InvalidParametersException("Maximum contribution must not be below the minimum");
        }
        if (request.durationDays() <= 0 || request.durationDays() > maxDurationDays) {
            throw new InvalidParametersException("Duration must be between 1 and " + maxDurationDays + " days");
        }
        if (!hasText(request.title())) {
            throw new InvalidParametersException("Title is required");
        }
        if (hasText(request.tokenId())) {
            requireAllowedToken(request.tokenId());
        }
        WithdrawalSettingsRequest withdrawals = request.withdrawals();
        if (withdrawals != null && withdrawals.limitEnabled() && !MoneyUtil.isPositive(withdrawals.ceiling())) {
            throw new InvalidParametersException("A withdrawal limit needs a positive ceiling");
        }
    }

    private void requireAllowedToken(String tokenId) {
        if (!allowedTokens.contains(tokenId)) {
            log.warn("Rejected token {}, not on the allowed list", tokenId);
            throw new InvalidParametersException("Token " + tokenId + " is not allowed");
        }
    }

    static WithdrawalPolicy toPolicy(WithdrawalSettingsRequest settings) {
        if (settings == null) {
            return WithdrawalPolicy.disabled();
        }
        return WithdrawalPolicy.builder()
                .partialWithdrawalsEnabled(settings.partialWithdrawalsEnabled())
                .limitEnabled(settings.limitEnabled())
                .ceiling(settings.ceiling() == null ? null : MoneyUtil.format(settings.ceiling()))
                .totalWithdrawn(BigDecimal.ZERO)
                .minIntervalSeconds(settings.minIntervalSeconds())
                .build();
    }
}
