package com.openfashion.campaignservice;

import com.openfashion.campaignservice.core.exceptions.*;
import com.openfashion.campaignservice.dto.CampaignDetailsUpdateRequest;
import com.openfashion.campaignservice.dto.WithdrawalSettingsRequest;
import com.openfashion.campaignservice.dto.event.CampaignEventType;
import com.openfashion.campaignservice.model.AssetType;
import com.openfashion.campaignservice.model.Campaign;
import com.openfashion.campaignservice.model.CampaignOwnership;
import com.openfashion.campaignservice.repository.CampaignOwnershipRepository;
import com.openfashion.campaignservice.repository.CampaignRepository;
import com.openfashion.campaignservice.service.AccessGate;
import com.openfashion.campaignservice.service.CampaignEventPublisher;
import com.openfashion.campaignservice.service.imp.CampaignRegistryServiceImp;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static com.openfashion.campaignservice.CampaignFixtures.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CampaignRegistryServiceUnitTest {

    @Mock
    private CampaignRepository campaignRepository;
    @Mock
    private CampaignOwnershipRepository ownershipRepository;
    @Mock
    private CampaignEventPublisher eventPublisher;
    @Mock
    private AccessGate accessGate;

    private CampaignRegistryServiceImp registryService;

    private UUID creator;

    @BeforeEach
    void setUp() {
        registryService = new CampaignRegistryServiceImp(
                campaignRepository,
                ownershipRepository,
                eventPublisher,
                accessGate,
                Clock.fixed(NOW, ZoneOffset.UTC));
        ReflectionTestUtils.setField(registryService, "maxDurationDays", 365);
        ReflectionTestUtils.setField(registryService, "allowedTokens", Set.of("USDC"));

        creator = UUID.randomUUID();
    }

    @Test
    @DisplayName("Create stores the campaign, its deadline and the creator's ownership")
    void testCreateCampaign() {
        when(campaignRepository.save(any(Campaign.class))).thenAnswer(invocation -> {
            Campaign saved = invocation.getArgument(0);
            saved.setId(1L);
            return saved;
        });

        Long id = registryService.createCampaign(creator, CampaignFixtures.createRequest("1000", 30, "USDC"));

        assertThat(id).isEqualTo(1L);

        ArgumentCaptor<Campaign> captor = ArgumentCaptor.forClass(Campaign.class);
        verify(campaignRepository).save(captor.capture());
        Campaign saved = captor.getValue();
        assertThat(saved.getDeadline()).isEqualTo(NOW.plus(Duration.ofDays(30)));
        assertThat(saved.getFundingAsset().getType()).isEqualTo(AssetType.TOKEN);
        assertThat(saved.getGoal()).isEqualByComparingTo("1000");
        assertThat(saved.isCompleted()).isFalse();

        verify(ownershipRepository).save(argThat(o -> o.getCampaignId().equals(1L) && o.getAccountId().equals(creator)));
        verify(eventPublisher).publish(eq(CampaignEventType.CAMPAIGN_CREATED), eq(1L), any());
    }

    @Test
    @DisplayName("Invalid parameters are rejected before anything is saved")
    void testCreateValidation() {
        assertThatThrownBy(() -> registryService.createCampaign(creator, CampaignFixtures.createRequest("0", 30, null)))
                .isInstanceOf(InvalidParametersException.class);
        assertThatThrownBy(() -> registryService.createCampaign(creator, CampaignFixtures.createRequest("1000", 0, null)))
                .isInstanceOf(InvalidParametersException.class);
        assertThatThrownBy(() -> registryService.createCampaign(creator, CampaignFixtures.createRequest("1000", 366, null)))
                .isInstanceOf(InvalidParametersException.class);
        assertThatThrownBy(() -> registryService.createCampaign(creator, CampaignFixtures.createRequest("1000", 30, "SHIB")))
                .isInstanceOf(InvalidParametersException.class);
        assertThatThrownBy(() -> registryService.createCampaign(creator, CampaignFixtures.createRequest("1000",
                new WithdrawalSettingsRequest(true, true, null, 0))))
                .isInstanceOf(InvalidParametersException.class);

        verify(campaignRepository, never()).save(any());
    }

    @Test
    @DisplayName("Creation is blocked while the platform is paused")
    void testCreateWhilePaused() {
        doThrow(new PlatformPausedException()).when(accessGate).requireNotPaused();

        assertThatThrownBy(() -> registryService.createCampaign(creator, CampaignFixtures.createRequest("1000", 30, null)))
                .isInstanceOf(PlatformPausedException.class);
        verifyNoInteractions(campaignRepository);
    }

    @Test
    @DisplayName("mustExist rejects ids outside the issued range")
    void testMustExist() {
        when(campaignRepository.findByIdForUpdate(99L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> registryService.mustExist(0L)).isInstanceOf(CampaignNotFoundException.class);
        assertThatThrownBy(() -> registryService.mustExist(99L)).isInstanceOf(CampaignNotFoundException.class);
        assertThat(registryService.exists(0L)).isFalse();
    }

    @Test
    @DisplayName("Detail update keeps fields that were sent empty")
    void testUpdateDetails() {
        Campaign campaign = CampaignFixtures.openCampaign(1L, creator, "1000");
        campaign.setDescription("Old description");
        when(campaignRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(campaign));

        registryService.updateCampaignDetails(1L, creator,
                new CampaignDetailsUpdateRequest("New title", "", null, "energy"));

        assertThat(campaign.getTitle()).isEqualTo("New title");
        assertThat(campaign.getDescription()).isEqualTo("Old description");
        assertThat(campaign.getCategory()).isEqualTo("energy");

        assertThatThrownBy(() -> registryService.updateCampaignDetails(1L, UUID.randomUUID(),
                new CampaignDetailsUpdateRequest("x", null, null, null)))
                .isInstanceOf(UnauthorizedException.class);
    }

    @Test
    @DisplayName("Ownership transfer moves the campaign between ownership indexes")
    void testTransferOwnership() {
        UUID newCreator = UUID.randomUUID();
        Campaign campaign = CampaignFixtures.openCampaign(1L, creator, "1000");
        CampaignOwnership ownership = CampaignOwnership.builder().id(4L).accountId(creator).campaignId(1L).build();
        when(campaignRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(campaign));
        when(ownershipRepository.findByCampaignId(1L)).thenReturn(Optional.of(ownership));

        registryService.transferOwnership(1L, creator, newCreator);

        assertThat(campaign.getCreatorId()).isEqualTo(newCreator);
        assertThat(ownership.getAccountId()).isEqualTo(newCreator);

        assertThatThrownBy(() -> registryService.transferOwnership(1L, newCreator, newCreator))
                .isInstanceOf(InvalidParametersException.class);
        assertThatThrownBy(() -> registryService.transferOwnership(1L, creator, UUID.randomUUID()))
                .isInstanceOf(UnauthorizedException.class);
    }

    @Test
    @DisplayName("Funding asset changes only before the first contribution and to allowed tokens")
    void testChangeFundingAsset() {
        Campaign campaign = CampaignFixtures.openCampaign(1L, creator, "1000");
        when(campaignRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(campaign));

        assertThatThrownBy(() -> registryService.changeFundingAsset(1L, creator, "SHIB"))
                .isInstanceOf(InvalidParametersException.class);

        registryService.changeFundingAsset(1L, creator, "USDC");
        assertThat(campaign.getFundingAsset().getTokenId()).isEqualTo("USDC");

        campaign.setBackerCount(1);
        assertThatThrownBy(() -> registryService.changeFundingAsset(1L, creator, null))
                .isInstanceOf(InvalidParametersException.class);
    }

    @Test
    @DisplayName("Verified and promoted flags are platform-owner only")
    void testFlags() {
        UUID owner = UUID.randomUUID();
        Campaign campaign = CampaignFixtures.openCampaign(1L, creator, "1000");
        lenient().when(campaignRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(campaign));
        doThrow(new UnauthorizedException(creator)).when(accessGate).requireOwner(creator);

        assertThatThrownBy(() -> registryService.setVerified(1L, creator, true))
                .isInstanceOf(UnauthorizedException.class);

        registryService.setVerified(1L, owner, true);
        registryService.setPromoted(1L, owner, true);

        assertThat(campaign.isVerified()).isTrue();
        assertThat(campaign.isPromoted()).isTrue();
    }
}
