package com.openfashion.campaignservice;

import com.openfashion.campaignservice.core.exceptions.CampaignClosedException;
import com.openfashion.campaignservice.core.exceptions.InvalidParametersException;
import com.openfashion.campaignservice.core.exceptions.UnauthorizedException;
import com.openfashion.campaignservice.dto.RefundSweepResult;
import com.openfashion.campaignservice.dto.event.CampaignEventType;
import com.openfashion.campaignservice.model.Campaign;
import com.openfashion.campaignservice.model.CampaignStatus;
import com.openfashion.campaignservice.model.Milestone;
import com.openfashion.campaignservice.repository.CampaignRepository;
import com.openfashion.campaignservice.service.*;
import com.openfashion.campaignservice.service.imp.CampaignLifecycleServiceImp;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import static com.openfashion.campaignservice.CampaignFixtures.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CampaignLifecycleServiceUnitTest {

    @Mock
    private CampaignRegistryService registryService;
    @Mock
    private RefundService refundService;
    @Mock
    private CampaignRepository campaignRepository;
    @Mock
    private CampaignEventPublisher eventPublisher;
    @Mock
    private PayoutExecutor payoutExecutor;

    private CampaignLifecycleServiceImp lifecycleService;

    private UUID creator;
    private Campaign campaign;

    @BeforeEach
    void setUp() {
        lifecycleService = new CampaignLifecycleServiceImp(
                registryService,
                refundService,
                campaignRepository,
                eventPublisher,
                payoutExecutor,
                Clock.fixed(NOW, ZoneOffset.UTC));

        creator = UUID.randomUUID();
        campaign = CampaignFixtures.openCampaign(3L, creator, "1000");
    }

    @Test
    @DisplayName("Funding releases the goal minus milestone amounts after writing the status")
    void testCompleteFunding() {
        campaign.setAmountRaised(new BigDecimal("1200"));
        campaign.getMilestones().add(new Milestone(new BigDecimal("300"), "Phase two", false));
        when(payoutExecutor.payCreatorWithFee(eq(campaign), any(BigDecimal.class), anyString()))
                .thenReturn(new FeeSplit(new BigDecimal("17.5"), new BigDecimal("682.5")));

        lifecycleService.completeFunding(campaign);

        assertThat(campaign.getStatus()).isEqualTo(CampaignStatus.FUNDED);
        assertThat(campaign.getFundedAt()).isEqualTo(NOW);
        assertThat(campaign.getAmountReleased()).isEqualByComparingTo("700");
        assertThat(campaign.getAmountRaised()).isEqualByComparingTo("1200");

        InOrder inOrder = inOrder(campaignRepository, payoutExecutor);
        inOrder.verify(campaignRepository).saveAndFlush(campaign);
        inOrder.verify(payoutExecutor).payCreatorWithFee(eq(campaign), argThat(a -> a.compareTo(new BigDecimal("700")) == 0), anyString());

        verify(eventPublisher).publish(eq(CampaignEventType.CAMPAIGN_FUNDED), eq(3L), any());
        verify(eventPublisher).publish(eq(CampaignEventType.FUNDING_PAYOUT), eq(3L), any());
    }

    @Test
    @DisplayName("Funding runs at most once")
    void testCompleteFundingOnce() {
        campaign.setStatus(CampaignStatus.FUNDED);

        lifecycleService.completeFunding(campaign);

        verifyNoInteractions(payoutExecutor, campaignRepository, eventPublisher);
    }

    @Test
    @DisplayName("Fully milestoned goal funds without an immediate payout")
    void testCompleteFundingAllMilestones() {
        campaign.setAmountRaised(new BigDecimal("1000"));
        campaign.getMilestones().add(new Milestone(new BigDecimal("1000"), "Everything", false));

        lifecycleService.completeFunding(campaign);

        assertThat(campaign.getStatus()).isEqualTo(CampaignStatus.FUNDED);
        verifyNoInteractions(payoutExecutor);
    }

    @Test
    @DisplayName("Cancel marks the campaign cancelled and starts the refund sweep")
    void testCancel() {
        when(registryService.mustExist(3L)).thenReturn(campaign);
        RefundSweepResult sweep = new RefundSweepResult(3L, 0, BigDecimal.ZERO, true);
        when(refundService.refundNextBatch(campaign)).thenReturn(sweep);

        RefundSweepResult result = lifecycleService.cancelCampaign(3L, creator);

        assertThat(result).isSameAs(sweep);
        assertThat(campaign.getStatus()).isEqualTo(CampaignStatus.CANCELLED);
        assertThat(campaign.getCancelledAt()).isEqualTo(NOW);
        verify(eventPublisher).publish(eq(CampaignEventType.CAMPAIGN_CANCELLED), eq(3L), any());
    }

    @Test
    @DisplayName("Cancel is forbidden for non-creators and completed campaigns")
    void testCancelRejected() {
        when(registryService.mustExist(3L)).thenReturn(campaign);

        assertThatThrownBy(() -> lifecycleService.cancelCampaign(3L, UUID.randomUUID()))
                .isInstanceOf(UnauthorizedException.class);

        campaign.setStatus(CampaignStatus.FUNDED);
        assertThatThrownBy(() -> lifecycleService.cancelCampaign(3L, creator))
                .isInstanceOf(CampaignClosedException.class);

        campaign.setStatus(CampaignStatus.CANCELLED);
        assertThatThrownBy(() -> lifecycleService.cancelCampaign(3L, creator))
                .isInstanceOf(CampaignClosedException.class);

        verifyNoInteractions(refundService);
    }

    @Test
    @DisplayName("continueRefundSweep only works on cancelled campaigns")
    void testContinueSweep() {
        when(registryService.mustExist(3L)).thenReturn(campaign);

        assertThatThrownBy(() -> lifecycleService.continueRefundSweep(3L))
                .isInstanceOf(InvalidParametersException.class);

        campaign.setStatus(CampaignStatus.CANCELLED);
        lifecycleService.continueRefundSweep(3L);
        verify(refundService).refundNextBatch(campaign);
    }

    @Test
    @DisplayName("New goal must exceed raised and cover the milestones")
    void testModifyGoal() {
        campaign.setAmountRaised(new BigDecimal("400"));
        campaign.getMilestones().add(new Milestone(new BigDecimal("600"), "Build", false));
        when(registryService.mustExist(3L)).thenReturn(campaign);

        assertThatThrownBy(() -> lifecycleService.modifyGoal(3L, creator, new BigDecimal("400")))
                .isInstanceOf(InvalidParametersException.class);
        assertThatThrownBy(() -> lifecycleService.modifyGoal(3L, creator, new BigDecimal("500")))
                .isInstanceOf(InvalidParametersException.class);

        lifecycleService.modifyGoal(3L, creator, new BigDecimal("1500"));

        assertThat(campaign.getGoal()).isEqualByComparingTo("1500");
        verify(eventPublisher).publish(eq(CampaignEventType.GOAL_MODIFIED), eq(3L), any());
    }

    @Test
    @DisplayName("Goal of a completed campaign cannot change")
    void testModifyGoalClosed() {
        campaign.setStatus(CampaignStatus.CANCELLED);
        when(registryService.mustExist(3L)).thenReturn(campaign);

        assertThatThrownBy(() -> lifecycleService.modifyGoal(3L, creator, new BigDecimal("5000")))
                .isInstanceOf(CampaignClosedException.class);
    }

    @Test
    @DisplayName("Deadline extension adds days to the current deadline")
    void testExtendDeadline() {
        when(registryService.mustExist(3L)).thenReturn(campaign);
        Instant before = campaign.getDeadline();

        lifecycleService.extendDeadline(3L, creator, 10);

        assertThat(campaign.getDeadline()).isEqualTo(before.plus(Duration.ofDays(10)));
        assertThatThrownBy(() -> lifecycleService.extendDeadline(3L, creator, 0))
                .isInstanceOf(InvalidParametersException.class);
    }
}
