package com.openfashion.campaignservice;

import com.openfashion.campaignservice.core.exceptions.*;
import com.openfashion.campaignservice.dto.PayoutResult;
import com.openfashion.campaignservice.dto.WithdrawalSettingsRequest;
import com.openfashion.campaignservice.dto.event.CampaignEventType;
import com.openfashion.campaignservice.model.Campaign;
import com.openfashion.campaignservice.model.CampaignStatus;
import com.openfashion.campaignservice.model.Milestone;
import com.openfashion.campaignservice.model.WithdrawalPolicy;
import com.openfashion.campaignservice.repository.CampaignRepository;
import com.openfashion.campaignservice.service.*;
import com.openfashion.campaignservice.service.imp.WithdrawalServiceImp;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.time.Clock;
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
class WithdrawalServiceUnitTest {

    @Mock
    private CampaignRegistryService registryService;
    @Mock
    private CampaignRepository campaignRepository;
    @Mock
    private CampaignEventPublisher eventPublisher;
    @Mock
    private PayoutExecutor payoutExecutor;
    @Mock
    private AccessGate accessGate;

    private WithdrawalServiceImp withdrawalService;

    private UUID creator;
    private Campaign campaign;

    @BeforeEach
    void setUp() {
        withdrawalService = new WithdrawalServiceImp(
                registryService,
                campaignRepository,
                eventPublisher,
                payoutExecutor,
                accessGate,
                Clock.fixed(NOW, ZoneOffset.UTC));
        ReflectionTestUtils.setField(withdrawalService, "maxMilestones", 10);

        creator = UUID.randomUUID();
        campaign = CampaignFixtures.openCampaign(5L, creator, "1000");
        lenient().when(registryService.mustExist(5L)).thenReturn(campaign);
        lenient().when(payoutExecutor.payCreatorWithFee(any(), any(BigDecimal.class), anyString()))
                .thenAnswer(invocation -> new FeeSplit(BigDecimal.ZERO, invocation.getArgument(1)));
    }

    @Test
    @DisplayName("Surplus withdrawal pays raised minus goal and lowers raised to the goal")
    void testWithdrawSurplus() {
        campaign.setStatus(CampaignStatus.FUNDED);
        campaign.setAmountRaised(new BigDecimal("1250"));

        PayoutResult result = withdrawalService.withdrawSurplus(5L, creator);

        assertThat(result.gross()).isEqualByComparingTo("250");
        assertThat(campaign.getAmountRaised()).isEqualByComparingTo("1000");
        verify(eventPublisher).publish(eq(CampaignEventType.SURPLUS_WITHDRAWN), eq(5L), any());
    }

    @Test
    @DisplayName("Surplus needs a funded campaign with value above the goal")
    void testWithdrawSurplusRejected() {
        assertThatThrownBy(() -> withdrawalService.withdrawSurplus(5L, creator))
                .isInstanceOf(CampaignNotFundedException.class);

        campaign.setStatus(CampaignStatus.FUNDED);
        campaign.setAmountRaised(new BigDecimal("1000"));
        assertThatThrownBy(() -> withdrawalService.withdrawSurplus(5L, creator))
                .isInstanceOf(NoExcessException.class);

        verifyNoInteractions(payoutExecutor);
    }

    @Test
    @DisplayName("Partial withdrawal must be enabled")
    void testPartialDisabled() {
        campaign.setAmountRaised(new BigDecimal("500"));

        assertThatThrownBy(() -> withdrawalService.withdrawPartialFunds(5L, creator, BigDecimal.TEN))
                .isInstanceOf(WithdrawalsDisabledException.class);
    }

    @Test
    @DisplayName("Partial withdrawal respects raised, ceiling and interval")
    void testPartialWithdrawalRules() {
        campaign.setAmountRaised(new BigDecimal("500"));
        campaign.setWithdrawalPolicy(WithdrawalPolicy.builder()
                .partialWithdrawalsEnabled(true)
                .limitEnabled(true)
                .ceiling(new BigDecimal("150"))
                .minIntervalSeconds(3600)
                .build());

        assertThatThrownBy(() -> withdrawalService.withdrawPartialFunds(5L, creator, new BigDecimal("501")))
                .isInstanceOf(InsufficientFundsException.class);
        assertThatThrownBy(() -> withdrawalService.withdrawPartialFunds(5L, creator, new BigDecimal("151")))
                .isInstanceOf(WithdrawalLimitExceededException.class);

        withdrawalService.withdrawPartialFunds(5L, creator, new BigDecimal("100"));

        assertThat(campaign.getAmountRaised()).isEqualByComparingTo("400");
        assertThat(campaign.getWithdrawalPolicy().getTotalWithdrawn()).isEqualByComparingTo("100");
        assertThat(campaign.getWithdrawalPolicy().getLastWithdrawalAt()).isEqualTo(NOW);

        assertThatThrownBy(() -> withdrawalService.withdrawPartialFunds(5L, creator, BigDecimal.ONE))
                .isInstanceOf(IntervalNotElapsedException.class);
    }

    @Test
    @DisplayName("Each partial withdrawal pays under its own stable custody reference")
    void testPartialWithdrawalReferences() {
        campaign.setAmountRaised(new BigDecimal("500"));
        campaign.setWithdrawalPolicy(WithdrawalPolicy.builder().partialWithdrawalsEnabled(true).build());

        withdrawalService.withdrawPartialFunds(5L, creator, new BigDecimal("100"));
        withdrawalService.withdrawPartialFunds(5L, creator, new BigDecimal("100"));

        verify(payoutExecutor).payCreatorWithFee(eq(campaign), any(BigDecimal.class), eq("campaign-5:partial-0"));
        verify(payoutExecutor).payCreatorWithFee(eq(campaign), any(BigDecimal.class), eq("campaign-5:partial-1"));
        assertThat(campaign.getWithdrawalPolicy().getWithdrawalSequence()).isEqualTo(2);
    }

    @Test
    @DisplayName("Creator withdrawals are blocked while paused")
    void testPartialWhilePaused() {
        doThrow(new PlatformPausedException()).when(accessGate).requireNotPaused();

        assertThatThrownBy(() -> withdrawalService.withdrawPartialFunds(5L, creator, BigDecimal.TEN))
                .isInstanceOf(PlatformPausedException.class);
        verifyNoInteractions(registryService);
    }

    @Test
    @DisplayName("Ceiling cannot be configured below what was already withdrawn")
    void testConfigureWithdrawals() {
        campaign.getWithdrawalPolicy().setTotalWithdrawn(new BigDecimal("200"));

        assertThatThrownBy(() -> withdrawalService.configureWithdrawals(5L, creator,
                new WithdrawalSettingsRequest(true, true, new BigDecimal("100"), 0)))
                .isInstanceOf(InvalidParametersException.class);

        withdrawalService.configureWithdrawals(5L, creator,
                new WithdrawalSettingsRequest(true, true, new BigDecimal("300"), 60));

        WithdrawalPolicy policy = campaign.getWithdrawalPolicy();
        assertThat(policy.isPartialWithdrawalsEnabled()).isTrue();
        assertThat(policy.getCeiling()).isEqualByComparingTo("300");
        assertThat(policy.getTotalWithdrawn()).isEqualByComparingTo("200");
        assertThat(policy.getMinIntervalSeconds()).isEqualTo(60);
    }

    @Test
    @DisplayName("Milestones are capped in count and total amount")
    void testAddMilestone() {
        withdrawalService.addMilestone(5L, creator, new BigDecimal("600"), "Frame");

        assertThatThrownBy(() -> withdrawalService.addMilestone(5L, creator, new BigDecimal("401"), "Roof"))
                .isInstanceOf(InvalidParametersException.class);
        assertThatThrownBy(() -> withdrawalService.addMilestone(5L, creator, BigDecimal.ONE, " "))
                .isInstanceOf(InvalidParametersException.class);

        ReflectionTestUtils.setField(withdrawalService, "maxMilestones", 1);
        assertThatThrownBy(() -> withdrawalService.addMilestone(5L, creator, BigDecimal.ONE, "Paint"))
                .isInstanceOf(InvalidParametersException.class);

        assertThat(campaign.getMilestones()).hasSize(1);
    }

    @Test
    @DisplayName("Milestones complete once each, in any order, on funded campaigns")
    void testCompleteMilestone() {
        campaign.getMilestones().add(new Milestone(new BigDecimal("200"), "Frame", false));
        campaign.getMilestones().add(new Milestone(new BigDecimal("300"), "Roof", false));
        campaign.setStatus(CampaignStatus.FUNDED);
        campaign.setAmountRaised(new BigDecimal("1000"));
        campaign.setAmountReleased(new BigDecimal("500"));

        PayoutResult result = withdrawalService.completeMilestone(5L, creator, 1);

        assertThat(result.gross()).isEqualByComparingTo("300");
        assertThat(campaign.getMilestones().get(1).isCompleted()).isTrue();
        assertThat(campaign.getMilestones().get(0).isCompleted()).isFalse();
        assertThat(campaign.getAmountReleased()).isEqualByComparingTo("800");
        assertThat(campaign.getWithdrawalPolicy().getTotalWithdrawn()).isEqualByComparingTo("300");

        assertThatThrownBy(() -> withdrawalService.completeMilestone(5L, creator, 1))
                .isInstanceOf(MilestoneAlreadyCompletedException.class);
        assertThatThrownBy(() -> withdrawalService.completeMilestone(5L, creator, 2))
                .isInstanceOf(InvalidParametersException.class);

        withdrawalService.completeMilestone(5L, creator, 0);
        assertThat(campaign.getAmountReleased()).isEqualByComparingTo("1000");
    }

    @Test
    @DisplayName("Milestone release honours the withdrawal ceiling and needs a funded campaign")
    void testCompleteMilestoneRejected() {
        campaign.getMilestones().add(new Milestone(new BigDecimal("200"), "Frame", false));

        assertThatThrownBy(() -> withdrawalService.completeMilestone(5L, creator, 0))
                .isInstanceOf(CampaignNotFundedException.class);

        campaign.setStatus(CampaignStatus.FUNDED);
        campaign.setAmountRaised(new BigDecimal("1000"));
        campaign.setAmountReleased(new BigDecimal("800"));
        campaign.setWithdrawalPolicy(WithdrawalPolicy.builder()
                .limitEnabled(true)
                .ceiling(new BigDecimal("100"))
                .build());

        assertThatThrownBy(() -> withdrawalService.completeMilestone(5L, creator, 0))
                .isInstanceOf(WithdrawalLimitExceededException.class);
        assertThat(campaign.getMilestones().get(0).isCompleted()).isFalse();
    }
}
