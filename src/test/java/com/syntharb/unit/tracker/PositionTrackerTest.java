package com.syntharb.unit.tracker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.syntharb.domain.enums.CloseReason;
import com.syntharb.domain.enums.LegStatus;
import com.syntharb.domain.enums.PositionStatus;
import com.syntharb.domain.model.ArbitrageOpportunity;
import com.syntharb.domain.model.LegFill;
import com.syntharb.domain.model.PositionFilter;
import com.syntharb.domain.model.PositionMetadata;
import com.syntharb.domain.model.SyntheticPosition;
import com.syntharb.event.EventPublisherHelper;
import com.syntharb.exception.BusinessException;
import com.syntharb.exception.ErrorCode;
import com.syntharb.exception.InvalidTransitionException;
import com.syntharb.exception.LegIndexOutOfRangeException;
import com.syntharb.exception.PositionNotFoundException;
import com.syntharb.tracker.PositionTracker;
import com.syntharb.validation.DataValidator;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for PositionTracker covering the position state machine, leg execution,
 * exposure recomputation and event publication.
 */
@ExtendWith(MockitoExtension.class)
class PositionTrackerTest {

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    private PositionTracker positionTracker;

    @BeforeEach
    void setUp() {
        positionTracker = new PositionTracker(new DataValidator(), eventPublisherHelper);
    }

    static ArbitrageOpportunity opportunity() {
        return ArbitrageOpportunity.builder()
                .id("opp-1")
                .symbol("NBA-LAL")
                .sport("basketball")
                .exchange1("pinnacle")
                .exchange2("betfair")
                .price1(new BigDecimal("1.95"))
                .price2(new BigDecimal("2.10"))
                .profit(new BigDecimal("50"))
                .confidence(new BigDecimal("0.9"))
                .build();
    }

    static LegFill fill(String price, String quantity) {
        return LegFill.builder()
                .status(LegStatus.FILLED)
                .fillPrice(new BigDecimal(price))
                .fillQuantity(new BigDecimal(quantity))
                .commission(new BigDecimal("2.50"))
                .build();
    }

    // ==============================
    // END-TO-END LIFECYCLE
    // ==============================

    @Test
    @DisplayName("Add, fill, close: PENDING -> ACTIVE -> COMPLETED with correct exposure and PnL")
    void fullLifecycle() {
        SyntheticPosition added = positionTracker.addPosition(opportunity(), null);

        assertThat(added.getId()).startsWith("pos_");
        assertThat(added.getStatus()).isEqualTo(PositionStatus.PENDING);
        assertThat(added.getLegs()).hasSize(2);
        assertThat(added.getExpectedPnl()).isEqualByComparingTo("45.00");
        assertThat(added.getCurrentExposure()).isEqualByComparingTo("0");

        SyntheticPosition filled = positionTracker.updateLegExecution(added.getId(), 0, fill("-110", "1000"));

        assertThat(filled.getStatus()).isEqualTo(PositionStatus.ACTIVE);
        assertThat(filled.getCurrentExposure()).isEqualByComparingTo("110000");
        assertThat(filled.getRisk().getPeakExposure()).isEqualByComparingTo("110000");
        assertThat(filled.getTotalCost()).isEqualByComparingTo("-110000");
        assertThat(filled.getTotalCommission()).isEqualByComparingTo("2.50");
        assertThat(filled.getLegs().get(0).getFilledAt()).isNotNull();

        SyntheticPosition closed =
                positionTracker.closePosition(added.getId(), CloseReason.COMPLETED, new BigDecimal("150"));

        assertThat(closed.getStatus()).isEqualTo(PositionStatus.COMPLETED);
        assertThat(closed.getRealizedPnl()).isEqualByComparingTo("150");
        assertThat(closed.getClosedAt()).isNotNull();

        verify(eventPublisherHelper).publishPositionAdded(eq(positionTracker), any());
        verify(eventPublisherHelper).publishPositionUpdated(eq(positionTracker), any(), eq(0));
        verify(eventPublisherHelper).publishPositionClosed(eq(positionTracker), any(), eq(CloseReason.COMPLETED));
    }

    // ==============================
    // ADD
    // ==============================

    @Nested
    @DisplayName("Add Position")
    class AddPosition {

        @Test
        @DisplayName("Opportunity quoted in American odds (-110 / +105) opens a pending position")
        void acceptsAmericanOdds() {
            ArbitrageOpportunity odds = opportunity().toBuilder()
                    .price1(new BigDecimal("-110"))
                    .price2(new BigDecimal("105"))
                    .build();

            SyntheticPosition added = positionTracker.addPosition(odds, null);

            assertThat(added.getStatus()).isEqualTo(PositionStatus.PENDING);
            assertThat(added.getLegs().get(0).getTargetPrice()).isEqualByComparingTo("-110");
            assertThat(added.getLegs().get(1).getTargetPrice()).isEqualByComparingTo("105");
            assertThat(added.getExpectedPnl()).isEqualByComparingTo("45.00");
            verify(eventPublisherHelper).publishPositionAdded(eq(positionTracker), any());
        }

        @Test
        @DisplayName("Invalid opportunity is rejected with field errors and nothing is stored")
        void rejectsInvalidOpportunity() {
            ArbitrageOpportunity bad = opportunity().toBuilder().exchange2("pinnacle").build();

            assertThatThrownBy(() -> positionTracker.addPosition(bad, null))
                    .isInstanceOf(BusinessException.class)
                    .satisfies(ex -> {
                        BusinessException business = (BusinessException) ex;
                        assertThat(business.getErrorCode()).isEqualTo(ErrorCode.VALIDATION_ERROR);
                        assertThat(business.getDetails()).containsKey("errors");
                    });

            assertThat(positionTracker.getSnapshot().size()).isZero();
            verify(eventPublisherHelper, never()).publishPositionAdded(any(), any());
        }

        @Test
        @DisplayName("Returned position is a copy; caller mutations do not leak into the tracker")
        void returnsCopies() {
            SyntheticPosition added = positionTracker.addPosition(opportunity(), null);
            added.setStatus(PositionStatus.CANCELLED);
            added.getLegs().clear();

            SyntheticPosition stored = positionTracker.getPosition(added.getId());

            assertThat(stored.getStatus()).isEqualTo(PositionStatus.PENDING);
            assertThat(stored.getLegs()).hasSize(2);
        }

        @Test
        @DisplayName("Listing is newest first and honours filters")
        void listingAndFilters() {
            SyntheticPosition first = positionTracker.addPosition(opportunity(), null);
            SyntheticPosition second = positionTracker.addPosition(
                    opportunity().toBuilder().sport("soccer").build(),
                    PositionMetadata.builder().assignedTo("desk-2").tags(new ArrayList<>(List.of("hedge"))).build());

            assertThat(positionTracker.getPositions(null))
                    .extracting(SyntheticPosition::getId)
                    .containsExactly(second.getId(), first.getId());
            assertThat(positionTracker.getPositions(PositionFilter.builder().sport("soccer").build()))
                    .extracting(SyntheticPosition::getId)
                    .containsExactly(second.getId());
            assertThat(positionTracker.getPositions(PositionFilter.builder().tags(List.of("hedge", "x")).build()))
                    .hasSize(1);
            assertThat(positionTracker.getPositions(PositionFilter.builder().assignedTo("desk-9").build()))
                    .isEmpty();
        }

        @Test
        @DisplayName("Every mutation advances the snapshot version")
        void snapshotVersion() {
            long before = positionTracker.getSnapshot().getVersion();
            SyntheticPosition added = positionTracker.addPosition(opportunity(), null);
            positionTracker.updateLegExecution(added.getId(), 1, fill("2.10", "10"));

            assertThat(positionTracker.getSnapshot().getVersion()).isEqualTo(before + 2);
        }
    }

    // ==============================
    // LEG EXECUTION
    // ==============================

    @Nested
    @DisplayName("Leg Execution")
    class LegExecution {

        @Test
        @DisplayName("Unknown position throws PositionNotFoundException")
        void unknownPosition() {
            assertThatThrownBy(() -> positionTracker.updateLegExecution("pos_missing", 0, fill("1", "1")))
                    .isInstanceOf(PositionNotFoundException.class);
            assertThatThrownBy(() -> positionTracker.getPosition("pos_missing"))
                    .isInstanceOf(PositionNotFoundException.class);
        }

        @Test
        @DisplayName("Leg index outside the leg list is rejected without side effects")
        void legIndexOutOfRange() {
            SyntheticPosition added = positionTracker.addPosition(opportunity(), null);

            assertThatThrownBy(() -> positionTracker.updateLegExecution(added.getId(), 2, fill("1", "1")))
                    .isInstanceOf(LegIndexOutOfRangeException.class);
            assertThatThrownBy(() -> positionTracker.updateLegExecution(added.getId(), -1, fill("1", "1")))
                    .isInstanceOf(LegIndexOutOfRangeException.class);

            assertThat(positionTracker.getPosition(added.getId()).getStatus()).isEqualTo(PositionStatus.PENDING);
            verify(eventPublisherHelper, never()).publishPositionUpdated(any(), any(), anyInt());
        }

        @Test
        @DisplayName("Fill without quantity, or with negative commission, is a validation error")
        void rejectsBadFills() {
            SyntheticPosition added = positionTracker.addPosition(opportunity(), null);
            LegFill noQuantity = LegFill.builder()
                    .status(LegStatus.FILLED)
                    .fillPrice(BigDecimal.ONE)
                    .build();
            LegFill negativeCommission = fill("1", "1");
            negativeCommission.setCommission(new BigDecimal("-1"));

            assertThatThrownBy(() -> positionTracker.updateLegExecution(added.getId(), 0, noQuantity))
                    .isInstanceOf(BusinessException.class);
            assertThatThrownBy(() -> positionTracker.updateLegExecution(added.getId(), 0, negativeCommission))
                    .isInstanceOf(BusinessException.class);
        }

        @Test
        @DisplayName("Cancelled leg carries no fill and leaves a PENDING position pending")
        void cancelledLegKeepsPending() {
            SyntheticPosition added = positionTracker.addPosition(opportunity(), null);

            SyntheticPosition updated = positionTracker.updateLegExecution(
                    added.getId(), 0, LegFill.builder().status(LegStatus.CANCELLED).build());

            assertThat(updated.getStatus()).isEqualTo(PositionStatus.PENDING);
            assertThat(updated.getCurrentExposure()).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("Exposure is recomputed from all legs; peak keeps the maximum")
        void exposureRecomputed() {
            SyntheticPosition added = positionTracker.addPosition(opportunity(), null);

            positionTracker.updateLegExecution(added.getId(), 0, fill("100", "10"));
            SyntheticPosition hedged = positionTracker.updateLegExecution(added.getId(), 1, fill("-90", "10"));

            assertThat(hedged.getCurrentExposure()).isEqualByComparingTo("100");
            assertThat(hedged.getRisk().getPeakExposure()).isEqualByComparingTo("1000");
            assertThat(hedged.getTotalCommission()).isEqualByComparingTo("5.00");
        }

        @Test
        @DisplayName("Exposure always equals |sum of fill notionals| after random fill sequences")
        void exposureMatchesNetNotional() {
            Random random = new Random(42);
            for (int round = 0; round < 50; round++) {
                SyntheticPosition added = positionTracker.addPosition(opportunity(), null);
                BigDecimal[] notionals = new BigDecimal[2];
                notionals[0] = BigDecimal.ZERO;
                notionals[1] = BigDecimal.ZERO;
                SyntheticPosition last = added;
                for (int step = 0; step < 6; step++) {
                    int leg = random.nextInt(2);
                    BigDecimal price = BigDecimal.valueOf(random.nextInt(4001) - 2000, 2);
                    BigDecimal quantity = BigDecimal.valueOf(random.nextInt(1000) + 1);
                    last = positionTracker.updateLegExecution(
                            added.getId(),
                            leg,
                            LegFill.builder()
                                    .status(LegStatus.PARTIAL)
                                    .fillPrice(price)
                                    .fillQuantity(quantity)
                                    .build());
                    notionals[leg] = price.multiply(quantity);
                }
                BigDecimal expected = notionals[0].add(notionals[1]).abs();
                assertThat(last.getCurrentExposure()).isEqualByComparingTo(expected);
                assertThat(last.getRisk().getPeakExposure()).isGreaterThanOrEqualTo(last.getCurrentExposure());
            }
        }
    }

    // ==============================
    // STATE MACHINE
    // ==============================

    @Nested
    @DisplayName("State Machine")
    class StateMachine {

        @Test
        @DisplayName("PENDING position may be cancelled directly")
        void pendingToCancelled() {
            SyntheticPosition added = positionTracker.addPosition(opportunity(), null);

            SyntheticPosition closed = positionTracker.closePosition(added.getId(), CloseReason.FAILED, null);

            assertThat(closed.getStatus()).isEqualTo(PositionStatus.CANCELLED);
            assertThat(closed.getRealizedPnl()).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("Terminal positions reject fills and further closes")
        void terminalRejectsMutations() {
            SyntheticPosition added = positionTracker.addPosition(opportunity(), null);
            positionTracker.closePosition(added.getId(), CloseReason.MANUAL, BigDecimal.TEN);

            assertThatThrownBy(() -> positionTracker.updateLegExecution(added.getId(), 0, fill("1", "1")))
                    .isInstanceOf(InvalidTransitionException.class);
            assertThatThrownBy(() -> positionTracker.closePosition(added.getId(), CloseReason.CANCELLED, null))
                    .isInstanceOf(InvalidTransitionException.class)
                    .satisfies(ex -> assertThat(((InvalidTransitionException) ex).getFrom())
                            .isEqualTo(PositionStatus.COMPLETED));

            assertThat(positionTracker.getPosition(added.getId()).getRealizedPnl()).isEqualByComparingTo("10");
        }

        @Test
        @DisplayName("Close without reason is a validation error")
        void closeRequiresReason() {
            SyntheticPosition added = positionTracker.addPosition(opportunity(), null);

            assertThatThrownBy(() -> positionTracker.closePosition(added.getId(), null, null))
                    .isInstanceOf(BusinessException.class);
        }

        @Test
        @DisplayName("Concurrent closes: exactly one succeeds")
        void concurrentClose() throws Exception {
            SyntheticPosition added = positionTracker.addPosition(opportunity(), null);
            int threads = 8;
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            List<Boolean> outcomes = Collections.synchronizedList(new ArrayList<>());
            try {
                for (int i = 0; i < threads; i++) {
                    pool.submit(() -> {
                        start.await();
                        try {
                            positionTracker.closePosition(added.getId(), CloseReason.COMPLETED, BigDecimal.ONE);
                            outcomes.add(true);
                        } catch (InvalidTransitionException e) {
                            outcomes.add(false);
                        }
                        return null;
                    });
                }
                start.countDown();
                pool.shutdown();
                assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
            } finally {
                pool.shutdownNow();
            }

            assertThat(outcomes).hasSize(threads);
            assertThat(outcomes.stream().filter(Boolean::booleanValue).count()).isEqualTo(1);
            verify(eventPublisherHelper).publishPositionClosed(any(), any(), eq(CloseReason.COMPLETED));
        }
    }
}
