package com.syntharb.unit.event;

import static org.assertj.core.api.Assertions.assertThat;

import com.syntharb.domain.enums.CloseReason;
import com.syntharb.domain.enums.PositionStatus;
import com.syntharb.domain.model.RiskAlert;
import com.syntharb.domain.model.SyntheticPosition;
import com.syntharb.event.DomainEvent;
import com.syntharb.event.DomainEventBus;
import com.syntharb.event.DomainEventType;
import com.syntharb.event.EventPublisherHelper;
import com.syntharb.event.EventSubscription;
import com.syntharb.event.PositionEvent;
import com.syntharb.event.RiskAlertEvent;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for DomainEventBus and EventPublisherHelper: ordered synchronous delivery,
 * listener isolation and unsubscription.
 */
class DomainEventBusTest {

    private DomainEventBus domainEventBus;
    private EventPublisherHelper eventPublisherHelper;

    @BeforeEach
    void setUp() {
        domainEventBus = new DomainEventBus();
        eventPublisherHelper = new EventPublisherHelper(domainEventBus);
    }

    private static SyntheticPosition position() {
        return SyntheticPosition.builder().id("pos_1").status(PositionStatus.ACTIVE).build();
    }

    @Nested
    @DisplayName("Delivery")
    class Delivery {

        @Test
        @DisplayName("Listeners run in subscription order on the publishing thread")
        void orderedDelivery() {
            List<String> calls = new ArrayList<>();
            Thread publisher = Thread.currentThread();
            domainEventBus.subscribe(DomainEventType.POSITION_ADDED, event -> calls.add("relay"));
            domainEventBus.subscribe(DomainEventType.POSITION_ADDED, event -> calls.add("risk"));
            domainEventBus.subscribe(DomainEventType.POSITION_ADDED, event -> {
                assertThat(Thread.currentThread()).isSameAs(publisher);
                calls.add("metrics");
            });

            eventPublisherHelper.publishPositionAdded(this, position());

            assertThat(calls).containsExactly("relay", "risk", "metrics");
        }

        @Test
        @DisplayName("Only listeners of the event's type are called")
        void typeRouting() {
            List<DomainEventType> seen = new ArrayList<>();
            domainEventBus.subscribe(DomainEventType.RISK_ALERT, event -> seen.add(event.getType()));

            eventPublisherHelper.publishPositionClosed(this, position(), CloseReason.COMPLETED);
            eventPublisherHelper.publishRiskAlert(this, RiskAlert.builder().id("alert_1").build());

            assertThat(seen).containsExactly(DomainEventType.RISK_ALERT);
        }

        @Test
        @DisplayName("Failing listener does not stop the others or reach the publisher")
        void listenerIsolation() {
            List<String> calls = new ArrayList<>();
            domainEventBus.subscribe(DomainEventType.POSITION_UPDATED, event -> {
                throw new IllegalStateException("boom");
            });
            domainEventBus.subscribe(DomainEventType.POSITION_UPDATED, event -> calls.add("second"));

            eventPublisherHelper.publishPositionUpdated(this, position(), 1);

            assertThat(calls).containsExactly("second");
        }

        @Test
        @DisplayName("Helper builds typed events with their payload")
        void typedEvents() {
            List<DomainEvent> events = new ArrayList<>();
            domainEventBus.subscribe(DomainEventType.POSITION_UPDATED, events::add);
            domainEventBus.subscribe(DomainEventType.POSITION_CLOSED, events::add);
            domainEventBus.subscribe(DomainEventType.ALERT_ACKNOWLEDGED, events::add);

            eventPublisherHelper.publishPositionUpdated(this, position(), 1);
            eventPublisherHelper.publishPositionClosed(this, position(), CloseReason.FAILED);
            eventPublisherHelper.publishAlertAcknowledged(this, RiskAlert.builder().id("alert_9").build());

            assertThat(((PositionEvent) events.get(0)).getLegIndex()).isEqualTo(1);
            assertThat(((PositionEvent) events.get(1)).getCloseReason()).isEqualTo(CloseReason.FAILED);
            assertThat(((RiskAlertEvent) events.get(2)).getAlert().getId()).isEqualTo("alert_9");
            assertThat(events.get(2).getType().getWireName()).isEqualTo("alertAcknowledged");
            assertThat(events.get(0).getSource()).isSameAs(this);
        }
    }

    @Nested
    @DisplayName("Subscriptions")
    class Subscriptions {

        @Test
        @DisplayName("Unsubscribed listener receives nothing further")
        void unsubscribe() {
            List<String> calls = new ArrayList<>();
            EventSubscription subscription =
                    domainEventBus.subscribe(DomainEventType.POSITION_ADDED, event -> calls.add("x"));

            eventPublisherHelper.publishPositionAdded(this, position());
            subscription.unsubscribe();
            eventPublisherHelper.publishPositionAdded(this, position());

            assertThat(calls).hasSize(1);
            assertThat(domainEventBus.getListenerCount(DomainEventType.POSITION_ADDED)).isZero();
        }

        @Test
        @DisplayName("Listener may unsubscribe itself during delivery")
        void unsubscribeDuringPublish() {
            List<String> calls = new ArrayList<>();
            EventSubscription[] self = new EventSubscription[1];
            self[0] = domainEventBus.subscribe(DomainEventType.POSITION_ADDED, event -> {
                calls.add("once");
                self[0].unsubscribe();
            });
            domainEventBus.subscribe(DomainEventType.POSITION_ADDED, event -> calls.add("always"));

            eventPublisherHelper.publishPositionAdded(this, position());
            eventPublisherHelper.publishPositionAdded(this, position());

            assertThat(calls).containsExactly("once", "always", "always");
        }

        @Test
        @DisplayName("Publishing with no listeners is a no-op")
        void noListeners() {
            eventPublisherHelper.publishPositionAdded(this, position());

            assertThat(domainEventBus.getListenerCount(DomainEventType.POSITION_ADDED)).isZero();
        }
    }
}
