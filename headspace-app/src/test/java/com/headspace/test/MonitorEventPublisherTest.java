package com.headspace.test;

import com.headspace.domain.monitor.model.entity.MonitorEventEntity;
import com.headspace.test.support.InMemoryMonitorEventRepository;
import com.headspace.trigger.event.MonitorEventNotice;
import com.headspace.trigger.event.MonitorEventPublisher;
import com.headspace.types.enums.MonitorEventTypeEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class MonitorEventPublisherTest {

    private final InMemoryMonitorEventRepository eventRepository = new InMemoryMonitorEventRepository();
    private final MonitorEventPublisher publisher = new MonitorEventPublisher(eventRepository);

    @Test
    public void shouldDeliverOnlyToSubscribersOfSameAgent() {
        List<MonitorEventEntity> first = new ArrayList<>();
        List<MonitorEventEntity> other = new ArrayList<>();
        publisher.subscribe(1L, "a", first::add);
        publisher.subscribe(2L, "b", other::add);

        MonitorEventEntity saved = publisher.publish(MonitorEventTypeEnum.CONTEXT_UPDATED, 1L, Map.of("percentUsed", 40));

        Assertions.assertEquals(1, first.size());
        Assertions.assertEquals(saved.getId(), first.get(0).getId());
        Assertions.assertTrue(other.isEmpty());
        Assertions.assertEquals(1, publisher.replay(1L, 0L, 10).size());
    }

    @Test
    public void shouldKeepDeliveringWhenOneSubscriberFails() {
        List<MonitorEventEntity> healthy = new ArrayList<>();
        publisher.subscribe(1L, "broken", event -> {
            throw new IllegalStateException("emitter closed");
        });
        publisher.subscribe(1L, "healthy", healthy::add);

        publisher.publish(MonitorEventTypeEnum.SESSION_ENDED, 1L, null);

        Assertions.assertEquals(1, healthy.size());
        Assertions.assertTrue(healthy.get(0).getEventData().isEmpty());
    }

    @Test
    public void shouldStopDeliveringAfterUnsubscribe() {
        List<MonitorEventEntity> received = new ArrayList<>();
        publisher.subscribe(1L, "a", received::add);
        publisher.unsubscribe(1L, "a");

        publisher.publish(MonitorEventTypeEnum.TURN_CREATED, 1L, Map.of("turnId", 7));

        Assertions.assertTrue(received.isEmpty());
        Assertions.assertEquals(1, eventRepository.size());
    }

    @Test
    public void shouldHoldEventsUntilTransactionCommits() {
        TransactionSynchronizationManager.initSynchronization();
        try {
            publisher.publishAfterCommit(MonitorEventTypeEnum.STATE_CHANGED, 1L, Map.of("toState", "COMMANDED"));
            publisher.publishAfterCommit(MonitorEventTypeEnum.TURN_CREATED, 1L, Map.of("turnId", 3));
            Assertions.assertEquals(0, eventRepository.size());

            for (TransactionSynchronization synchronization : TransactionSynchronizationManager.getSynchronizations()) {
                synchronization.afterCommit();
            }
        } finally {
            TransactionSynchronizationManager.clearSynchronization();
        }

        Assertions.assertEquals(2, eventRepository.size());
        Assertions.assertEquals(1, eventRepository.ofType(MonitorEventTypeEnum.STATE_CHANGED).size());
    }

    @Test
    public void shouldDropEventsOfRolledBackTransaction() {
        TransactionSynchronizationManager.initSynchronization();
        try {
            publisher.publishAfterCommit(MonitorEventTypeEnum.TURN_CREATED, 1L, Map.of("turnId", 3));
            for (TransactionSynchronization synchronization : TransactionSynchronizationManager.getSynchronizations()) {
                synchronization.afterCompletion(TransactionSynchronization.STATUS_ROLLED_BACK);
            }
        } finally {
            TransactionSynchronizationManager.clearSynchronization();
        }

        Assertions.assertEquals(0, eventRepository.size());
    }

    @Test
    public void shouldParseNoticeWithOriginContainingSeparators() {
        MonitorEventNotice notice = MonitorEventNotice.parse("12/340/TURN_UPDATED@host-a/pid@9");

        Assertions.assertNotNull(notice);
        Assertions.assertEquals(12L, notice.agentId());
        Assertions.assertEquals(340L, notice.eventId());
        Assertions.assertEquals(MonitorEventTypeEnum.TURN_UPDATED, notice.eventType());
        Assertions.assertTrue(notice.isFrom("host-a/pid@9"));
        Assertions.assertEquals("12/340/TURN_UPDATED@host-a/pid@9", notice.format());
    }

    @Test
    public void shouldRejectMalformedNotices() {
        Assertions.assertNull(MonitorEventNotice.parse(null));
        Assertions.assertNull(MonitorEventNotice.parse("  "));
        Assertions.assertNull(MonitorEventNotice.parse("12/340/TURN_UPDATED"));
        Assertions.assertNull(MonitorEventNotice.parse("12/340/TURN_UPDATED@"));
        Assertions.assertNull(MonitorEventNotice.parse("12/340/NOT_A_TYPE@node"));
        Assertions.assertNull(MonitorEventNotice.parse("12/0/TURN_CREATED@node"));
        Assertions.assertNull(MonitorEventNotice.parse("x/340/TURN_CREATED@node"));
        Assertions.assertNull(MonitorEventNotice.parse("12:340:node"));
    }
}
