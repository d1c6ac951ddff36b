package com.headspace.trigger.event;

import com.headspace.domain.monitor.adapter.repository.IMonitorEventRepository;
import com.headspace.domain.monitor.model.entity.MonitorEventEntity;
import com.headspace.types.enums.MonitorEventTypeEnum;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import javax.sql.DataSource;
import java.sql.SQLException;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Consumer;

/**
 * 监控事件发布器：事件先落库，再分发给本实例的 Agent 订阅者，并通知其他实例。
 * <p>
 * 其他实例收到通知后，从该 Agent 已转发的最大事件 ID 之后回放补齐，漏掉的通知由下一条通知或重连补上。
 * 同一事件可能被投递多次，订阅者按事件 ID 去重。
 * </p>
 */
@Slf4j
@Component
public class MonitorEventPublisher {

    private static final String DEFAULT_CHANNEL = "monitor_events_channel";
    private static final int CATCH_UP_BATCH = 100;

    private final IMonitorEventRepository monitorEventRepository;
    private final ConcurrentMap<Long, ConcurrentMap<String, Consumer<MonitorEventEntity>>> subscribersByAgent =
            new ConcurrentHashMap<>();
    /** 每个 Agent 已从其他实例转发到本地的最大事件 ID */
    private final ConcurrentMap<Long, Long> relayedUpTo = new ConcurrentHashMap<>();
    private final String instanceId;
    private final PgNotifyRelay relay;

    public MonitorEventPublisher(IMonitorEventRepository monitorEventRepository) {
        this(monitorEventRepository, null, DEFAULT_CHANNEL, null);
    }

    @Autowired
    public MonitorEventPublisher(IMonitorEventRepository monitorEventRepository,
                                 ObjectProvider<DataSource> dataSourceProvider,
                                 @Value("${event.notify.channel:monitor_events_channel}") String notifyChannel,
                                 @Value("${event.publisher.instance-id:}") String configuredInstanceId) {
        this.monitorEventRepository = monitorEventRepository;
        this.instanceId = StringUtils.isBlank(configuredInstanceId)
                ? "headspace-" + UUID.randomUUID()
                : configuredInstanceId.trim();
        DataSource dataSource = dataSourceProvider == null ? null : dataSourceProvider.getIfAvailable();
        this.relay = dataSource == null ? null : new PgNotifyRelay(dataSource,
                StringUtils.defaultIfBlank(notifyChannel, DEFAULT_CHANNEL), this::onRelayNotice, this::catchUpAll);
    }

    @PostConstruct
    public void start() {
        if (relay == null) {
            log.info("Cross-instance event relay disabled, no DataSource. instanceId={}", instanceId);
            return;
        }
        relay.start();
    }

    @PreDestroy
    public void stop() {
        if (relay != null) {
            relay.stop();
        }
    }

    /**
     * 有活动事务时注册到提交之后发布，回滚则不发布；否则立即发布。
     */
    public void publishAfterCommit(MonitorEventTypeEnum eventType, Long agentId, Map<String, Object> eventData) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            publishQuietly(eventType, agentId, eventData);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                publishQuietly(eventType, agentId, eventData);
            }
        });
    }

    public MonitorEventEntity publish(MonitorEventTypeEnum eventType, Long agentId, Map<String, Object> eventData) {
        if (eventType == null || agentId == null) {
            return null;
        }
        MonitorEventEntity saved = monitorEventRepository.save(MonitorEventEntity.create(agentId, eventType,
                eventData == null ? Collections.emptyMap() : eventData));
        deliverLocally(saved);
        announce(saved);
        return saved;
    }

    public List<MonitorEventEntity> replay(Long agentId, Long afterEventId, int limit) {
        return monitorEventRepository.findByAgentIdAfterEventId(agentId, afterEventId, limit);
    }

    public void subscribe(Long agentId, String subscriberId, Consumer<MonitorEventEntity> consumer) {
        if (agentId == null || subscriberId == null || consumer == null) {
            return;
        }
        subscribersByAgent.computeIfAbsent(agentId, key -> new ConcurrentHashMap<>()).put(subscriberId, consumer);
    }

    public void unsubscribe(Long agentId, String subscriberId) {
        if (agentId == null || subscriberId == null) {
            return;
        }
        ConcurrentMap<String, Consumer<MonitorEventEntity>> subscribers = subscribersByAgent.get(agentId);
        if (subscribers == null) {
            return;
        }
        subscribers.remove(subscriberId);
        if (subscribers.isEmpty() && subscribersByAgent.remove(agentId, subscribers)) {
            relayedUpTo.remove(agentId);
        }
    }

    // state is already committed when this runs, a lost broadcast is recovered by replay
    private void publishQuietly(MonitorEventTypeEnum eventType, Long agentId, Map<String, Object> eventData) {
        try {
            publish(eventType, agentId, eventData);
        } catch (RuntimeException ex) {
            log.warn("EVENT_PUBLISH_FAILED agentId={}, eventType={}, error={}", agentId, eventType, ex.getMessage());
        }
    }

    private void deliverLocally(MonitorEventEntity event) {
        ConcurrentMap<String, Consumer<MonitorEventEntity>> subscribers = subscribersByAgent.get(event.getAgentId());
        if (subscribers == null) {
            return;
        }
        subscribers.forEach((subscriberId, consumer) -> {
            try {
                consumer.accept(event);
            } catch (RuntimeException ex) {
                log.debug("Subscriber rejected monitor event. agentId={}, subscriberId={}, eventId={}, error={}",
                        event.getAgentId(), subscriberId, event.getId(), ex.getMessage());
            }
        });
    }

    private void announce(MonitorEventEntity event) {
        if (relay == null || event.getId() == null) {
            return;
        }
        try {
            relay.send(MonitorEventNotice.of(event, instanceId).format());
        } catch (SQLException ex) {
            log.warn("EVENT_RELAY_SEND_FAILED agentId={}, eventId={}, eventType={}, error={}",
                    event.getAgentId(), event.getId(), event.getEventType(), ex.getMessage());
        }
    }

    private void onRelayNotice(String payload) {
        MonitorEventNotice notice = MonitorEventNotice.parse(payload);
        if (notice == null) {
            log.debug("Ignoring unrecognized relay payload. payload={}", payload);
            return;
        }
        if (notice.isFrom(instanceId) || !subscribersByAgent.containsKey(notice.agentId())) {
            return;
        }
        catchUp(notice.agentId(), notice.eventId() - 1, notice.eventId());
    }

    private void catchUpAll() {
        relayedUpTo.forEach((agentId, upTo) -> {
            if (subscribersByAgent.containsKey(agentId)) {
                catchUp(agentId, upTo, Long.MAX_VALUE);
            }
        });
    }

    /**
     * 回放 (cursor, targetEventId] 区间的事件并推进游标；目标事件尚不可见时游标停在原处，等待下一次补齐。
     */
    private void catchUp(Long agentId, long firstCursor, long targetEventId) {
        long cursor = relayedUpTo.getOrDefault(agentId, firstCursor);
        if (cursor >= targetEventId) {
            return;
        }
        long delivered = cursor;
        for (MonitorEventEntity event : replay(agentId, cursor, CATCH_UP_BATCH)) {
            if (event.getId() > targetEventId) {
                break;
            }
            deliverLocally(event);
            delivered = event.getId();
        }
        if (delivered > cursor) {
            relayedUpTo.merge(agentId, delivered, Math::max);
            log.debug("Relayed monitor events. agentId={}, fromEventId={}, toEventId={}", agentId, cursor, delivered);
        }
    }
}
