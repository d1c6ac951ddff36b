package com.headspace.trigger.http;

import com.headspace.domain.agent.adapter.repository.IAgentRepository;
import com.headspace.domain.agent.model.entity.AgentEntity;
import com.headspace.domain.monitor.model.entity.MonitorEventEntity;
import com.headspace.domain.task.adapter.repository.IAgentTaskRepository;
import com.headspace.domain.task.model.entity.AgentTaskEntity;
import com.headspace.trigger.event.MonitorEventPublisher;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Agent 监控事件 SSE 流（实时推送 + 断线按事件 ID 回放）。
 */
@Slf4j
@RestController
@RequestMapping("/api/agents")
public class AgentEventStreamController {

    private final IAgentRepository agentRepository;
    private final IAgentTaskRepository agentTaskRepository;
    private final MonitorEventPublisher monitorEventPublisher;
    private final ConcurrentMap<Long, ConcurrentMap<String, SubscriberState>> subscribersByAgent;
    private final ExecutorService pushExecutor;
    private final int replayBatchSize;
    private final Counter pushAttemptCounter;
    private final Counter pushFailCounter;
    private final Counter replayEventsCounter;

    public AgentEventStreamController(IAgentRepository agentRepository,
                                      IAgentTaskRepository agentTaskRepository,
                                      MonitorEventPublisher monitorEventPublisher,
                                      ObjectProvider<MeterRegistry> meterRegistryProvider,
                                      @Value("${sse.replay.batch-size:200}") int replayBatchSize) {
        this.agentRepository = agentRepository;
        this.agentTaskRepository = agentTaskRepository;
        this.monitorEventPublisher = monitorEventPublisher;
        this.subscribersByAgent = new ConcurrentHashMap<>();
        this.pushExecutor = Executors.newFixedThreadPool(2, runnable -> {
            Thread thread = new Thread(runnable, "agent-stream-push");
            thread.setDaemon(true);
            return thread;
        });
        this.replayBatchSize = replayBatchSize <= 0 ? 200 : replayBatchSize;
        MeterRegistry meterRegistry = meterRegistryProvider.getIfAvailable(SimpleMeterRegistry::new);
        this.pushAttemptCounter = Counter.builder("headspace.sse.push.attempt.total").register(meterRegistry);
        this.pushFailCounter = Counter.builder("headspace.sse.push.fail.total").register(meterRegistry);
        this.replayEventsCounter = Counter.builder("headspace.sse.replay.events.total").register(meterRegistry);
    }

    @GetMapping(value = "/{agentId}/events/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamEvents(@PathVariable("agentId") Long agentId,
                                   @RequestParam(value = "lastEventId", required = false) Long lastEventIdParam,
                                   @RequestHeader(value = "Last-Event-ID", required = false) String lastEventIdHeader) {
        SseEmitter emitter = new SseEmitter(30L * 60L * 1000L);
        String subscriberId = UUID.randomUUID().toString();
        long cursor = resolveCursor(lastEventIdParam, lastEventIdHeader);
        SubscriberState state = new SubscriberState(emitter, cursor);
        subscribersByAgent.computeIfAbsent(agentId, key -> new ConcurrentHashMap<>()).put(subscriberId, state);

        emitter.onCompletion(() -> removeSubscriber(agentId, subscriberId));
        emitter.onTimeout(() -> removeSubscriber(agentId, subscriberId));
        emitter.onError(ex -> removeSubscriber(agentId, subscriberId));

        sendEvent(emitter, "StreamReady", Map.of("agentId", agentId, "lastEventId", cursor), null);
        sendAgentSnapshot(agentId, emitter);
        monitorEventPublisher.subscribe(agentId, subscriberId, event -> {
            if (event != null) {
                pushExecutor.execute(() -> deliverEvent(agentId, subscriberId, event));
            }
        });
        replayMissedEvents(agentId, subscriberId);
        return emitter;
    }

    @Scheduled(fixedDelayString = "${sse.heartbeat-interval-ms:10000}", scheduler = "daemonScheduler")
    public void emitHeartbeat() {
        for (Map.Entry<Long, ConcurrentMap<String, SubscriberState>> entry : subscribersByAgent.entrySet()) {
            Long agentId = entry.getKey();
            ConcurrentMap<String, SubscriberState> subscribers = entry.getValue();
            if (subscribers == null || subscribers.isEmpty()) {
                subscribersByAgent.remove(agentId, subscribers);
                continue;
            }
            for (Map.Entry<String, SubscriberState> subscriberEntry : subscribers.entrySet()) {
                if (!sendEvent(subscriberEntry.getValue().emitter, "Heartbeat", Map.of("agentId", agentId), null)) {
                    removeSubscriber(agentId, subscriberEntry.getKey());
                }
            }
        }
    }

    private void replayMissedEvents(Long agentId, String subscriberId) {
        SubscriberState subscriber = getSubscriber(agentId, subscriberId);
        if (subscriber == null) {
            return;
        }
        while (true) {
            List<MonitorEventEntity> events;
            try {
                events = monitorEventPublisher.replay(agentId, subscriber.lastEventId.get(), replayBatchSize);
            } catch (Exception ex) {
                log.warn("Replay agent events failed. agentId={}, subscriberId={}, error={}",
                        agentId, subscriberId, ex.getMessage());
                return;
            }
            if (events == null || events.isEmpty()) {
                return;
            }
            replayEventsCounter.increment(events.size());
            for (MonitorEventEntity event : events) {
                deliverEvent(agentId, subscriberId, event);
            }
            if (events.size() < replayBatchSize || getSubscriber(agentId, subscriberId) == null) {
                return;
            }
        }
    }

    private void deliverEvent(Long agentId, String subscriberId, MonitorEventEntity event) {
        SubscriberState subscriber = getSubscriber(agentId, subscriberId);
        if (subscriber == null || event == null || event.getId() == null) {
            return;
        }
        synchronized (subscriber) {
            long eventId = event.getId();
            if (eventId <= subscriber.lastEventId.get()) {
                return;
            }
            String name = event.getEventType() == null ? "MonitorEvent" : event.getEventType().getEventName();
            if (!sendEvent(subscriber.emitter, name, event.getEventData(), eventId)) {
                removeSubscriber(agentId, subscriberId);
                return;
            }
            subscriber.lastEventId.updateAndGet(previous -> Math.max(previous, eventId));
        }
    }

    private void sendAgentSnapshot(Long agentId, SseEmitter emitter) {
        AgentEntity agent = agentRepository.findById(agentId);
        Map<String, Object> payload = new HashMap<>();
        payload.put("agentId", agentId);
        if (agent == null) {
            payload.put("status", "NOT_FOUND");
            sendEvent(emitter, "AgentSnapshot", payload, null);
            return;
        }
        payload.put("status", agent.isActive() ? "ACTIVE" : "ENDED");
        payload.put("contextPercentUsed", agent.getContextPercentUsed());
        AgentTaskEntity active = agentTaskRepository.findActiveByAgentId(agentId);
        payload.put("activeTaskId", active == null ? null : active.getId());
        payload.put("activeTaskState", active == null || active.getState() == null ? null : active.getState().name());
        sendEvent(emitter, "AgentSnapshot", payload, null);
    }

    private long resolveCursor(Long lastEventIdParam, String lastEventIdHeader) {
        if (lastEventIdHeader != null && !lastEventIdHeader.isBlank()) {
            try {
                return Math.max(Long.parseLong(lastEventIdHeader.trim()), 0L);
            } catch (NumberFormatException ex) {
                log.debug("Invalid Last-Event-ID header ignored. value={}", lastEventIdHeader);
            }
        }
        return lastEventIdParam == null ? 0L : Math.max(lastEventIdParam, 0L);
    }

    private void removeSubscriber(Long agentId, String subscriberId) {
        ConcurrentMap<String, SubscriberState> subscribers = subscribersByAgent.get(agentId);
        if (subscribers == null) {
            return;
        }
        subscribers.remove(subscriberId);
        if (subscribers.isEmpty()) {
            subscribersByAgent.remove(agentId, subscribers);
        }
        monitorEventPublisher.unsubscribe(agentId, subscriberId);
    }

    private SubscriberState getSubscriber(Long agentId, String subscriberId) {
        ConcurrentMap<String, SubscriberState> subscribers = subscribersByAgent.get(agentId);
        return subscribers == null ? null : subscribers.get(subscriberId);
    }

    private boolean sendEvent(SseEmitter emitter, String name, Object data, Long eventId) {
        if (emitter == null) {
            return false;
        }
        pushAttemptCounter.increment();
        try {
            SseEmitter.SseEventBuilder builder = SseEmitter.event().name(name).data(data);
            if (eventId != null) {
                builder.id(String.valueOf(eventId));
            }
            emitter.send(builder);
            return true;
        } catch (IOException | RuntimeException ex) {
            pushFailCounter.increment();
            log.debug("SSE send failed: {}", ex.getMessage());
            return false;
        }
    }

    @PreDestroy
    public void shutdown() {
        pushExecutor.shutdownNow();
    }

    private static final class SubscriberState {
        private final SseEmitter emitter;
        private final AtomicLong lastEventId;

        private SubscriberState(SseEmitter emitter, long lastEventId) {
            this.emitter = emitter;
            this.lastEventId = new AtomicLong(Math.max(lastEventId, 0L));
        }
    }
}
