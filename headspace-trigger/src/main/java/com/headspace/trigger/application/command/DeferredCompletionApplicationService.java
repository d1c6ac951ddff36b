package com.headspace.trigger.application.command;

import com.headspace.domain.agent.adapter.repository.IAgentRepository;
import com.headspace.domain.agent.model.entity.AgentEntity;
import com.headspace.domain.transcript.adapter.gateway.ITranscriptSource;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * 延迟完成用例：停止信号不带正文时，离开请求线程补读日志中的最终回复再捕获。
 * <p>
 * 日志写入可能晚于 hook 到达，按有限次数退避重试；使用更长的 deferred 锁超时。
 * </p>
 */
@Slf4j
@Service
public class DeferredCompletionApplicationService {

    private final TurnCaptureApplicationService turnCaptureApplicationService;
    private final IAgentRepository agentRepository;
    private final ITranscriptSource transcriptSource;
    private final Executor executor;
    private final int maxAttempts;
    private final long backoffMs;

    public DeferredCompletionApplicationService(TurnCaptureApplicationService turnCaptureApplicationService,
                                                IAgentRepository agentRepository,
                                                ITranscriptSource transcriptSource,
                                                @Qualifier("commonThreadPoolExecutor") Executor executor,
                                                @Value("${deferred-completion.max-attempts:5}") int maxAttempts,
                                                @Value("${deferred-completion.backoff-ms:500}") long backoffMs) {
        this.turnCaptureApplicationService = turnCaptureApplicationService;
        this.agentRepository = agentRepository;
        this.transcriptSource = transcriptSource;
        this.executor = executor;
        this.maxAttempts = maxAttempts > 0 ? maxAttempts : 5;
        this.backoffMs = backoffMs >= 0 ? backoffMs : 500L;
    }

    public CompletableFuture<TurnCaptureApplicationService.TurnCaptureResult> submit(TurnSignal signal) {
        log.info("DEFERRED_COMPLETION_SCHEDULED agentId={}, intent={}", signal.agentId(), signal.intent());
        return CompletableFuture.supplyAsync(() -> complete(signal), executor)
                .whenComplete((result, ex) -> {
                    if (ex != null) {
                        log.warn("Deferred completion failed. agentId={}, error={}", signal.agentId(), ex.getMessage(), ex);
                    }
                });
    }

    TurnCaptureApplicationService.TurnCaptureResult complete(TurnSignal signal) {
        String text = awaitAgentText(signal.agentId());
        if (StringUtils.isBlank(text)) {
            log.warn("Deferred completion found no agent text, capturing empty turn. agentId={}, attempts={}",
                    signal.agentId(), maxAttempts);
            text = "";
        }
        return turnCaptureApplicationService.captureDeferred(signal.withText(text));
    }

    private String awaitAgentText(Long agentId) {
        AgentEntity agent = agentRepository.findById(agentId);
        if (agent == null || !agent.hasTranscript()) {
            return null;
        }
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String text = transcriptSource.readLatestAgentText(agent.getTranscriptPath());
            if (StringUtils.isNotBlank(text)) {
                log.debug("Deferred completion text resolved. agentId={}, attempt={}", agentId, attempt);
                return text;
            }
            if (attempt < maxAttempts && !sleep(backoffMs * attempt)) {
                return null;
            }
        }
        return null;
    }

    private boolean sleep(long millis) {
        if (millis <= 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
