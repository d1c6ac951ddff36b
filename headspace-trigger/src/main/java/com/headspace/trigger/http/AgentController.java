package com.headspace.trigger.http;

import com.headspace.api.dto.AgentRegisterRequestDTO;
import com.headspace.api.dto.AgentSummaryDTO;
import com.headspace.api.dto.TurnCaptureResponseDTO;
import com.headspace.api.dto.TurnDTO;
import com.headspace.api.dto.TurnSignalRequestDTO;
import com.headspace.api.response.Response;
import com.headspace.domain.agent.adapter.repository.IAgentRepository;
import com.headspace.domain.agent.model.entity.AgentEntity;
import com.headspace.domain.task.adapter.repository.IAgentTaskRepository;
import com.headspace.domain.task.model.entity.AgentTaskEntity;
import com.headspace.domain.turn.adapter.repository.ITurnRepository;
import com.headspace.domain.turn.model.entity.TurnEntity;
import com.headspace.trigger.application.command.AgentSessionApplicationService;
import com.headspace.trigger.application.command.DeferredCompletionApplicationService;
import com.headspace.trigger.application.command.TurnCaptureApplicationService;
import com.headspace.trigger.application.command.TurnSignal;
import com.headspace.types.enums.ResponseCode;
import com.headspace.types.enums.TurnActorEnum;
import com.headspace.types.enums.TurnIntentEnum;
import com.headspace.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Agent 会话与回合信号 API。
 */
@Slf4j
@RestController
@RequestMapping("/api/agents")
public class AgentController {

    private static final int DEFAULT_TURN_LIMIT = 100;
    private static final int MAX_TURN_LIMIT = 1000;
    private static final String OUTCOME_DEFERRED = "DEFERRED";

    private final TurnCaptureApplicationService turnCaptureApplicationService;
    private final DeferredCompletionApplicationService deferredCompletionApplicationService;
    private final AgentSessionApplicationService agentSessionApplicationService;
    private final IAgentRepository agentRepository;
    private final IAgentTaskRepository agentTaskRepository;
    private final ITurnRepository turnRepository;

    public AgentController(TurnCaptureApplicationService turnCaptureApplicationService,
                           DeferredCompletionApplicationService deferredCompletionApplicationService,
                           AgentSessionApplicationService agentSessionApplicationService,
                           IAgentRepository agentRepository,
                           IAgentTaskRepository agentTaskRepository,
                           ITurnRepository turnRepository) {
        this.turnCaptureApplicationService = turnCaptureApplicationService;
        this.deferredCompletionApplicationService = deferredCompletionApplicationService;
        this.agentSessionApplicationService = agentSessionApplicationService;
        this.agentRepository = agentRepository;
        this.agentTaskRepository = agentTaskRepository;
        this.turnRepository = turnRepository;
    }

    @PostMapping
    public Response<AgentSummaryDTO> register(@RequestBody AgentRegisterRequestDTO request) {
        if (request == null || StringUtils.isBlank(request.getSessionUuid())) {
            return illegal("sessionUuid不能为空");
        }
        AgentEntity agent = agentSessionApplicationService.register(request.getSessionUuid(),
                request.getTranscriptPath(), request.getTmuxPaneId());
        return success(toSummary(agent));
    }

    @GetMapping("/{agentId}")
    public Response<AgentSummaryDTO> getAgent(@PathVariable("agentId") Long agentId) {
        AgentEntity agent = agentRepository.findById(agentId);
        if (agent == null) {
            return Response.<AgentSummaryDTO>builder()
                    .code(ResponseCode.NOT_FOUND.getCode())
                    .info("Agent不存在")
                    .build();
        }
        return success(toSummary(agent));
    }

    /**
     * 回合信号入口。被状态机拒绝时回合仍已保存，响应码为 INVALID_TRANSITION 并带回 turnId。
     */
    @PostMapping("/{agentId}/turns")
    public Response<TurnCaptureResponseDTO> captureTurn(@PathVariable("agentId") Long agentId,
                                                        @RequestBody TurnSignalRequestDTO request) {
        if (request == null) {
            return illegal("请求不能为空");
        }
        TurnActorEnum actor = parseEnum(TurnActorEnum.class, request.getActor(), "actor");
        TurnIntentEnum intent = parseEnum(TurnIntentEnum.class, request.getIntent(), "intent");
        LocalDateTime receiptTime = request.getReceiptTime() == null ? LocalDateTime.now() : request.getReceiptTime();
        TurnSignal signal = new TurnSignal(agentId, actor, intent, request.getText(), receiptTime);

        if (Boolean.TRUE.equals(request.getDeferred()) && StringUtils.isBlank(request.getText())) {
            deferredCompletionApplicationService.submit(signal);
            TurnCaptureResponseDTO dto = new TurnCaptureResponseDTO();
            dto.setAgentId(agentId);
            dto.setOutcome(OUTCOME_DEFERRED);
            return success(dto);
        }

        TurnCaptureApplicationService.TurnCaptureResult result = turnCaptureApplicationService.capture(signal);
        TurnCaptureResponseDTO dto = toCaptureResponse(result);
        if (!result.isApplied()) {
            return Response.<TurnCaptureResponseDTO>builder()
                    .code(ResponseCode.INVALID_TRANSITION.getCode())
                    .info(StringUtils.defaultIfBlank(result.reason(), ResponseCode.INVALID_TRANSITION.getInfo()))
                    .data(dto)
                    .build();
        }
        return success(dto);
    }

    @PostMapping("/{agentId}/end")
    public Response<AgentSummaryDTO> endSession(@PathVariable("agentId") Long agentId) {
        agentSessionApplicationService.end(agentId);
        return success(toSummary(agentRepository.findById(agentId)));
    }

    @GetMapping("/{agentId}/turns")
    public Response<List<TurnDTO>> listTurns(@PathVariable("agentId") Long agentId,
                                             @RequestParam(value = "limit", required = false) Integer limit) {
        int normalizedLimit = limit == null || limit <= 0 ? DEFAULT_TURN_LIMIT : Math.min(limit, MAX_TURN_LIMIT);
        List<TurnEntity> turns = turnRepository.findByAgentId(agentId, normalizedLimit);
        List<TurnDTO> result = new ArrayList<>(turns.size());
        for (TurnEntity turn : turns) {
            result.add(toTurnDTO(turn));
        }
        return success(result);
    }

    private <E extends Enum<E>> E parseEnum(Class<E> type, String value, String field) {
        if (StringUtils.isBlank(value)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), field + "不能为空");
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "不支持的" + field + ": " + value);
        }
    }

    private AgentSummaryDTO toSummary(AgentEntity agent) {
        if (agent == null) {
            return null;
        }
        AgentSummaryDTO dto = new AgentSummaryDTO();
        dto.setId(agent.getId());
        dto.setSessionUuid(agent.getSessionUuid());
        dto.setTranscriptPath(agent.getTranscriptPath());
        dto.setTmuxPaneId(agent.getTmuxPaneId());
        dto.setContextPercentUsed(agent.getContextPercentUsed());
        dto.setContextRemainingTokens(agent.getContextRemainingTokens());
        dto.setStartedAt(agent.getStartedAt());
        dto.setLastSeenAt(agent.getLastSeenAt());
        dto.setEndedAt(agent.getEndedAt());
        AgentTaskEntity active = agentTaskRepository.findActiveByAgentId(agent.getId());
        if (active != null) {
            dto.setActiveTaskId(active.getId());
            dto.setActiveTaskState(active.getState() == null ? null : active.getState().name());
        }
        return dto;
    }

    private TurnCaptureResponseDTO toCaptureResponse(TurnCaptureApplicationService.TurnCaptureResult result) {
        TurnCaptureResponseDTO dto = new TurnCaptureResponseDTO();
        dto.setAgentId(result.agentId());
        dto.setTaskId(result.taskId());
        dto.setTurnId(result.turnId());
        dto.setOutcome(result.outcome().name());
        dto.setFromState(result.fromState() == null ? null : result.fromState().name());
        dto.setToState(result.toState() == null ? null : result.toState().name());
        dto.setTrigger(result.trigger());
        dto.setReason(result.reason());
        return dto;
    }

    private TurnDTO toTurnDTO(TurnEntity turn) {
        TurnDTO dto = new TurnDTO();
        dto.setId(turn.getId());
        dto.setAgentId(turn.getAgentId());
        dto.setTaskId(turn.getTaskId());
        dto.setActor(turn.getActor() == null ? null : turn.getActor().code());
        dto.setIntent(turn.getIntent() == null ? null : turn.getIntent().code());
        dto.setText(turn.getText());
        dto.setEventTime(turn.getEventTime());
        dto.setTimestampSource(turn.getTimestampSource() == null ? null : turn.getTimestampSource().name());
        dto.setCreatedAt(turn.getCreatedAt());
        return dto;
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }

    private <T> Response<T> illegal(String message) {
        return Response.<T>builder()
                .code(ResponseCode.ILLEGAL_PARAMETER.getCode())
                .info(message)
                .build();
    }
}
