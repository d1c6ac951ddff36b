package com.headspace.infrastructure.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.headspace.types.enums.ResponseCode;
import com.headspace.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.Map;

/**
 * JSON 编解码：事件载荷（JSONB）、转录日志行、旁路文件。
 * <p>
 * 解析失败统一抛出 {@link AppException}，由调用方决定跳过还是上抛。
 * </p>
 */
@Component
public class JsonCodec {

    private static final String EMPTY_OBJECT = "{}";

    private final ObjectMapper objectMapper;

    public JsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * 解析单行 JSONL 记录；空行返回 null。
     */
    public JsonNode readLine(String line) {
        if (StringUtils.isBlank(line)) {
            return null;
        }
        try {
            return objectMapper.readTree(line.trim());
        } catch (JsonProcessingException ex) {
            throw new AppException(ResponseCode.UN_ERROR.getCode(), "Malformed json line: " + ex.getOriginalMessage(), ex);
        }
    }

    /**
     * 解析 JSON 对象为 Map；空串返回 null，非对象（数组、标量）返回空 Map。
     */
    public Map<String, Object> readObject(String json) {
        JsonNode node = readLine(json);
        if (node == null) {
            return null;
        }
        if (!(node instanceof ObjectNode)) {
            return Collections.emptyMap();
        }
        return objectMapper.convertValue(node, objectMapper.getTypeFactory()
                .constructMapType(Map.class, String.class, Object.class));
    }

    public String writeEventData(Map<String, ?> eventData) {
        if (eventData == null || eventData.isEmpty()) {
            return EMPTY_OBJECT;
        }
        try {
            return objectMapper.writeValueAsString(eventData);
        } catch (JsonProcessingException ex) {
            throw new AppException(ResponseCode.UN_ERROR.getCode(), "Failed to write event data", ex);
        }
    }
}
