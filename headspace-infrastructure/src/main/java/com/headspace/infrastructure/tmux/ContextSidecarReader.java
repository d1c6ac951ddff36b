package com.headspace.infrastructure.tmux;

import com.headspace.domain.agent.adapter.gateway.IContextUsageSidecar;
import com.headspace.domain.agent.model.valobj.ContextUsage;
import com.headspace.infrastructure.util.JsonCodec;
import com.headspace.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * 读取状态栏脚本写出的旁路文件 {sidecar-dir}/{面板编号}，内容为 {"percent_used": 45, "remaining_tokens": "110k"}。
 */
@Slf4j
@Component
public class ContextSidecarReader implements IContextUsageSidecar {

    private final JsonCodec jsonCodec;
    private final Path sidecarDir;

    public ContextSidecarReader(JsonCodec jsonCodec,
                                @Value("${context-poller.sidecar-dir:/tmp/claude_headspace_ctx}") String sidecarDir) {
        this.jsonCodec = jsonCodec;
        this.sidecarDir = Paths.get(StringUtils.defaultIfBlank(sidecarDir, "/tmp/claude_headspace_ctx"));
    }

    @Override
    public ContextUsage read(String paneId, Duration maxAge) {
        if (StringUtils.isBlank(paneId)) {
            return null;
        }
        Path file = sidecarDir.resolve(StringUtils.remove(paneId, '%'));
        if (!Files.isRegularFile(file)) {
            return null;
        }
        try {
            Instant modifiedAt = Files.getLastModifiedTime(file).toInstant();
            if (maxAge != null && modifiedAt.isBefore(Instant.now().minus(maxAge))) {
                return null;
            }
            Map<String, Object> data = jsonCodec.readObject(Files.readString(file, StandardCharsets.UTF_8));
            if (data == null || !(data.get("percent_used") instanceof Number percent)) {
                return null;
            }
            Object remaining = data.get("remaining_tokens");
            return new ContextUsage(percent.intValue(), remaining == null ? null : String.valueOf(remaining));
        } catch (IOException | AppException ex) {
            log.debug("Context sidecar unreadable. file={}, error={}", file, ex.getMessage());
            return null;
        }
    }
}
