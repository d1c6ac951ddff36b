package com.headspace.infrastructure.transcript;

import com.fasterxml.jackson.databind.JsonNode;
import com.headspace.domain.transcript.adapter.gateway.ITranscriptSource;
import com.headspace.domain.transcript.model.valobj.TranscriptChunk;
import com.headspace.domain.transcript.model.valobj.TranscriptEntry;
import com.headspace.infrastructure.util.JsonCodec;
import com.headspace.types.enums.ResponseCode;
import com.headspace.types.enums.TurnActorEnum;
import com.headspace.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * JSONL 转录日志读取：每行一个 JSON 对象，message.role 为发出方，
 * message.content 为字符串或 {type:"text", text} 块列表。
 */
@Slf4j
@Component
public class JsonlTranscriptSource implements ITranscriptSource {

    private static final int TAIL_BYTES = 64 * 1024;

    private final JsonCodec jsonCodec;
    private final int maxReadBytes;

    public JsonlTranscriptSource(JsonCodec jsonCodec,
                                 @Value("${reconciler.max-read-bytes:1048576}") int maxReadBytes) {
        this.jsonCodec = jsonCodec;
        this.maxReadBytes = maxReadBytes > 0 ? maxReadBytes : 1024 * 1024;
    }

    @Override
    public TranscriptChunk readFrom(String transcriptPath, long position) {
        Path path = resolve(transcriptPath);
        if (path == null) {
            return TranscriptChunk.empty(position);
        }
        try (RandomAccessFile file = new RandomAccessFile(path.toFile(), "r")) {
            long length = file.length();
            long start = position;
            if (start > length) {
                log.warn("Transcript shrank below read position, restarting from 0. path={}, position={}, length={}",
                        transcriptPath, position, length);
                start = 0L;
            }
            int toRead = (int) Math.min(length - start, maxReadBytes);
            if (toRead <= 0) {
                return TranscriptChunk.empty(start);
            }
            byte[] buffer = new byte[toRead];
            file.seek(start);
            file.readFully(buffer);
            int consumed = lastNewline(buffer) + 1;
            if (consumed <= 0) {
                if (toRead == maxReadBytes) {
                    log.warn("Transcript line exceeds read limit, skipping bytes. path={}, position={}, bytes={}",
                            transcriptPath, start, toRead);
                    return TranscriptChunk.empty(start + toRead);
                }
                return TranscriptChunk.empty(start);
            }
            String content = new String(buffer, 0, consumed, StandardCharsets.UTF_8);
            List<TranscriptEntry> entries = new ArrayList<>();
            for (String line : content.split("\n")) {
                TranscriptEntry entry = parseLine(line);
                if (entry != null) {
                    entries.add(entry);
                }
            }
            return new TranscriptChunk(entries, start + consumed);
        } catch (IOException ex) {
            throw new AppException(ResponseCode.UN_ERROR.getCode(), "Failed to read transcript: " + transcriptPath, ex);
        }
    }

    @Override
    public String readLatestAgentText(String transcriptPath) {
        Path path = resolve(transcriptPath);
        if (path == null) {
            return null;
        }
        List<String> lines = readTail(path);
        List<String> parts = new ArrayList<>();
        for (int i = lines.size() - 1; i >= 0; i--) {
            JsonNode node = parseNode(lines.get(i));
            if (node == null) {
                continue;
            }
            String type = node.path("type").asText("");
            if ("user".equals(type)) {
                if (hasAnyContent(node.path("message").path("content"))) {
                    break;
                }
                continue;
            }
            if (!"assistant".equals(type)) {
                continue;
            }
            String text = extractText(node.path("message").path("content"));
            if (StringUtils.isNotBlank(text)) {
                parts.add(text);
            }
        }
        if (parts.isEmpty()) {
            return null;
        }
        Collections.reverse(parts);
        return String.join("\n\n", parts);
    }

    TranscriptEntry parseLine(String line) {
        JsonNode node = parseNode(line);
        if (node == null) {
            return null;
        }
        JsonNode message = node.path("message");
        TurnActorEnum actor = resolveActor(message.path("role").asText(node.path("type").asText("")));
        if (actor == null) {
            return null;
        }
        String text = extractText(message.path("content"));
        if (StringUtils.isBlank(text)) {
            return null;
        }
        return new TranscriptEntry(actor, text, parseTimestamp(node.path("timestamp").asText(null)));
    }

    private JsonNode parseNode(String line) {
        if (StringUtils.isBlank(line)) {
            return null;
        }
        try {
            return jsonCodec.readLine(line);
        } catch (AppException ex) {
            log.warn("Malformed JSON line in transcript, skipping. error={}", ex.getMessage());
            return null;
        }
    }

    private TurnActorEnum resolveActor(String role) {
        if ("user".equals(role)) {
            return TurnActorEnum.USER;
        }
        if ("assistant".equals(role)) {
            return TurnActorEnum.AGENT;
        }
        return null;
    }

    private String extractText(JsonNode content) {
        if (content == null || content.isMissingNode() || content.isNull()) {
            return null;
        }
        if (content.isTextual()) {
            return content.asText();
        }
        if (!content.isArray()) {
            return null;
        }
        List<String> parts = new ArrayList<>();
        for (JsonNode block : content) {
            if ("text".equals(block.path("type").asText()) && block.hasNonNull("text")) {
                parts.add(block.get("text").asText());
            }
        }
        return parts.isEmpty() ? null : String.join("\n", parts);
    }

    private boolean hasAnyContent(JsonNode content) {
        if (content == null || content.isMissingNode() || content.isNull()) {
            return false;
        }
        if (content.isTextual()) {
            return StringUtils.isNotBlank(content.asText());
        }
        return content.isArray() && content.size() > 0;
    }

    private LocalDateTime parseTimestamp(String value) {
        if (StringUtils.isBlank(value)) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).atZoneSameInstant(ZoneId.systemDefault()).toLocalDateTime();
        } catch (DateTimeParseException ex) {
            log.debug("Unparseable transcript timestamp. value={}, error={}", value, ex.getMessage());
            return null;
        }
    }

    private List<String> readTail(Path path) {
        try (RandomAccessFile file = new RandomAccessFile(path.toFile(), "r")) {
            long length = file.length();
            long start = Math.max(0L, length - TAIL_BYTES);
            byte[] buffer = new byte[(int) (length - start)];
            file.seek(start);
            file.readFully(buffer);
            String content = new String(buffer, StandardCharsets.UTF_8);
            List<String> lines = new ArrayList<>(List.of(content.split("\n")));
            if (start > 0 && !lines.isEmpty()) {
                lines.remove(0);
            }
            return lines;
        } catch (IOException ex) {
            throw new AppException(ResponseCode.UN_ERROR.getCode(), "Failed to read transcript: " + path, ex);
        }
    }

    private Path resolve(String transcriptPath) {
        if (StringUtils.isBlank(transcriptPath)) {
            return null;
        }
        Path path = Paths.get(transcriptPath);
        return Files.isRegularFile(path) ? path : null;
    }

    private int lastNewline(byte[] buffer) {
        for (int i = buffer.length - 1; i >= 0; i--) {
            if (buffer[i] == '\n') {
                return i;
            }
        }
        return -1;
    }
}
