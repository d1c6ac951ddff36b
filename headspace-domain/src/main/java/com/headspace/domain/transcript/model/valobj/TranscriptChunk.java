package com.headspace.domain.transcript.model.valobj;

import java.util.Collections;
import java.util.List;

/**
 * 一次增量读取的结果：新记录与读取后的字节偏移。
 */
public record TranscriptChunk(List<TranscriptEntry> entries, long nextPosition) {

    public static TranscriptChunk empty(long position) {
        return new TranscriptChunk(Collections.emptyList(), position);
    }

    public boolean isEmpty() {
        return entries == null || entries.isEmpty();
    }
}
