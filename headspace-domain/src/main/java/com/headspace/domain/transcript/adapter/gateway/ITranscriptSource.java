package com.headspace.domain.transcript.adapter.gateway;

import com.headspace.domain.transcript.model.valobj.TranscriptChunk;

/**
 * 权威转录日志读取端口。
 */
public interface ITranscriptSource {

    /**
     * 从字节偏移处读取完整的新行；末尾未写完的行留待下次读取。
     */
    TranscriptChunk readFrom(String transcriptPath, long position);

    /**
     * 读取最后一条 Agent 文本，没有时返回 null。
     */
    String readLatestAgentText(String transcriptPath);
}
