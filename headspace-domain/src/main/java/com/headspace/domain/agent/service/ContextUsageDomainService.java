package com.headspace.domain.agent.service;

import com.headspace.domain.agent.model.valobj.ContextUsage;
import org.springframework.stereotype.Service;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 从面板状态栏文本解析上下文窗口用量，例如 "[ctx: 45% used, 110k remaining]"。
 */
@Service
public class ContextUsageDomainService {

    private static final Pattern ANSI_ESCAPE = Pattern.compile("\\x1b\\[[0-9;]*[A-Za-z]");
    private static final Pattern CONTEXT_PATTERN =
            Pattern.compile("\\[ctx:\\s*(\\d+)%\\s*used,\\s*(\\d+\\.?\\d*[kKmM]?)\\s*remaining]");
    private static final int TAIL_LINES = 5;

    public ContextUsage parse(String paneText) {
        if (paneText == null || paneText.isBlank()) {
            return null;
        }
        String[] lines = stripAnsi(paneText).split("\n");
        int from = Math.max(0, lines.length - TAIL_LINES);
        for (int i = lines.length - 1; i >= from; i--) {
            Matcher matcher = CONTEXT_PATTERN.matcher(lines[i]);
            if (matcher.find()) {
                int percent = Integer.parseInt(matcher.group(1));
                return new ContextUsage(percent, matcher.group(2));
            }
        }
        return null;
    }

    public String stripAnsi(String text) {
        return text == null ? null : ANSI_ESCAPE.matcher(text).replaceAll("");
    }
}
