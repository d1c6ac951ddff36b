package com.headspace.infrastructure.tmux;

import com.headspace.domain.agent.adapter.gateway.IPaneSampler;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * 通过 tmux 命令行抓取面板内容。面板不存在或命令失败时返回 null，由调用方按“不可用”处理。
 */
@Slf4j
@Component
public class TmuxPaneSampler implements IPaneSampler {

    private final String tmuxBinary;
    private final long commandTimeoutMs;

    public TmuxPaneSampler(@Value("${watchdog.tmux-binary:tmux}") String tmuxBinary,
                           @Value("${watchdog.command-timeout-ms:2000}") long commandTimeoutMs) {
        this.tmuxBinary = StringUtils.defaultIfBlank(tmuxBinary, "tmux");
        this.commandTimeoutMs = commandTimeoutMs > 0 ? commandTimeoutMs : 2000L;
    }

    @Override
    public String capturePane(String paneId, int lines) {
        if (StringUtils.isBlank(paneId) || lines <= 0) {
            return null;
        }
        CommandResult result = run(List.of(tmuxBinary, "capture-pane", "-t", paneId, "-p", "-S", "-" + lines));
        return result.success() ? result.output() : null;
    }

    @Override
    public boolean isPaneAlive(String paneId) {
        if (StringUtils.isBlank(paneId)) {
            return false;
        }
        CommandResult result = run(List.of(tmuxBinary, "display-message", "-p", "-t", paneId, "#{pane_id}"));
        return result.success() && StringUtils.isNotBlank(result.output());
    }

    private CommandResult run(List<String> command) {
        ProcessBuilder builder = new ProcessBuilder(command);
        builder.redirectErrorStream(true);
        Process process;
        try {
            process = builder.start();
        } catch (IOException ex) {
            log.debug("tmux spawn failed. command={}, error={}", command, ex.getMessage());
            return CommandResult.failed();
        }
        try {
            process.getOutputStream().close();
            boolean finished = process.waitFor(commandTimeoutMs, TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(1, TimeUnit.SECONDS);
                log.debug("tmux command timed out. command={}, timeoutMs={}", command, commandTimeoutMs);
                return CommandResult.failed();
            }
            String output = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
            if (process.exitValue() != 0) {
                log.debug("tmux command failed. command={}, exit={}, output={}", command, process.exitValue(), output.strip());
                return CommandResult.failed();
            }
            return new CommandResult(true, output);
        } catch (InterruptedException ex) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            return CommandResult.failed();
        } catch (IOException ex) {
            process.destroyForcibly();
            log.debug("tmux output read failed. command={}, error={}", command, ex.getMessage());
            return CommandResult.failed();
        }
    }

    private record CommandResult(boolean success, String output) {

        private static CommandResult failed() {
            return new CommandResult(false, null);
        }
    }
}
