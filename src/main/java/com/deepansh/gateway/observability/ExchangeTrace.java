package com.deepansh.gateway.observability;

import com.deepansh.gateway.model.ToolResult;
import com.deepansh.gateway.model.Usage;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Mutable per-exchange record of what happened: model turns, token usage and
 * tool latencies. Created when an exchange starts and logged as one summary
 * line when it ends.
 *
 * Kept separate from the conversation so observability concerns don't bleed
 * into the orchestration loop.
 */
@Data
@Slf4j
public class ExchangeTrace {

    private final String exchangeId;
    private final String model;
    private final long startTimeMs = System.currentTimeMillis();
    private final List<ToolCallRecord> toolCallRecords = Collections.synchronizedList(new ArrayList<>());

    private int modelTurns;
    private int promptTokens;
    private int completionTokens;

    public void recordModelTurn() {
        modelTurns++;
    }

    public void recordToolResult(ToolResult result) {
        toolCallRecords.add(new ToolCallRecord(
                result.getName(),
                result.getExecutionTimeMs(),
                result.getError() == null ? null : result.getError().type().code()));
    }

    public void addUsage(Usage usage) {
        if (usage == null) {
            return;
        }
        this.promptTokens += usage.promptTokens();
        this.completionTokens += usage.completionTokens();
    }

    public long elapsedMs() {
        return System.currentTimeMillis() - startTimeMs;
    }

    public int totalTokens() {
        return promptTokens + completionTokens;
    }

    /** One line per exchange; the single place exchange outcomes are logged. */
    public void logSummary(String outcome, Throwable failure) {
        if (failure == null) {
            log.info("Exchange {} [id={}, model={}, turns={}, tools={}, tokens={}, latency={}ms]",
                    outcome, exchangeId, model, modelTurns, describeTools(), totalTokens(), elapsedMs());
        } else {
            log.error("Exchange {} [id={}, model={}, turns={}, tools={}, tokens={}, latency={}ms]: {}",
                    outcome, exchangeId, model, modelTurns, describeTools(), totalTokens(), elapsedMs(),
                    failure.getMessage());
        }
    }

    private String describeTools() {
        synchronized (toolCallRecords) {
            return toolCallRecords.stream()
                    .map(r -> r.toolName() + ":" + r.latencyMs() + "ms" + (r.errorType() == null ? "" : "!" + r.errorType()))
                    .toList()
                    .toString();
        }
    }

    public record ToolCallRecord(
            String toolName,
            long latencyMs,
            String errorType
    ) {}
}
