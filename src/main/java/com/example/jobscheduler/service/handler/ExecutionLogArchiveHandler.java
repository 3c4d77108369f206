package com.example.jobscheduler.service.handler;

import com.example.jobscheduler.exception.JobHandlerException;
import com.example.jobscheduler.service.archive.ExecutionLogArchiveService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Handler for "execution-log-archive" jobs.
 * <p>
 * Moves terminal execution logs older than the retention window into the history
 * table, batch by batch, until none are left or the record cap is reached.
 * <p>
 * Expected parameters (all optional, clamped to their ranges):
 * - retentionDays: 30, 1..365
 * - batchSize: 1000, 100..10000
 * - maxRecords: 100000, 1000..1000000
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExecutionLogArchiveHandler implements JobHandler {

    public static final String HANDLER_TYPE = "execution-log-archive";

    private final ExecutionLogArchiveService archiveService;
    private final ObjectMapper objectMapper;

    @Override
    public String getHandlerType() {
        return HANDLER_TYPE;
    }

    @Override
    public String execute(String parameters) throws InterruptedException {
        var params = parse(parameters);
        var retentionDays = clamp(params, "retentionDays", 30, 1, 365);
        var batchSize = clamp(params, "batchSize", 1000, 100, 10_000);
        var maxRecords = clamp(params, "maxRecords", 100_000, 1000, 1_000_000);

        var cutoff = Instant.now().minus(Duration.ofDays(retentionDays));
        log.info("Archiving execution logs ended before {} (batch: {}, max: {})", cutoff, batchSize, maxRecords);

        var total = 0;
        var batches = 0;
        while (total < maxRecords) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("Archive interrupted after " + total + " records");
            }
            var moved = archiveService.archiveBatch(cutoff, Math.min(batchSize, maxRecords - total));
            if (moved == 0) {
                break;
            }
            total += moved;
            batches++;
        }

        log.info("Archived {} execution logs in {} batch(es)", total, batches);
        return String.format("Archived %d execution logs older than %d days in %d batch(es)", total, retentionDays, batches);
    }

    static int clamp(JsonNode params, String field, int defaultValue, int min, int max) {
        var node = params.get(field);
        var value = node != null && node.canConvertToInt() ? node.asInt() : defaultValue;
        return Math.max(min, Math.min(max, value));
    }

    private JsonNode parse(String parameters) {
        try {
            var node = objectMapper.readTree(parameters == null || parameters.isBlank() ? "{}" : parameters);
            return node.isObject() ? node : objectMapper.createObjectNode();
        } catch (JsonProcessingException e) {
            throw new JobHandlerException(HANDLER_TYPE, "Invalid parameters: " + e.getOriginalMessage(), e, false);
        }
    }
}
