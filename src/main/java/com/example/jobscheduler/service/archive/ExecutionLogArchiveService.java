package com.example.jobscheduler.service.archive;

import com.example.jobscheduler.domain.repository.JobExecutionLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * Moves terminal execution logs into the history table.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExecutionLogArchiveService {

    private final JobExecutionLogRepository executionLogRepository;

    /**
     * Archive one batch of logs that ended before the cutoff. Copy and delete commit together.
     *
     * @return number of logs moved; 0 when nothing is left to archive
     */
    @Transactional
    public int archiveBatch(Instant cutoff, int batchSize) {
        var ids = executionLogRepository.findArchivableIds(cutoff, PageRequest.of(0, batchSize));
        if (ids.isEmpty()) {
            return 0;
        }

        var copied = executionLogRepository.copyToHistory(ids, Instant.now());
        var deleted = executionLogRepository.deleteByIds(ids);
        if (copied != deleted) {
            log.warn("Archive batch copied {} but deleted {} logs; {} were already in history", copied, deleted, deleted - copied);
        }
        log.debug("Archived {} execution logs ended before {}", deleted, cutoff);
        return deleted;
    }
}
