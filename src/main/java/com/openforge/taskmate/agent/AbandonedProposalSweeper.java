package com.openforge.taskmate.agent;

import com.openforge.taskmate.config.OrchestratorProperties;
import com.openforge.taskmate.domain.ToolCallRecord;
import com.openforge.taskmate.repository.ToolCallRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Periodically cancels proposals nobody confirmed within the confirmation
 * window.  Safe to run on every instance at once: each record is re-checked
 * under its row lock before it is touched.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AbandonedProposalSweeper {

    private final ToolCallRecordRepository repository;
    private final ToolCallExecutor         executor;
    private final OrchestratorProperties   properties;

    @Scheduled(fixedDelayString = "${taskmate.orchestrator.sweep-interval-ms:60000}",
               initialDelayString = "${taskmate.orchestrator.sweep-interval-ms:60000}")
    public void sweep() {
        LocalDateTime cutoff = LocalDateTime.now().minus(properties.confirmationWindow());
        List<ToolCallRecord> stale = repository.findByStatusAndCreateTimeBefore(ToolCallRecord.Status.PROPOSED, cutoff);
        if (stale.isEmpty()) return;

        int abandoned = 0;
        for (ToolCallRecord record : stale) {
            if (executor.abandon(record.getId())) {
                abandoned++;
            }
        }
        log.warn("[Sweeper] Abandoned {} of {} unconfirmed tool calls older than {}",
                abandoned, stale.size(), properties.confirmationWindow());
    }
}
