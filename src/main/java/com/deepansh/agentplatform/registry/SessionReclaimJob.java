package com.deepansh.agentplatform.registry;

import com.deepansh.agentplatform.registry.report.ReclaimReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Keeps the process under its session ceiling by reclaiming the least
 * recently active sessions on a fixed delay.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SessionReclaimJob {

    private final AgentRegistry registry;

    @Scheduled(initialDelayString = "${platform.lifecycle.reclaim-interval:PT1M}",
            fixedDelayString = "${platform.lifecycle.reclaim-interval:PT1M}")
    public void reclaim() {
        ReclaimReport report = registry.reclaimIfOverCapacity();
        if (report.getSessionsReclaimed() > 0 || !report.getErrors().isEmpty()) {
            log.warn("Reclaimed idle sessions [before={}, reclaimed={}, agents={}, errors={}]",
                    report.getSessionsBefore(), report.getSessionsReclaimed(),
                    report.getAgentsReclaimed(), report.getErrors().size());
        }
    }
}
