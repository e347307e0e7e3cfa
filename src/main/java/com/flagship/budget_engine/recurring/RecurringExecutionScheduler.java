package com.flagship.budget_engine.recurring;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * In-process trigger for recurring batches.
 *
 * Disabled unless {@code budget-engine.recurring.scheduler.enabled=true}; hosts with their
 * own job scheduler call {@link RecurringExecutionService#runDueRecurring} directly.
 * Running more than one enabled replica executes due series more than once.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(name = "budget-engine.recurring.scheduler.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class RecurringExecutionScheduler {

    private final RecurringExecutionService executionService;

    @Scheduled(cron = "${budget-engine.recurring.scheduler.cron:0 0 * * * *}")
    public void runDueSeries() {
        try {
            ExecutionResult result = executionService.runDueRecurring(ExecutionOptions.defaults());
            if (!result.getFailed().isEmpty()) {
                log.warn("Scheduled recurring batch had failures: runId={}, failed={}",
                        result.getRunId(), result.getSummary().getFailedExecutions());
            }
        } catch (Exception e) {
            log.error("Scheduled recurring batch aborted", e);
        }
    }
}
