package com.flagship.budget_engine.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.ZoneId;

/**
 * Engine configuration bound from {@code budget-engine.*}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "budget-engine")
public class BudgetEngineProperties {

    /**
     * Time zone used to turn calendar days into instants (period windows, due dates).
     */
    @NotBlank
    private String zone = "UTC";

    /**
     * Reserved category marking transfers between a user's own accounts.
     */
    @NotBlank
    private String transferCategory = "trasferimento";

    @Valid
    private Recurring recurring = new Recurring();

    public ZoneId zoneId() {
        return ZoneId.of(zone);
    }

    @Data
    public static class Recurring {

        /**
         * Series overdue by more than this many days are skipped instead of backfilled.
         */
        @Min(0)
        private int maxDaysOverdue = 7;

        @Valid
        private Scheduler scheduler = new Scheduler();
    }

    @Data
    public static class Scheduler {

        /**
         * Runs due series periodically from inside the host. Off by default: the host's own
         * scheduler normally owns this trigger.
         */
        private boolean enabled = false;

        private String cron = "0 0 * * * *";
    }
}
