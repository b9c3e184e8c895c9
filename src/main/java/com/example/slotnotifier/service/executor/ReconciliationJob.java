package com.example.slotnotifier.service.executor;

import com.example.slotnotifier.config.SlotNotifierProperties;
import com.example.slotnotifier.service.NotificationScheduleService;
import com.example.slotnotifier.service.alert.SlackAlertService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Keeps the job store in line with the preference source: once at start-up
 * and then periodically, so edits made directly in the sheet are picked up.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReconciliationJob {

    private final NotificationScheduleService scheduleService;
    private final SlackAlertService slackAlertService;
    private final SlotNotifierProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void reconcileOnStartup() {
        if (!properties.isReconcileOnStartup()) {
            log.info("Start-up reconciliation disabled");
            return;
        }
        reconcile("startup");
    }

    @Scheduled(fixedDelayString = "${slot-notifier.reconcile-interval-ms:3600000}",
            initialDelayString = "${slot-notifier.reconcile-interval-ms:3600000}")
    @SchedulerLock(name = "preferenceReconcile", lockAtLeastFor = "30s", lockAtMostFor = "15m")
    public void reconcilePeriodically() {
        reconcile("periodic");
    }

    private void reconcile(String trigger) {
        try {
            var result = scheduleService.reconcileFromSource();
            log.info("{} reconciliation done: {} of {} records scheduled, {} orphan job(s) removed",
                    trigger, result.getScheduled(), result.getTotalRecords(), result.getRemoved());
        } catch (Exception e) {
            log.error("{} reconciliation failed: {}", trigger, e.getMessage(), e);
            slackAlertService.sendErrorAlert("Preference reconciliation failed",
                    "Jobs could not be rebuilt from the preference source (" + trigger + ")", e.getMessage());
        }
    }
}
