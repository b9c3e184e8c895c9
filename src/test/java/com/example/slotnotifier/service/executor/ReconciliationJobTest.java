package com.example.slotnotifier.service.executor;

import com.example.slotnotifier.config.SlotNotifierProperties;
import com.example.slotnotifier.dto.ReconcileResult;
import com.example.slotnotifier.exception.ExternalServiceException;
import com.example.slotnotifier.service.NotificationScheduleService;
import com.example.slotnotifier.service.alert.SlackAlertService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ReconciliationJob Tests")
class ReconciliationJobTest {

    @Mock
    private NotificationScheduleService scheduleService;

    @Mock
    private SlackAlertService slackAlertService;

    private SlotNotifierProperties properties;
    private ReconciliationJob reconciliationJob;

    @BeforeEach
    void setUp() {
        properties = new SlotNotifierProperties();
        reconciliationJob = new ReconciliationJob(scheduleService, slackAlertService, properties);
    }

    @Test
    @DisplayName("Should rebuild jobs at start-up")
    void shouldReconcileOnStartup() {
        when(scheduleService.reconcileFromSource()).thenReturn(ReconcileResult.builder().totalRecords(2).scheduled(2).build());

        reconciliationJob.reconcileOnStartup();

        verify(scheduleService).reconcileFromSource();
        verifyNoInteractions(slackAlertService);
    }

    @Test
    @DisplayName("Should skip start-up reconciliation when disabled")
    void shouldSkipWhenDisabled() {
        properties.setReconcileOnStartup(false);

        reconciliationJob.reconcileOnStartup();

        verifyNoInteractions(scheduleService);
    }

    @Test
    @DisplayName("Should alert when the preference source cannot be read")
    void shouldAlertOnFailure() {
        when(scheduleService.reconcileFromSource()).thenThrow(new ExternalServiceException("record-store", 503, "unavailable"));

        reconciliationJob.reconcilePeriodically();

        verify(slackAlertService).sendErrorAlert(eq("Preference reconciliation failed"), anyString(), anyString());
    }
}
