package com.chambua.standings.controller;

import com.chambua.standings.config.StandingsProperties;
import com.chambua.standings.exception.QueueOverloadException;
import com.chambua.standings.exception.SnapshotCorruptedException;
import com.chambua.standings.exception.SnapshotNotFoundException;
import com.chambua.standings.exception.TransientStoreException;
import com.chambua.standings.model.AdminAudit;
import com.chambua.standings.queue.CalculationJobQueue;
import com.chambua.standings.queue.JobClaim;
import com.chambua.standings.queue.JobPriority;
import com.chambua.standings.queue.RetryPolicy;
import com.chambua.standings.repository.AdminAuditRepository;
import com.chambua.standings.service.StandingsTriggerService;
import com.chambua.standings.snapshot.SnapshotService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.hamcrest.Matchers.is;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = StandingsAdminController.class)
@ActiveProfiles("test")
class StandingsAdminControllerTest {

    @TestConfiguration
    static class QueueConfig {
        @Bean
        Clock clock() {
            return Clock.fixed(Instant.parse("2024-08-01T12:00:00Z"), ZoneOffset.UTC);
        }

        @Bean
        CalculationJobQueue calculationJobQueue(Clock clock) {
            return new CalculationJobQueue(new StandingsProperties(),
                    RetryPolicy.withoutJitter(3, Duration.ofMillis(1000), Duration.ofMillis(30000)), clock);
        }
    }

    @Autowired private MockMvc mockMvc;
    @Autowired private CalculationJobQueue queue;

    @MockBean private StandingsTriggerService triggerService;
    @MockBean private SnapshotService snapshotService;
    @MockBean private AdminAuditRepository adminAuditRepository;

    @AfterEach
    void tearDown() {
        queue.resume();
        queue.clearPending();
    }

    @Test
    void recalculateAcceptsAndAudits() throws Exception {
        when(triggerService.requestRecalculation(eq(1L), eq(2L), eq(JobPriority.HIGH), eq("manual"), any()))
                .thenReturn("job-1");

        mockMvc.perform(post("/api/admin/standings/recalculate")
                        .header("X-User-Id", "ops-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"leagueId\":1,\"seasonId\":2,\"priority\":\"high\"}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.success", is(true)))
                .andExpect(jsonPath("$.jobId", is("job-1")));

        verify(adminAuditRepository).save(argThat((AdminAudit a) ->
                a.getAction().equals("recalculate") && a.getUserId().equals("ops-1")));
    }

    @Test
    void seasonOutsideLeagueIsRejectedAsBadInput() throws Exception {
        when(triggerService.requestRecalculation(any(), any(), any(), anyString(), any()))
                .thenThrow(new IllegalArgumentException("Season 9 does not belong to league 1"));

        mockMvc.perform(post("/api/admin/standings/recalculate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"leagueId\":1,\"seasonId\":9}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code", is("INVALID_REQUEST")))
                .andExpect(jsonPath("$.category", is("FIX_INPUT")));
    }

    @Test
    void malformedBodyIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/admin/standings/recalculate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code", is("INVALID_REQUEST")));
    }

    @Test
    void overloadedQueueAsksCallerToRetryLater() throws Exception {
        when(triggerService.requestRecalculation(any(), any(), any(), anyString(), any()))
                .thenThrow(new QueueOverloadException(100));

        mockMvc.perform(post("/api/admin/standings/recalculate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"leagueId\":1,\"seasonId\":2}"))
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.code", is("QUEUE_OVERLOAD")))
                .andExpect(jsonPath("$.category", is("RETRY_LATER")));
    }

    @Test
    void unknownJobIsNotFound() throws Exception {
        mockMvc.perform(get("/api/admin/standings/queue/jobs/does-not-exist"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code", is("JOB_NOT_FOUND")));
    }

    @Test
    void cancelPendingJobThenCancellingAgainConflicts() throws Exception {
        String jobId = queue.enqueue(101L, 1L, JobPriority.NORMAL);

        mockMvc.perform(post("/api/admin/standings/queue/jobs/" + jobId + "/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.job.status", is("CANCELLED")));

        mockMvc.perform(post("/api/admin/standings/queue/jobs/" + jobId + "/cancel"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code", is("INVALID_JOB_STATE")));
    }

    @Test
    void retryRequeuesFailedJob() throws Exception {
        String jobId = queue.enqueue(102L, 1L, JobPriority.NORMAL);
        JobClaim claim = queue.dequeue().orElseThrow();
        queue.fail(claim.jobId(), claim.claimToken(), "bad data", false);

        mockMvc.perform(post("/api/admin/standings/queue/jobs/" + jobId + "/retry"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.jobId", is(jobId)))
                .andExpect(jsonPath("$.merged", is(false)));

        mockMvc.perform(get("/api/admin/standings/queue/jobs/" + jobId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status", is("PENDING")))
                .andExpect(jsonPath("$.attempts", is(0)));
        verify(triggerService).dispatchNow();
    }

    @Test
    void pauseIsVisibleInQueueStatus() throws Exception {
        queue.enqueue(103L, 1L, JobPriority.NORMAL);

        mockMvc.perform(post("/api/admin/standings/queue/pause").param("cancelPending", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.isPaused", is(true)))
                .andExpect(jsonPath("$.cancelledJobs", is(1)));

        mockMvc.perform(get("/api/admin/standings/queue"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.isPaused", is(true)))
                .andExpect(jsonPath("$.queueLength", is(0)));
    }

    @Test
    void auditFailureDoesNotFailTheAction() throws Exception {
        when(adminAuditRepository.save(any())).thenThrow(new DataAccessResourceFailureException("audit table gone"));

        mockMvc.perform(post("/api/admin/standings/queue/clear"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success", is(true)));
    }

    @Test
    void createSnapshotDefaultsCreatorAndDescription() throws Exception {
        when(snapshotService.snapshot(1L, 2L, "Manual snapshot", "admin")).thenReturn(42L);

        mockMvc.perform(post("/api/admin/standings/snapshots")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"leagueId\":1,\"seasonId\":2}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.snapshotId", is(42)));
    }

    @Test
    void restoreReportsEntriesRestored() throws Exception {
        when(snapshotService.rollback(42L)).thenReturn(20);

        mockMvc.perform(post("/api/admin/standings/snapshots/42/restore").header("X-User-Id", "ops-2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.restoredEntries", is(20)));

        verify(adminAuditRepository).save(argThat((AdminAudit a) ->
                a.getAction().equals("restore") && a.getAffectedCount() == 20L));
    }

    @Test
    void snapshotErrorsMapToTheirStatus() throws Exception {
        when(snapshotService.rollback(1L)).thenThrow(new SnapshotNotFoundException(1L));
        when(snapshotService.rollback(2L)).thenThrow(new SnapshotCorruptedException(2L, "checksum mismatch"));
        when(snapshotService.rollback(3L)).thenThrow(new TransientStoreException("database unavailable"));

        mockMvc.perform(post("/api/admin/standings/snapshots/1/restore"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code", is("SNAPSHOT_NOT_FOUND")));
        mockMvc.perform(post("/api/admin/standings/snapshots/2/restore"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code", is("SNAPSHOT_CORRUPTED")))
                .andExpect(jsonPath("$.category", is("CONTACT_OPERATOR")));
        mockMvc.perform(post("/api/admin/standings/snapshots/3/restore"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code", is("STORE_UNAVAILABLE")))
                .andExpect(jsonPath("$.category", is("RETRY_LATER")));
    }

    @Test
    void nonNumericSnapshotIdIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/admin/standings/snapshots/abc"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code", is("INVALID_REQUEST")));
    }
}
