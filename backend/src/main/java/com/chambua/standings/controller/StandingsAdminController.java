package com.chambua.standings.controller;

import com.chambua.standings.dto.JobSummaryDTO;
import com.chambua.standings.dto.QueueStatusDTO;
import com.chambua.standings.dto.RecalculationRequest;
import com.chambua.standings.dto.SnapshotDetailDTO;
import com.chambua.standings.dto.SnapshotRequest;
import com.chambua.standings.model.AdminAudit;
import com.chambua.standings.queue.CalculationJob;
import com.chambua.standings.queue.CalculationJobQueue;
import com.chambua.standings.queue.JobPriority;
import com.chambua.standings.repository.AdminAuditRepository;
import com.chambua.standings.service.StandingsTriggerService;
import com.chambua.standings.snapshot.SnapshotService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/admin/standings")
@CrossOrigin(origins = "*")
public class StandingsAdminController {

    private static final Logger log = LoggerFactory.getLogger(StandingsAdminController.class);
    private static final String USER_HEADER = "X-User-Id";

    private final StandingsTriggerService triggerService;
    private final CalculationJobQueue queue;
    private final SnapshotService snapshotService;
    private final AdminAuditRepository adminAuditRepository;
    private final Clock clock;

    public StandingsAdminController(StandingsTriggerService triggerService,
                                    CalculationJobQueue queue,
                                    SnapshotService snapshotService,
                                    AdminAuditRepository adminAuditRepository,
                                    Clock clock) {
        this.triggerService = triggerService;
        this.queue = queue;
        this.snapshotService = snapshotService;
        this.adminAuditRepository = adminAuditRepository;
        this.clock = clock;
    }

    @PostMapping("/recalculate")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Map<String, Object> recalculate(@RequestBody RecalculationRequest request,
                                           @RequestHeader(value = USER_HEADER, required = false) String userId) {
        JobPriority priority = JobPriority.parseOrDefault(request.getPriority(), JobPriority.NORMAL);
        String jobId = triggerService.requestRecalculation(request.getLeagueId(), request.getSeasonId(), priority,
                "manual", request.getDescription());
        audit("recalculate", userId, String.format("{\"leagueId\":%s,\"seasonId\":%s,\"priority\":\"%s\",\"jobId\":\"%s\"}",
                request.getLeagueId(), request.getSeasonId(), priority, jobId), 1L);
        Map<String, Object> resp = new LinkedHashMap<>();
        resp.put("success", true);
        resp.put("jobId", jobId);
        return resp;
    }

    @GetMapping("/queue")
    public QueueStatusDTO queueStatus() {
        return queue.getStatus();
    }

    @GetMapping("/queue/jobs/{jobId}")
    public JobSummaryDTO job(@PathVariable String jobId) {
        return JobSummaryDTO.from(queue.getJob(jobId), clock.instant());
    }

    @PostMapping("/queue/jobs/{jobId}/cancel")
    public Map<String, Object> cancel(@PathVariable String jobId,
                                      @RequestHeader(value = USER_HEADER, required = false) String userId) {
        queue.cancel(jobId);
        audit("cancel", userId, "{\"jobId\":\"" + jobId + "\"}", 1L);
        return jobResponse(queue.getJob(jobId), clock.instant());
    }

    @PostMapping("/queue/jobs/{jobId}/retry")
    public Map<String, Object> retry(@PathVariable String jobId,
                                     @RequestHeader(value = USER_HEADER, required = false) String userId) {
        String activeId = queue.retryFailed(jobId);
        triggerService.dispatchNow();
        audit("retry", userId, "{\"jobId\":\"" + jobId + "\",\"activeJobId\":\"" + activeId + "\"}", 1L);
        Map<String, Object> resp = new LinkedHashMap<>();
        resp.put("success", true);
        resp.put("jobId", activeId);
        resp.put("merged", !activeId.equals(jobId));
        return resp;
    }

    @PostMapping("/queue/pause")
    public Map<String, Object> pause(@RequestParam(value = "cancelPending", defaultValue = "false") boolean cancelPending,
                                     @RequestHeader(value = USER_HEADER, required = false) String userId) {
        int cancelled = queue.pause(cancelPending);
        audit("pause", userId, "{\"cancelPending\":" + cancelPending + "}", (long) cancelled);
        Map<String, Object> resp = new LinkedHashMap<>();
        resp.put("success", true);
        resp.put("isPaused", true);
        resp.put("cancelledJobs", cancelled);
        return resp;
    }

    @PostMapping("/queue/resume")
    public Map<String, Object> resume(@RequestHeader(value = USER_HEADER, required = false) String userId) {
        queue.resume();
        triggerService.dispatchNow();
        audit("resume", userId, "{}", 0L);
        Map<String, Object> resp = new LinkedHashMap<>();
        resp.put("success", true);
        resp.put("isPaused", false);
        return resp;
    }

    @PostMapping("/queue/clear")
    public Map<String, Object> clear(@RequestHeader(value = USER_HEADER, required = false) String userId) {
        int cancelled = queue.clearPending();
        audit("clear", userId, "{}", (long) cancelled);
        Map<String, Object> resp = new LinkedHashMap<>();
        resp.put("success", true);
        resp.put("cancelledJobs", cancelled);
        return resp;
    }

    @GetMapping("/history")
    public Map<String, Object> history(@RequestParam(value = "leagueId", required = false) Long leagueId,
                                       @RequestParam(value = "limit", defaultValue = "50") int limit) {
        int capped = Math.max(1, Math.min(limit, 200));
        Map<String, Object> resp = new LinkedHashMap<>();
        resp.put("jobs", queue.history(leagueId, capped));
        resp.put("recentFailures", queue.recentFailures());
        return resp;
    }

    @GetMapping("/snapshots")
    public Map<String, Object> snapshots(@RequestParam(value = "leagueId", required = false) Long leagueId,
                                         @RequestParam(value = "seasonId", required = false) Long seasonId) {
        Map<String, Object> resp = new LinkedHashMap<>();
        resp.put("snapshots", snapshotService.listSnapshots(leagueId, seasonId));
        return resp;
    }

    @GetMapping("/snapshots/{snapshotId}")
    public SnapshotDetailDTO snapshot(@PathVariable Long snapshotId) {
        return snapshotService.getSnapshot(snapshotId);
    }

    @PostMapping("/snapshots")
    @ResponseStatus(HttpStatus.CREATED)
    public Map<String, Object> createSnapshot(@RequestBody SnapshotRequest request,
                                              @RequestHeader(value = USER_HEADER, required = false) String userId) {
        String creator = userOrDefault(userId);
        String description = request.getDescription() != null ? request.getDescription() : "Manual snapshot";
        Long snapshotId = snapshotService.snapshot(request.getLeagueId(), request.getSeasonId(), description, creator);
        audit("snapshot", userId, String.format("{\"leagueId\":%s,\"seasonId\":%s,\"snapshotId\":%d}",
                request.getLeagueId(), request.getSeasonId(), snapshotId), 1L);
        Map<String, Object> resp = new LinkedHashMap<>();
        resp.put("success", true);
        resp.put("snapshotId", snapshotId);
        return resp;
    }

    @PostMapping("/snapshots/{snapshotId}/restore")
    public Map<String, Object> restore(@PathVariable Long snapshotId,
                                       @RequestHeader(value = USER_HEADER, required = false) String userId) {
        int restored = snapshotService.rollback(snapshotId);
        audit("restore", userId, "{\"snapshotId\":" + snapshotId + "}", (long) restored);
        Map<String, Object> resp = new LinkedHashMap<>();
        resp.put("success", true);
        resp.put("restoredEntries", restored);
        return resp;
    }

    @GetMapping("/audit")
    public List<AdminAudit> recentAudit(@RequestParam(value = "limit", defaultValue = "50") int limit) {
        return adminAuditRepository.findRecent(PageRequest.of(0, Math.max(1, Math.min(limit, 200)))).getContent();
    }

    private static Map<String, Object> jobResponse(CalculationJob job, Instant now) {
        Map<String, Object> resp = new LinkedHashMap<>();
        resp.put("success", true);
        resp.put("job", JobSummaryDTO.from(job, now));
        return resp;
    }

    private static String userOrDefault(String userId) {
        return userId != null && !userId.isBlank() ? userId.trim() : "admin";
    }

    // Audit rows are best effort; the operator action has already happened
    private void audit(String action, String userId, String params, Long affected) {
        try {
            adminAuditRepository.save(new AdminAudit(action, userOrDefault(userId), params, affected));
        } catch (DataAccessException e) {
            log.warn("[Admin][Audit] failed to record action={} params={}: {}", action, params, e.getMessage());
        }
    }
}
