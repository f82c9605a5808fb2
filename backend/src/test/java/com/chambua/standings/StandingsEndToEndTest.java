package com.chambua.standings;

import com.chambua.standings.dto.LeagueTableEntryDTO;
import com.chambua.standings.model.AdminAudit;
import com.chambua.standings.model.League;
import com.chambua.standings.model.Match;
import com.chambua.standings.model.Season;
import com.chambua.standings.model.Team;
import com.chambua.standings.queue.CalculationJobQueue;
import com.chambua.standings.queue.JobStatus;
import com.chambua.standings.repository.AdminAuditRepository;
import com.chambua.standings.repository.LeagueRepository;
import com.chambua.standings.repository.MatchRepository;
import com.chambua.standings.repository.SeasonRepository;
import com.chambua.standings.repository.TableEntryRepository;
import com.chambua.standings.repository.TableSnapshotRepository;
import com.chambua.standings.repository.TeamRepository;
import com.chambua.standings.service.LeagueTableService;
import com.chambua.standings.service.MatchResultChangedEvent;
import com.chambua.standings.support.Poll;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.is;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class StandingsEndToEndTest {

    @Autowired private MockMvc mockMvc;
    @Autowired private ObjectMapper objectMapper;
    @Autowired private ApplicationEventPublisher eventPublisher;
    @Autowired private CalculationJobQueue queue;
    @Autowired private LeagueTableService leagueTableService;

    @Autowired private LeagueRepository leagueRepository;
    @Autowired private SeasonRepository seasonRepository;
    @Autowired private TeamRepository teamRepository;
    @Autowired private MatchRepository matchRepository;
    @Autowired private TableEntryRepository tableEntryRepository;
    @Autowired private TableSnapshotRepository tableSnapshotRepository;
    @Autowired private AdminAuditRepository adminAuditRepository;

    private League league;
    private Season season;
    private Team a;
    private Team b;
    private Team c;

    @BeforeEach
    void setup() {
        tableEntryRepository.deleteAll();
        tableSnapshotRepository.deleteAll();
        adminAuditRepository.deleteAll();
        matchRepository.deleteAll();
        teamRepository.deleteAll();
        seasonRepository.deleteAll();
        leagueRepository.deleteAll();

        league = leagueRepository.save(new League("Premier", "Kenya"));
        season = seasonRepository.save(new Season(league, "2024/2025", LocalDate.of(2024, 8, 1), LocalDate.of(2025, 5, 31)));
        a = teamRepository.save(new Team("A", league));
        b = teamRepository.save(new Team("B", league));
        c = teamRepository.save(new Team("C", league));

        // A 2-0 B, B 1-1 C
        matchRepository.saveAll(List.of(
                new Match(league, season, a, b, 1, 2, 0),
                new Match(league, season, b, c, 2, 1, 1)));
    }

    private String tablePath() {
        return "/api/league/" + league.getId() + "/seasons/" + season.getId() + "/table";
    }

    private List<String> publishedOrder() {
        return leagueTableService.getPublishedTable(league.getId(), season.getId())
                .map(t -> t.getEntries().stream().map(LeagueTableEntryDTO::getTeamName).collect(Collectors.toList()))
                .orElse(List.of());
    }

    @Test
    void recalculateSnapshotAndRestoreFlow() throws Exception {
        mockMvc.perform(get(tablePath())).andExpect(status().isNotFound());

        String body = mockMvc.perform(post("/api/admin/standings/recalculate")
                        .header("X-User-Id", "ops")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"leagueId\":" + league.getId() + ",\"seasonId\":" + season.getId() + "}"))
                .andExpect(status().isAccepted())
                .andReturn().getResponse().getContentAsString();
        String jobId = objectMapper.readTree(body).get("jobId").asText();

        Poll.until(Duration.ofSeconds(10), () -> queue.getJob(jobId).getStatus() == JobStatus.COMPLETED);

        mockMvc.perform(get(tablePath()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.entries[0].teamName", is("A")))
                .andExpect(jsonPath("$.entries[0].points", is(3)))
                .andExpect(jsonPath("$.entries[1].teamName", is("C")))
                .andExpect(jsonPath("$.entries[2].teamName", is("B")));

        String snapshotBody = mockMvc.perform(post("/api/admin/standings/snapshots")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"leagueId\":" + league.getId() + ",\"seasonId\":" + season.getId() + ",\"description\":\"after matchday 2\"}"))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        long snapshotId = objectMapper.readTree(snapshotBody).get("snapshotId").asLong();

        // C 2-0 A arrives through the automatic trigger
        Match third = matchRepository.save(new Match(league, season, c, a, 3, 2, 0));
        eventPublisher.publishEvent(new MatchResultChangedEvent(league.getId(), season.getId(), third.getId(), "result recorded"));

        Poll.until(Duration.ofSeconds(10), () -> publishedOrder().equals(List.of("C", "A", "B")));

        mockMvc.perform(post("/api/admin/standings/snapshots/" + snapshotId + "/restore"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.restoredEntries", is(3)));
        assertThat(publishedOrder()).containsExactly("A", "C", "B");

        String history = mockMvc.perform(get("/api/admin/standings/history").param("leagueId", league.getId().toString()))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        JsonNode jobs = objectMapper.readTree(history).get("jobs");
        assertThat(jobs.size()).isGreaterThanOrEqualTo(2);
        assertThat(jobs.findValuesAsText("trigger")).contains("manual", "match-result");

        // the automatic run snapshotted the table it replaced, plus the manual one
        mockMvc.perform(get("/api/admin/standings/snapshots")
                        .param("leagueId", league.getId().toString())
                        .param("seasonId", season.getId().toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.snapshots.length()", is(2)));

        assertThat(adminAuditRepository.findAll()).extracting(AdminAudit::getAction).contains("recalculate", "snapshot", "restore");
    }

    @Test
    void healthIsReportedOverHttp() throws Exception {
        mockMvc.perform(get("/api/standings/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.metrics.workerPoolSize", is(2)));
    }

    @Test
    void mismatchedSeasonIsRejected() throws Exception {
        League other = leagueRepository.save(new League("Super", "Kenya"));

        mockMvc.perform(post("/api/admin/standings/recalculate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"leagueId\":" + other.getId() + ",\"seasonId\":" + season.getId() + "}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.category", is("FIX_INPUT")));
    }
}
