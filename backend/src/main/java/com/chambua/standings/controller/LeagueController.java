package com.chambua.standings.controller;

import com.chambua.standings.dto.LeagueTable;
import com.chambua.standings.model.League;
import com.chambua.standings.model.Season;
import com.chambua.standings.repository.LeagueRepository;
import com.chambua.standings.service.LeagueTableService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

@RestController
@RequestMapping("/api/league")
@CrossOrigin(origins = "*")
public class LeagueController {

    private final LeagueTableService leagueTableService;
    private final LeagueRepository leagueRepository;

    public LeagueController(LeagueTableService leagueTableService, LeagueRepository leagueRepository) {
        this.leagueTableService = leagueTableService;
        this.leagueRepository = leagueRepository;
    }

    @GetMapping
    public List<League> listLeagues() {
        return leagueRepository.findAll();
    }

    @GetMapping("/{leagueId}/seasons")
    public List<Season> listSeasons(@PathVariable Long leagueId) {
        if (!leagueTableService.leagueExists(leagueId)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "League not found");
        }
        return leagueTableService.listSeasons(leagueId);
    }

    @GetMapping("/{leagueId}/seasons/{seasonId}/table")
    public LeagueTable getLeagueTable(@PathVariable Long leagueId, @PathVariable Long seasonId) {
        return leagueTableService.getPublishedTable(leagueId, seasonId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "No table published for this season"));
    }

    @GetMapping("/{leagueId}/seasons/{seasonId}/table/preview")
    public LeagueTable previewLeagueTable(@PathVariable Long leagueId, @PathVariable Long seasonId) {
        return leagueTableService.previewTable(leagueId, seasonId);
    }
}
