package com.chambua.standings.snapshot;

import com.chambua.standings.config.StandingsProperties;
import com.chambua.standings.dto.LeagueTable;
import com.chambua.standings.dto.LeagueTableEntryDTO;
import com.chambua.standings.dto.SnapshotDetailDTO;
import com.chambua.standings.dto.SnapshotSummaryDTO;
import com.chambua.standings.exception.SnapshotCorruptedException;
import com.chambua.standings.exception.SnapshotNotFoundException;
import com.chambua.standings.exception.TransientStoreException;
import com.chambua.standings.model.TableSnapshot;
import com.chambua.standings.repository.TableSnapshotRepository;
import com.chambua.standings.store.TableStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Write-once copies of published tables and restore from them.
 *
 * <p>Entries are stored as JSON together with a SHA-256 of that JSON; a snapshot whose checksum no longer matches
 * is refused on restore.
 */
@Service
public class SnapshotService {
    private static final Logger log = LoggerFactory.getLogger(SnapshotService.class);

    private static final TypeReference<List<LeagueTableEntryDTO>> ENTRY_LIST = new TypeReference<>() {};

    private final TableSnapshotRepository snapshotRepository;
    private final TableStore tableStore;
    private final ObjectMapper objectMapper;
    private final StandingsProperties.Snapshot config;
    private final Clock clock;

    public SnapshotService(TableSnapshotRepository snapshotRepository, TableStore tableStore, ObjectMapper objectMapper,
                           StandingsProperties properties, Clock clock) {
        this.snapshotRepository = snapshotRepository;
        this.tableStore = tableStore;
        this.objectMapper = objectMapper;
        this.config = properties.getSnapshot();
        this.clock = clock;
    }

    /**
     * Captures the current table, empty if nothing has been published yet.
     *
     * @return id of the new snapshot
     */
    @Transactional
    public Long snapshot(Long leagueId, Long seasonId, String description, String createdBy) {
        if (leagueId == null || seasonId == null) {
            throw new IllegalArgumentException("leagueId and seasonId are required");
        }
        LeagueTable table = tableStore.getCurrentTable(leagueId, seasonId);
        String json = writeEntries(table.getEntries());
        TableSnapshot saved;
        try {
            saved = snapshotRepository.save(new TableSnapshot(leagueId, seasonId, description, createdBy, json,
                    table.size(), sha256Hex(json), clock.instant()));
            pruneTable(leagueId, seasonId);
        } catch (DataAccessException e) {
            throw new TransientStoreException("Failed to store snapshot for league " + leagueId + " season " + seasonId, e);
        }
        log.info("[Snapshot][Create] snapshotId={} leagueId={} seasonId={} entries={} createdBy={}",
                saved.getId(), leagueId, seasonId, table.size(), createdBy);
        return saved.getId();
    }

    /** Metadata only, newest first. Either filter may be null. */
    @Transactional(readOnly = true)
    public List<SnapshotSummaryDTO> listSnapshots(Long leagueId, Long seasonId) {
        return snapshotRepository.findFiltered(leagueId, seasonId).stream()
                .map(SnapshotSummaryDTO::from)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public SnapshotDetailDTO getSnapshot(Long snapshotId) {
        TableSnapshot s = require(snapshotId);
        return new SnapshotDetailDTO(SnapshotSummaryDTO.from(s), readEntries(s));
    }

    /**
     * Replaces the current table of the snapshot's league season with the captured entries. The state being
     * replaced is not snapshotted.
     *
     * @return number of entries restored
     */
    @Transactional
    public int rollback(Long snapshotId) {
        TableSnapshot s = require(snapshotId);
        LeagueTable table = new LeagueTable(s.getLeagueId(), s.getSeasonId(), readEntries(s));
        int restored = tableStore.replaceTable(s.getLeagueId(), s.getSeasonId(), table, "rollback:" + snapshotId);
        log.info("[Snapshot][Rollback] snapshotId={} leagueId={} seasonId={} restored={}",
                snapshotId, s.getLeagueId(), s.getSeasonId(), restored);
        return restored;
    }

    @Scheduled(cron = "${standings.snapshot.purge-cron:0 30 3 * * *}")
    @Transactional
    public int purgeExpired() {
        Instant cutoff = clock.instant().minus(Duration.ofDays(config.getMaxAgeDays()));
        List<TableSnapshot> expired = snapshotRepository.findByCreatedAtBefore(cutoff);
        if (!expired.isEmpty()) {
            snapshotRepository.deleteAll(expired);
            log.info("[Snapshot][Purge] removed={} cutoff={}", expired.size(), cutoff);
        }
        return expired.size();
    }

    private void pruneTable(Long leagueId, Long seasonId) {
        List<TableSnapshot> all = snapshotRepository.findByLeagueIdAndSeasonIdOrderByCreatedAtDescIdDesc(leagueId, seasonId);
        int keep = Math.max(1, config.getMaxPerTable());
        if (all.size() > keep) {
            List<TableSnapshot> excess = all.subList(keep, all.size());
            snapshotRepository.deleteAll(excess);
            log.debug("[Snapshot][Prune] leagueId={} seasonId={} removed={}", leagueId, seasonId, excess.size());
        }
    }

    private TableSnapshot require(Long snapshotId) {
        if (snapshotId == null) {
            throw new SnapshotNotFoundException(null);
        }
        return snapshotRepository.findById(snapshotId).orElseThrow(() -> new SnapshotNotFoundException(snapshotId));
    }

    private List<LeagueTableEntryDTO> readEntries(TableSnapshot s) {
        if (!sha256Hex(s.getEntriesJson()).equals(s.getChecksum())) {
            log.error("[Snapshot][Corrupted] snapshotId={} checksum mismatch", s.getId());
            throw new SnapshotCorruptedException(s.getId(), "checksum mismatch");
        }
        try {
            List<LeagueTableEntryDTO> entries = objectMapper.readValue(s.getEntriesJson(), ENTRY_LIST);
            if (entries.size() != s.getEntryCount()) {
                throw new SnapshotCorruptedException(s.getId(), "expected " + s.getEntryCount() + " entries, found " + entries.size());
            }
            return entries;
        } catch (JsonProcessingException e) {
            throw new SnapshotCorruptedException(s.getId(), e);
        }
    }

    private String writeEntries(List<LeagueTableEntryDTO> entries) {
        try {
            return objectMapper.writeValueAsString(entries);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Table entries could not be serialized", e);
        }
    }

    static String sha256Hex(String value) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] digest = md.digest(value.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder();
            for (byte b : digest) sb.append(String.format("%02x", b));
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }
}
