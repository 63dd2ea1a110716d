package com.example.driftmonitor.service;

import com.example.driftmonitor.action.ActionResult;
import com.example.driftmonitor.decision.DriftAction;
import com.example.driftmonitor.error.ReportPersistenceException;
import com.example.driftmonitor.model.DriftEvent;
import com.example.driftmonitor.repo.DriftEventRepo;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Persists run reports as JSON files named after the run's start time, plus one
 * {@code drift_events} summary document per run. Files are never overwritten.
 */
public class RunReportWriter {

    private static final Logger logger = LoggerFactory.getLogger(RunReportWriter.class);

    static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);
    static final int MAX_NAME_ATTEMPTS = 100;

    private final ObjectMapper mapper;
    private final DriftEventRepo driftEventRepo;
    private final Path directory;

    public RunReportWriter(ObjectMapper objectMapper, DriftEventRepo driftEventRepo, Path directory) {
        this.mapper = objectMapper.copy()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
        this.driftEventRepo = driftEventRepo;
        this.directory = directory;
    }

    /**
     * Writes the report to {@code drift_report_<start>.json}, or {@code drift_report_<start>_<n>.json}
     * when an earlier run that started in the same second already holds that name.
     *
     * @throws ReportPersistenceException when the directory or file cannot be written
     */
    public Path write(RunReport report) {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new ReportPersistenceException("Failed to create report directory " + directory, e);
        }

        String stamp = FILE_STAMP.format(report.getStartTime());
        Path path = null;
        for (int attempt = 0; path == null && attempt < MAX_NAME_ATTEMPTS; attempt++) {
            Path candidate = directory.resolve(fileName(stamp, attempt));
            try (Writer out = Files.newBufferedWriter(candidate, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
                mapper.writeValue(out, report);
                path = candidate;
            } catch (FileAlreadyExistsException e) {
                logger.debug("Run report {} already exists, trying the next name", candidate);
            } catch (IOException e) {
                throw new ReportPersistenceException("Failed to write run report " + candidate, e);
            }
        }
        if (path == null) {
            throw new ReportPersistenceException("No free run report name for " + stamp + " in " + directory
                    + " after " + MAX_NAME_ATTEMPTS + " attempts");
        }
        logger.info("Run report saved to {}", path);

        saveSummary(report, path);
        return path;
    }

    static String fileName(String stamp, int attempt) {
        return attempt == 0
                ? "drift_report_" + stamp + ".json"
                : "drift_report_" + stamp + "_" + attempt + ".json";
    }

    private void saveSummary(RunReport report, Path path) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("report_path", path.toString());
        details.put("duration_seconds", report.getDurationSeconds());
        if (report.getDriftReport() != null) {
            details.put("overall_drift_detected", report.getDriftReport().isOverallDriftDetected());
            details.put("monitor_errors", report.getDriftReport().getMonitorErrors());
        }
        details.put("action_statuses", report.getActionResults().entrySet().stream()
                .collect(Collectors.toMap(Map.Entry::getKey, e -> e.getValue().getStatus().value(),
                        (a, b) -> a, LinkedHashMap::new)));

        List<String> actions = report.getActionsTaken().stream().map(DriftAction::value).collect(Collectors.toList());
        DriftEvent event = DriftEvent.builder()
                .runId(report.getRunId())
                .timestamp(report.getStartTime())
                .status(report.getStatus().name())
                .driftScore(report.getDriftReport() == null ? 0.0 : report.getDriftReport().getOverallDriftScore())
                .actionsTaken(actions)
                .details(details)
                .build();
        try {
            driftEventRepo.save(event);
        } catch (DataAccessException e) {
            // the report file is the audit record; the summary row is best effort
            logger.warn("Failed to save drift event for run {}: {}", report.getRunId(), e.getMessage());
        }
    }

    static Map<String, ActionResult> byWireName(Map<DriftAction, ActionResult> results) {
        Map<String, ActionResult> keyed = new LinkedHashMap<>();
        results.forEach((action, result) -> keyed.put(action.value(), result));
        return keyed;
    }
}
