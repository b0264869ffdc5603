package com.eainde.xrf.job;

import com.eainde.xrf.exception.GridReadException;
import com.eainde.xrf.exception.XrfProcessingException;
import com.eainde.xrf.hazard.HazardService;
import com.eainde.xrf.hazard.LeadPaintHazard;
import com.eainde.xrf.hazard.PositiveComponentInput;
import com.eainde.xrf.io.SpreadsheetGridReader;
import com.eainde.xrf.model.AreaType;
import com.eainde.xrf.model.RawGrid;
import com.eainde.xrf.model.Reading;
import com.eainde.xrf.normalize.NameNormalizer;
import com.eainde.xrf.normalize.NormalizedReadings;
import com.eainde.xrf.parse.ParseError;
import com.eainde.xrf.parse.ParseMetadata;
import com.eainde.xrf.parse.ParseOptions;
import com.eainde.xrf.parse.ParseResult;
import com.eainde.xrf.parse.ParsedBatch;
import com.eainde.xrf.parse.XrfParseService;
import com.eainde.xrf.summary.JobSummary;
import com.eainde.xrf.summary.SummaryService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Runs a whole job: grid loading, parsing, name normalization, classification and hazards.
 *
 * <p>Both area files share one component pass and one substrate pass so the grouping
 * service sees every name of the job at once. Any file that fails to parse fails the job.</p>
 */
@Slf4j
@Service
public class XrfJobService {

    private final SpreadsheetGridReader gridReader;
    private final XrfParseService parseService;
    private final NameNormalizer componentNormalizer;
    private final NameNormalizer substrateNormalizer;
    private final SummaryService summaryService;
    private final HazardService hazardService;
    private final ParseOptions parseOptions;

    public XrfJobService(SpreadsheetGridReader gridReader,
                         XrfParseService parseService,
                         @Qualifier("componentNormalizer") NameNormalizer componentNormalizer,
                         @Qualifier("substrateNormalizer") NameNormalizer substrateNormalizer,
                         SummaryService summaryService,
                         HazardService hazardService,
                         @Value("${xrf.parse.use-ai-fallback:true}") boolean useAiFallback,
                         @Value("${xrf.parse.always-use-ai:false}") boolean alwaysUseAi) {
        this.gridReader = gridReader;
        this.parseService = parseService;
        this.componentNormalizer = componentNormalizer;
        this.substrateNormalizer = substrateNormalizer;
        this.summaryService = summaryService;
        this.hazardService = hazardService;
        this.parseOptions = new ParseOptions(useAiFallback, alwaysUseAi);
    }

    /**
     * @param commonArea common-area export, may be {@code null}
     * @param units      unit export, may be {@code null}
     */
    public JobProcessingResult process(String jobNumber, UploadedSheet commonArea, UploadedSheet units) {
        if (commonArea == null && units == null) {
            throw new XrfProcessingException("Job " + jobNumber + " has no spreadsheet to process");
        }
        log.info("Processing job {}", jobNumber);

        Map<AreaType, UploadedSheet> uploads = new EnumMap<>(AreaType.class);
        if (commonArea != null) uploads.put(AreaType.COMMON_AREA, commonArea);
        if (units != null) uploads.put(AreaType.UNITS, units);

        List<FileParseReport> reports = new ArrayList<>();
        Map<AreaType, List<Reading>> readings = new EnumMap<>(AreaType.class);
        boolean failed = false;
        for (Map.Entry<AreaType, UploadedSheet> upload : uploads.entrySet()) {
            UploadedSheet sheet = upload.getValue();
            ParseResult result = parseFile(sheet);
            reports.add(new FileParseReport(sheet.fileName(), upload.getKey(), result.metadata(),
                    result.warnings(), result.errors()));
            if (result.isSuccess()) {
                readings.put(upload.getKey(), result.batch().map(ParsedBatch::readings).orElse(List.of()));
            } else {
                log.warn("Job {}: '{}' could not be parsed: {}", jobNumber, sheet.fileName(), result.errors());
                failed = true;
            }
        }
        if (failed) {
            return new JobProcessingResult(null, reports);
        }

        List<Reading> commonAreaReadings = readings.getOrDefault(AreaType.COMMON_AREA, List.of());
        List<Reading> unitReadings = readings.getOrDefault(AreaType.UNITS, List.of());
        List<Reading> all = new ArrayList<>(commonAreaReadings);
        all.addAll(unitReadings);

        NormalizedReadings components = componentNormalizer.normalizeReadings(all,
                p -> log.debug("Job {} components: {} ({}/{})", jobNumber, p.message(), p.processed(), p.total()));
        NormalizedReadings substrates = substrateNormalizer.normalizeReadings(components.readings(),
                p -> log.debug("Job {} substrates: {} ({}/{})", jobNumber, p.message(), p.processed(), p.total()));
        List<Reading> normalized = substrates.readings();
        int aiNormalizations = components.aiNormalizations() + substrates.aiNormalizations();

        String sourceFileName = uploads.values().stream()
                .map(UploadedSheet::fileName)
                .collect(Collectors.joining(", "));
        JobSummary summary = summaryService.generateJobSummary(jobNumber, sourceFileName,
                uploads.containsKey(AreaType.COMMON_AREA) ? normalized.subList(0, commonAreaReadings.size()) : null,
                uploads.containsKey(AreaType.UNITS) ? normalized.subList(commonAreaReadings.size(), normalized.size()) : null,
                aiNormalizations);

        if (hazardService.isAvailable()) {
            List<PositiveComponentInput> positives = hazardService.collectPositiveComponents(
                    summary.commonAreaSummary(), summary.unitsSummary());
            List<LeadPaintHazard> hazards = hazardService.generateHazards(positives);
            summary = summary.withHazards(hazards);
        }

        log.info("Job {} complete: {} reading(s), {} AI normalization(s)", jobNumber, normalized.size(), aiNormalizations);
        return new JobProcessingResult(summary, reports);
    }

    private ParseResult parseFile(UploadedSheet sheet) {
        RawGrid grid;
        try (InputStream content = sheet.open()) {
            grid = gridReader.read(sheet.fileName(), content);
        } catch (GridReadException e) {
            log.warn("Could not read '{}'", sheet.fileName(), e);
            return ParseResult.failure(List.of(ParseError.ofSheet(e.getMessage())), List.of(),
                    ParseMetadata.empty(sheet.fileName()));
        } catch (IOException e) {
            throw new GridReadException("Failed to close upload " + sheet.fileName(), e);
        }
        return parseService.parse(grid, parseOptions,
                (processed, total, stage) -> log.debug("'{}' {}: {}/{}", sheet.fileName(), stage, processed, total));
    }
}
