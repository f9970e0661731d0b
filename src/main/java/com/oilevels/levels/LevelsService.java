package com.oilevels.levels;

import com.oilevels.domain.enums.PricingMode;
import com.oilevels.domain.model.DailyRecord;
import com.oilevels.domain.model.DayLevels;
import com.oilevels.domain.model.DaySnapshot;
import com.oilevels.domain.model.TradingDay;
import com.oilevels.exception.BaseException;
import com.oilevels.exception.NoValidDataException;
import com.oilevels.exception.WorkbookReadException;
import com.oilevels.exception.WorkbookWriteException;
import com.oilevels.workbook.DaySheetParser;
import com.oilevels.workbook.DaySheetSelector;
import com.oilevels.workbook.SheetParseResult;
import com.oilevels.workbook.WorkbookRenderer;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point of the level pipeline: workbook bytes in, workbook bytes with the
 * {@code Total} and {@code Max} sheets out.
 *
 * <p>Flow: select day sheets, parse each (failures are skipped and logged), resolve a pricing
 * mode per strike, fold days into cumulative snapshots, rank the top strikes per day, assemble
 * the two report tables and render them into the workbook.
 *
 * <p>Processing is all-or-nothing. An unreadable workbook or a workbook without a single
 * parsable day sheet aborts the run and no bytes are produced.
 */
@Service
public class LevelsService {

    private static final Logger log = LoggerFactory.getLogger(LevelsService.class);

    private final DaySheetSelector daySheetSelector;
    private final DaySheetParser daySheetParser;
    private final PricingModeResolver pricingModeResolver;
    private final CumulativeAggregator cumulativeAggregator;
    private final TopLevelExtractor topLevelExtractor;
    private final ReportAssembler reportAssembler;
    private final WorkbookRenderer workbookRenderer;

    public LevelsService(
            DaySheetSelector daySheetSelector,
            DaySheetParser daySheetParser,
            PricingModeResolver pricingModeResolver,
            CumulativeAggregator cumulativeAggregator,
            TopLevelExtractor topLevelExtractor,
            ReportAssembler reportAssembler,
            WorkbookRenderer workbookRenderer) {
        this.daySheetSelector = daySheetSelector;
        this.daySheetParser = daySheetParser;
        this.pricingModeResolver = pricingModeResolver;
        this.cumulativeAggregator = cumulativeAggregator;
        this.topLevelExtractor = topLevelExtractor;
        this.reportAssembler = reportAssembler;
        this.workbookRenderer = workbookRenderer;
    }

    /**
     * Runs the pipeline and returns the augmented workbook, or empty when the run failed.
     * The failure is logged once here.
     */
    public Optional<byte[]> process(byte[] workbookBytes) {
        try {
            return Optional.of(generate(workbookBytes));
        } catch (BaseException e) {
            log.error("Level generation failed [{}]: {}", e.getErrorCode().getCode(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Runs the pipeline and returns the augmented workbook.
     *
     * @throws WorkbookReadException if the bytes are not a readable workbook
     * @throws NoValidDataException if no day sheet could be parsed
     * @throws WorkbookWriteException if the report sheets cannot be written into the workbook
     */
    public byte[] generate(byte[] workbookBytes) {
        try (Workbook workbook = open(workbookBytes)) {
            LevelsReport report = analyze(workbook);
            byte[] output = render(workbook, report);
            log.info("Workbook processed: {} days, {} strikes, {} bytes",
                    report.getSnapshots().size(), report.strikeCount(), output.length);
            return output;
        } catch (IOException e) {
            throw new WorkbookReadException("Failed to close workbook", e);
        }
    }

    /**
     * Runs the pipeline up to the report tables without touching the workbook bytes.
     */
    public LevelsReport preview(byte[] workbookBytes) {
        try (Workbook workbook = open(workbookBytes)) {
            return analyze(workbook);
        } catch (IOException e) {
            throw new WorkbookReadException("Failed to close workbook", e);
        }
    }

    public LevelsReport analyze(Workbook workbook) {
        List<String> daySheets = daySheetSelector.select(workbook);
        log.info("Found day sheets: {}", daySheets);

        List<TradingDay> days = new ArrayList<>();
        Map<String, String> skipped = new LinkedHashMap<>();
        for (String sheetName : daySheets) {
            SheetParseResult result = daySheetParser.parse(workbook.getSheet(sheetName), days.size());
            if (result.isSuccess()) {
                days.add(new TradingDay(days.size(), sheetName, result.getRecords()));
            } else {
                log.warn("Skipping sheet {} [{}]: {}", sheetName, result.getFailureReason(), result.getFailureMessage());
                skipped.put(sheetName, result.getFailureReason() + ": " + result.getFailureMessage());
            }
        }

        if (days.isEmpty()) {
            throw new NoValidDataException(daySheets, skipped);
        }

        List<DailyRecord> allRecords = days.stream().flatMap(day -> day.getRecords().stream()).toList();
        Map<BigDecimal, PricingMode> modes = pricingModeResolver.resolveAll(allRecords);
        long forced = modes.values().stream().filter(mode -> mode == PricingMode.FORCE_LTP).count();
        log.info("Pricing modes resolved for {} strikes, {} forced to LTP", modes.size(), forced);

        List<DaySnapshot> snapshots = cumulativeAggregator.aggregate(days, modes);
        List<DayLevels> dayLevels = topLevelExtractor.extractAll(snapshots);

        return LevelsReport.builder()
                .daySheets(List.copyOf(daySheets))
                .skippedSheets(skipped)
                .snapshots(snapshots)
                .dayLevels(dayLevels)
                .totalTable(reportAssembler.assembleTotal(snapshots))
                .maxTable(reportAssembler.assembleMax(dayLevels))
                .build();
    }

    private byte[] render(Workbook workbook, LevelsReport report) {
        try {
            workbookRenderer.render(workbook, report.getTotalTable());
            workbookRenderer.render(workbook, report.getMaxTable());
            return workbookRenderer.toBytes(workbook);
        } catch (BaseException e) {
            throw e;
        } catch (RuntimeException e) {
            // e.g. the Max sheet running past the 256-column limit of .xls workbooks
            throw new WorkbookWriteException("Unable to write report sheets: " + e.getMessage(), e);
        }
    }

    private Workbook open(byte[] workbookBytes) {
        if (workbookBytes == null || workbookBytes.length == 0) {
            throw new WorkbookReadException("Workbook is empty", null);
        }
        try {
            return WorkbookFactory.create(new ByteArrayInputStream(workbookBytes));
        } catch (IOException | RuntimeException e) {
            throw new WorkbookReadException("Unable to open workbook: " + e.getMessage(), e);
        }
    }
}
