package org.dxworks.surveyreports;

import org.dxworks.surveyreports.html.HtmlTableRenderer;
import org.dxworks.surveyreports.html.TableRenderer;
import org.dxworks.surveyreports.report.DescriptionRenderer;
import org.dxworks.surveyreports.report.DisplayLogicAssembler;
import org.dxworks.surveyreports.report.ReportAssembler;
import org.dxworks.surveyreports.report.ResultsTableAssembler;
import org.dxworks.surveyreports.report.TextAppendixAssembler;
import org.dxworks.surveyreports.report.TextAppendixRenderer;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

public class ReportRegistry {

    public static Optional<ReportKind> byName(String name) {
        if (name == null) return Optional.empty();
        for (ReportKind kind : ReportKind.values()) {
            if (kind.getName().equalsIgnoreCase(name.trim())) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    public static Set<String> allReportNames() {
        return Arrays.stream(ReportKind.values())
            .map(ReportKind::getName)
            .collect(Collectors.toSet());
    }

    /**
     * Assemblers for the reports enabled in the configuration, in report order.
     */
    public static Map<ReportKind, ReportAssembler> buildAssemblers(SurveyReportsConfig config) {
        TableRenderer tableRenderer = new HtmlTableRenderer();
        Map<ReportKind, ReportAssembler> assemblers = new EnumMap<>(ReportKind.class);

        for (ReportKind kind : ReportKind.values()) {
            if (config.isReportEnabled(kind)) {
                assemblers.put(kind, createAssembler(kind, tableRenderer, config));
            }
        }

        return Collections.unmodifiableMap(assemblers);
    }

    private static ReportAssembler createAssembler(ReportKind kind, TableRenderer tableRenderer,
                                                   SurveyReportsConfig config) {
        return switch (kind) {
            case RESULTS_TABLES -> new ResultsTableAssembler(
                    new DescriptionRenderer(tableRenderer), config.isIncludeBlockHeaders());
            case TEXT_APPENDICES -> new TextAppendixAssembler(
                    new TextAppendixRenderer(tableRenderer), config.getNThreshold());
            case DISPLAY_LOGIC -> new DisplayLogicAssembler(tableRenderer);
        };
    }
}
