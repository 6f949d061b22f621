package org.dxworks.surveyreports;

import org.dxworks.surveyreports.report.DisplayLogicAssembler;
import org.dxworks.surveyreports.report.ReportAssembler;
import org.dxworks.surveyreports.report.ResultsTableAssembler;
import org.dxworks.surveyreports.report.TextAppendixAssembler;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class ReportRegistryTest {

    @Test
    void byName() {
        assertEquals(Optional.of(ReportKind.TEXT_APPENDICES), ReportRegistry.byName("text_appendices"));
        assertEquals(Optional.of(ReportKind.DISPLAY_LOGIC), ReportRegistry.byName(" DISPLAY_LOGIC "));
        assertEquals(Optional.empty(), ReportRegistry.byName("pdf"));
        assertEquals(Optional.empty(), ReportRegistry.byName(null));
    }

    @Test
    void allReportNames() {
        assertEquals(Set.of("results_tables", "text_appendices", "display_logic"), ReportRegistry.allReportNames());
    }

    @Test
    void buildAssemblers_allByDefaultInReportOrder() {
        Map<ReportKind, ReportAssembler> assemblers = ReportRegistry.buildAssemblers(SurveyReportsConfig.defaults());

        assertEquals(List.of(ReportKind.RESULTS_TABLES, ReportKind.TEXT_APPENDICES, ReportKind.DISPLAY_LOGIC),
                List.copyOf(assemblers.keySet()));
        assertInstanceOf(ResultsTableAssembler.class, assemblers.get(ReportKind.RESULTS_TABLES));
        assertInstanceOf(TextAppendixAssembler.class, assemblers.get(ReportKind.TEXT_APPENDICES));
        assertInstanceOf(DisplayLogicAssembler.class, assemblers.get(ReportKind.DISPLAY_LOGIC));
    }

    @Test
    void fileNames() {
        assertEquals("text_appendices.html", ReportKind.TEXT_APPENDICES.fileName());
    }
}
