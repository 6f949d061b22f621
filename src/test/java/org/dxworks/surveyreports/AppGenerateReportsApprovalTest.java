package org.dxworks.surveyreports;

import org.approvaltests.Approvals;
import org.dxworks.surveyreports.model.Survey;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class AppGenerateReportsApprovalTest {

    @Test
    void generateReports_feedbackSurvey() throws IOException {
        verify("feedback_survey.json");
    }

    @Test
    void generateReports_isIdempotent() throws IOException {
        Survey survey = TestUtils.loadSurvey("feedback_survey.json");

        assertEquals(App.generateReports(survey, SurveyReportsConfig.defaults()),
                App.generateReports(survey, SurveyReportsConfig.defaults()));
    }

    @Test
    void generateReports_withoutBlockHeaders() throws IOException {
        Survey survey = TestUtils.loadSurvey("text_entry_only.json");

        Map<ReportKind, String> reports = App.generateReports(survey, SurveyReportsConfig.with(false, 15));

        assertEquals(3, reports.size());
        assertFalse(reports.get(ReportKind.RESULTS_TABLES).contains("<h5>"));
        assertEquals("", reports.get(ReportKind.DISPLAY_LOGIC));
    }

    @Test
    void generateReports_onlyEnabledReports(@TempDir Path tempDir) throws IOException {
        Path configFile = tempDir.resolve("survey-reports-config.yml");
        Files.writeString(configFile, "reports: [text_appendices]\n");
        Survey survey = TestUtils.loadSurvey("text_entry_only.json");

        Map<ReportKind, String> reports = App.generateReports(survey, SurveyReportsConfig.load(configFile));

        assertEquals(Set.of(ReportKind.TEXT_APPENDICES), reports.keySet());
        assertTrue(reports.get(ReportKind.TEXT_APPENDICES).contains("<td>Appendix A</td>"));
    }

    private static void verify(String surveyFile) throws IOException {
        Survey survey = TestUtils.loadSurvey(surveyFile);
        Map<ReportKind, String> reports = App.generateReports(survey, SurveyReportsConfig.defaults());

        List<String> sections = new ArrayList<>();
        for (Map.Entry<ReportKind, String> report : reports.entrySet()) {
            sections.add("=== " + report.getKey().getName() + " ===\n" + report.getValue());
        }
        Approvals.verify(String.join("\n\n", sections) + "\n");
    }
}
