package org.dxworks.surveyreports;

import org.dxworks.surveyreports.model.Survey;
import org.dxworks.surveyreports.report.ProcessingSummary;
import org.dxworks.surveyreports.report.ReportAssembler;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

public class App {

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            System.err.println("Usage: java -jar survey-reports.jar <survey-file> <output-folder>");
            System.err.println("  <survey-file>:   Path to the decoded survey JSON (blocks, flow, responses)");
            System.err.println("  <output-folder>: Folder the HTML reports are written to");
            System.err.println("Reports: " + String.join(", ", ReportRegistry.allReportNames()));
            System.exit(2);
        }

        Path input = Paths.get(args[0]);
        if (!Files.isRegularFile(input)) {
            System.err.println("Error: Survey file does not exist: " + input);
            System.exit(1);
        }

        Path outputFolder = Paths.get(args[1]);
        Files.createDirectories(outputFolder);

        System.out.println("Starting report generation...");
        System.out.println("Input: " + input.toAbsolutePath());

        Instant startTime = Instant.now();
        SurveyReportsConfig config = SurveyReportsConfig.load();
        Survey survey = SurveyReader.read(input);
        System.out.println("Found " + survey.blocks.size() + " blocks and " + survey.questions().size() + " questions");

        Map<ReportKind, String> reports = generateReports(survey, config);
        for (Map.Entry<ReportKind, String> report : reports.entrySet()) {
            Path output = outputFolder.resolve(report.getKey().fileName());
            Files.writeString(output, report.getValue(), StandardCharsets.UTF_8);
            System.out.println("Wrote " + report.getKey().getName() + ": " + output.toAbsolutePath());
        }

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Report generation complete!");
        System.out.println(ProcessingSummary.uncodeableQuestionsMessage(survey.questions()));
        System.out.println("Reports written: " + reports.size());
        System.out.println("Duration: " + Duration.between(startTime, Instant.now()).toMillis() + " ms");
        System.out.println("=".repeat(60));
    }

    /**
     * Runs every enabled report over the survey. Each assembler starts from a clean state.
     */
    public static Map<ReportKind, String> generateReports(Survey survey, SurveyReportsConfig config) {
        Map<ReportKind, String> reports = new EnumMap<>(ReportKind.class);
        for (Map.Entry<ReportKind, ReportAssembler> entry : ReportRegistry.buildAssemblers(config).entrySet()) {
            reports.put(entry.getKey(), entry.getValue().assemble(survey));
        }
        return reports;
    }
}
