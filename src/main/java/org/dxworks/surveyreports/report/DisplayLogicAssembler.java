package org.dxworks.surveyreports.report;

import org.dxworks.surveyreports.analyzer.BlockOrderResolver;
import org.dxworks.surveyreports.analyzer.DisplayLogicExtractor;
import org.dxworks.surveyreports.html.TableRenderer;
import org.dxworks.surveyreports.model.Block;
import org.dxworks.surveyreports.model.Question;
import org.dxworks.surveyreports.model.Survey;

import java.util.ArrayList;
import java.util.List;

/**
 * Display logic report: one single-row table per question carrying display or skip logic.
 */
public class DisplayLogicAssembler implements ReportAssembler {

    private final TableRenderer tableRenderer;

    public DisplayLogicAssembler(TableRenderer tableRenderer) {
        this.tableRenderer = tableRenderer;
    }

    @Override
    public String assemble(Survey survey) {
        List<String> fragments = new ArrayList<>();
        for (int index : BlockOrderResolver.resolve(survey.blocks, survey.flow)) {
            Block block = survey.blocks.get(index);
            if (block == null || !block.hasElements()) continue;

            for (Question question : block.blockElements) {
                fragments.addAll(questionFragments(question));
            }
        }
        return ReportFragments.join(fragments);
    }

    List<String> questionFragments(Question question) {
        if (question == null) {
            return List.of();
        }
        List<String> logic = DisplayLogicExtractor.logicLines(question);
        // a heading alone means nothing was found under it
        if (logic.size() <= 1) {
            return List.of();
        }

        List<String> row = new ArrayList<>();
        row.add(nullToEmpty(question.exportTag()));
        row.add(nullToEmpty(question.questionText()));
        row.addAll(logic);

        List<String> fragments = new ArrayList<>();
        fragments.add(tableRenderer.render(ReportFragments.SURVEY_LOGIC_CLASS, List.of(), List.of(row)));
        fragments.add(ReportFragments.BREAK);
        return fragments;
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
