package org.dxworks.surveyreports.report;

import org.dxworks.surveyreports.analyzer.QuestionClassifier;
import org.dxworks.surveyreports.html.TableRenderer;
import org.dxworks.surveyreports.model.Question;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Renders a question's description table, followed by its results table when one was tabulated.
 */
public class DescriptionRenderer {

    public static final String DISPLAY_LOGIC_REFERRAL = "Refer to the Display Logic panel for this question's logic.";
    public static final String ONE_TEXT_COMPONENT = "This question has a text entry component. See Appendix.";
    public static final String MANY_TEXT_COMPONENTS = "This question has multiple text entry components. See Appendices.";

    private final TableRenderer tableRenderer;

    public DescriptionRenderer(TableRenderer tableRenderer) {
        this.tableRenderer = tableRenderer;
    }

    public List<String> render(Question question) {
        List<String> fragments = new ArrayList<>();

        List<List<String>> descriptionRows = new ArrayList<>();
        for (String line : descriptionLines(question)) {
            descriptionRows.add(List.of(line));
        }
        fragments.add(tableRenderer.render(ReportFragments.DESCRIPTION_CLASS, Collections.emptyList(), descriptionRows));
        fragments.add(ReportFragments.NBSP);

        if (question.table != null) {
            fragments.add(tableRenderer.render(ReportFragments.RESULTS_CLASS,
                    question.table.columns(), question.table.rows()));
        }
        fragments.add(ReportFragments.DOUBLE_BREAK);
        return fragments;
    }

    public List<String> descriptionLines(Question question) {
        String tag = question.exportTag();
        boolean textEntry = QuestionClassifier.isTextEntry(question);

        List<String> lines = new ArrayList<>();
        lines.add(ReportFragments.exportTagHeader(tag));
        lines.add(nullToEmpty(question.questionText()));
        if (question.qtNotes != null) {
            for (String note : question.qtNotes) {
                lines.add(nullToEmpty(note));
            }
        }
        if (QuestionClassifier.hasDisplayLogic(question)) {
            lines.add(DISPLAY_LOGIC_REFERRAL);
        }

        if (question.table == null) {
            if (textEntry) {
                lines.add("Question " + tag + " is a text entry question. See Appendix.");
            } else if (!QuestionClassifier.allResponseColumnsAreText(question)) {
                lines.add("The results table for Question " + tag + " could not be automatically processed.");
            }
        }

        if (!textEntry) {
            int textColumns = QuestionClassifier.textColumns(question).size();
            if (textColumns == 1) {
                lines.add(ONE_TEXT_COMPONENT);
            } else if (textColumns > 1) {
                lines.add(MANY_TEXT_COMPONENTS);
            }
        }
        return lines;
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
