package org.dxworks.surveyreports.report;

import org.dxworks.surveyreports.analyzer.ChoiceTextResolver;
import org.dxworks.surveyreports.html.TableRenderer;
import org.dxworks.surveyreports.model.CodedComment;
import org.dxworks.surveyreports.model.DataTable;
import org.dxworks.surveyreports.model.Question;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Renders the individual text appendix tables. Labels are issued by the caller, so rendering the
 * not-automatable notice never consumes an appendix number.
 */
public class TextAppendixRenderer {

    public static final String VERBATIM_DISCLAIMER = "Verbatim responses -- these have not been edited in any way.";
    public static final String CODED_COMMENTS = "Coded Comments";
    public static final String NO_RESPONDENTS = "No respondents answered this question";
    public static final String NOT_AUTOMATABLE = "This question could not be automatically processed because the CSV "
            + "response dataset does not separate the responses for each text entry component of this question.";

    private final TableRenderer tableRenderer;

    public TextAppendixRenderer(TableRenderer tableRenderer) {
        this.tableRenderer = tableRenderer;
    }

    /**
     * Two-column appendix with the coded categories and their frequencies.
     */
    public List<String> codedComments(Question question, CodedComment codedComment, String appendixLabel) {
        DataTable frequencies = codedComment.frequencies;
        if (frequencies == null || frequencies.columns().size() != 2) {
            throw new IllegalArgumentException("Coded comments of " + question.exportTag()
                    + " must have exactly two columns");
        }
        String questionText = ChoiceTextResolver.questionTextFor(question, codedComment.responseColumn);
        String tag = ReportFragments.exportTagHeader(question.exportTag());

        List<List<String>> rows = new ArrayList<>();
        rows.add(List.of(appendixLabel, appendixLabel));
        rows.add(List.of(questionText, questionText));
        rows.add(List.of(CODED_COMMENTS, CODED_COMMENTS));
        rows.add(List.of("", ""));
        rows.add(List.of("Responses", "N"));
        rows.addAll(frequencies.rows());

        return table(List.of(tag, tag + " "), rows);
    }

    /**
     * Verbatim appendix, one table column per response column, under a shared label.
     */
    public List<String> verbatim(Question question, DataTable responses, String appendixLabel) {
        String responseCount = "Responses: (" + responses.rowCount() + ")";

        List<String> header = new ArrayList<>();
        List<String> labelRow = new ArrayList<>();
        List<String> questionRow = new ArrayList<>();
        List<String> disclaimerRow = new ArrayList<>();
        List<String> blankRow = new ArrayList<>();
        List<String> countRow = new ArrayList<>();
        for (String column : responses.columns()) {
            header.add(ReportFragments.exportTagHeader(column));
            labelRow.add(appendixLabel);
            questionRow.add(ChoiceTextResolver.questionTextFor(question, column));
            disclaimerRow.add(VERBATIM_DISCLAIMER);
            blankRow.add("");
            countRow.add(responseCount);
        }

        List<List<String>> rows = new ArrayList<>();
        rows.add(labelRow);
        rows.add(questionRow);
        rows.add(disclaimerRow);
        rows.add(blankRow);
        rows.add(countRow);
        rows.addAll(responses.rows());

        return table(header, rows);
    }

    public List<String> noRespondents(Question question, String appendixLabel) {
        List<List<String>> rows = new ArrayList<>();
        rows.add(List.of(appendixLabel));
        rows.add(Collections.singletonList(question.questionText()));
        rows.add(List.of(VERBATIM_DISCLAIMER));
        rows.add(List.of(""));
        rows.add(List.of(NO_RESPONDENTS));
        return table(List.of(ReportFragments.exportTagHeader(question.exportTag())), rows);
    }

    public List<String> notAutomatable(Question question) {
        List<List<String>> rows = new ArrayList<>();
        rows.add(Collections.singletonList(question.questionText()));
        rows.add(List.of(""));
        rows.add(List.of(NOT_AUTOMATABLE));
        return table(List.of(ReportFragments.exportTagHeader(question.exportTag())), rows);
    }

    private List<String> table(List<String> header, List<List<String>> rows) {
        List<String> fragments = new ArrayList<>();
        fragments.add(tableRenderer.render(ReportFragments.TEXT_APPENDIX_CLASS, header, rows));
        fragments.add(ReportFragments.BREAK);
        return fragments;
    }
}
