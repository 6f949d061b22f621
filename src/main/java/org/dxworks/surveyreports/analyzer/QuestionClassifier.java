package org.dxworks.surveyreports.analyzer;

import org.dxworks.surveyreports.model.Choice;
import org.dxworks.surveyreports.model.Payload;
import org.dxworks.surveyreports.model.Question;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Decides how each report treats a question, from its type, selector and response columns.
 */
public final class QuestionClassifier {

    public static final String TEXT_ENTRY = "TE";
    public static final String DESCRIPTIVE_BOX = "DB";
    public static final String MULTIPLE_CHOICE = "MC";

    /** Marker in the response column name of a free text component. */
    public static final String TEXT_COLUMN_MARKER = "TEXT";

    private static final Set<String> SINGLE_ANSWER_SELECTORS = Set.of("SAVR", "SAHR", "SACOL", "DL", "SB");

    private QuestionClassifier() {}

    /**
     * @throws IllegalArgumentException if the element is not skipped and has no payload or question type
     */
    public static QuestionKind classify(Question question) {
        if (question.qtSkip) {
            return QuestionKind.SKIP;
        }
        String type = requireQuestionType(question);
        if (DESCRIPTIVE_BOX.equals(type)) {
            return QuestionKind.DESCRIPTIVE;
        }
        if (TEXT_ENTRY.equals(type)) {
            return QuestionKind.TEXT_ENTRY;
        }
        if (!textColumns(question).isEmpty()) {
            return QuestionKind.HAS_TEXT_COLUMNS;
        }
        return QuestionKind.STANDARD;
    }

    public static String requireQuestionType(Question question) {
        if (!question.hasQuestionType()) {
            String tag = question.exportTag();
            throw new IllegalArgumentException("Block element " + (tag == null ? "" : tag + " ")
                    + "has no Payload with a QuestionType");
        }
        return question.payload.questionType;
    }

    public static boolean isTextEntry(Question question) {
        return question.hasQuestionType() && TEXT_ENTRY.equals(question.payload.questionType);
    }

    /**
     * Response columns of free text components, in column order.
     */
    public static List<String> textColumns(Question question) {
        if (question.responses == null) {
            return Collections.emptyList();
        }
        List<String> columns = new ArrayList<>();
        for (String column : question.responses.columns()) {
            if (isTextColumn(column)) {
                columns.add(column);
            }
        }
        return columns;
    }

    public static boolean isTextColumn(String column) {
        return column != null && column.contains(TEXT_COLUMN_MARKER);
    }

    /**
     * True when every response column is a text column; vacuously true without responses.
     */
    public static boolean allResponseColumnsAreText(Question question) {
        if (question.responses == null) {
            return true;
        }
        return question.responses.columns().stream().allMatch(QuestionClassifier::isTextColumn);
    }

    public static boolean hasDisplayLogic(Question question) {
        Payload payload = question.payload;
        if (payload == null) {
            return false;
        }
        return payload.displayLogic != null
                || anyHasDisplayLogic(payload.choices)
                || anyHasDisplayLogic(payload.answers);
    }

    public static boolean isMultipleChoiceSingleAnswer(Question question) {
        Payload payload = question.payload;
        return payload != null
                && MULTIPLE_CHOICE.equals(payload.questionType)
                && payload.selector != null
                && SINGLE_ANSWER_SELECTORS.contains(payload.selector);
    }

    /**
     * Single answer multiple choice with more than one text entry choice. The response export
     * keeps these components in columns that cannot be told apart, so they are not tabled.
     */
    public static boolean isMultiTextSingleAnswer(Question question) {
        if (!isMultipleChoiceSingleAnswer(question) || question.payload.choices == null) {
            return false;
        }
        long textEntryChoices = question.payload.choices.values().stream()
                .filter(choice -> choice != null && choice.textEntry)
                .count();
        return textEntryChoices > 1;
    }

    /**
     * A question whose results could not be tabulated automatically and which has no appendix to point to.
     */
    public static boolean isUncodeable(Question question) {
        String type = requireQuestionType(question);
        return question.table == null
                && !TEXT_ENTRY.equals(type)
                && !DESCRIPTIVE_BOX.equals(type)
                && !TEXT_ENTRY.equals(question.payload.selector);
    }

    private static boolean anyHasDisplayLogic(Map<String, Choice> choices) {
        if (choices == null) {
            return false;
        }
        for (Choice choice : choices.values()) {
            if (choice != null && choice.displayLogic != null) {
                return true;
            }
        }
        return false;
    }
}
