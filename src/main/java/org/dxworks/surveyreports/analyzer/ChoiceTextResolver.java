package org.dxworks.surveyreports.analyzer;

import org.dxworks.surveyreports.html.HtmlText;
import org.dxworks.surveyreports.model.Choice;
import org.dxworks.surveyreports.model.Payload;
import org.dxworks.surveyreports.model.Question;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps a response column such as {@code Q5_4_TEXT} back to the display text of choice 4 of Q5.
 */
public final class ChoiceTextResolver {

    private static final Pattern CHOICE_COLUMN = Pattern.compile("^.+?_(\\d+)(?:_TEXT)?$");

    private ChoiceTextResolver() {}

    /**
     * The cleaned choice text, or the empty string when the column does not name a known choice.
     */
    public static String choiceText(Question question, String responseColumn) {
        Payload payload = question.payload;
        if (payload == null || payload.choices == null || responseColumn == null) {
            return "";
        }
        Matcher matcher = CHOICE_COLUMN.matcher(responseColumn);
        if (!matcher.matches()) {
            return "";
        }
        Choice choice = payload.choices.get(matcher.group(1));
        if (choice == null || choice.display == null) {
            return "";
        }
        return HtmlText.clean(choice.display);
    }

    /**
     * The question text, suffixed with {@code -<choice text>} when the column belongs to a choice.
     */
    public static String questionTextFor(Question question, String responseColumn) {
        String questionText = question.questionText() == null ? "" : question.questionText();
        String choiceText = choiceText(question, responseColumn);
        return choiceText.isEmpty() ? questionText : questionText + "-" + choiceText;
    }
}
