package org.dxworks.surveyreports.analyzer;

import org.dxworks.surveyreports.model.Question;
import org.junit.jupiter.api.Test;

import static org.dxworks.surveyreports.TestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

public class ChoiceTextResolverTest {

    private static Question roleQuestion() {
        Question question = multipleChoice("MAVR", "Q4", "Your roles?");
        question.payload.choices.put("1", choice("Student", false));
        question.payload.choices.put("5", choice("Other <i>(please specify)</i>", true));
        return question;
    }

    @Test
    void choiceText_fromTextColumn() {
        assertEquals("Other (please specify)", ChoiceTextResolver.choiceText(roleQuestion(), "Q4_5_TEXT"));
        assertEquals("Student", ChoiceTextResolver.choiceText(roleQuestion(), "Q4_1"));
    }

    @Test
    void choiceText_emptyWhenColumnNamesNoChoice() {
        assertEquals("", ChoiceTextResolver.choiceText(roleQuestion(), "Q4_TEXT"));
        assertEquals("", ChoiceTextResolver.choiceText(roleQuestion(), "Q4_9_TEXT"));
        assertEquals("", ChoiceTextResolver.choiceText(question("TE", "Q1", "Why?"), "Q1_1_TEXT"));
    }

    @Test
    void questionTextFor_appendsChoiceText() {
        assertEquals("Your roles?-Other (please specify)",
                ChoiceTextResolver.questionTextFor(roleQuestion(), "Q4_5_TEXT"));
        assertEquals("Your roles?", ChoiceTextResolver.questionTextFor(roleQuestion(), "Q4_TEXT"));
    }
}
