package org.dxworks.surveyreports.report;

import org.dxworks.surveyreports.analyzer.QuestionClassifier;
import org.dxworks.surveyreports.model.Question;

import java.util.List;
import java.util.stream.Collectors;

public final class ProcessingSummary {

    public static final String ALL_PROCESSED = "All questions were successfully processed!";

    private ProcessingSummary() {}

    /**
     * Lists the questions with no results table that are neither text entry nor descriptive.
     */
    public static String uncodeableQuestionsMessage(List<Question> questions) {
        List<String> tags = questions.stream()
                .filter(QuestionClassifier::isUncodeable)
                .map(Question::exportTag)
                .collect(Collectors.toList());

        String message = tags.isEmpty()
                ? ALL_PROCESSED
                : "The following questions could not be automatically processed: " + String.join(", ", tags);
        return "<b>" + message + "</b>";
    }
}
