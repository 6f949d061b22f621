package org.dxworks.surveyreports.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * A decoded survey: its blocks in declaration order and, optionally, the flow
 * (block identifiers in display order).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Survey {
    @JsonProperty("Blocks")
    public List<Block> blocks = new ArrayList<>();

    @JsonProperty("Flow")
    public List<String> flow; // nullable, absent means declaration order

    /**
     * The block elements that are questions (carry a question type), in declaration order.
     */
    public List<Question> questions() {
        List<Question> questions = new ArrayList<>();
        for (Block block : blocks) {
            if (block == null || !block.hasElements()) continue;
            for (Question element : block.blockElements) {
                if (element != null && element.hasQuestionType()) {
                    questions.add(element);
                }
            }
        }
        return questions;
    }
}
