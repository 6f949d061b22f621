package org.dxworks.surveyreports.analyzer;

import com.fasterxml.jackson.databind.JsonNode;
import org.dxworks.surveyreports.html.HtmlText;
import org.dxworks.surveyreports.model.Choice;
import org.dxworks.surveyreports.model.Payload;
import org.dxworks.surveyreports.model.Question;
import org.dxworks.surveyreports.model.SkipLogic;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Flattens the display and skip logic attached to a question into readable lines.
 *
 * Qualtrics stores display logic as nested condition sets keyed "0", "1", ...; each condition
 * carries a {@code Description} and, after the first, a {@code Conjuction} (sic).
 */
public final class DisplayLogicExtractor {

    public static final String QUESTION_HEADING = "Question Display Logic:";
    public static final String SKIP_LOGIC_HEADING = "Skip Logic:";

    private DisplayLogicExtractor() {}

    /**
     * Heading and condition lines for the question, its choices and answers, then its skip logic.
     * Empty when the question has no logic at all.
     */
    public static List<String> logicLines(Question question) {
        List<String> lines = new ArrayList<>();
        Payload payload = question.payload;
        if (payload == null) {
            return lines;
        }

        if (payload.displayLogic != null) {
            lines.add(QUESTION_HEADING);
            lines.addAll(conditions(payload.displayLogic));
        }
        appendChoiceLogic(lines, "Choice", payload.choices);
        appendChoiceLogic(lines, "Answer", payload.answers);

        if (payload.skipLogic != null && !payload.skipLogic.isEmpty()) {
            lines.add(SKIP_LOGIC_HEADING);
            for (SkipLogic skip : payload.skipLogic) {
                if (skip != null) {
                    lines.add(HtmlText.clean(skip.description));
                }
            }
        }
        return lines;
    }

    public static List<String> conditions(JsonNode logic) {
        List<String> conditions = new ArrayList<>();
        collectConditions(logic, conditions);
        return conditions;
    }

    private static void appendChoiceLogic(List<String> lines, String kind, Map<String, Choice> choices) {
        if (choices == null) return;
        for (Choice choice : choices.values()) {
            if (choice == null || choice.displayLogic == null) continue;
            lines.add(kind + " Display Logic for " + HtmlText.clean(choice.display) + ":");
            lines.addAll(conditions(choice.displayLogic));
        }
    }

    private static void collectConditions(JsonNode node, List<String> out) {
        if (node == null) return;

        if (node.isArray()) {
            for (JsonNode element : node) {
                collectConditions(element, out);
            }
            return;
        }
        if (!node.isObject()) return;

        JsonNode description = node.get("Description");
        if (description != null && description.isTextual()) {
            JsonNode conjunction = node.get("Conjuction");
            String prefix = conjunction != null && conjunction.isTextual() ? conjunction.asText() + " " : "";
            out.add(HtmlText.clean(prefix + description.asText()));
            return;
        }

        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            JsonNode value = fields.next().getValue();
            if (value.isContainerNode()) {
                collectConditions(value, out);
            }
        }
    }
}
