package org.dxworks.surveyreports.report;

import org.dxworks.surveyreports.analyzer.BlockOrderResolver;
import org.dxworks.surveyreports.analyzer.QuestionClassifier;
import org.dxworks.surveyreports.analyzer.QuestionKind;
import org.dxworks.surveyreports.model.Block;
import org.dxworks.surveyreports.model.Question;
import org.dxworks.surveyreports.model.Survey;

import java.util.ArrayList;
import java.util.List;

/**
 * Results report: per block an optional header, then for every reportable question its
 * description and results table.
 */
public class ResultsTableAssembler implements ReportAssembler {

    private final DescriptionRenderer descriptionRenderer;
    private final boolean includeBlockHeaders;

    public ResultsTableAssembler(DescriptionRenderer descriptionRenderer, boolean includeBlockHeaders) {
        this.descriptionRenderer = descriptionRenderer;
        this.includeBlockHeaders = includeBlockHeaders;
    }

    @Override
    public String assemble(Survey survey) {
        List<String> fragments = new ArrayList<>();
        fragments.add(ReportFragments.BREAK);

        for (int index : BlockOrderResolver.resolve(survey.blocks, survey.flow)) {
            Block block = survey.blocks.get(index);
            if (block == null || !block.hasElements()) continue;

            if (includeBlockHeaders) {
                fragments.add(ReportFragments.blockHeader(block));
            }
            for (Question question : block.blockElements) {
                fragments.addAll(questionFragments(question));
            }
        }
        return ReportFragments.join(fragments);
    }

    List<String> questionFragments(Question question) {
        // Elements that are not questions (page breaks, ...) have nothing to report
        if (question == null || !question.hasQuestionType()) {
            return List.of();
        }
        QuestionKind kind = QuestionClassifier.classify(question);
        return switch (kind) {
            case SKIP, DESCRIPTIVE -> List.of();
            case TEXT_ENTRY, HAS_TEXT_COLUMNS, STANDARD -> descriptionRenderer.render(question);
        };
    }
}
