package org.dxworks.surveyreports.report;

import org.dxworks.surveyreports.analyzer.BlockOrderResolver;
import org.dxworks.surveyreports.analyzer.QuestionClassifier;
import org.dxworks.surveyreports.analyzer.QuestionKind;
import org.dxworks.surveyreports.model.Block;
import org.dxworks.surveyreports.model.CodedComment;
import org.dxworks.surveyreports.model.DataTable;
import org.dxworks.surveyreports.model.Question;
import org.dxworks.surveyreports.model.Survey;

import java.util.ArrayList;
import java.util.List;

/**
 * Text appendix report: coded comment breakdowns and verbatim free text responses, lettered
 * "Appendix A", "Appendix B", ... across the whole survey.
 *
 * Every coded comment table, verbatim table and no-respondents placeholder takes the next
 * appendix label. The notice for single answer questions with several text entry choices
 * takes none.
 */
public class TextAppendixAssembler implements ReportAssembler {

    public static final int DEFAULT_N_THRESHOLD = 15;

    private final TextAppendixRenderer renderer;
    private final int nThreshold;

    public TextAppendixAssembler(TextAppendixRenderer renderer, int nThreshold) {
        this.renderer = renderer;
        this.nThreshold = nThreshold;
    }

    @Override
    public String assemble(Survey survey) {
        AppendixSequence appendices = new AppendixSequence();
        List<String> fragments = new ArrayList<>();

        for (int index : BlockOrderResolver.resolve(survey.blocks, survey.flow)) {
            Block block = survey.blocks.get(index);
            if (block == null || !block.hasElements()) continue;

            fragments.add(ReportFragments.blockHeader(block));
            for (Question question : block.blockElements) {
                fragments.addAll(questionFragments(question, appendices));
            }
        }
        return ReportFragments.join(fragments);
    }

    /**
     * Appendices for one question, labelled from {@code appendices}.
     *
     * @throws IllegalArgumentException if an element with responses or coded comments has no question type
     */
    public List<String> questionFragments(Question question, AppendixSequence appendices) {
        if (question == null || question.qtSkip) {
            return List.of();
        }
        boolean verbatim = !question.verbatimSkip && question.hasResponses();
        if (!question.hasQuestionType()) {
            if (verbatim || question.hasCodedComments()) {
                QuestionClassifier.requireQuestionType(question);
            }
            return List.of();
        }

        List<String> fragments = new ArrayList<>(codedCommentAppendices(question, appendices));
        if (!verbatim) {
            return fragments;
        }

        QuestionKind kind = QuestionClassifier.classify(question);
        List<String> verbatimFragments = switch (kind) {
            case TEXT_ENTRY -> textEntryAppendices(question, appendices);
            case HAS_TEXT_COLUMNS, DESCRIPTIVE -> textColumnAppendices(question, appendices);
            case SKIP, STANDARD -> List.of();
        };
        fragments.addAll(verbatimFragments);
        return fragments;
    }

    private List<String> codedCommentAppendices(Question question, AppendixSequence appendices) {
        List<String> fragments = new ArrayList<>();
        if (!question.hasCodedComments()) {
            return fragments;
        }
        for (CodedComment codedComment : question.codedComments) {
            if (codedCount(question, codedComment) > nThreshold) {
                fragments.addAll(renderer.codedComments(question, codedComment, appendices.next()));
            }
        }
        return fragments;
    }

    private List<String> textEntryAppendices(Question question, AppendixSequence appendices) {
        DataTable responses = question.responses.withoutBlankRows();
        if (responses.isEmpty()) {
            return renderer.noRespondents(question, appendices.next());
        }
        return renderer.verbatim(question, responses, appendices.next());
    }

    private List<String> textColumnAppendices(Question question, AppendixSequence appendices) {
        List<String> fragments = new ArrayList<>();
        boolean multiTextSingleAnswer = QuestionClassifier.isMultiTextSingleAnswer(question);

        for (String column : QuestionClassifier.textColumns(question)) {
            DataTable responses = question.responses.select(column).withoutBlankRows();
            if (responses.isEmpty()) {
                fragments.addAll(renderer.noRespondents(question, appendices.next()));
                continue;
            }
            if (multiTextSingleAnswer) {
                fragments.addAll(renderer.notAutomatable(question));
                break;
            }
            fragments.addAll(renderer.verbatim(question, responses, appendices.next()));
        }
        return fragments;
    }

    /**
     * Number of categorized comments: the second cell of the frequency table's last row.
     */
    static int codedCount(Question question, CodedComment codedComment) {
        DataTable frequencies = codedComment.frequencies;
        if (frequencies == null || frequencies.isEmpty() || frequencies.columns().size() < 2) {
            throw new IllegalArgumentException("Coded comments of " + question.exportTag()
                    + " have no frequency table with a count column");
        }
        List<String> lastRow = frequencies.rows().get(frequencies.rowCount() - 1);
        String cell = lastRow.get(1);
        try {
            return (int) Double.parseDouble(cell.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Coded comments of " + question.exportTag()
                    + " end with a non-numeric count: '" + cell + "'", e);
        }
    }
}
