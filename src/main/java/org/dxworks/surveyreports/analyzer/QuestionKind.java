package org.dxworks.surveyreports.analyzer;

/**
 * Disposition of a block element. Every question resolves to exactly one kind.
 */
public enum QuestionKind {
    /** Flagged {@code qtSkip}: left out of every report. */
    SKIP,
    /** Descriptive box ({@code DB}): carries text only, no results. */
    DESCRIPTIVE,
    /** Text entry question ({@code TE}). */
    TEXT_ENTRY,
    /** Any other question with at least one text entry response column. */
    HAS_TEXT_COLUMNS,
    STANDARD
}
