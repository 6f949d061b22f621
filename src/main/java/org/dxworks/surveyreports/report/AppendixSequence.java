package org.dxworks.surveyreports.report;

/**
 * Numbers the appendices of one text appendix report. A fresh sequence starts at "Appendix A";
 * each call to {@link #next()} issues the next label.
 */
public final class AppendixSequence {

    private int nextNumber = 1;

    public String next() {
        return "Appendix " + AppendixLabeler.label(nextNumber++);
    }

    /**
     * Number of appendix labels issued so far.
     */
    public int issued() {
        return nextNumber - 1;
    }
}
