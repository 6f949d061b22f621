package org.dxworks.surveyreports;

public enum ReportKind {
    RESULTS_TABLES("results_tables"),
    TEXT_APPENDICES("text_appendices"),
    DISPLAY_LOGIC("display_logic");

    private final String name;

    ReportKind(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public String fileName() {
        return name + ".html";
    }
}
