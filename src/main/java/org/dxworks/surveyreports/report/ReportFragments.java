package org.dxworks.surveyreports.report;

import org.dxworks.surveyreports.html.HtmlText;
import org.dxworks.surveyreports.model.Block;

import java.util.List;

final class ReportFragments {

    static final String DESCRIPTION_CLASS = "question_description data table table-bordered table-condensed";
    static final String RESULTS_CLASS = "data table table-bordered table-condensed";
    static final String TEXT_APPENDIX_CLASS = "text_appendices data table table-bordered table-condensed";
    static final String SURVEY_LOGIC_CLASS = "survey_logic data table table-bordered table-condensed";

    static final String BREAK = "<br>";
    static final String DOUBLE_BREAK = "<br><br>";
    static final String NBSP = "&nbsp;";

    private ReportFragments() {}

    static String blockHeader(Block block) {
        return "<h5>" + HtmlText.escape(block.description) + "</h5><br>";
    }

    static String exportTagHeader(String tag) {
        return "Export Tag: " + (tag == null ? "" : tag);
    }

    static String join(List<String> fragments) {
        return String.join("\n", fragments);
    }
}
