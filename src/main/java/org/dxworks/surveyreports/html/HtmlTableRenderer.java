package org.dxworks.surveyreports.html;

import java.util.List;

public class HtmlTableRenderer implements TableRenderer {

    private static final String NL = "\n";

    @Override
    public String render(String cssClass, List<String> header, List<List<String>> rows) {
        StringBuilder sb = new StringBuilder();
        sb.append("<table class=\"").append(HtmlText.escape(cssClass)).append("\">").append(NL);
        if (header != null && !header.isEmpty()) {
            appendRow(sb, "th", header);
        }
        for (List<String> row : rows) {
            appendRow(sb, "td", row);
        }
        sb.append("</table>");
        return sb.toString();
    }

    private static void appendRow(StringBuilder sb, String cellTag, List<String> cells) {
        sb.append("<tr>");
        for (String cell : cells) {
            sb.append('<').append(cellTag).append('>')
              .append(HtmlText.escape(cell))
              .append("</").append(cellTag).append('>');
        }
        sb.append("</tr>").append(NL);
    }
}
