package org.dxworks.surveyreports.html;

import java.util.List;

/**
 * Renders a matrix of cells as one bordered table fragment. Implementations escape every cell.
 */
public interface TableRenderer {

    /**
     * @param cssClass value of the table's class attribute
     * @param header   header cells, or an empty list for a table without a header row
     * @param rows     body rows
     */
    String render(String cssClass, List<String> header, List<List<String>> rows);
}
