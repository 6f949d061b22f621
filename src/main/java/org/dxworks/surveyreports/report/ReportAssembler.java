package org.dxworks.surveyreports.report;

import org.dxworks.surveyreports.model.Survey;

/**
 * Builds one HTML report from a survey. Implementations keep no state between calls.
 */
public interface ReportAssembler {
    String assemble(Survey survey);
}
