package org.dxworks.surveyreports.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Manually coded breakdown of one open-ended response column. The last row of
 * {@link #frequencies} holds the total of categorized responses in its second column.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CodedComment {
    @JsonProperty("ResponseColumn")
    public String responseColumn;

    @JsonProperty("Frequencies")
    public DataTable frequencies;
}
