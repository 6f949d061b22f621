package org.dxworks.surveyreports.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class SkipLogic {
    @JsonProperty("Description")
    public String description;
}
