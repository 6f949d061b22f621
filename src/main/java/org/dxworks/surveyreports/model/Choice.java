package org.dxworks.surveyreports.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * A choice or answer of a question. Qualtrics exports {@code TextEntry} as the string "true";
 * Jackson coerces it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Choice {
    @JsonProperty("Display")
    public String display;

    @JsonProperty("TextEntry")
    public boolean textEntry;

    @JsonProperty("DisplayLogic")
    public JsonNode displayLogic; // nullable
}
