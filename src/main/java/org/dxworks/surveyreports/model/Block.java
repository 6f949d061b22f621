package org.dxworks.surveyreports.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class Block {
    @JsonProperty("ID")
    public String id;

    @JsonProperty("Description")
    public String description;

    @JsonProperty("BlockElements")
    public List<Question> blockElements; // nullable

    public boolean hasElements() {
        return blockElements != null && !blockElements.isEmpty();
    }
}
