package org.dxworks.surveyreports.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.LinkedHashMap;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class Payload {
    @JsonProperty("QuestionType")
    public String questionType; // TE, DB, MC, Matrix, ...

    @JsonProperty("Selector")
    public String selector;

    @JsonProperty("DataExportTag")
    public String dataExportTag;

    @JsonProperty("QuestionTextClean")
    public String questionTextClean;

    @JsonProperty("Choices")
    public LinkedHashMap<String, Choice> choices; // keyed by choice code, nullable

    @JsonProperty("Answers")
    public LinkedHashMap<String, Choice> answers; // nullable

    @JsonProperty("DisplayLogic")
    public JsonNode displayLogic; // raw Qualtrics condition tree, nullable

    @JsonProperty("SkipLogic")
    public List<SkipLogic> skipLogic; // nullable
}
