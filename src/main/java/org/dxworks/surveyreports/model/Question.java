package org.dxworks.surveyreports.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A block element. Only elements carrying a {@link Payload} with a question type
 * are questions; anything else (page breaks and the like) is passed through untouched.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Question {
    @JsonProperty("Payload")
    public Payload payload; // nullable

    @JsonProperty("Responses")
    public DataTable responses; // nullable

    @JsonProperty("Table")
    public DataTable table; // nullable, present when results were tabulated upstream

    @JsonProperty("CodedComments")
    public List<CodedComment> codedComments; // nullable

    @JsonProperty("qtSkip")
    public boolean qtSkip;

    @JsonProperty("verbatimSkip")
    public boolean verbatimSkip;

    @JsonProperty("qtNotes")
    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
    public List<String> qtNotes; // nullable

    public boolean hasQuestionType() {
        return payload != null && payload.questionType != null;
    }

    public boolean hasResponses() {
        return responses != null && !responses.columns().isEmpty();
    }

    public boolean hasCodedComments() {
        return codedComments != null && !codedComments.isEmpty();
    }

    public String exportTag() {
        return payload == null ? null : payload.dataExportTag;
    }

    public String questionText() {
        return payload == null ? null : payload.questionTextClean;
    }
}
