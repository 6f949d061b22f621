package org.dxworks.surveyreports;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.type.LogicalType;
import org.dxworks.surveyreports.model.Survey;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a decoded survey document (blocks, flow and per-question responses) from JSON.
 */
public class SurveyReader {

    private static final ObjectMapper MAPPER = createMapper();

    private static ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        // Qualtrics exports a question without choices as "Choices": []
        mapper.coercionConfigFor(LogicalType.Map)
                .setCoercion(CoercionInputShape.EmptyArray, CoercionAction.AsEmpty);
        return mapper;
    }

    public static Survey read(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return read(in);
        }
    }

    public static Survey read(InputStream in) throws IOException {
        Survey survey = MAPPER.readValue(in, Survey.class);
        if (survey == null || survey.blocks == null) {
            throw new IOException("Survey document has no Blocks");
        }
        return survey;
    }
}
