package org.dxworks.surveyreports;

import org.dxworks.surveyreports.model.Block;
import org.dxworks.surveyreports.model.Choice;
import org.dxworks.surveyreports.model.DataTable;
import org.dxworks.surveyreports.model.Payload;
import org.dxworks.surveyreports.model.Question;
import org.dxworks.surveyreports.model.Survey;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

public class TestUtils {
    public static final String SURVEYS_BASE_PATH = "src/test/resources/surveys/";

    public static Survey loadSurvey(String fileName) throws IOException {
        return SurveyReader.read(Paths.get(SURVEYS_BASE_PATH + fileName));
    }

    public static Question question(String type, String tag, String text) {
        Payload payload = new Payload();
        payload.questionType = type;
        payload.dataExportTag = tag;
        payload.questionTextClean = text;
        Question question = new Question();
        question.payload = payload;
        return question;
    }

    public static Question multipleChoice(String selector, String tag, String text) {
        Question question = question("MC", tag, text);
        question.payload.selector = selector;
        question.payload.choices = new LinkedHashMap<>();
        return question;
    }

    public static Choice choice(String display, boolean textEntry) {
        Choice choice = new Choice();
        choice.display = display;
        choice.textEntry = textEntry;
        return choice;
    }

    public static DataTable table(String column, List<String> values) {
        LinkedHashMap<String, List<String>> columns = new LinkedHashMap<>();
        columns.put(column, values);
        return DataTable.fromColumns(columns);
    }

    public static DataTable table(String column1, List<String> values1, String column2, List<String> values2) {
        LinkedHashMap<String, List<String>> columns = new LinkedHashMap<>();
        columns.put(column1, values1);
        columns.put(column2, values2);
        return DataTable.fromColumns(columns);
    }

    public static DataTable table(String column1, List<String> values1, String column2, List<String> values2,
                                  String column3, List<String> values3) {
        LinkedHashMap<String, List<String>> columns = new LinkedHashMap<>();
        columns.put(column1, values1);
        columns.put(column2, values2);
        columns.put(column3, values3);
        return DataTable.fromColumns(columns);
    }

    public static Block block(String id, String description, Question... questions) {
        Block block = new Block();
        block.id = id;
        block.description = description;
        block.blockElements = new ArrayList<>(List.of(questions));
        return block;
    }

    public static Survey survey(Block... blocks) {
        Survey survey = new Survey();
        survey.blocks = new ArrayList<>(List.of(blocks));
        return survey;
    }
}
