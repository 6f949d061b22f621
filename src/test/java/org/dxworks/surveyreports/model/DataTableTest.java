package org.dxworks.surveyreports.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DataTableTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    void readsColumnOrientedJson() throws Exception {
        DataTable table = MAPPER.readValue("{\"Q1\": [\"1\", \"2\"], \"Q1_4_TEXT\": [\"hi\", null]}", DataTable.class);

        assertEquals(List.of("Q1", "Q1_4_TEXT"), table.columns());
        assertEquals(List.of(List.of("1", "hi"), List.of("2", "")), table.rows());
    }

    @Test
    void writesColumnOrientedJson() throws Exception {
        DataTable table = new DataTable(List.of("Q1", "Q1_4_TEXT"), List.of(List.of("1", "hi"), List.of("2", "")));

        assertEquals("{\"Q1\":[\"1\",\"2\"],\"Q1_4_TEXT\":[\"hi\",\"\"]}", MAPPER.writeValueAsString(table));
    }

    @Test
    void readsNumericCellsAsText() throws Exception {
        DataTable table = MAPPER.readValue("{\"Q1_TEXT\": [\"good\", -99]}", DataTable.class);

        assertEquals(List.of(List.of("good"), List.of("-99")), table.rows());
    }

    @Test
    void shortColumnsArePaddedWithEmptyCells() throws Exception {
        DataTable table = MAPPER.readValue("{\"a\": [\"1\", \"2\", \"3\"], \"b\": [\"x\"]}", DataTable.class);

        assertEquals(3, table.rowCount());
        assertEquals(List.of("3", ""), table.rows().get(2));
    }

    @Test
    void writesBackColumnOrientedJson() throws Exception {
        DataTable table = new DataTable(List.of("a", "b"), List.of(List.of("1", "2")));

        assertEquals("{\"a\":[\"1\"],\"b\":[\"2\"]}", MAPPER.writeValueAsString(table));
    }

    @Test
    void withoutBlankRows_dropsRowsThatAreAllMissingOrEmpty() {
        DataTable table = new DataTable(List.of("a", "b"), List.of(
                List.of("-99", ""),
                List.of("", "kept"),
                List.of("", ""),
                List.of("-99", "-99")));

        DataTable cleaned = table.withoutBlankRows();

        assertEquals(List.of(List.of("", "kept")), cleaned.rows());
        assertEquals(4, table.rowCount());
    }

    @Test
    void select_projectsOneColumn() {
        DataTable table = new DataTable(List.of("Q1", "Q1_4_TEXT"), List.of(
                List.of("1", "-99"),
                List.of("4", "my own")));

        DataTable projected = table.select("Q1_4_TEXT");

        assertEquals(List.of("Q1_4_TEXT"), projected.columns());
        assertEquals(List.of(List.of("-99"), List.of("my own")), projected.rows());
        assertEquals(List.of(List.of("my own")), projected.withoutBlankRows().rows());
    }

    @Test
    void select_unknownColumnFails() {
        DataTable table = new DataTable(List.of("a"), List.of());

        assertThrows(IllegalArgumentException.class, () -> table.select("b"));
    }

    @Test
    void rejectsRaggedRows() {
        assertThrows(IllegalArgumentException.class,
                () -> new DataTable(List.of("a", "b"), List.of(List.of("1"))));
    }
}
