package org.pgbulk.pipeline;

import org.junit.jupiter.api.Test;
import org.pgbulk.config.ColumnSpec;
import org.pgbulk.config.ConfigurationException;
import org.pgbulk.manager.util.StagingColumn;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ColumnMapperTest {

    private static Map<String, List<ColumnSpec>> addressesAndUsers() {
        Map<String, List<ColumnSpec>> tables = new LinkedHashMap<>();
        tables.put("addresses", List.of(
                ColumnSpec.builder().destinationColumn("id").sourceColumn("address_id").sqlType("TEXT").build(),
                ColumnSpec.of("street", "TEXT"),
                ColumnSpec.of("state", "TEXT")));
        tables.put("users", List.of(
                ColumnSpec.of("id", "TEXT"),
                ColumnSpec.of("age", "TEXT"),
                ColumnSpec.of("name", "TEXT"),
                ColumnSpec.of("nickname", "TEXT"),
                ColumnSpec.builder().destinationColumn("address").sqlType("TEXT").referencesColumn("address_id").build()));
        return tables;
    }

    private static Map<String, Object> record() {
        Map<String, Object> record = new HashMap<>();
        record.put("id", "u-1");
        record.put("age", "37");
        record.put("name", "Ada");
        record.put("nickname", "ada");
        record.put("address_id", "a-9");
        record.put("street", "Main St");
        record.put("state", "CA");
        return record;
    }

    @Test
    void testStagingLayout() {
        ColumnMapper mapper = new ColumnMapper(addressesAndUsers());

        assertEquals(8, mapper.getWidth());
        assertEquals(List.of("addresses_id", "addresses_street", "addresses_state",
                        "users_id", "users_age", "users_name", "users_nickname", "users_address"),
                mapper.getColumns().stream().map(StagingColumn::getStagingName).collect(Collectors.toList()));
    }

    @Test
    void testEveryColumnPopulated() {
        Object[] row = new ColumnMapper(addressesAndUsers()).map(record());

        assertArrayEquals(new Object[]{"a-9", "Main St", "CA", "u-1", "37", "Ada", "ada", "a-9"}, row);
    }

    @Test
    void testReferenceCarriesSourceValueNotName() {
        Object[] row = new ColumnMapper(addressesAndUsers()).map(record());

        assertEquals("a-9", row[7]);
        assertNotEquals("address_id", row[7]);
    }

    @Test
    void testMissingFieldsAreNull() {
        Map<String, Object> partial = new HashMap<>();
        partial.put("id", "u-2");

        Object[] row = new ColumnMapper(addressesAndUsers()).map(partial);

        assertEquals("u-2", row[3]);
        assertNull(row[0]);
        assertNull(row[7]);
    }

    @Test
    void testUnknownFieldsAreIgnored() {
        Map<String, Object> record = record();
        record.put("unused", "x");

        assertEquals(8, new ColumnMapper(addressesAndUsers()).map(record).length);
    }

    @Test
    void testFirstMatchingColumnWins() {
        Map<String, List<ColumnSpec>> tables = new LinkedHashMap<>();
        tables.put("a", List.of(ColumnSpec.of("code", "TEXT")));
        tables.put("b", List.of(ColumnSpec.of("code", "TEXT")));

        Object[] row = new ColumnMapper(tables).map(Map.of("code", "X"));

        assertArrayEquals(new Object[]{"X", null}, row);
    }

    @Test
    void testUnknownReferenceFailsAtConstruction() {
        Map<String, List<ColumnSpec>> tables = new LinkedHashMap<>();
        tables.put("users", List.of(
                ColumnSpec.of("id", "TEXT"),
                ColumnSpec.builder().destinationColumn("address").sqlType("TEXT").referencesColumn("missing").build()));

        assertThrows(ConfigurationException.class, () -> new ColumnMapper(tables));
    }
}
