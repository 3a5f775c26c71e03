package com.entity.semantic.extract;

import com.entity.semantic.core.model.RecordKey;
import com.entity.semantic.core.model.RecordNode;
import com.entity.semantic.core.model.SourceRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("NameExtractor Tests")
class NameExtractorTest {

    private final NameExtractor extractor = new NameExtractor();

    private static SourceRecord record(Map<String, ?> fields) {
        return SourceRecord.of(RecordKey.of("CUSTOMERS", "1"), fields);
    }

    @Nested
    @DisplayName("Full name fields")
    class FullNameTests {

        @Test
        @DisplayName("Should take a top-level NAME_FULL")
        void topLevelFullName() {
            assertEquals(Optional.of("Robert Smith"),
                    extractor.extract(record(Map.of("NAME_FULL", "Robert Smith"))));
        }

        @Test
        @DisplayName("Nested full name should win over a sibling declared after it")
        void nestedBeforeLaterSibling() {
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("PRIMARY", Map.of("NAME_FULL", "Nested First"));
            fields.put("NAME_ORG", "Top Later");

            Optional<ExtractedName> name = extractor.extractWithSource(record(fields).body());

            assertEquals("Nested First", name.orElseThrow().value());
            assertEquals("PRIMARY.NAME_FULL", name.orElseThrow().fieldPath());
        }

        @Test
        @DisplayName("Top-level full name declared first should win over a later nested one")
        void topLevelBeforeLaterNested() {
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("NAME_ORG", "Acme Corp");
            fields.put("CONTACT", Map.of("NAME_FULL", "Jane Doe"));

            assertEquals(Optional.of("Acme Corp"), extractor.extract(record(fields)));
        }

        @Test
        @DisplayName("Should match suffixes case-insensitively")
        void suffixCaseInsensitive() {
            assertEquals(Optional.of("Acme Corp"),
                    extractor.extract(record(Map.of("primary_name_org", "Acme Corp"))));
        }

        @Test
        @DisplayName("Should find a name nested inside a list of mappings")
        void nestedInList() {
            Map<String, Object> fields = Map.of(
                    "NAMES", List.of(Map.of("NAME_TYPE", "PRIMARY", "NAME_FULL", "Ann Lee")));

            Optional<ExtractedName> name = extractor.extractWithSource(RecordNode.fromMap(fields));

            assertTrue(name.isPresent());
            assertEquals("Ann Lee", name.get().value());
            assertEquals("NAMES[0].NAME_FULL", name.get().fieldPath());
            assertEquals(ExtractedName.Rule.FULL_NAME_FIELD, name.get().rule());
        }

        @Test
        @DisplayName("Full name should win over name parts declared earlier")
        void fullNameBeatsParts() {
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("NAME_FIRST", "Bob");
            fields.put("NAME_LAST", "Jones");
            fields.put("ALIAS", Map.of("NAME_FULL", "Robert Jones"));

            assertEquals(Optional.of("Robert Jones"), extractor.extract(record(fields)));
        }

        @Test
        @DisplayName("First field in declaration order should win")
        void declarationOrder() {
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("PRIMARY_NAME_FULL", "First Name");
            fields.put("SECONDARY_NAME_FULL", "Second Name");

            assertEquals(Optional.of("First Name"), extractor.extract(record(fields)));
        }

        @Test
        @DisplayName("Value should be trimmed and blank values skipped")
        void trimsAndSkipsBlank() {
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("NAME_FULL", "   ");
            fields.put("NAME_ORG", "  Acme  ");

            assertEquals(Optional.of("Acme"), extractor.extract(record(fields)));
        }

        @Test
        @DisplayName("Non-string values should be treated as absent")
        void nonStringAbsent() {
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("NAME_FULL", 12345);
            fields.put("NAME_LAST", "Smith");

            assertEquals(Optional.of("Smith"), extractor.extract(record(fields)));
        }
    }

    @Nested
    @DisplayName("Name parts")
    class NamePartsTests {

        @Test
        @DisplayName("Should join first, middle and last in that order")
        void joinsParts() {
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("NAME_LAST", "Smith");
            fields.put("NAME_MIDDLE", "J");
            fields.put("NAME_FIRST", "Robert");

            assertEquals(Optional.of("Robert J Smith"), extractor.extract(record(fields)));
        }

        @Test
        @DisplayName("Should skip empty parts")
        void skipsEmptyParts() {
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("NAME_FIRST", "Robert");
            fields.put("NAME_MIDDLE", "");
            fields.put("NAME_LAST", "Smith");

            assertEquals(Optional.of("Robert Smith"), extractor.extract(record(fields)));
        }

        @Test
        @DisplayName("Should report the mapping path for nested parts")
        void nestedPartsPath() {
            Map<String, Object> fields = Map.of("PERSON", Map.of("NAME_FIRST", "Ann", "NAME_LAST", "Lee"));

            ExtractedName name = extractor.extractWithSource(RecordNode.fromMap(fields)).orElseThrow();

            assertEquals("Ann Lee", name.value());
            assertEquals("PERSON", name.fieldPath());
            assertEquals(ExtractedName.Rule.NAME_PARTS, name.rule());
        }
    }

    @Nested
    @DisplayName("No name")
    class NoNameTests {

        @Test
        @DisplayName("Record with only a phone number should have no name")
        void phoneOnly() {
            assertTrue(extractor.extract(record(Map.of("PHONE_NUMBER", "555-1234"))).isEmpty());
        }

        @Test
        @DisplayName("Empty record should have no name")
        void emptyRecord() {
            assertTrue(extractor.extract(record(Map.of())).isEmpty());
        }

        @Test
        @DisplayName("Null tree should have no name")
        void nullTree() {
            assertTrue(extractor.extract((RecordNode) null).isEmpty());
        }
    }

    @Nested
    @DisplayName("Traversal limits")
    class TraversalTests {

        @Test
        @DisplayName("Should be deterministic across calls")
        void deterministic() {
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("A", Map.of("NAME_FULL", "One"));
            fields.put("B", Map.of("NAME_FULL", "Two"));
            SourceRecord record = record(fields);

            for (int i = 0; i < 20; i++) {
                assertEquals(Optional.of("One"), extractor.extract(record));
            }
        }

        @Test
        @DisplayName("Names deeper than the max depth should be ignored")
        void maxDepth() {
            Map<String, Object> deep = Map.of("NAME_FULL", "Hidden");
            for (int i = 0; i < 5; i++) {
                deep = Map.of("LEVEL", deep);
            }
            SourceRecord record = record(deep);

            assertTrue(new NameExtractor(3).extract(record).isEmpty());
            assertEquals(Optional.of("Hidden"), new NameExtractor(10).extract(record));
        }

        @Test
        @DisplayName("Cyclic input should terminate")
        void cyclicInput() {
            Map<String, Object> root = new HashMap<>();
            root.put("SELF", root);
            root.put("PHONE", "555");

            assertTrue(extractor.extract(record(root)).isEmpty());
        }

        @Test
        @DisplayName("Non-positive max depth should be rejected")
        void invalidMaxDepth() {
            assertThrows(IllegalArgumentException.class, () -> new NameExtractor(0));
        }
    }
}
