package com.batchbridge.domain.service.ingestion;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reads CSV (with a header row) or JSON payloads into uniform rows.
 *
 * JSON may be an array of objects, an object holding such an array under the
 * given collection field, or a single object.
 */
@Component
public class TabularPayloadReader {

    private final CsvMapper csvMapper;
    private final ObjectMapper objectMapper;

    public TabularPayloadReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.csvMapper = CsvMapper.builder()
                .enable(CsvParser.Feature.TRIM_SPACES)
                .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
                .enable(CsvParser.Feature.IGNORE_TRAILING_UNMAPPABLE)
                .enable(CsvParser.Feature.ALLOW_TRAILING_COMMA)
                .build();
    }

    public SourceTable read(byte[] content, String collectionField) {
        String text = stripBom(new String(content, StandardCharsets.UTF_8));
        String trimmed = text.stripLeading();
        if (trimmed.isEmpty()) {
            return new SourceTable(Set.of(), List.of());
        }
        char first = trimmed.charAt(0);
        if (first == '[' || first == '{') {
            return readJson(trimmed, collectionField);
        }
        return readCsv(text);
    }

    private SourceTable readCsv(String text) {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        List<SourceRow> rows = new ArrayList<>();
        Set<String> columns = new LinkedHashSet<>();
        try (MappingIterator<Map<String, String>> iterator = csvMapper
                .readerFor(Map.class)
                .with(schema)
                .readValues(text)) {

            int line = 0;
            while (iterator.hasNextValue()) {
                Map<String, String> raw = iterator.nextValue();
                line++;
                rows.add(new SourceRow(line, normalizeKeys(raw), null));
            }

            // Header is only known once the parser has consumed it
            CsvSchema parsed = (CsvSchema) iterator.getParserSchema();
            if (parsed != null) {
                parsed.forEach(column -> columns.add(normalize(column.getName())));
            }
        } catch (IOException | RuntimeException e) {
            throw new PayloadParseException("Unreadable CSV payload: " + e.getMessage(), e);
        }
        return new SourceTable(columns, rows);
    }

    private SourceTable readJson(String text, String collectionField) {
        JsonNode root;
        try {
            root = objectMapper.reader().with(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS).readTree(text);
        } catch (JsonProcessingException e) {
            throw new PayloadParseException("Unreadable JSON payload: " + e.getOriginalMessage(), e);
        }

        JsonNode elements = root;
        if (root.isObject()) {
            JsonNode nested = root.get(collectionField);
            elements = nested != null && nested.isArray() ? nested : objectMapper.createArrayNode().add(root);
        }

        List<SourceRow> rows = new ArrayList<>();
        Set<String> columns = new LinkedHashSet<>();
        int line = 0;
        for (JsonNode element : elements) {
            line++;
            if (!element.isObject()) {
                rows.add(new SourceRow(line, Map.of(), "element is not an object"));
                continue;
            }
            Map<String, String> fields = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> it = element.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> field = it.next();
                fields.put(normalize(field.getKey()), textOf(field.getValue()));
            }
            columns.addAll(fields.keySet());
            rows.add(new SourceRow(line, fields, null));
        }
        return new SourceTable(columns, rows);
    }

    private static String textOf(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.decimalValue().toPlainString();
        }
        if (value.isValueNode()) {
            return value.asText();
        }
        return value.toString();
    }

    private static Map<String, String> normalizeKeys(Map<String, String> raw) {
        Map<String, String> fields = new LinkedHashMap<>();
        raw.forEach((key, value) -> fields.put(normalize(key), value));
        return fields;
    }

    private static String normalize(String column) {
        return column.trim().toLowerCase(Locale.ROOT);
    }

    private static String stripBom(String text) {
        return !text.isEmpty() && text.charAt(0) == '\uFEFF' ? text.substring(1) : text;
    }
}
