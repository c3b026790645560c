package com.familyledger.store.sheets;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Converts Sheets API JSON payloads into ledger records.
 */
final class SheetsValuesParser {

    private SheetsValuesParser() {
    }

    /**
     * ValueRange ({"values": [[header...], [row...], ...]}) to header-keyed records. Short rows are padded with "";
     * numbers become BigDecimal, everything else text. A sheet with only a header row has no records.
     */
    static List<Map<String, Object>> toRecords(JsonNode valueRange) {
        JsonNode values = valueRange == null ? null : valueRange.path("values");
        if (values == null || !values.isArray() || values.size() < 2) {
            return List.of();
        }
        JsonNode headerRow = values.get(0);
        List<String> headers = new ArrayList<>(headerRow.size());
        headerRow.forEach(h -> headers.add(h.asText()));

        List<Map<String, Object>> records = new ArrayList<>(values.size() - 1);
        for (int r = 1; r < values.size(); r++) {
            JsonNode row = values.get(r);
            Map<String, Object> record = new LinkedHashMap<>();
            for (int c = 0; c < headers.size(); c++) {
                JsonNode cell = row.path(c);
                record.putIfAbsent(headers.get(c), toCell(cell));
            }
            records.add(record);
        }
        return records;
    }

    /**
     * Worksheet titles from a spreadsheet resource ({"sheets": [{"properties": {"title": ...}}]}), in tab order.
     */
    static List<String> sheetTitles(JsonNode spreadsheet) {
        List<String> titles = new ArrayList<>();
        if (spreadsheet == null) {
            return titles;
        }
        for (JsonNode sheet : spreadsheet.path("sheets")) {
            JsonNode title = sheet.path("properties").path("title");
            if (title.isTextual()) {
                titles.add(title.asText());
            }
        }
        return titles;
    }

    /**
     * Number of rows written, from an append response ({"updates": {"updatedRows": n}}); empty when malformed.
     */
    static Optional<Integer> updatedRows(JsonNode appendResponse) {
        if (appendResponse == null) {
            return Optional.empty();
        }
        JsonNode rows = appendResponse.path("updates").path("updatedRows");
        return rows.isIntegralNumber() ? Optional.of(rows.asInt()) : Optional.empty();
    }

    private static Object toCell(JsonNode cell) {
        if (cell == null || cell.isMissingNode() || cell.isNull()) {
            return "";
        }
        if (cell.isNumber()) {
            return cell.decimalValue();
        }
        return cell.asText();
    }
}
