package io.gdcc.healthdcat.mapping;

import io.gdcc.healthdcat.model.Record;
import io.gdcc.healthdcat.model.RecordSet;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.regex.Pattern;

/** Infers a CSVW datatype name for a column from its first non-empty value. */
final class ColumnDatatypes {
    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");

    private ColumnDatatypes() {}

    static String infer(RecordSet records, String column) {
        for (Record record : records) {
            Object value = record.get(column);
            if (value == null || value.toString().isEmpty()) {
                continue;
            }
            if (value instanceof Boolean) {
                return "boolean";
            }
            if (value instanceof Integer || value instanceof Long || value instanceof BigInteger) {
                return "integer";
            }
            if (value instanceof Number) {
                return "decimal";
            }
            return inferFromText(value.toString().trim());
        }
        return "string";
    }

    private static String inferFromText(String text) {
        if (INTEGER.matcher(text).matches()) {
            return "integer";
        }
        try {
            new BigDecimal(text);
            return "decimal";
        } catch (NumberFormatException e) {
            return "string";
        }
    }
}
