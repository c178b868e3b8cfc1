package org.pgbulk.pipeline;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.QuoteMode;

import java.io.IOException;
import java.lang.reflect.Array;
import java.nio.charset.StandardCharsets;
import java.util.Collection;

/**
 * Serializes staging rows in the dialect of {@code COPY ... (FORMAT CSV)}.
 * <p>
 * {@code null} is written as an unquoted empty field, which PostgreSQL reads as NULL; every
 * other value is quoted so empty strings survive. Collections and arrays become PostgreSQL
 * array literals. One formatter per thread: it reuses its buffer.
 */
public class CopyRowFormatter {

    static final CSVFormat COPY_CSV = CSVFormat.DEFAULT.builder()
            .setQuoteMode(QuoteMode.ALL_NON_NULL)
            .setNullString("")
            .setRecordSeparator('\n')
            .build();

    private final StringBuilder line = new StringBuilder(256);
    private final Object[] values;

    public CopyRowFormatter(int width) {
        this.values = new Object[width];
    }

    public byte[] format(Object[] row) throws IOException {
        for (int i = 0; i < row.length; i++) {
            values[i] = toCopyValue(row[i]);
        }
        line.setLength(0);
        COPY_CSV.printRecord(line, values);
        return line.toString().getBytes(StandardCharsets.UTF_8);
    }

    static Object toCopyValue(Object value) {
        if (value == null) return null;
        if (value instanceof Collection || value.getClass().isArray()) {
            StringBuilder literal = new StringBuilder();
            appendArray(literal, value);
            return literal.toString();
        }
        return value;
    }

    private static void appendArray(StringBuilder literal, Object array) {
        literal.append('{');
        boolean first = true;
        if (array instanceof Collection) {
            for (Object element : (Collection<?>) array) {
                if (!first) literal.append(',');
                appendElement(literal, element);
                first = false;
            }
        } else {
            int length = Array.getLength(array);
            for (int i = 0; i < length; i++) {
                if (!first) literal.append(',');
                appendElement(literal, Array.get(array, i));
                first = false;
            }
        }
        literal.append('}');
    }

    private static void appendElement(StringBuilder literal, Object element) {
        if (element == null) {
            literal.append("NULL");
        } else if (element instanceof Collection || element.getClass().isArray()) {
            appendArray(literal, element);
        } else {
            literal.append('"');
            String text = element.toString();
            for (int i = 0; i < text.length(); i++) {
                char c = text.charAt(i);
                if (c == '"' || c == '\\') literal.append('\\');
                literal.append(c);
            }
            literal.append('"');
        }
    }
}
