package org.starledger.parser.io;

import org.starledger.parser.model.FloatValue;
import org.starledger.parser.model.IntValue;
import org.starledger.parser.model.Key;
import org.starledger.parser.model.ListValue;
import org.starledger.parser.model.MapValue;
import org.starledger.parser.model.StringValue;
import org.starledger.parser.model.Value;

import java.util.Map;
import java.util.regex.Pattern;

/**
 * Serializes a value tree back into the save-file grammar.
 * <p>
 * Lists are written as brace blocks, never as repeated keys. Strings are quoted when they would
 * otherwise be read back as a number or contain delimiters.
 */
public final class SnapshotWriter {

    private static final Pattern BARE_STRING = Pattern.compile("[A-Za-z_][A-Za-z0-9_:.@\\-]*");

    private final StringBuilder out = new StringBuilder();

    private SnapshotWriter() {
    }

    /**
     * Writes a top-level document.
     *
     * @param document The top-level map.
     * @return The document text.
     */
    public static String write(MapValue document) {
        SnapshotWriter writer = new SnapshotWriter();
        writer.writeEntries(document, 0);
        return writer.out.toString();
    }

    private void writeEntries(MapValue map, int indent) {
        for (Map.Entry<Key, Value> entry : map.entries().entrySet()) {
            indent(indent);
            Key key = entry.getKey();
            out.append(key.numeric() ? key.text() : quoteIfNeeded(key.text()));
            out.append('=');
            writeValue(entry.getValue(), indent);
            out.append('\n');
        }
    }

    private void writeValue(Value value, int indent) {
        if (value instanceof IntValue i) {
            out.append(i.value());
        } else if (value instanceof FloatValue f) {
            out.append(formatDouble(f.value()));
        } else if (value instanceof StringValue s) {
            out.append(quoteIfNeeded(s.value()));
        } else if (value instanceof ListValue list) {
            out.append('{');
            for (Value element : list.values()) {
                out.append(' ');
                writeValue(element, indent + 1);
            }
            out.append(" }");
        } else if (value instanceof MapValue map) {
            out.append("{\n");
            writeEntries(map, indent + 1);
            indent(indent);
            out.append('}');
        }
    }

    private static String formatDouble(double value) {
        String text = Double.toString(value);
        return text.contains(".") ? text : text + ".0";
    }

    private static String quoteIfNeeded(String text) {
        if (BARE_STRING.matcher(text).matches()) {
            return text;
        }
        return '"' + text + '"';
    }

    private void indent(int indent) {
        out.append("\t".repeat(indent));
    }
}
