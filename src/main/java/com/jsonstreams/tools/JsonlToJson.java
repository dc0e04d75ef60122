package com.jsonstreams.tools;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.jsonstreams.core.StreamLog;
import com.jsonstreams.stream.Container;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;

/**
 * Streams a JSON-Lines input into a single JSON container, one record at a time.
 * <p>
 * Without a key field every record becomes an array element. With a key field the
 * target must be an object, and each record is written under the string value of
 * that field.
 */
public final class JsonlToJson {
    private static final TypeAdapter<JsonElement> ELEMENTS = new Gson().getAdapter(JsonElement.class);

    private final String keyField;

    public JsonlToJson(String keyField) {
        this.keyField = keyField;
    }

    public JsonlToJson() {
        this(null);
    }

    /**
     * Copies every non-blank line of {@code in} into {@code target}. The target is not closed.
     *
     * @return number of records written
     * @throws IllegalArgumentException if a line is not valid JSON, or lacks the key field
     */
    public long convert(BufferedReader in, Container target) throws IOException {
        long lineNo = 0;
        long records = 0;
        String line;
        while ((line = in.readLine()) != null) {
            lineNo++;
            if (line.isBlank()) {
                continue;
            }
            JsonElement record = parse(line, lineNo);
            if (keyField == null) {
                target.write(record);
            } else {
                target.write(keyOf(record, lineNo), record);
            }
            records++;
        }
        StreamLog.info("Converted " + records + " records from " + lineNo + " lines");
        return records;
    }

    // Strict RFC 8259: no unquoted strings or keys, no NaN, nothing after the value
    private static JsonElement parse(String line, long lineNo) {
        JsonReader reader = new JsonReader(new StringReader(line));
        reader.setLenient(false);
        try {
            JsonElement record = ELEMENTS.read(reader);
            if (reader.peek() != JsonToken.END_DOCUMENT) {
                throw new IllegalArgumentException("line " + lineNo + ": invalid JSON: unexpected content after value");
            }
            return record;
        } catch (IOException | JsonParseException e) {
            throw new IllegalArgumentException("line " + lineNo + ": invalid JSON: " + e.getMessage(), e);
        }
    }

    private String keyOf(JsonElement record, long lineNo) {
        if (!record.isJsonObject()) {
            throw new IllegalArgumentException("line " + lineNo + ": record is not an object, cannot read key '" + keyField + "'");
        }
        JsonObject obj = record.getAsJsonObject();
        JsonElement key = obj.get(keyField);
        if (key == null || !key.isJsonPrimitive() || !key.getAsJsonPrimitive().isString()) {
            throw new IllegalArgumentException("line " + lineNo + ": missing string field '" + keyField + "'");
        }
        return key.getAsString();
    }
}
