package com.jsonstreams.encoder;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonIOException;
import com.google.gson.stream.JsonWriter;
import com.jsonstreams.core.InvalidTypeException;

import java.io.IOException;
import java.io.StringWriter;

/**
 * Default encoder, backed by Gson.
 * <p>
 * Anything Gson can serialize may be written: primitives, strings, maps,
 * collections, arrays, records of plain fields and Gson's own {@link JsonElement}
 * trees, which are passed through unchanged. Non-finite numbers are rejected with
 * {@link InvalidTypeException}, unless the Gson instance was built with
 * {@code serializeSpecialFloatingPointValues()} and {@code setLenient()}.
 */
public final class GsonValueEncoder implements ValueEncoder {
    private final Gson gson;

    public GsonValueEncoder() {
        this(new GsonBuilder()
                .serializeNulls()
                .disableHtmlEscaping()
                .create());
    }

    /**
     * Uses a caller-configured Gson instance, e.g. one with custom type adapters.
     * Its pretty-printing setting is ignored; layout is driven by the indent argument.
     */
    public GsonValueEncoder(Gson gson) {
        this.gson = gson;
    }

    @Override
    public String encode(Object value, int indent, int depth) {
        StringWriter out = new StringWriter();
        try {
            JsonElement tree = value instanceof JsonElement ? (JsonElement) value : gson.toJsonTree(value);
            JsonWriter writer = gson.newJsonWriter(out);
            // newJsonWriter applies the Gson's own pretty printing, reset it either way
            writer.setIndent(indent > 0 ? Indentation.spaces(indent) : "");
            // Gson.toJson(JsonElement, JsonWriter) forces lenient mode, which lets NaN through
            gson.getAdapter(JsonElement.class).write(writer, tree);
            writer.flush();
        } catch (IllegalArgumentException e) {
            throw new InvalidTypeException("Cannot encode value: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new JsonIOException(e);
        }
        return Indentation.rebase(out.toString(), indent, depth);
    }
}
