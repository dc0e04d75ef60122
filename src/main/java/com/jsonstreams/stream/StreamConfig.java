package com.jsonstreams.stream;

import com.jsonstreams.encoder.GsonValueEncoder;
import com.jsonstreams.encoder.ValueEncoder;

import java.util.Objects;
import java.util.Properties;

/**
 * Immutable configuration for a {@link JsonStream}.
 */
public final class StreamConfig {
    public static final String KIND_PROPERTY = "jsonstreams.kind";
    public static final String INDENT_PROPERTY = "jsonstreams.indent";
    public static final String PRETTY_PROPERTY = "jsonstreams.pretty";
    public static final String GZIP_PROPERTY = "jsonstreams.gzip";

    private final Kind kind;
    private final int indent;
    private final boolean pretty;
    private final ValueEncoder encoder;
    private final Separators separators;
    private final boolean closeSink;
    private final boolean gzip;

    private StreamConfig(Builder builder) {
        this.kind = builder.kind;
        this.indent = builder.indent;
        this.pretty = builder.pretty;
        this.encoder = builder.encoder != null ? builder.encoder : new GsonValueEncoder();
        this.separators = builder.separators != null ? builder.separators : Separators.forIndent(builder.indent);
        this.closeSink = builder.closeSink;
        this.gzip = builder.gzip;
    }

    public Kind getKind() {
        return kind;
    }

    public int getIndent() {
        return indent;
    }

    public boolean isPretty() {
        return pretty;
    }

    public ValueEncoder getEncoder() {
        return encoder;
    }

    public Separators getSeparators() {
        return separators;
    }

    /**
     * Whether closing the stream closes a caller-supplied sink. Sinks the stream
     * opened itself are always closed.
     */
    public boolean isCloseSink() {
        return closeSink;
    }

    public boolean isGzip() {
        return gzip;
    }

    public static StreamConfig defaults(Kind kind) {
        return builder().kind(kind).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(StreamConfig config) {
        return new Builder()
            .kind(config.kind)
            .indent(config.indent)
            .pretty(config.pretty)
            .encoder(config.encoder)
            .separators(config.separators)
            .closeSink(config.closeSink)
            .gzip(config.gzip);
    }

    /**
     * Builds a configuration from {@code jsonstreams.*} properties. Absent keys keep
     * their defaults.
     *
     * @throws IllegalArgumentException if a present value cannot be parsed
     */
    public static StreamConfig fromProperties(Properties props) {
        Builder builder = builder();
        String kind = props.getProperty(KIND_PROPERTY);
        if (kind != null) {
            builder.kind(Kind.parse(kind));
        }
        String indent = props.getProperty(INDENT_PROPERTY);
        if (indent != null) {
            try {
                builder.indent(Integer.parseInt(indent.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(INDENT_PROPERTY + " is not a number: " + indent, e);
            }
        }
        String pretty = props.getProperty(PRETTY_PROPERTY);
        if (pretty != null) {
            builder.pretty(parseFlag(PRETTY_PROPERTY, pretty));
        }
        String gzip = props.getProperty(GZIP_PROPERTY);
        if (gzip != null) {
            builder.gzip(parseFlag(GZIP_PROPERTY, gzip));
        }
        return builder.build();
    }

    private static boolean parseFlag(String name, String value) {
        String v = value.trim();
        if ("true".equalsIgnoreCase(v)) {
            return true;
        }
        if ("false".equalsIgnoreCase(v)) {
            return false;
        }
        throw new IllegalArgumentException(name + " must be true or false: " + value);
    }

    public static final class Builder {
        private Kind kind = Kind.OBJECT;
        private int indent = 0;
        private boolean pretty = false;
        private ValueEncoder encoder;
        private Separators separators;
        private boolean closeSink = false;
        private boolean gzip = false;

        private Builder() {}

        public Builder kind(Kind kind) {
            this.kind = kind;
            return this;
        }

        public Builder indent(int indent) {
            this.indent = indent;
            return this;
        }

        public Builder pretty(boolean pretty) {
            this.pretty = pretty;
            return this;
        }

        public Builder encoder(ValueEncoder encoder) {
            this.encoder = encoder;
            return this;
        }

        /**
         * Overrides the separators. When unset they follow {@link Separators#forIndent(int)}.
         */
        public Builder separators(Separators separators) {
            this.separators = separators;
            return this;
        }

        public Builder closeSink(boolean closeSink) {
            this.closeSink = closeSink;
            return this;
        }

        public Builder gzip(boolean gzip) {
            this.gzip = gzip;
            return this;
        }

        public StreamConfig build() {
            Objects.requireNonNull(kind, "kind cannot be null");
            if (indent < 0) {
                throw new IllegalArgumentException("indent must not be negative");
            }
            return new StreamConfig(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StreamConfig)) return false;
        StreamConfig that = (StreamConfig) o;
        return indent == that.indent &&
               pretty == that.pretty &&
               closeSink == that.closeSink &&
               gzip == that.gzip &&
               kind == that.kind &&
               Objects.equals(encoder, that.encoder) &&
               Objects.equals(separators, that.separators);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, indent, pretty, encoder, separators, closeSink, gzip);
    }

    @Override
    public String toString() {
        return "StreamConfig{" +
               "kind=" + kind +
               ", indent=" + indent +
               ", pretty=" + pretty +
               ", encoder=" + encoder.getClass().getSimpleName() +
               ", separators=" + separators +
               ", closeSink=" + closeSink +
               ", gzip=" + gzip +
               '}';
    }
}
