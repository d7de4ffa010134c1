package com.spansentinel.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Where a detected value came from: the trace / span it was measured on and
 * the history it was compared against. Copied verbatim into the resulting
 * {@link Anomaly}.
 *
 * @since 1.0.0
 */
public final class AnomalyContext {

    private final UUID traceId;
    private final String traceName;
    private final UUID spanId;
    private final String spanName;
    private final Map<String, String> metadata;
    private final TimeWindow timeWindow;
    private final int sampleCount;

    private AnomalyContext(Builder builder) {
        this.traceId = builder.traceId;
        this.traceName = builder.traceName;
        this.spanId = builder.spanId;
        this.spanName = builder.spanName;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
        this.timeWindow = builder.timeWindow;
        this.sampleCount = builder.sampleCount;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private UUID traceId;
        private String traceName;
        private UUID spanId;
        private String spanName;
        private final Map<String, String> metadata = new LinkedHashMap<>();
        private TimeWindow timeWindow;
        private int sampleCount;

        public Builder traceId(UUID traceId) {
            this.traceId = traceId;
            return this;
        }

        /**
         * @param traceId textual trace UUID; blank means absent
         * @return this builder
         * @throws IllegalArgumentException if {@code traceId} is malformed
         */
        public Builder traceId(String traceId) {
            this.traceId = Identifiers.parseOptional("trace", traceId);
            return this;
        }

        public Builder traceName(String traceName) {
            this.traceName = traceName;
            return this;
        }

        public Builder spanId(UUID spanId) {
            this.spanId = spanId;
            return this;
        }

        /**
         * @param spanId textual span UUID; blank means absent
         * @return this builder
         * @throws IllegalArgumentException if {@code spanId} is malformed
         */
        public Builder spanId(String spanId) {
            this.spanId = Identifiers.parseOptional("span", spanId);
            return this;
        }

        public Builder spanName(String spanName) {
            this.spanName = spanName;
            return this;
        }

        public Builder metadata(Map<String, String> metadata) {
            this.metadata.clear();
            if (metadata != null) {
                this.metadata.putAll(metadata);
            }
            return this;
        }

        public Builder timeWindow(TimeWindow timeWindow) {
            this.timeWindow = timeWindow;
            return this;
        }

        public Builder sampleCount(int sampleCount) {
            this.sampleCount = sampleCount;
            return this;
        }

        public AnomalyContext build() {
            return new AnomalyContext(this);
        }
    }

    public UUID getTraceId() {
        return traceId;
    }

    public String getTraceName() {
        return traceName;
    }

    public UUID getSpanId() {
        return spanId;
    }

    public String getSpanName() {
        return spanName;
    }

    /** @return unmodifiable metadata, never {@code null} */
    public Map<String, String> getMetadata() {
        return metadata;
    }

    public TimeWindow getTimeWindow() {
        return timeWindow;
    }

    public int getSampleCount() {
        return sampleCount;
    }
}
