package com.netmeasure.worker;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * What a worker produced once it reached a terminal state.
 *
 * <p>The set of variants is closed: callers switch on {@link #getKind()} and cast to the matching
 * nested type.
 */
public abstract class WorkerResult {

    public enum Kind {
        EMPTY,
        SCALAR,
        SERIES,
        NAMED,
        DEFERRED
    }

    private static final Empty EMPTY = new Empty();

    private WorkerResult() {
    }

    public abstract Kind getKind();

    public static WorkerResult empty() {
        return EMPTY;
    }

    public static WorkerResult scalar(double value) {
        return new Scalar(value);
    }

    public static WorkerResult series(List<Sample> samples) {
        return new Series(samples);
    }

    public static WorkerResult named(Map<String, WorkerResult> parts) {
        return new Named(parts);
    }

    public static WorkerResult deferred(Postprocessor postprocessor) {
        return new Deferred(postprocessor);
    }

    public boolean isEmpty() {
        return getKind() == Kind.EMPTY;
    }

    public static final class Empty extends WorkerResult {
        private Empty() {
        }

        @Override
        public Kind getKind() {
            return Kind.EMPTY;
        }

        @Override
        public String toString() {
            return "Empty";
        }
    }

    public static final class Scalar extends WorkerResult {
        private final Double value;

        private Scalar(Double value) {
            this.value = value;
        }

        @Override
        public Kind getKind() {
            return Kind.SCALAR;
        }

        public Double getValue() {
            return value;
        }

        /**
         * Returns a scalar with the given value; a null value is kept as a missing datapoint.
         */
        public static Scalar ofNullable(Double value) {
            return new Scalar(value);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Scalar && Objects.equals(value, ((Scalar) o).value);
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(value);
        }

        @Override
        public String toString() {
            return "Scalar(" + value + ")";
        }
    }

    public static final class Series extends WorkerResult {
        private final List<Sample> samples;

        private Series(List<Sample> samples) {
            this.samples = List.copyOf(Objects.requireNonNull(samples, "samples"));
        }

        @Override
        public Kind getKind() {
            return Kind.SERIES;
        }

        public List<Sample> getSamples() {
            return samples;
        }

        public boolean hasSamples() {
            return !samples.isEmpty();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Series && samples.equals(((Series) o).samples);
        }

        @Override
        public int hashCode() {
            return samples.hashCode();
        }

        @Override
        public String toString() {
            return "Series(" + samples.size() + " samples)";
        }
    }

    public static final class Named extends WorkerResult {
        private final Map<String, WorkerResult> parts;

        private Named(Map<String, WorkerResult> parts) {
            Map<String, WorkerResult> copy = new LinkedHashMap<>();
            for (Map.Entry<String, WorkerResult> e : Objects.requireNonNull(parts, "parts").entrySet()) {
                Kind kind = e.getValue().getKind();
                if (kind != Kind.SCALAR && kind != Kind.SERIES) {
                    throw new IllegalArgumentException("Named results hold scalars or series only, got "
                            + kind + " for '" + e.getKey() + "'");
                }
                copy.put(e.getKey(), e.getValue());
            }
            this.parts = Collections.unmodifiableMap(copy);
        }

        @Override
        public Kind getKind() {
            return Kind.NAMED;
        }

        public Map<String, WorkerResult> getParts() {
            return parts;
        }

        @Override
        public String toString() {
            return "Named(" + parts.keySet() + ")";
        }
    }

    public static final class Deferred extends WorkerResult {
        private final Postprocessor postprocessor;

        private Deferred(Postprocessor postprocessor) {
            this.postprocessor = Objects.requireNonNull(postprocessor, "postprocessor");
        }

        @Override
        public Kind getKind() {
            return Kind.DEFERRED;
        }

        public Postprocessor getPostprocessor() {
            return postprocessor;
        }
    }
}
