package com.netmeasure.transform;

import com.netmeasure.model.ConfigurationException;
import com.netmeasure.worker.Sample;
import com.netmeasure.worker.WorkerResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.DoubleUnaryOperator;

/**
 * Registry of the named transformers a worker may list in its {@code transforms} chain.
 */
public final class Transformers {
    private static final Logger log = LoggerFactory.getLogger(Transformers.class);

    private static final Map<String, ValueTransformer> BY_NAME = new LinkedHashMap<>();

    static {
        register(simple("identity", v -> v));
        register(new ValueTransformer() {
            @Override
            public String getName() {
                return "rr_to_ms";
            }

            @Override
            public Double apply(Double value) {
                // transactions/second to milliseconds per transaction
                if (value == null || value == 0.0) {
                    return null;
                }
                return 1000.0 / value;
            }
        });
        register(simple("s_to_ms", v -> v * 1000.0));
        register(simple("bits_to_mbits", v -> v / 1000000.0));
        register(simple("kbits_to_mbits", v -> v / 1000.0));
        register(new CumulativeToEvents());
    }

    private Transformers() {
    }

    private static void register(ValueTransformer transformer) {
        BY_NAME.put(transformer.getName(), transformer);
    }

    public static Collection<String> names() {
        return BY_NAME.keySet();
    }

    /**
     * Resolves a list of transformer names into a chain.
     *
     * @param names transformer names, in application order
     * @return resolved chain
     * @throws ConfigurationException if a name is unknown
     */
    public static List<ValueTransformer> resolve(List<String> names) {
        if (names == null || names.isEmpty()) {
            return List.of();
        }
        List<ValueTransformer> out = new ArrayList<>();
        for (String raw : names) {
            String name = raw == null ? "" : raw.trim();
            ValueTransformer t = BY_NAME.get(name);
            if (t == null) {
                throw new ConfigurationException("Unknown transformer: '" + name + "'. Available: " + BY_NAME.keySet());
            }
            out.add(t);
        }
        return out;
    }

    /**
     * Applies a chain to a scalar or series result. Failures propagate as {@link TransformException}.
     *
     * @param chain transformers
     * @param result scalar or series result
     * @return transformed result
     */
    public static WorkerResult applyChain(List<ValueTransformer> chain, WorkerResult result) {
        WorkerResult current = result;
        for (ValueTransformer t : chain) {
            try {
                switch (current.getKind()) {
                    case SCALAR:
                        current = WorkerResult.Scalar.ofNullable(t.apply(((WorkerResult.Scalar) current).getValue()));
                        break;
                    case SERIES:
                        current = WorkerResult.series(t.applySeries(((WorkerResult.Series) current).getSamples()));
                        break;
                    default:
                        return current;
                }
            } catch (RuntimeException e) {
                throw new TransformException("Transformer '" + t.getName() + "' failed: " + e.getMessage(), e);
            }
        }
        return current;
    }

    /**
     * Applies a chain to a metadata value. Values that are not numbers, or that a transformer
     * rejects, are returned unchanged.
     *
     * @param chain transformers
     * @param value metadata value
     * @return transformed value
     */
    public static Object applyToMetadata(List<ValueTransformer> chain, Object value) {
        if (!(value instanceof Number)) {
            return value;
        }
        Double current = ((Number) value).doubleValue();
        for (ValueTransformer t : chain) {
            try {
                current = t.apply(current);
            } catch (RuntimeException e) {
                log.debug("Skipping transformer on metadata: transformer={}, value={}", t.getName(), value, e);
                return value;
            }
        }
        return current;
    }

    /**
     * Applies a chain to raw sample records ({@code t}, {@code val} and an optional {@code key}).
     * Records with different keys are transformed as separate series.
     *
     * @param chain transformers
     * @param records raw records; left unmodified
     * @return copies of the records with transformed {@code val} fields
     */
    public static List<Map<String, Object>> applyToRecords(List<ValueTransformer> chain, List<Map<String, Object>> records) {
        List<Map<String, Object>> out = new ArrayList<>(records.size());
        Map<Object, List<Integer>> byKey = new LinkedHashMap<>();
        for (Map<String, Object> record : records) {
            byKey.computeIfAbsent(record.get("key"), k -> new ArrayList<>()).add(out.size());
            out.add(new LinkedHashMap<>(record));
        }
        if (chain.isEmpty()) {
            return out;
        }
        for (List<Integer> indexes : byKey.values()) {
            List<Sample> samples = new ArrayList<>(indexes.size());
            for (int i : indexes) {
                Object t = out.get(i).get("t");
                Object val = out.get(i).get("val");
                samples.add(Sample.of(t instanceof Number ? ((Number) t).doubleValue() : 0.0,
                        val instanceof Number ? ((Number) val).doubleValue() : null));
            }
            for (ValueTransformer t : chain) {
                samples = t.applySeries(samples);
            }
            for (int j = 0; j < indexes.size(); j++) {
                out.get(indexes.get(j)).put("val", samples.get(j).getValue());
            }
        }
        return out;
    }

    private static ValueTransformer simple(String name, DoubleUnaryOperator op) {
        return new ValueTransformer() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public Double apply(Double value) {
                return value == null ? null : op.applyAsDouble(value);
            }
        };
    }

    /**
     * Turns cumulative counter samples into per-sample increments. Scalars are left as they are.
     */
    private static class CumulativeToEvents implements ValueTransformer {
        @Override
        public String getName() {
            return "cumulative_to_events";
        }

        @Override
        public Double apply(Double value) {
            return value;
        }

        @Override
        public List<Sample> applySeries(List<Sample> samples) {
            List<Sample> out = new ArrayList<>(samples.size());
            Double current = samples.isEmpty() ? null : samples.get(0).getValue();
            for (Sample s : samples) {
                Double v = s.getValue();
                out.add(Sample.of(s.getTime(), v == null || current == null ? null : v - current));
                if (v != null) {
                    current = v;
                }
            }
            return out;
        }
    }
}
