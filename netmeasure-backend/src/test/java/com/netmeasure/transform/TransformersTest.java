package com.netmeasure.transform;

import com.netmeasure.model.ConfigurationException;
import com.netmeasure.worker.Sample;
import com.netmeasure.worker.WorkerResult;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TransformersTest {

    @Test
    void rrToMsTurnsRatesIntoLatencies() {
        List<ValueTransformer> chain = Transformers.resolve(List.of("rr_to_ms"));

        WorkerResult result = Transformers.applyChain(chain,
                WorkerResult.series(List.of(Sample.of(1.0, 50.0), Sample.of(2.0, 0.0))));

        assertThat(((WorkerResult.Series) result).getSamples())
                .containsExactly(Sample.of(1.0, 20.0), Sample.of(2.0, null));
    }

    @Test
    void chainAppliesInOrder() {
        List<ValueTransformer> chain = Transformers.resolve(List.of("kbits_to_mbits", "s_to_ms"));

        WorkerResult result = Transformers.applyChain(chain, WorkerResult.scalar(2500.0));

        assertThat(((WorkerResult.Scalar) result).getValue()).isEqualTo(2500.0);
    }

    @Test
    void unknownNameIsAConfigurationError() {
        assertThatThrownBy(() -> Transformers.resolve(List.of("identity", "to_furlongs")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("to_furlongs");
        assertThat(Transformers.names()).contains("identity", "bits_to_mbits", "cumulative_to_events");
    }

    @Test
    void cumulativeToEventsDiffsSeries() {
        List<ValueTransformer> chain = Transformers.resolve(List.of("cumulative_to_events"));

        WorkerResult result = Transformers.applyChain(chain, WorkerResult.series(List.of(
                Sample.of(1.0, 10.0), Sample.of(2.0, 15.0), Sample.of(3.0, null), Sample.of(4.0, 22.0))));

        assertThat(((WorkerResult.Series) result).getSamples()).extracting(Sample::getValue)
                .containsExactly(0.0, 5.0, null, 7.0);
    }

    @Test
    void metadataTransformsTolerateNonNumbers() {
        List<ValueTransformer> chain = Transformers.resolve(List.of("bits_to_mbits"));

        assertThat(Transformers.applyToMetadata(chain, 4_000_000)).isEqualTo(4.0);
        assertThat(Transformers.applyToMetadata(chain, "n/a")).isEqualTo("n/a");
        assertThat(Transformers.applyToMetadata(chain, null)).isNull();
    }

    @Test
    void failingTransformerOnSeriesPropagates() {
        ValueTransformer failing = new ValueTransformer() {
            @Override
            public String getName() {
                return "failing";
            }

            @Override
            public Double apply(Double value) {
                throw new ArithmeticException("boom");
            }
        };

        assertThatThrownBy(() -> Transformers.applyChain(List.of(failing), WorkerResult.scalar(1.0)))
                .isInstanceOf(TransformException.class)
                .hasMessageContaining("failing");
        assertThat(Transformers.applyToMetadata(List.of(failing), 1.0)).isEqualTo(1.0);
    }

    @Test
    void rawRecordsAreTransformedPerKey() {
        List<Map<String, Object>> records = List.of(
                Map.of("t", 1.0, "val", 100.0, "key", "up"),
                Map.of("t", 1.0, "val", 10.0, "key", "down"),
                Map.of("t", 2.0, "val", 150.0, "key", "up"),
                Map.of("t", 2.0, "val", 30.0, "key", "down"));

        List<Map<String, Object>> out = Transformers.applyToRecords(
                Transformers.resolve(List.of("cumulative_to_events")), records);

        assertThat(out).extracting(r -> r.get("val")).containsExactly(0.0, 0.0, 50.0, 20.0);
        assertThat(records.get(2)).containsEntry("val", 150.0);
    }
}
