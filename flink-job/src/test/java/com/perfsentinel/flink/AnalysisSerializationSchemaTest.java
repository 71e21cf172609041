package com.perfsentinel.flink;

import com.fasterxml.jackson.databind.JsonNode;
import com.perfsentinel.core.model.ChangeCategory;
import com.perfsentinel.core.model.ChangeLocation;
import com.perfsentinel.core.model.ChangePoint;
import com.perfsentinel.core.model.ChangeWindow;
import com.perfsentinel.core.model.ClassifiedChangePoint;
import com.perfsentinel.core.model.OutlierResult;
import com.perfsentinel.core.model.RegimeStatistics;
import com.perfsentinel.core.model.SeriesAnalysis;
import com.perfsentinel.core.model.SeriesIdentifier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link AnalysisSerializationSchema}.
 */
class AnalysisSerializationSchemaTest {

    private final AnalysisSerializationSchema schema = new AnalysisSerializationSchema();

    @Test
    @DisplayName("Should write the analysis as JSON with ISO timestamps")
    void shouldSerializeAnalysis() throws IOException {
        SeriesIdentifier id = new SeriesIdentifier("sys-perf", "linux-standalone", "bestbuy_agg", "count", "4");
        double[] values = { 10, 10, 20, 20 };
        ClassifiedChangePoint point = new ClassifiedChangePoint(new ChangePoint(2, 12.5, 0.0),
                new ChangeWindow(2, 1, 2, ChangeLocation.BEHIND), "rev2", "rev1", "rev2",
                RegimeStatistics.describe(values, 0, 1), RegimeStatistics.describe(values, 2, 4),
                Math.log(2), ChangeCategory.MAJOR_IMPROVEMENT);
        SeriesAnalysis analysis = SeriesAnalysis.builder()
                .identifier(id)
                .seriesLength(4)
                .changePoints(List.of(point))
                .outliers(new OutlierResult(List.of(3), 0, List.of(1.1), List.of(2.2)))
                .analyzedAt(Instant.parse("2024-03-01T12:00:00Z"))
                .build();

        JsonNode json = schema.objectMapper().readTree(schema.serialize(analysis));

        assertThat(json.path("identifier").path("threadLevel").asText()).isEqualTo("4");
        assertThat(json.path("seriesLength").asInt()).isEqualTo(4);
        assertThat(json.path("analyzedAt").asText()).isEqualTo("2024-03-01T12:00:00Z");
        assertThat(json.path("changePoints").get(0).path("changePoint").path("index").asInt()).isEqualTo(2);
        assertThat(json.path("changePoints").get(0).path("category").asText()).isEqualTo("MAJOR_IMPROVEMENT");
        assertThat(json.path("changePoints").get(0).path("window").path("location").asText()).isEqualTo("BEHIND");
        assertThat(json.path("changePoints").get(0).path("stableRevision").asText()).isEqualTo("rev1");
        assertThat(json.path("outliers").path("order").get(0).asInt()).isEqualTo(3);
        assertThat(json.path("outliers").has("confirmedIndexes")).isFalse();
    }

    @Test
    @DisplayName("Serialized analysis should read back into an equal object")
    void shouldReadBack() throws IOException {
        SeriesAnalysis analysis = SeriesAnalysis.builder()
                .identifier(new SeriesIdentifier("p", "v", "t", "x", "1"))
                .seriesLength(10)
                .outlierRevisions(List.of("r1"))
                .analyzedAt(Instant.parse("2024-03-01T12:00:00Z"))
                .build();

        SeriesAnalysis read = schema.objectMapper().readValue(schema.serialize(analysis), SeriesAnalysis.class);

        assertThat(read).isEqualTo(analysis);
    }
}
