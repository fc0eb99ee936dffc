package com.ryuqq.fanout.adapter.inmemory.pipeline;

import com.ryuqq.fanout.adapter.inmemory.api.MetricDataQuery;
import com.ryuqq.fanout.adapter.inmemory.api.MetricDataResponse;
import com.ryuqq.fanout.adapter.inmemory.api.MetricDataResult;
import com.ryuqq.fanout.adapter.inmemory.api.Statistic;
import com.ryuqq.fanout.core.error.ParseException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * MetricDataResponseTranslator 테스트.
 *
 * @author Fanout Team
 * @since 1.0.0
 */
class MetricDataResponseTranslatorTest {

    private static final Instant T0 = Instant.parse("2024-03-01T00:00:00Z");

    private final MetricDataResponseTranslator translator = new MetricDataResponseTranslator();

    private static MetricDataQuery query(String id) {
        return new MetricDataQuery(id, "AWS/EC2", "CPUUtilization", Map.of(), Statistic.AVERAGE, 60, "label-" + id);
    }

    @Test
    void parse_ResultsReturnedInQueryOrder() throws Exception {
        // Given: results arrive out of order
        MetricDataResponse response = new MetricDataResponse(List.of(
            MetricDataResult.complete("b", "label-b", List.of(T0), List.of(2.0)),
            MetricDataResult.complete("a", "label-a", List.of(T0), List.of(1.0))
        ), "req-1");

        // When
        List<MetricQueryResultSet> resultSets = translator.parse(response, List.of(query("a"), query("b")));

        // Then
        assertEquals("a", resultSets.get(0).id());
        assertEquals(List.of(1.0), resultSets.get(0).values());
        assertEquals("b", resultSets.get(1).id());
    }

    @Test
    void parse_MissingResult_YieldsEmptyResultSet() throws Exception {
        // When
        List<MetricQueryResultSet> resultSets = translator.parse(
            new MetricDataResponse(List.of(), "req-1"), List.of(query("a")));

        // Then
        assertEquals(1, resultSets.size());
        assertTrue(resultSets.get(0).values().isEmpty());
        assertEquals("label-a", resultSets.get(0).label());
        assertFalse(resultSets.get(0).hasError());
    }

    @Test
    void parse_FailedResult_KeepsEmbeddedError() throws Exception {
        // Given
        MetricDataResponse response = new MetricDataResponse(
            List.of(MetricDataResult.failed("a", "label-a", "metric is throttled")), "req-1");

        // When
        MetricQueryResultSet resultSet = translator.parse(response, List.of(query("a"))).get(0);

        // Then
        assertTrue(resultSet.hasError());
        assertEquals("metric is throttled", resultSet.errorMessage());
    }

    @Test
    void parse_UnknownResultId_ThrowsParseException() {
        // Given
        MetricDataResponse response = new MetricDataResponse(
            List.of(MetricDataResult.complete("zzz", null, List.of(), List.of())), "req-7");

        // When & Then
        ParseException exception = assertThrows(ParseException.class,
            () -> translator.parse(response, List.of(query("a"))));
        assertTrue(exception.getMessage().contains("unknown query id: zzz"));
        assertTrue(exception.getMessage().contains("req-7"));
    }

    @Test
    void parse_MismatchedLengths_ThrowsParseException() {
        // Given
        MetricDataResponse response = new MetricDataResponse(
            List.of(MetricDataResult.complete("a", null, List.of(T0), List.of())), "req-1");

        // When & Then
        assertThrows(ParseException.class, () -> translator.parse(response, List.of(query("a"))));
    }
}
