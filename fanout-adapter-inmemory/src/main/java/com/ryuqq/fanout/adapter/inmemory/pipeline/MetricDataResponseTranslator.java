package com.ryuqq.fanout.adapter.inmemory.pipeline;

import com.ryuqq.fanout.adapter.inmemory.api.MetricDataQuery;
import com.ryuqq.fanout.adapter.inmemory.api.MetricDataResponse;
import com.ryuqq.fanout.adapter.inmemory.api.MetricDataResult;
import com.ryuqq.fanout.core.error.ParseException;
import com.ryuqq.fanout.core.spi.ResponseTranslator;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts a {@link MetricDataResponse} into {@link MetricQueryResultSet}s.
 *
 * <p>Result sets come back in the order of the native queries. A query without a result
 * yields an empty result set. A result that is not complete keeps its message as an
 * embedded error.</p>
 *
 * @author Fanout Team
 * @since 1.0.0
 */
public class MetricDataResponseTranslator
        implements ResponseTranslator<MetricDataQuery, MetricDataResponse, MetricQueryResultSet> {

    @Override
    public List<MetricQueryResultSet> parse(MetricDataResponse response, List<MetricDataQuery> queries)
            throws ParseException {
        Map<String, MetricDataQuery> queriesById = new HashMap<>();
        for (MetricDataQuery query : queries) {
            queriesById.put(query.id(), query);
        }

        Map<String, MetricDataResult> resultsById = new HashMap<>();
        for (MetricDataResult result : response.results()) {
            if (!queriesById.containsKey(result.id())) {
                throw new ParseException("response contains result for unknown query id: " + result.id()
                    + " (requestId: " + response.requestId() + ")");
            }
            if (resultsById.put(result.id(), result) != null) {
                throw new ParseException("response contains more than one result for query id: " + result.id());
            }
        }

        List<MetricQueryResultSet> resultSets = new ArrayList<>(queries.size());
        for (MetricDataQuery query : queries) {
            MetricDataResult result = resultsById.get(query.id());
            if (result == null) {
                resultSets.add(new MetricQueryResultSet(query.id(), query.label(), List.of(), List.of(), null));
            } else {
                resultSets.add(toResultSet(query, result));
            }
        }
        return resultSets;
    }

    private static MetricQueryResultSet toResultSet(MetricDataQuery query, MetricDataResult result)
            throws ParseException {
        if (result.timestamps().size() != result.values().size()) {
            throw new ParseException("result for query " + result.id() + " has "
                + result.timestamps().size() + " timestamps but " + result.values().size() + " values");
        }
        String label = result.label() == null ? query.label() : result.label();
        String error = null;
        if (!result.isComplete()) {
            error = result.message() == null ? result.statusCode() : result.message();
        }
        return new MetricQueryResultSet(result.id(), label, result.timestamps(), result.values(), error);
    }
}
