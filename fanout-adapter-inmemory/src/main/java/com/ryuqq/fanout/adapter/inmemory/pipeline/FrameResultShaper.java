package com.ryuqq.fanout.adapter.inmemory.pipeline;

import com.ryuqq.fanout.core.error.ShapeException;
import com.ryuqq.fanout.core.model.MetricQuery;
import com.ryuqq.fanout.core.model.QueryId;
import com.ryuqq.fanout.core.model.RegionGroup;
import com.ryuqq.fanout.core.model.TimeRange;
import com.ryuqq.fanout.core.result.DataResponse;
import com.ryuqq.fanout.core.result.Frame;
import com.ryuqq.fanout.core.spi.ResultShaper;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shapes {@link MetricQueryResultSet}s into one-frame {@link DataResponse}s keyed by query id.
 *
 * <p>Frame labels are the query's dimensions plus its region. Points outside the batch
 * time range are dropped. An embedded per-query error becomes
 * {@link DataResponse#error(Throwable)} with a {@link MetricQueryFailedException}.</p>
 *
 * @author Fanout Team
 * @since 1.0.0
 */
public class FrameResultShaper implements ResultShaper<MetricQueryResultSet> {

    static final String REGION_LABEL = "region";

    @Override
    public Map<QueryId, DataResponse> shape(List<MetricQueryResultSet> resultSets, RegionGroup group, TimeRange timeRange)
            throws ShapeException {
        Map<QueryId, MetricQuery> queries = new HashMap<>();
        for (MetricQuery query : group.queries()) {
            queries.put(query.id(), query);
        }

        Map<QueryId, DataResponse> shaped = new LinkedHashMap<>();
        for (MetricQueryResultSet resultSet : resultSets) {
            QueryId queryId = QueryId.of(resultSet.id());
            MetricQuery query = queries.get(queryId);
            if (query == null) {
                throw new ShapeException("result set " + resultSet.id() + " does not belong to region " + group.region());
            }
            if (resultSet.hasError()) {
                shaped.put(queryId, DataResponse.error(new MetricQueryFailedException(resultSet.id(), resultSet.errorMessage())));
            } else {
                shaped.put(queryId, DataResponse.of(List.of(toFrame(resultSet, query, group, timeRange))));
            }
        }
        return shaped;
    }

    private static Frame toFrame(MetricQueryResultSet resultSet, MetricQuery query, RegionGroup group, TimeRange timeRange) {
        List<Instant> timestamps = new ArrayList<>();
        List<Double> values = new ArrayList<>();
        for (int i = 0; i < resultSet.timestamps().size(); i++) {
            Instant timestamp = resultSet.timestamps().get(i);
            if (timeRange.contains(timestamp)) {
                timestamps.add(timestamp);
                values.add(resultSet.values().get(i));
            }
        }

        Map<String, String> labels = new LinkedHashMap<>();
        for (Map.Entry<String, String> parameter : query.parameters().entrySet()) {
            if (parameter.getKey().startsWith(MetricDataQueryTranslator.DIMENSION_PREFIX)) {
                labels.put(parameter.getKey().substring(MetricDataQueryTranslator.DIMENSION_PREFIX.length()), parameter.getValue());
            }
        }
        labels.put(REGION_LABEL, group.region().getName());

        String name = resultSet.label() == null ? resultSet.id() : resultSet.label();
        return new Frame(name, labels, timestamps, values);
    }
}
