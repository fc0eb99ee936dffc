package com.ryuqq.fanout.adapter.inmemory.pipeline;

import com.ryuqq.fanout.adapter.inmemory.api.MetricDataQuery;
import com.ryuqq.fanout.adapter.inmemory.api.MetricDataRequest;
import com.ryuqq.fanout.core.error.BuildException;
import com.ryuqq.fanout.core.model.TimeRange;
import com.ryuqq.fanout.core.spi.RequestBuilder;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Assembles a single {@link MetricDataRequest} for a region's queries.
 *
 * @author Fanout Team
 * @since 1.0.0
 */
public class MetricDataRequestBuilder implements RequestBuilder<MetricDataQuery, MetricDataRequest> {

    @Override
    public MetricDataRequest build(TimeRange timeRange, List<MetricDataQuery> queries) throws BuildException {
        if (queries.isEmpty()) {
            throw new BuildException("no queries to send");
        }
        if (queries.size() > MetricDataRequest.MAX_QUERIES) {
            throw new BuildException("too many queries in one request (max: "
                + MetricDataRequest.MAX_QUERIES + ", current: " + queries.size() + ")");
        }
        Set<String> ids = new HashSet<>();
        for (MetricDataQuery query : queries) {
            if (!ids.add(query.id())) {
                throw new BuildException("duplicate query id in request: " + query.id());
            }
        }
        return new MetricDataRequest(timeRange.from(), timeRange.to(), queries);
    }
}
