package com.ryuqq.fanout.adapter.inmemory.pipeline;

import com.ryuqq.fanout.adapter.inmemory.api.MetricDataQuery;
import com.ryuqq.fanout.adapter.inmemory.api.Statistic;
import com.ryuqq.fanout.core.error.TranslationException;
import com.ryuqq.fanout.core.model.MetricQuery;
import com.ryuqq.fanout.core.model.RegionGroup;
import com.ryuqq.fanout.core.spi.QueryTranslator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Translates generic {@link MetricQuery} parameters into {@link MetricDataQuery}.
 *
 * <p><strong>Recognized parameters:</strong></p>
 * <ul>
 *   <li>{@code namespace} (required)</li>
 *   <li>{@code metricName} (required)</li>
 *   <li>{@code statistic}: Average, Sum, Minimum, Maximum or SampleCount (default Average)</li>
 *   <li>{@code period}: bucket width in seconds, positive (default 60)</li>
 *   <li>{@code label}: series label (default metric name)</li>
 *   <li>{@code dimension.<name>}: dimension filter</li>
 * </ul>
 *
 * @author Fanout Team
 * @since 1.0.0
 */
public class MetricDataQueryTranslator implements QueryTranslator<MetricDataQuery> {

    public static final String NAMESPACE = "namespace";
    public static final String METRIC_NAME = "metricName";
    public static final String STATISTIC = "statistic";
    public static final String PERIOD = "period";
    public static final String LABEL = "label";
    public static final String DIMENSION_PREFIX = "dimension.";

    static final int DEFAULT_PERIOD_SECONDS = 60;

    @Override
    public List<MetricDataQuery> translate(RegionGroup group) throws TranslationException {
        List<MetricDataQuery> translated = new ArrayList<>(group.size());
        for (MetricQuery query : group.queries()) {
            translated.add(translate(query));
        }
        return translated;
    }

    private MetricDataQuery translate(MetricQuery query) throws TranslationException {
        String id = query.id().getValue();
        String namespace = required(query, NAMESPACE);
        String metricName = required(query, METRIC_NAME);

        String statisticLabel = query.parameter(STATISTIC);
        Statistic statistic = statisticLabel == null ? Statistic.AVERAGE : Statistic.fromLabel(statisticLabel);
        if (statistic == null) {
            throw new TranslationException("query " + id + " has unknown statistic: " + statisticLabel);
        }

        return new MetricDataQuery(
            id,
            namespace,
            metricName,
            dimensions(query),
            statistic,
            period(query),
            query.parameter(LABEL)
        );
    }

    private static String required(MetricQuery query, String name) throws TranslationException {
        String value = query.parameter(name);
        if (value == null || value.isBlank()) {
            throw new TranslationException("query " + query.id().getValue() + " is missing " + name);
        }
        return value;
    }

    private static int period(MetricQuery query) throws TranslationException {
        String raw = query.parameter(PERIOD);
        if (raw == null || raw.isBlank()) {
            return DEFAULT_PERIOD_SECONDS;
        }
        int period;
        try {
            period = Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new TranslationException("query " + query.id().getValue() + " has non-numeric period: " + raw, e);
        }
        if (period <= 0) {
            throw new TranslationException("query " + query.id().getValue() + " period must be positive (current: " + period + ")");
        }
        return period;
    }

    private static Map<String, String> dimensions(MetricQuery query) {
        Map<String, String> dimensions = new LinkedHashMap<>();
        for (Map.Entry<String, String> parameter : query.parameters().entrySet()) {
            if (parameter.getKey().startsWith(DIMENSION_PREFIX)) {
                dimensions.put(parameter.getKey().substring(DIMENSION_PREFIX.length()), parameter.getValue());
            }
        }
        return dimensions;
    }
}
