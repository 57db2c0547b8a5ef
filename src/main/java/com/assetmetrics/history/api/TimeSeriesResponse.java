package com.assetmetrics.history.api;

import com.assetmetrics.history.domain.Asset;
import com.assetmetrics.history.domain.DataPoint;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One OpenTSDB result series.
 *
 * Example response element:
 * {
 *   "metric": "cpu:used:percent.avg",
 *   "tags": {"region": "us-east-1", "accountNumber": "12345", "instanceId": "i-12345678"},
 *   "aggregateTags": [],
 *   "dps": {"1497949200": 12.5, "1497952800": 13.0}
 * }
 */
@Schema(description = "Time series for one asset and metric")
public record TimeSeriesResponse(
    String metric,
    Map<String, String> tags,
    List<String> aggregateTags,
    @Schema(description = "Epoch seconds to value")
    Map<String, Double> dps
) {

    public static TimeSeriesResponse of(String metric, Asset asset, List<DataPoint> points) {
        Map<String, String> tags = new LinkedHashMap<>();
        tags.put(QueryRequest.REGION, asset.region());
        tags.put(QueryRequest.ACCOUNT_NUMBER, asset.accountNumber());
        tags.put(QueryRequest.INSTANCE_ID, asset.instanceId());

        Map<String, Double> dps = new LinkedHashMap<>();
        for (DataPoint point : points) {
            dps.put(Long.toString(point.epochSeconds()), point.value());
        }
        return new TimeSeriesResponse(metric, tags, List.of(), dps);
    }
}
