package com.assetmetrics.history.upstream;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Wire format of one upstream metrics response.
 *
 * <pre>
 * {
 *   "datasets": [{
 *     "metadata": {"assetType": "aws:ec2:instance", "granularity": "hour",
 *                  "keys": ["assetId", "timestamp", "cpu:used:percent.avg"]},
 *     "values": [["arn:...", "2017-06-20T09:00:00+00:00", 12.5]]
 *   }],
 *   "request": {"next": "https://...&amp;page=2"}
 * }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record UpstreamPayload(
    List<Dataset> datasets,
    Request request
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Dataset(Metadata metadata, List<List<Object>> values) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Metadata(String assetType, String granularity, List<String> keys) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Request(String next) {}
}
