package com.assetmetrics.history.api;

import com.assetmetrics.history.domain.Asset;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.List;
import java.util.Map;

/**
 * OpenTSDB {@code /api/query} request body.
 * Only absolute millisecond timestamps are supported.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@Schema(description = "Time series query")
public record QueryRequest(

    @Schema(description = "Start time in milliseconds since epoch (inclusive)", example = "1497916800000")
    @NotNull(message = "Start time is required")
    @PositiveOrZero(message = "Start time cannot be negative")
    Long start,

    @Schema(description = "End time in milliseconds since epoch (exclusive); defaults to now", example = "1497960000000")
    @PositiveOrZero(message = "End time cannot be negative")
    Long end,

    @Schema(description = "Sub queries, one time series each")
    @NotEmpty(message = "At least one query is required")
    List<@Valid SubQuery> queries
) {

    static final String REGION = "region";
    static final String ACCOUNT_NUMBER = "accountNumber";
    static final String INSTANCE_ID = "instanceId";

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SubQuery(
        @Schema(description = "Metric name", example = "cpu:used:percent.avg")
        @NotBlank(message = "Metric is required")
        String metric,

        @Schema(description = "Aggregator; only 'avg' is advertised", example = "avg")
        String aggregator,

        @Schema(description = "Tag filters as plain key/value pairs")
        Map<String, String> tags,

        @Schema(description = "Tag filters")
        List<Filter> filters
    ) {

        /**
         * Resolves the asset from filters, then tags; tags win when both are present.
         *
         * @throws IllegalArgumentException if any of the three asset tags is missing
         */
        public Asset toAsset() {
            String region = null;
            String accountNumber = null;
            String instanceId = null;
            if (filters != null) {
                for (Filter filter : filters) {
                    if (filter == null || filter.tagk() == null) {
                        continue;
                    }
                    switch (filter.tagk()) {
                        case REGION -> region = filter.filter();
                        case ACCOUNT_NUMBER -> accountNumber = filter.filter();
                        case INSTANCE_ID -> instanceId = filter.filter();
                        default -> { }
                    }
                }
            }
            if (tags != null) {
                region = tags.getOrDefault(REGION, region);
                accountNumber = tags.getOrDefault(ACCOUNT_NUMBER, accountNumber);
                instanceId = tags.getOrDefault(INSTANCE_ID, instanceId);
            }
            Asset asset = new Asset(region, accountNumber, instanceId);
            if (!asset.isComplete()) {
                throw new IllegalArgumentException("region, accountNumber, and instanceId tags required");
            }
            return asset;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Filter(
        String type,
        String tagk,
        String filter,
        Boolean groupBy
    ) {}
}
