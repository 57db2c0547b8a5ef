package com.assetmetrics.history.api;

import com.assetmetrics.history.domain.Asset;
import com.assetmetrics.history.domain.DataPoint;
import com.assetmetrics.history.service.TimeSeriesQueryService;
import com.assetmetrics.history.util.MetricNames;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * OpenTSDB-compatible HTTP API so dashboards can read asset metric history
 * as if this service were an OpenTSDB server.
 */
@RestController
@RequestMapping("/api")
@Validated
@Tag(name = "Time Series", description = "OpenTSDB-compatible metric history API")
public class QueryController {

    private static final Logger log = LoggerFactory.getLogger(QueryController.class);

    private final TimeSeriesQueryService queryService;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public QueryController(TimeSeriesQueryService queryService, MeterRegistry meterRegistry, Clock clock) {
        this.queryService = queryService;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    /**
     * POST /api/query
     *
     * Returns one series per sub query. A missing end time means now.
     * Escaped metric names are decoded before reading; see {@link MetricNames}.
     */
    @Operation(
        summary = "Query metric history",
        description = """
            Reads one metric of one asset per sub query over [start, end).
            Every sub query needs the region, accountNumber and instanceId tags,
            either in "tags" or in "filters".

            **Example Request:**
            ```
            POST /api/query
            {"start": 1497916800000, "end": 1497960000000,
             "queries": [{"metric": "cpu:used:percent.avg",
                          "tags": {"region": "us-east-1", "accountNumber": "12345", "instanceId": "i-12345678"}}]}
            ```
            """
    )
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Successfully read metric history"),
        @ApiResponse(
            responseCode = "400",
            description = "Invalid query (e.g. missing asset tags)",
            content = @Content(
                mediaType = "application/json",
                schema = @Schema(implementation = ErrorResponse.class),
                examples = @ExampleObject(
                    name = "Missing tags",
                    value = """
                        {
                          "status": 400,
                          "error": "INVALID_ARGUMENT",
                          "message": "region, accountNumber, and instanceId tags required",
                          "path": "/api/query",
                          "timestamp": "2017-06-20T12:00:00Z"
                        }
                        """
                )
            )
        ),
        @ApiResponse(
            responseCode = "502",
            description = "Upstream rejected the request or sent an unreadable response",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "503",
            description = "Upstream unreachable",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    @PostMapping("/query")
    public ResponseEntity<List<TimeSeriesResponse>> query(@Valid @RequestBody QueryRequest request) {
        Timer.Sample sample = Timer.start(meterRegistry);

        long start = request.start();
        long end = request.end() == null || request.end() == 0 ? clock.millis() : request.end();

        List<TimeSeriesResponse> result = new ArrayList<>(request.queries().size());
        for (QueryRequest.SubQuery query : request.queries()) {
            Asset asset = query.toAsset();
            String metric = MetricNames.unescape(query.metric());
            List<DataPoint> points = queryService.fetch(asset, metric, start, end);
            result.add(TimeSeriesResponse.of(metric, asset, points));
        }

        // Only successful queries are timed
        sample.stop(meterRegistry.timer("api.query.request.time"));
        log.debug("Query: from={}, to={}, series={}", start, end, result.size());
        return ResponseEntity.ok(result);
    }

    @Operation(summary = "Suggest metric names or tag values; always empty")
    @GetMapping("/suggest")
    public ResponseEntity<List<String>> suggest() {
        return ResponseEntity.ok(List.of());
    }

    @Operation(summary = "List supported aggregators")
    @GetMapping("/aggregators")
    public ResponseEntity<List<String>> aggregators() {
        return ResponseEntity.ok(List.of("avg"));
    }

    @Operation(summary = "Report the emulated OpenTSDB API version")
    @GetMapping("/version")
    public ResponseEntity<Map<String, String>> version() {
        return ResponseEntity.ok(Map.of("version", "1.0"));
    }

    @Operation(summary = "Report OpenTSDB configuration flags expected by dashboards")
    @GetMapping("/config")
    public ResponseEntity<Map<String, String>> config() {
        return ResponseEntity.ok(Map.of(
            "tsd.core.auto_create_metrics", "true",
            "tsd.core.auto_create_tagks", "true",
            "tsd.core.auto_create_tagvs", "true"
        ));
    }

    /**
     * Filter types understood by {@code /api/query}. Only exact tag values are used,
     * so literal_or is the one type advertised.
     */
    @Operation(summary = "List supported tag filter types")
    @GetMapping("/config/filters")
    public ResponseEntity<Map<String, FilterDescription>> filters() {
        return ResponseEntity.ok(Map.of(
            "literal_or", new FilterDescription(
                "region=literal_or(us-east-1)  {\"type\":\"literal_or\",\"tagk\":\"region\","
                    + "\"filter\":\"us-east-1\",\"groupBy\":false}",
                "Accepts an exact value. The region, accountNumber and instanceId tags select the asset.")
        ));
    }

    /**
     * One entry of the OpenTSDB filter listing.
     */
    public record FilterDescription(String examples, String description) {}
}
