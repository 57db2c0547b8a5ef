package com.assetmetrics.history.upstream;

import com.assetmetrics.history.domain.Entry;
import com.assetmetrics.history.domain.Page;
import com.assetmetrics.history.exception.MalformedResponseException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Decodes one upstream response body into a {@link Page}.
 *
 * Each value row becomes one {@link Entry}: the {@code timestamp} column is the
 * sample time, the {@code assetId} column is ignored, null cells are skipped and
 * every other column must be numeric.
 */
public class PageDecoder {

    private static final Logger log = LoggerFactory.getLogger(PageDecoder.class);

    static final String ASSET_ID_KEY = "assetId";
    static final String TIMESTAMP_KEY = "timestamp";

    private final ObjectMapper objectMapper;

    public PageDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @param body Raw JSON response body
     * @param dateHeader Value of the HTTP {@code Date} header, may be null
     * @return The decoded page
     * @throws MalformedResponseException if the body does not match the expected shape
     */
    public Page decode(String body, String dateHeader) {
        UpstreamPayload payload = readPayload(body);
        List<Entry> entries = new ArrayList<>();

        List<UpstreamPayload.Dataset> datasets =
            payload.datasets() == null ? List.of() : payload.datasets();
        if (datasets.size() > 1) {
            throw new MalformedResponseException("Multiple datasets not supported");
        }
        for (UpstreamPayload.Dataset dataset : datasets) {
            if (dataset.metadata() == null || dataset.metadata().keys() == null) {
                throw new MalformedResponseException("Metadata chunk missing");
            }
            extractEntries(dataset.metadata().keys(), dataset.values(), entries);
        }

        String next = payload.request() == null ? null : payload.request().next();
        return new Page(entries, next, parseBatchDay(dateHeader));
    }

    /**
     * Reduces an RFC 1123 {@code Date} header to a UTC calendar day.
     * Returns null when the header is absent or unparsable; skew detection is skipped then.
     */
    static LocalDate parseBatchDay(String dateHeader) {
        if (dateHeader == null || dateHeader.isBlank()) {
            return null;
        }
        try {
            return ZonedDateTime.parse(dateHeader, DateTimeFormatter.RFC_1123_DATE_TIME)
                .withZoneSameInstant(ZoneOffset.UTC)
                .toLocalDate();
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparsable Date header '{}': {}", dateHeader, e.getMessage());
            return null;
        }
    }

    private UpstreamPayload readPayload(String body) {
        if (body == null || body.isBlank()) {
            throw new MalformedResponseException("Empty response body");
        }
        try {
            UpstreamPayload payload = objectMapper.readValue(body, UpstreamPayload.class);
            if (payload == null) {
                throw new MalformedResponseException("Empty response body");
            }
            return payload;
        } catch (JsonProcessingException e) {
            throw new MalformedResponseException("Unparsable response body: " + e.getOriginalMessage(), e);
        }
    }

    private void extractEntries(List<String> keys, List<List<Object>> rows, List<Entry> sink) {
        if (rows == null) {
            return;
        }
        for (List<Object> row : rows) {
            if (row == null || row.size() != keys.size()) {
                throw new MalformedResponseException("Wrong number of values");
            }
            Instant time = null;
            Map<String, Double> values = new HashMap<>();
            for (int i = 0; i < row.size(); i++) {
                String key = keys.get(i);
                Object value = row.get(i);
                if (ASSET_ID_KEY.equals(key)) {
                    continue;
                }
                if (TIMESTAMP_KEY.equals(key)) {
                    time = parseTimestamp(value);
                } else if (value != null) {
                    if (!(value instanceof Number)) {
                        throw new MalformedResponseException(value + " should be a number.");
                    }
                    values.put(key, ((Number) value).doubleValue());
                }
            }
            if (time == null) {
                throw new MalformedResponseException("Missing timestamp");
            }
            sink.add(new Entry(time, values));
        }
    }

    private Instant parseTimestamp(Object value) {
        if (!(value instanceof String)) {
            throw new MalformedResponseException(value + " should be a string.");
        }
        String text = (String) value;
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException e) {
            throw new MalformedResponseException("Unparsable timestamp: " + text, e);
        }
    }
}
