package com.portfoliotracker.marketdata.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.portfoliotracker.common.exception.MalformedResponseException;
import com.portfoliotracker.common.exception.RateLimitExceededException;
import com.portfoliotracker.common.exception.UpstreamErrorException;
import com.portfoliotracker.common.model.CompanyOverview;
import com.portfoliotracker.common.model.DailyBar;
import com.portfoliotracker.common.model.Symbol;
import com.portfoliotracker.marketdata.model.AlphaVantageTimeSeriesResponse;
import com.portfoliotracker.marketdata.model.AlphaVantageTimeSeriesResponse.DailyOhlcv;
import com.portfoliotracker.marketdata.model.OverviewPayload;
import com.portfoliotracker.marketdata.model.TimeSeriesPayload;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Turns raw Alpha Vantage bodies into payloads, classifying provider error envelopes.
 *
 * <p>Classification order for every body:
 * <ol>
 *   <li>not a JSON object → {@link MalformedResponseException}</li>
 *   <li>{@code Information}/{@code Note} about rate limits, call frequency or premium plans → {@link RateLimitExceededException}</li>
 *   <li>{@code Error Message} → {@link UpstreamErrorException} with the provider's text</li>
 *   <li>any other {@code Information} notice → {@link UpstreamErrorException}</li>
 *   <li>data shape check (time series only; overview accepts any remaining object)</li>
 * </ol>
 *
 * <p>Used both for fresh responses and for re-reading cached bodies.
 */
public class AlphaVantageResponseParser {

    private static final String ERROR_MESSAGE_FIELD = "Error Message";
    private static final String INFORMATION_FIELD   = "Information";
    private static final String NOTE_FIELD          = "Note";

    private static final List<String> RATE_LIMIT_MARKERS = List.of("rate limit", "call frequency", "premium plan");

    private final ObjectMapper objectMapper;

    public AlphaVantageResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public TimeSeriesPayload parseTimeSeries(Symbol symbol, String body) {
        JsonNode root = readObject(symbol, body);
        checkErrorSignals(symbol, root);

        JsonNode series = root.get(AlphaVantageTimeSeriesResponse.DAILY_SERIES_FIELD);
        if (series == null || !series.isObject()) {
            throw new MalformedResponseException(symbol.value(),
                "Unexpected response format from Alpha Vantage API for " + symbol);
        }
        return new TimeSeriesPayload(body, toBars(symbol, root));
    }

    public OverviewPayload parseOverview(Symbol symbol, String body) {
        JsonNode root = readObject(symbol, body);
        checkErrorSignals(symbol, root);

        Map<String, String> attributes = new LinkedHashMap<>();
        root.fields().forEachRemaining(field -> {
            if (field.getValue().isValueNode()) {
                attributes.put(field.getKey(), field.getValue().asText());
            }
        });
        return new OverviewPayload(body, CompanyOverview.from(symbol, attributes));
    }

    // ── envelope handling ─────────────────────────────────────────────────────

    private JsonNode readObject(Symbol symbol, String body) {
        if (body == null || body.isBlank()) {
            throw new MalformedResponseException(symbol.value(), "Empty response from Alpha Vantage for " + symbol);
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            if (root == null || !root.isObject()) {
                throw new MalformedResponseException(symbol.value(),
                    "Alpha Vantage response for " + symbol + " is not a JSON object");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new MalformedResponseException(symbol.value(),
                "Alpha Vantage response for " + symbol + " is not valid JSON", e);
        }
    }

    private void checkErrorSignals(Symbol symbol, JsonNode root) {
        String information = textOrNull(root, INFORMATION_FIELD);
        String note = textOrNull(root, NOTE_FIELD);
        if (mentionsRateLimit(information) || mentionsRateLimit(note)) {
            throw new RateLimitExceededException(symbol.value());
        }
        String errorMessage = textOrNull(root, ERROR_MESSAGE_FIELD);
        if (errorMessage != null) {
            throw new UpstreamErrorException(symbol.value(), "Alpha Vantage API error: " + errorMessage);
        }
        if (information != null) {
            throw new UpstreamErrorException(symbol.value(), "Alpha Vantage API notice: " + information);
        }
    }

    private static boolean mentionsRateLimit(String text) {
        if (text == null) return false;
        String lower = text.toLowerCase(Locale.ROOT);
        return RATE_LIMIT_MARKERS.stream().anyMatch(lower::contains);
    }

    private static String textOrNull(JsonNode root, String field) {
        JsonNode node = root.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }

    // ── bars ──────────────────────────────────────────────────────────────────

    private List<DailyBar> toBars(Symbol symbol, JsonNode root) {
        try {
            AlphaVantageTimeSeriesResponse response = objectMapper.treeToValue(root, AlphaVantageTimeSeriesResponse.class);
            TreeMap<LocalDate, DailyOhlcv> sorted = new TreeMap<>(Comparator.reverseOrder());
            response.timeSeriesDaily().forEach((date, ohlcv) -> sorted.put(LocalDate.parse(date), ohlcv));

            List<DailyBar> bars = new ArrayList<>(sorted.size());
            sorted.forEach((date, ohlcv) -> bars.add(ohlcv.toBar(date)));
            if (bars.isEmpty()) {
                throw new MalformedResponseException(symbol.value(),
                    "Alpha Vantage returned an empty daily series for " + symbol);
            }
            return List.copyOf(bars);
        } catch (JsonProcessingException | IllegalArgumentException | DateTimeParseException | NullPointerException e) {
            throw new MalformedResponseException(symbol.value(),
                "Unreadable daily bar in Alpha Vantage response for " + symbol, e);
        }
    }
}
