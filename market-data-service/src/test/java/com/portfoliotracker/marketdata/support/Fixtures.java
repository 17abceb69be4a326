package com.portfoliotracker.marketdata.support;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.Locale;
import java.util.Map;

/**
 * Alpha Vantage bodies for tests: recorded files under {@code /alphavantage} and
 * generated daily series.
 */
public final class Fixtures {

    private Fixtures() {}

    public static String load(String name) {
        try (InputStream in = Fixtures.class.getResourceAsStream("/alphavantage/" + name)) {
            if (in == null) throw new IllegalArgumentException("Missing fixture " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Daily series body whose newest bar (dated {@code newest}) closes at {@code closes[0]},
     * the previous day at {@code closes[1]}, and so on.
     */
    public static String dailySeries(String symbol, LocalDate newest, double... closes) {
        StringBuilder bars = new StringBuilder();
        for (int i = 0; i < closes.length; i++) {
            if (i > 0) bars.append(',');
            String close = String.format(Locale.ROOT, "%.4f", closes[i]);
            bars.append('"').append(newest.minusDays(i)).append("\": {")
                .append("\"1. open\": \"").append(close).append("\", ")
                .append("\"2. high\": \"").append(close).append("\", ")
                .append("\"3. low\": \"").append(close).append("\", ")
                .append("\"4. close\": \"").append(close).append("\", ")
                .append("\"5. volume\": \"1000\"}");
        }
        return "{\"Meta Data\": {\"2. Symbol\": \"" + symbol + "\"}, "
            + "\"Time Series (Daily)\": {" + bars + "}}";
    }

    public static String overview(String symbol, Map<String, String> attributes) {
        StringBuilder body = new StringBuilder("{\"Symbol\": \"").append(symbol).append('"');
        attributes.forEach((k, v) -> body.append(", \"").append(k).append("\": \"").append(v).append('"'));
        return body.append('}').toString();
    }
}
