package com.polyexplorer.polymarket;

import com.polyexplorer.core.error.FailureText;
import com.polyexplorer.core.error.ParseFailure;
import com.polyexplorer.core.error.PipelineException;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns raw Gamma JSON into {@link GammaEvent}. Only {@link ParseFailure}s leave this class; field
 * names in failures are paths such as {@code markets[1].outcomePrices}.
 */
public final class GammaResponseParser {
    static final String LIST_OF_TEXT = "list of text";
    static final String NOT_A_NUMBER = "not a decimal number";

    private static final Pattern ERROR_OFFSET = Pattern.compile(" at (\\d+) \\[");

    private final int snippetMaxLen;

    public GammaResponseParser(int snippetMaxLen) {
        this.snippetMaxLen = Math.max(16, snippetMaxLen);
    }

    public GammaEvent parseEvent(String body) {
        JSONObject root = readObject(body);
        String slug = requireString(root, "slug", "slug");
        String title = requireString(root, "title", "title");

        Object rawMarkets = root.opt("markets");
        if (rawMarkets == null || rawMarkets == JSONObject.NULL) {
            throw new PipelineException(new ParseFailure.MissingField("markets"));
        }
        if (!(rawMarkets instanceof JSONArray)) {
            throw new PipelineException(new ParseFailure.InvalidFieldFormat(
                    "markets", "JSON array", String.valueOf(rawMarkets)));
        }
        JSONArray arr = (JSONArray) rawMarkets;
        List<GammaMarket> markets = new ArrayList<>(arr.length());
        for (int i = 0; i < arr.length(); i++) {
            String path = "markets[" + i + "]";
            JSONObject item = arr.optJSONObject(i);
            if (item == null) {
                throw new PipelineException(new ParseFailure.InvalidFieldFormat(
                        path, "JSON object", String.valueOf(arr.opt(i))));
            }
            markets.add(parseMarket(item, path));
        }

        return new GammaEvent(
                slug,
                title,
                root.optBoolean("active", false),
                root.optBoolean("closed", false),
                groupTotal(root, "volume"),
                groupTotal(root, "liquidity"),
                markets
        );
    }

    GammaMarket parseMarket(JSONObject item, String path) {
        List<String> outcomes = requireEncodedList(item, "outcomes", path);
        List<String> rawPrices = requireEncodedList(item, "outcomePrices", path);
        if (rawPrices.size() != outcomes.size()) {
            throw new PipelineException(new ParseFailure.InvalidArrayLength(
                    path + ".outcomePrices", outcomes.size(), rawPrices.size()));
        }
        List<Double> prices = new ArrayList<>(rawPrices.size());
        for (int i = 0; i < rawPrices.size(); i++) {
            prices.add(parseNumber(path + ".outcomePrices[" + i + "]", rawPrices.get(i)));
        }

        return new GammaMarket(
                requireString(item, "question", path + ".question"),
                requireString(item, "conditionId", path + ".conditionId"),
                requireString(item, "slug", path + ".slug"),
                outcomes,
                prices,
                requireEncodedList(item, "clobTokenIds", path),
                item.optBoolean("active", false),
                item.optBoolean("closed", false),
                optionalNumber(item, "volumeNum", path + ".volumeNum", 0.0),
                optionalNumber(item, "volume24hr", path + ".volume24hr", 0.0),
                optionalNumber(item, "volume1wk", path + ".volume1wk", 0.0),
                optionalNumber(item, "volume1mo", path + ".volume1mo", 0.0),
                optionalNumber(item, "volume1yr", path + ".volume1yr", 0.0),
                optionalNumber(item, "liquidityNum", path + ".liquidityNum", 0.0),
                optionalNumber(item, "lastTradePrice", path + ".lastTradePrice", 0.0),
                nullableNumber(item, "bestBid", path + ".bestBid"),
                nullableNumber(item, "bestAsk", path + ".bestAsk"),
                optionalInstant(item, "updatedAt", path + ".updatedAt"),
                optionalInstant(item, "endDate", path + ".endDate")
        );
    }

    private JSONObject readObject(String body) {
        String raw = body == null ? "" : body;
        Object value;
        try {
            value = new JSONTokener(raw).nextValue();
        } catch (JSONException e) {
            throw new PipelineException(new ParseFailure.JsonDeserializationFailed(
                    null,
                    "GammaEvent",
                    FailureText.jsonErrorSnippet(raw, errorOffset(e), snippetMaxLen),
                    reasonOf(e)
            ), e);
        }
        if (!(value instanceof JSONObject)) {
            throw new PipelineException(new ParseFailure.JsonDeserializationFailed(
                    null,
                    "GammaEvent",
                    FailureText.jsonErrorSnippet(raw, snippetMaxLen),
                    "expected a JSON object but found " + typeName(value)
            ));
        }
        return (JSONObject) value;
    }

    private String requireString(JSONObject obj, String key, String path) {
        Object value = obj.opt(key);
        if (value == null || value == JSONObject.NULL) {
            throw new PipelineException(new ParseFailure.MissingField(path));
        }
        if (!(value instanceof String)) {
            throw new PipelineException(new ParseFailure.InvalidFieldFormat(path, "string", String.valueOf(value)));
        }
        return (String) value;
    }

    /**
     * Gamma ships some arrays as JSON text inside a string field; plain arrays are accepted too.
     */
    private List<String> requireEncodedList(JSONObject obj, String key, String parentPath) {
        String path = parentPath + "." + key;
        Object value = obj.opt(key);
        if (value == null || value == JSONObject.NULL) {
            throw new PipelineException(new ParseFailure.MissingField(path));
        }
        JSONArray arr;
        if (value instanceof JSONArray) {
            arr = (JSONArray) value;
        } else if (value instanceof String) {
            String text = (String) value;
            try {
                arr = new JSONArray(text);
            } catch (JSONException e) {
                throw new PipelineException(new ParseFailure.JsonDeserializationFailed(
                        path,
                        LIST_OF_TEXT,
                        FailureText.jsonErrorSnippet(text, errorOffset(e), snippetMaxLen),
                        reasonOf(e)
                ), e);
            }
        } else {
            throw new PipelineException(new ParseFailure.JsonDeserializationFailed(
                    path,
                    LIST_OF_TEXT,
                    FailureText.jsonErrorSnippet(String.valueOf(value), snippetMaxLen),
                    "expected a string holding a JSON array but found " + typeName(value)
            ));
        }
        List<String> out = new ArrayList<>(arr.length());
        for (int i = 0; i < arr.length(); i++) {
            Object item = arr.opt(i);
            if (item == null || item == JSONObject.NULL || item instanceof JSONObject || item instanceof JSONArray) {
                throw new PipelineException(new ParseFailure.JsonDeserializationFailed(
                        path,
                        LIST_OF_TEXT,
                        FailureText.jsonErrorSnippet(arr.toString(), snippetMaxLen),
                        "element " + i + " is " + typeName(item)
                ));
            }
            out.add(String.valueOf(item));
        }
        return out;
    }

    private double groupTotal(JSONObject root, String key) {
        double value = optionalNumber(root, key, key, 0.0);
        if (value < 0.0) {
            throw new PipelineException(new ParseFailure.InvalidNumber(
                    key, String.valueOf(root.opt(key)), "group total must not be negative"));
        }
        return value;
    }

    private double optionalNumber(JSONObject obj, String key, String path, double fallback) {
        Double value = nullableNumber(obj, key, path);
        return value == null ? fallback : value;
    }

    private Double nullableNumber(JSONObject obj, String key, String path) {
        Object value = obj.opt(key);
        if (value == null || value == JSONObject.NULL) {
            return null;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            String text = ((String) value).trim();
            if (text.isEmpty()) {
                return null;
            }
            return parseNumber(path, text);
        }
        throw new PipelineException(new ParseFailure.InvalidNumber(
                path, String.valueOf(value), "expected a number but found " + typeName(value)));
    }

    private double parseNumber(String path, String raw) {
        String text = raw == null ? "" : raw.trim();
        try {
            double parsed = Double.parseDouble(text);
            if (!Double.isFinite(parsed)) {
                throw new PipelineException(new ParseFailure.InvalidNumber(path, text, "not a finite number"));
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new PipelineException(new ParseFailure.InvalidNumber(path, text, NOT_A_NUMBER), e);
        }
    }

    private Instant optionalInstant(JSONObject obj, String key, String path) {
        Object value = obj.opt(key);
        if (value == null || value == JSONObject.NULL) {
            return null;
        }
        String text = String.valueOf(value).trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            // date-only values are taken as midnight UTC
            if (text.length() == 10) {
                return LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            throw new PipelineException(new ParseFailure.InvalidFieldFormat(path, "ISO-8601 timestamp", text), e);
        }
    }

    static int errorOffset(JSONException e) {
        String message = e.getMessage();
        if (message == null) {
            return -1;
        }
        Matcher m = ERROR_OFFSET.matcher(message);
        if (!m.find()) {
            return -1;
        }
        try {
            return Integer.parseInt(m.group(1));
        } catch (NumberFormatException ignored) {
            return -1;
        }
    }

    private static String reasonOf(Exception e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }

    private static String typeName(Object value) {
        if (value == null || value == JSONObject.NULL) {
            return "null";
        }
        if (value instanceof JSONObject) {
            return "object";
        }
        if (value instanceof JSONArray) {
            return "array";
        }
        if (value instanceof Number) {
            return "number";
        }
        if (value instanceof Boolean) {
            return "boolean";
        }
        return "string";
    }
}
