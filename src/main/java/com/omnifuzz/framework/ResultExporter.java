package com.omnifuzz.framework;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.omnifuzz.model.AttackResult;
import com.omnifuzz.model.AttackSummary;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Writes results as a JSON array, one object per result. Field names follow
 * {@link AttackResult}; absent optional fields are omitted.
 */
public class ResultExporter {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    private final boolean includeRaw;

    /**
     * @param includeRaw whether to write rawRequest and rawResponse, which dominate export size
     */
    public ResultExporter(boolean includeRaw) {
        this.includeRaw = includeRaw;
    }

    public String toJson(List<AttackResult> results) {
        return GSON.toJson(toJsonArray(results));
    }

    public void writeJson(List<AttackResult> results, Path file) throws IOException {
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            GSON.toJson(toJsonArray(results), writer);
        }
    }

    public String summaryToJson(AttackSummary summary) {
        JsonObject obj = new JsonObject();
        obj.addProperty("totalResults", summary.getTotalResults());
        obj.addProperty("errorCount", summary.getErrorCount());
        JsonObject statuses = new JsonObject();
        summary.getStatusCounts().forEach((code, count) -> statuses.addProperty(Integer.toString(code), count));
        obj.add("statusCounts", statuses);
        JsonObject matches = new JsonObject();
        summary.getMatchCounts().forEach(matches::addProperty);
        obj.add("matchCounts", matches);
        JsonObject extractions = new JsonObject();
        summary.getDistinctExtractions().forEach((rule, values) -> {
            JsonArray arr = new JsonArray();
            values.forEach(arr::add);
            extractions.add(rule, arr);
        });
        obj.add("distinctExtractions", extractions);
        return GSON.toJson(obj);
    }

    private JsonArray toJsonArray(List<AttackResult> results) {
        JsonArray array = new JsonArray();
        for (AttackResult r : results) {
            array.add(toJsonObject(r));
        }
        return array;
    }

    private JsonObject toJsonObject(AttackResult r) {
        JsonObject obj = new JsonObject();
        obj.addProperty("requestNumber", r.getRequestNumber());
        obj.add("payloads", stringMap(r.getPayloads()));
        if (r.getStatusCode() != null) obj.addProperty("statusCode", r.getStatusCode());
        if (r.getLength() != null) obj.addProperty("length", r.getLength());
        if (r.getElapsedMs() != null) obj.addProperty("elapsedMs", r.getElapsedMs());
        if (r.hasError()) {
            obj.addProperty("error", r.getError());
            obj.addProperty("errorKind", r.getErrorKind().name());
        }
        JsonObject matches = new JsonObject();
        r.getMatches().forEach(matches::addProperty);
        obj.add("matches", matches);
        obj.add("extractions", stringMap(r.getExtractions()));
        if (includeRaw) {
            obj.addProperty("rawRequest", r.getRawRequest());
            if (r.hasResponse()) obj.addProperty("rawResponse", r.getRawResponse());
        }
        return obj;
    }

    private static JsonObject stringMap(Map<String, String> map) {
        JsonObject obj = new JsonObject();
        map.forEach(obj::addProperty);
        return obj;
    }
}
