package com.omnifuzz.framework;

import com.omnifuzz.model.HeaderField;
import com.omnifuzz.model.HttpTarget;
import com.omnifuzz.model.MaterializedRequest;
import com.omnifuzz.model.Position;
import com.omnifuzz.model.RequestPlan;
import com.omnifuzz.model.RequestTemplate;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Splices processed payloads into the template. Spans are rewritten
 * right-to-left by start offset so earlier offsets stay valid. The result is
 * split into request line, headers and body only as far as needed to build a
 * {@link MaterializedRequest}; no further HTTP parsing happens here.
 */
public class RequestTemplater {

    private final RequestTemplate template;
    private final List<Position> rightToLeft;
    private final boolean updateContentLength;

    public RequestTemplater(RequestTemplate template, List<Position> positions, boolean updateContentLength) {
        this.template = template;
        List<Position> sorted = new ArrayList<>(positions);
        sorted.sort(Comparator.comparingInt(Position::getStart).reversed());
        this.rightToLeft = List.copyOf(sorted);
        this.updateContentLength = updateContentLength;
    }

    /** Template text with each planned position replaced; other positions keep their text. */
    public String substitute(Map<String, String> payloadsByPosition) {
        StringBuilder sb = new StringBuilder(template.getText());
        for (Position p : rightToLeft) {
            String payload = payloadsByPosition.get(p.getId());
            if (payload != null) {
                sb.replace(p.getStart(), p.getEnd(), payload);
            }
        }
        return sb.toString();
    }

    public MaterializedRequest materialize(RequestPlan plan) {
        return parse(substitute(plan.getPayloadsByPosition()), template.getTarget(), updateContentLength);
    }

    /**
     * Splits raw request text into its parts. Accepts CRLF or bare LF line
     * endings. When {@code updateContentLength} is set and a Content-Length
     * header is present, its value is rewritten to the UTF-8 length of the body.
     */
    static MaterializedRequest parse(String raw, HttpTarget target, boolean updateContentLength) {
        int crlf = raw.indexOf("\r\n\r\n");
        int lf = raw.indexOf("\n\n");
        int headEnd;
        int bodyStart;
        if (crlf >= 0 && (lf < 0 || crlf < lf)) {
            headEnd = crlf;
            bodyStart = crlf + 4;
        } else if (lf >= 0) {
            headEnd = lf;
            bodyStart = lf + 2;
        } else {
            headEnd = raw.length();
            bodyStart = raw.length();
        }
        String head = raw.substring(0, headEnd);
        String body = raw.substring(bodyStart);
        String lineSeparator = head.contains("\r\n") || (crlf >= 0 && headEnd == crlf) ? "\r\n" : "\n";
        String[] lines = head.split("\r?\n", -1);

        String requestLine = lines.length > 0 ? lines[0] : "";
        String method = requestLine;
        String url = "";
        String version = "";
        int firstSpace = requestLine.indexOf(' ');
        if (firstSpace >= 0) {
            method = requestLine.substring(0, firstSpace);
            String rest = requestLine.substring(firstSpace + 1);
            int lastSpace = rest.lastIndexOf(' ');
            if (lastSpace >= 0 && rest.startsWith("HTTP/", lastSpace + 1)) {
                url = rest.substring(0, lastSpace);
                version = rest.substring(lastSpace + 1);
            } else {
                url = rest;
            }
        }

        List<HeaderField> headers = new ArrayList<>();
        boolean rewritten = false;
        String bodyLength = Integer.toString(body.getBytes(StandardCharsets.UTF_8).length);
        for (int i = 1; i < lines.length; i++) {
            int colon = lines[i].indexOf(':');
            if (colon <= 0) continue;
            String name = lines[i].substring(0, colon).trim();
            String value = lines[i].substring(colon + 1).trim();
            if (updateContentLength && name.equalsIgnoreCase("Content-Length") && !value.equals(bodyLength)) {
                value = bodyLength;
                lines[i] = lines[i].substring(0, colon) + ": " + bodyLength;
                rewritten = true;
            }
            headers.add(new HeaderField(name, value));
        }

        String finalRaw = raw;
        if (rewritten) {
            finalRaw = String.join(lineSeparator, lines) + raw.substring(headEnd, bodyStart) + body;
        }
        return new MaterializedRequest(method, url, version, headers, body, finalRaw, target);
    }
}
