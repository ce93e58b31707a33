package com.omnifuzz.framework;

import com.omnifuzz.model.Position;
import com.omnifuzz.model.RequestTemplate;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Marks every parameter value in the template: query string values on the
 * request line, form values in an {@code application/x-www-form-urlencoded}
 * body, and cookie values in {@code Cookie} headers. Names are left alone.
 * Labels read {@code query:name}, {@code body:name} or {@code cookie:name};
 * ids are {@code p1}, {@code p2}, ... in template order.
 */
public class AutoParameterPositionResolver implements PositionResolver {

    @Override
    public List<Position> resolvePositions(RequestTemplate template) {
        String text = template.getText();
        List<Span> spans = new ArrayList<>();

        int lineEnd = indexOfLineEnd(text, 0);
        String requestLine = text.substring(0, lineEnd);
        int urlStart = requestLine.indexOf(' ');
        if (urlStart >= 0) {
            int urlEnd = requestLine.indexOf(' ', urlStart + 1);
            if (urlEnd < 0) urlEnd = requestLine.length();
            int query = requestLine.indexOf('?', urlStart + 1);
            if (query >= 0 && query < urlEnd) {
                int fragment = requestLine.indexOf('#', query);
                int queryEnd = fragment >= 0 && fragment < urlEnd ? fragment : urlEnd;
                collectPairs(text, query + 1, queryEnd, '&', "query", spans);
            }
        }

        int headEnd = headerBlockEnd(text);
        boolean formBody = false;
        int lineStart = lineEnd;
        while (lineStart < headEnd) {
            lineStart = skipLineBreak(text, lineStart);
            if (lineStart >= headEnd) break;
            int end = Math.min(indexOfLineEnd(text, lineStart), headEnd);
            int colon = text.indexOf(':', lineStart);
            if (colon > lineStart && colon < end) {
                String name = text.substring(lineStart, colon).trim().toLowerCase(Locale.ROOT);
                if (name.equals("cookie")) {
                    collectPairs(text, colon + 1, end, ';', "cookie", spans);
                } else if (name.equals("content-type")) {
                    formBody = text.substring(colon + 1, end).toLowerCase(Locale.ROOT)
                            .contains("application/x-www-form-urlencoded");
                }
            }
            lineStart = end;
        }

        int bodyStart = skipBlankLine(text, headEnd);
        if (formBody && bodyStart < text.length()) {
            int bodyEnd = text.length();
            while (bodyEnd > bodyStart && (text.charAt(bodyEnd - 1) == '\n' || text.charAt(bodyEnd - 1) == '\r')) {
                bodyEnd--;
            }
            collectPairs(text, bodyStart, bodyEnd, '&', "body", spans);
        }

        spans.sort(Comparator.comparingInt(Span::start));
        List<Position> positions = new ArrayList<>(spans.size());
        for (int i = 0; i < spans.size(); i++) {
            Span s = spans.get(i);
            positions.add(new Position("p" + (i + 1), s.start(), s.end(), s.label()));
        }
        return positions;
    }

    /** Adds a span for the value of every {@code name=value} pair in [from, to). */
    private static void collectPairs(String text, int from, int to, char separator, String kind, List<Span> out) {
        int pairStart = from;
        while (pairStart <= to) {
            int pairEnd = text.indexOf(separator, pairStart);
            if (pairEnd < 0 || pairEnd > to) pairEnd = to;
            int eq = text.indexOf('=', pairStart);
            if (eq >= 0 && eq < pairEnd) {
                String name = text.substring(pairStart, eq).trim();
                if (!name.isEmpty()) {
                    int valueStart = eq + 1;
                    int valueEnd = pairEnd;
                    while (valueEnd > valueStart && text.charAt(valueEnd - 1) == ' ') valueEnd--;
                    out.add(new Span(valueStart, valueEnd, kind + ":" + name));
                }
            }
            pairStart = pairEnd + 1;
        }
    }

    private static int indexOfLineEnd(String text, int from) {
        int nl = text.indexOf('\n', from);
        if (nl < 0) return text.length();
        return nl > from && text.charAt(nl - 1) == '\r' ? nl - 1 : nl;
    }

    private static int skipLineBreak(String text, int at) {
        if (at < text.length() && text.charAt(at) == '\r') at++;
        if (at < text.length() && text.charAt(at) == '\n') at++;
        return at;
    }

    /** Offset of the line break that ends the header block, or the text length. */
    private static int headerBlockEnd(String text) {
        int crlf = text.indexOf("\r\n\r\n");
        int lf = text.indexOf("\n\n");
        if (crlf >= 0 && (lf < 0 || crlf < lf)) return crlf;
        if (lf >= 0) return lf;
        return text.length();
    }

    private static int skipBlankLine(String text, int headEnd) {
        if (text.startsWith("\r\n\r\n", headEnd)) return headEnd + 4;
        if (text.startsWith("\n\n", headEnd)) return headEnd + 2;
        return text.length();
    }

    private record Span(int start, int end, String label) {
    }
}
