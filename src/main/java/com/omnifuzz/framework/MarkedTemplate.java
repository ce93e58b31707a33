package com.omnifuzz.framework;

import com.omnifuzz.model.ConfigurationException;
import com.omnifuzz.model.HttpTarget;
import com.omnifuzz.model.Position;
import com.omnifuzz.model.RequestTemplate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A request edited with {@code §} markers around each payload position.
 * {@link #parse} strips the markers and records the spans they enclosed.
 */
public class MarkedTemplate {

    public static final char MARKER = '§';

    private final RequestTemplate template;
    private final List<Position> positions;

    private MarkedTemplate(RequestTemplate template, List<Position> positions) {
        this.template = template;
        this.positions = Collections.unmodifiableList(positions);
    }

    /**
     * @throws ConfigurationException if a marker has no closing partner
     */
    public static MarkedTemplate parse(String markedText, HttpTarget target) throws ConfigurationException {
        StringBuilder clean = new StringBuilder(markedText.length());
        List<Position> positions = new ArrayList<>();
        int open = -1;
        for (int i = 0; i < markedText.length(); i++) {
            char c = markedText.charAt(i);
            if (c != MARKER) {
                clean.append(c);
            } else if (open < 0) {
                open = clean.length();
            } else {
                String id = "p" + (positions.size() + 1);
                positions.add(new Position(id, open, clean.length(), id));
                open = -1;
            }
        }
        if (open >= 0) {
            throw new ConfigurationException("Unbalanced position marker at offset " + open);
        }
        return new MarkedTemplate(new RequestTemplate(clean.toString(), target), positions);
    }

    public static MarkedTemplate parse(String markedText) throws ConfigurationException {
        return parse(markedText, null);
    }

    /** Renders the template with markers around each position, the inverse of {@link #parse}. */
    public static String mark(RequestTemplate template, List<Position> positions) {
        StringBuilder sb = new StringBuilder(template.getText());
        List<Position> sorted = new ArrayList<>(positions);
        sorted.sort((a, b) -> Integer.compare(b.getStart(), a.getStart()));
        for (Position p : sorted) {
            sb.insert(p.getEnd(), MARKER);
            sb.insert(p.getStart(), MARKER);
        }
        return sb.toString();
    }

    public RequestTemplate getTemplate() { return template; }
    public List<Position> getPositions() { return positions; }
}
