package com.omnifuzz.modules.processors;

import com.omnifuzz.model.EncodingException;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Encoders and decoders behind the processor pipeline. Decoders reject
 * malformed input with {@link EncodingException}; encoders are total.
 */
public final class PayloadEncoder {

    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private PayloadEncoder() {}

    /**
     * Encodes only characters that break an HTTP request line or a URL/body
     * parameter (space, &amp;, #, +, ;, bare %), preserving existing %XX
     * sequences so pre-encoded payloads are not double-encoded.
     */
    public static String encodeKeyChars(String payload) {
        StringBuilder sb = new StringBuilder(payload.length() + 16);
        int len = payload.length();

        for (int i = 0; i < len; i++) {
            char c = payload.charAt(i);

            if (c == '%' && i + 2 < len && isHex(payload.charAt(i + 1)) && isHex(payload.charAt(i + 2))) {
                sb.append(c);
                sb.append(payload.charAt(i + 1));
                sb.append(payload.charAt(i + 2));
                i += 2;
                continue;
            }

            switch (c) {
                case ' ':  sb.append("%20"); break;
                case '&':  sb.append("%26"); break;
                case '#':  sb.append("%23"); break;
                case '+':  sb.append("%2B"); break;
                case ';':  sb.append("%3B"); break;
                case '%':  sb.append("%25"); break;
                default:   sb.append(c);     break;
            }
        }

        return sb.toString();
    }

    /**
     * Percent-encodes the UTF-8 bytes of every character outside the RFC 3986
     * unreserved set.
     */
    public static String urlEncode(String payload) {
        byte[] bytes = payload.getBytes(StandardCharsets.UTF_8);
        StringBuilder sb = new StringBuilder(bytes.length * 3);
        for (byte b : bytes) {
            int v = b & 0xFF;
            if (isUnreserved(v)) {
                sb.append((char) v);
            } else {
                sb.append('%').append(HEX[v >> 4]).append(HEX[v & 0x0F]);
            }
        }
        return sb.toString();
    }

    /**
     * Decodes %XX sequences (UTF-8). '+' is left as-is. A '%' not followed by
     * two hex digits, or bytes that are not valid UTF-8, are rejected.
     */
    public static String urlDecode(String payload) throws EncodingException {
        ByteArrayOutputStream out = new ByteArrayOutputStream(payload.length());
        int len = payload.length();
        for (int i = 0; i < len; i++) {
            char c = payload.charAt(i);
            if (c == '%') {
                if (i + 2 >= len || !isHex(payload.charAt(i + 1)) || !isHex(payload.charAt(i + 2))) {
                    throw new EncodingException("url-decode", "Malformed escape at offset " + i);
                }
                out.write(Character.digit(payload.charAt(i + 1), 16) << 4 | Character.digit(payload.charAt(i + 2), 16));
                i += 2;
            } else {
                byte[] chunk = String.valueOf(c).getBytes(StandardCharsets.UTF_8);
                if (Character.isHighSurrogate(c) && i + 1 < len) {
                    chunk = payload.substring(i, i + 2).getBytes(StandardCharsets.UTF_8);
                    i++;
                }
                out.write(chunk, 0, chunk.length);
            }
        }
        return strictUtf8("url-decode", out.toByteArray());
    }

    /** Escapes the five HTML-significant characters. */
    public static String htmlEncode(String payload) {
        StringBuilder sb = new StringBuilder(payload.length() + 16);
        for (int i = 0; i < payload.length(); i++) {
            char c = payload.charAt(i);
            switch (c) {
                case '&':  sb.append("&amp;");  break;
                case '<':  sb.append("&lt;");   break;
                case '>':  sb.append("&gt;");   break;
                case '"':  sb.append("&quot;"); break;
                case '\'': sb.append("&#39;");  break;
                default:   sb.append(c);        break;
            }
        }
        return sb.toString();
    }

    /**
     * Resolves the named entities produced by {@link #htmlEncode} plus decimal
     * and hex character references. An unterminated or unknown entity is rejected.
     */
    public static String htmlDecode(String payload) throws EncodingException {
        StringBuilder sb = new StringBuilder(payload.length());
        int len = payload.length();
        for (int i = 0; i < len; i++) {
            char c = payload.charAt(i);
            if (c != '&') {
                sb.append(c);
                continue;
            }
            int semi = payload.indexOf(';', i + 1);
            if (semi < 0) {
                throw new EncodingException("html-decode", "Unterminated entity at offset " + i);
            }
            String entity = payload.substring(i + 1, semi);
            switch (entity) {
                case "amp":  sb.append('&');  break;
                case "lt":   sb.append('<');  break;
                case "gt":   sb.append('>');  break;
                case "quot": sb.append('"');  break;
                case "apos": sb.append('\''); break;
                default:     sb.appendCodePoint(numericReference(entity, i)); break;
            }
            i = semi;
        }
        return sb.toString();
    }

    private static int numericReference(String entity, int offset) throws EncodingException {
        if (!entity.startsWith("#") || entity.length() < 2) {
            throw new EncodingException("html-decode", "Unknown entity &" + entity + "; at offset " + offset);
        }
        try {
            int cp = entity.charAt(1) == 'x' || entity.charAt(1) == 'X'
                    ? Integer.parseInt(entity.substring(2), 16)
                    : Integer.parseInt(entity.substring(1), 10);
            if (!Character.isValidCodePoint(cp)) {
                throw new EncodingException("html-decode", "Invalid code point in &" + entity + ";");
            }
            return cp;
        } catch (NumberFormatException e) {
            throw new EncodingException("html-decode", "Malformed character reference &" + entity + ";", e);
        }
    }

    public static String base64Encode(String payload) {
        return Base64.getEncoder().encodeToString(payload.getBytes(StandardCharsets.UTF_8));
    }

    /** Standard alphabet with padding; the decoded bytes must be valid UTF-8. */
    public static String base64Decode(String payload) throws EncodingException {
        byte[] bytes;
        try {
            bytes = Base64.getDecoder().decode(payload.trim());
        } catch (IllegalArgumentException e) {
            throw new EncodingException("base64-decode", "Not valid base64: " + e.getMessage(), e);
        }
        return strictUtf8("base64-decode", bytes);
    }

    private static String strictUtf8(String processor, byte[] bytes) throws EncodingException {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new EncodingException(processor, "Decoded bytes are not valid UTF-8", e);
        }
    }

    private static boolean isUnreserved(int c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')
                || c == '-' || c == '.' || c == '_' || c == '~';
    }

    private static boolean isHex(char c) {
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }
}
