package com.omnifuzz.modules.processors;

import com.omnifuzz.model.ConfigurationException;
import com.omnifuzz.model.EncodingException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * One step of the processor pipeline: a pure {@code String -> String}
 * transformation, or a rejection for decoders given malformed input.
 */
public class PayloadProcessor {

    public enum HashAlgorithm {
        MD5("MD5"),
        SHA1("SHA-1"),
        SHA256("SHA-256");

        private final String jcaName;

        HashAlgorithm(String jcaName) {
            this.jcaName = jcaName;
        }

        public String getJcaName() { return jcaName; }
    }

    private final ProcessorKind kind;
    private final boolean enabled;
    private final String argument;
    private final String replacement;
    private final HashAlgorithm hashAlgorithm;
    private final Pattern pattern;
    private final String configError;

    private PayloadProcessor(ProcessorKind kind, boolean enabled, String argument,
                             String replacement, HashAlgorithm hashAlgorithm) {
        this.kind = Objects.requireNonNull(kind, "kind is required");
        this.enabled = enabled;
        this.argument = argument != null ? argument : "";
        this.replacement = replacement != null ? replacement : "";
        this.hashAlgorithm = hashAlgorithm;

        Pattern compiled = null;
        String error = null;
        if (kind == ProcessorKind.MATCH_REPLACE) {
            try {
                compiled = Pattern.compile(this.argument);
            } catch (PatternSyntaxException e) {
                error = "Invalid match-replace regex '" + this.argument + "': " + e.getDescription();
            }
        }
        this.pattern = compiled;
        this.configError = error;
    }

    /** Processors that take no argument (encoders, decoders, case and reverse). */
    public static PayloadProcessor of(ProcessorKind kind) {
        switch (kind) {
            case HASH:
            case ADD_PREFIX:
            case ADD_SUFFIX:
            case MATCH_REPLACE:
                throw new IllegalArgumentException(kind.getId() + " needs an argument");
            default:
                return new PayloadProcessor(kind, true, null, null, null);
        }
    }

    public static PayloadProcessor prefix(String prefix) {
        return new PayloadProcessor(ProcessorKind.ADD_PREFIX, true, prefix, null, null);
    }

    public static PayloadProcessor suffix(String suffix) {
        return new PayloadProcessor(ProcessorKind.ADD_SUFFIX, true, suffix, null, null);
    }

    /** Replaces every match of {@code regex}; {@code replacement} may use $1 group references. */
    public static PayloadProcessor matchReplace(String regex, String replacement) {
        return new PayloadProcessor(ProcessorKind.MATCH_REPLACE, true, regex, replacement, null);
    }

    public static PayloadProcessor hash(HashAlgorithm algorithm) {
        return new PayloadProcessor(ProcessorKind.HASH, true, null, null,
                Objects.requireNonNull(algorithm, "algorithm is required"));
    }

    /** Same processor with the enabled flag changed. */
    public PayloadProcessor withEnabled(boolean enabled) {
        return new PayloadProcessor(kind, enabled, argument, replacement, hashAlgorithm);
    }

    public ProcessorKind getKind() { return kind; }
    public boolean isEnabled() { return enabled; }
    public String getArgument() { return argument; }
    public String getReplacement() { return replacement; }
    public HashAlgorithm getHashAlgorithm() { return hashAlgorithm; }

    /** Fails if this processor could never run (currently: a bad match-replace regex). */
    public void validate() throws ConfigurationException {
        if (configError != null) {
            throw new ConfigurationException(configError);
        }
    }

    public String apply(String input) throws EncodingException {
        switch (kind) {
            case URL_ENCODE:           return PayloadEncoder.urlEncode(input);
            case URL_ENCODE_KEY_CHARS: return PayloadEncoder.encodeKeyChars(input);
            case URL_DECODE:           return PayloadEncoder.urlDecode(input);
            case HTML_ENCODE:          return PayloadEncoder.htmlEncode(input);
            case HTML_DECODE:          return PayloadEncoder.htmlDecode(input);
            case BASE64_ENCODE:        return PayloadEncoder.base64Encode(input);
            case BASE64_DECODE:        return PayloadEncoder.base64Decode(input);
            case HASH:                 return hash(input);
            case ADD_PREFIX:           return argument + input;
            case ADD_SUFFIX:           return input + argument;
            case MATCH_REPLACE:        return matchReplace(input);
            case REVERSE:              return new StringBuilder(input).reverse().toString();
            case LOWERCASE:            return input.toLowerCase(Locale.ROOT);
            case UPPERCASE:            return input.toUpperCase(Locale.ROOT);
            default:
                throw new IllegalStateException("Unhandled processor " + kind);
        }
    }

    private String hash(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance(hashAlgorithm.getJcaName());
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                sb.append(String.format("%02x", b & 0xFF));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships MD5, SHA-1 and SHA-256
            throw new IllegalStateException(hashAlgorithm.getJcaName() + " unavailable", e);
        }
    }

    private String matchReplace(String input) throws EncodingException {
        try {
            return pattern.matcher(input).replaceAll(replacement);
        } catch (IllegalArgumentException | IndexOutOfBoundsException e) {
            throw new EncodingException("match-replace", "Bad replacement '" + replacement + "': " + e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        String arg = switch (kind) {
            case HASH -> "(" + hashAlgorithm + ")";
            case ADD_PREFIX, ADD_SUFFIX -> "(" + argument + ")";
            case MATCH_REPLACE -> "(" + argument + " -> " + replacement + ")";
            default -> "";
        };
        return kind.getId() + arg + (enabled ? "" : " [disabled]");
    }
}
