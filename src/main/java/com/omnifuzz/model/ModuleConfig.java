package com.omnifuzz.model;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Engine-wide settings holder. The extension writes values (defaults plus
 * persisted preferences); the engine and its components read them.
 */
public class ModuleConfig {

    /** Rewrite Content-Length after substitution. */
    public static final String UPDATE_CONTENT_LENGTH = "templater.updateContentLength";
    /** Hard upper bound applied to any run's maxConcurrent. */
    public static final String MAX_CONCURRENT_CAP = "scheduler.maxConcurrentCap";
    /** Admission delay of the throttle given to runs whose builder sets none. */
    public static final String DEFAULT_DELAY_MS = "scheduler.defaultDelayMs";

    private final Map<String, String> stringProps = new ConcurrentHashMap<>();
    private final Map<String, Integer> intProps = new ConcurrentHashMap<>();
    private final Map<String, Boolean> boolProps = new ConcurrentHashMap<>();

    /** Settings with the engine defaults applied. */
    public static ModuleConfig defaults() {
        ModuleConfig config = new ModuleConfig();
        config.setBool(UPDATE_CONTENT_LENGTH, true);
        config.setInt(MAX_CONCURRENT_CAP, 50);
        config.setInt(DEFAULT_DELAY_MS, 100);
        return config;
    }

    public void setString(String key, String value) {
        stringProps.put(key, value);
    }

    public String getString(String key, String defaultValue) {
        return stringProps.getOrDefault(key, defaultValue);
    }

    public void setInt(String key, int value) {
        intProps.put(key, value);
    }

    public int getInt(String key, int defaultValue) {
        return intProps.getOrDefault(key, defaultValue);
    }

    public void setBool(String key, boolean value) {
        boolProps.put(key, value);
    }

    public boolean getBool(String key, boolean defaultValue) {
        return boolProps.getOrDefault(key, defaultValue);
    }

    public Set<String> getBoolKeys() {
        return Collections.unmodifiableSet(boolProps.keySet());
    }

    public Set<String> getIntKeys() {
        return Collections.unmodifiableSet(intProps.keySet());
    }

    public Set<String> getStringKeys() {
        return Collections.unmodifiableSet(stringProps.keySet());
    }
}
