package com.omnifuzz;

import burp.api.montoya.BurpExtension;
import burp.api.montoya.MontoyaApi;
import burp.api.montoya.persistence.PersistedObject;
import com.omnifuzz.framework.AttackEngine;
import com.omnifuzz.framework.MontoyaTransport;
import com.omnifuzz.model.ModuleConfig;

/**
 * OmniFuzz - Entry Point
 *
 * Intruder-style attack engine for Burp Suite: payload positions, payload
 * sources and processors, four attack strategies, throttled concurrent
 * dispatch through Burp's HTTP stack, grep match/extract and per-request results.
 *
 * Built exclusively on the Montoya API.
 */
public class OmniFuzzExtension implements BurpExtension {

    private static final String PREFIX = "omnifuzz.";

    private AttackEngine engine;

    @Override
    public void initialize(MontoyaApi api) {
        api.extension().setName("OmniFuzz");
        api.logging().logToOutput("=== OmniFuzz initializing ===");

        ModuleConfig settings = loadSettings(api.persistence().extensionData());
        MontoyaTransport transport = new MontoyaTransport(api, false);
        engine = new AttackEngine(transport, settings);
        engine.setLogger(msg -> api.logging().logToOutput(msg));
        engine.setErrorLogger(msg -> api.logging().logToError(msg));

        api.extension().registerUnloadingHandler(() -> {
            api.logging().logToOutput("OmniFuzz unloading...");
            engine.shutdown();
            api.logging().logToOutput("OmniFuzz unloaded. Goodbye!");
        });

        api.logging().logToOutput("=== OmniFuzz ready ===");
        api.logging().logToOutput("maxConcurrent cap: " + settings.getInt(ModuleConfig.MAX_CONCURRENT_CAP, 0)
                + " | default delay: " + settings.getInt(ModuleConfig.DEFAULT_DELAY_MS, 0) + " ms"
                + " | update Content-Length: " + settings.getBool(ModuleConfig.UPDATE_CONTENT_LENGTH, true));
    }

    public AttackEngine getEngine() {
        return engine;
    }

    /** Engine defaults overridden by values saved in the project file under {@code omnifuzz.<key>}. */
    static ModuleConfig loadSettings(PersistedObject data) {
        ModuleConfig settings = ModuleConfig.defaults();
        Boolean updateLength = data.getBoolean(PREFIX + ModuleConfig.UPDATE_CONTENT_LENGTH);
        if (updateLength != null) {
            settings.setBool(ModuleConfig.UPDATE_CONTENT_LENGTH, updateLength);
        }
        Integer cap = data.getInteger(PREFIX + ModuleConfig.MAX_CONCURRENT_CAP);
        if (cap != null && cap > 0) {
            settings.setInt(ModuleConfig.MAX_CONCURRENT_CAP, cap);
        }
        Integer delay = data.getInteger(PREFIX + ModuleConfig.DEFAULT_DELAY_MS);
        if (delay != null && delay >= 0) {
            settings.setInt(ModuleConfig.DEFAULT_DELAY_MS, delay);
        }
        return settings;
    }
}
