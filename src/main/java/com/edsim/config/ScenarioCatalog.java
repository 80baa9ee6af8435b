package com.edsim.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Named scenarios from {@code edsim.scenarios}, each an overlay on the base {@code edsim} block.
 */
public final class ScenarioCatalog {

    private final Config base;
    private final Config scenarios;

    public ScenarioCatalog(Config root) {
        Config edsim = root.getConfig(SimulationParameters.ROOT);
        this.base = edsim.withoutPath("scenarios");
        this.scenarios = edsim.hasPath("scenarios") ? edsim.getConfig("scenarios") : ConfigFactory.empty();
    }

    public static ScenarioCatalog load() {
        return new ScenarioCatalog(ConfigFactory.load());
    }

    public List<String> names() {
        List<String> names = new ArrayList<>(scenarios.root().keySet());
        Collections.sort(names);
        return names;
    }

    public boolean contains(String name) {
        return scenarios.root().containsKey(name);
    }

    /**
     * @throws ConfigurationException for an unknown scenario name
     */
    public SimulationParameters parameters(String name) {
        if (!contains(name)) {
            throw new ConfigurationException(List.of("Unknown scenario '" + name + "', known: " + names()));
        }
        Config overlay = scenarios.getConfig("\"" + name + "\"");
        return SimulationParameters.fromConfig(overlay.withFallback(base).resolve());
    }
}
