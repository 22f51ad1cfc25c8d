package com.beancount.langserver.loader;

import com.beancount.langserver.loader.display.DisplayContext;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ledger-wide settings gathered from {@code option} and {@code plugin} directives, plus the set of
 * files that made up the ledger.
 */
public final class LedgerOptions {

    /** A {@code plugin "module" "config"} directive. */
    public static final class Plugin {
        private final String module;
        private final String config;

        public Plugin(String module, String config) {
            this.module = Objects.requireNonNull(module, "module");
            this.config = config;
        }

        public String getModule() {
            return module;
        }

        /** Configuration string, or {@code null} when absent. */
        public String getConfig() {
            return config;
        }

        @Override
        public boolean equals(Object obj) {
            if (!(obj instanceof Plugin)) {
                return false;
            }
            Plugin other = (Plugin) obj;
            return module.equals(other.module) && Objects.equals(config, other.config);
        }

        @Override
        public int hashCode() {
            return Objects.hash(module, config);
        }

        @Override
        public String toString() {
            return config == null ? module : module + "(" + config + ")";
        }
    }

    private final Map<String, List<String>> rawOptions = new LinkedHashMap<>();
    private final LinkedHashSet<String> operatingCurrencies = new LinkedHashSet<>();
    private final List<Plugin> plugins = new ArrayList<>();
    private final List<String> includes = new ArrayList<>();
    private DisplayContext displayContext = new DisplayContext();
    private String title;
    private String inputHash;

    /** Records a raw option; recognized names also update their typed view. */
    public void setOption(String name, String value) {
        rawOptions.computeIfAbsent(name, key -> new ArrayList<>()).add(value);
        switch (name) {
            case "title" -> title = value;
            case "operating_currency" -> operatingCurrencies.add(value);
            default -> {
                // stored verbatim only
            }
        }
    }

    public void addPlugin(Plugin plugin) {
        plugins.add(Objects.requireNonNull(plugin, "plugin"));
    }

    /** Last value of an option, or {@code null} when never set. */
    public String getOption(String name) {
        List<String> values = rawOptions.get(name);
        return values == null || values.isEmpty() ? null : values.get(values.size() - 1);
    }

    public List<String> getOptionValues(String name) {
        return Collections.unmodifiableList(rawOptions.getOrDefault(name, List.of()));
    }

    public Map<String, List<String>> getRawOptions() {
        return Collections.unmodifiableMap(rawOptions);
    }

    public String getTitle() {
        return title;
    }

    public List<String> getOperatingCurrencies() {
        return List.copyOf(operatingCurrencies);
    }

    public List<Plugin> getPlugins() {
        return Collections.unmodifiableList(plugins);
    }

    /** Every file read while loading, sorted; the root file included. */
    public List<String> getIncludes() {
        return Collections.unmodifiableList(includes);
    }

    public void setIncludes(List<String> files) {
        includes.clear();
        includes.addAll(files);
    }

    public String getInputHash() {
        return inputHash;
    }

    public void setInputHash(String inputHash) {
        this.inputHash = inputHash;
    }

    public DisplayContext getDisplayContext() {
        return displayContext;
    }

    public void setDisplayContext(DisplayContext displayContext) {
        this.displayContext = Objects.requireNonNull(displayContext, "displayContext");
    }
}
