package org.tactica.runtime;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Instantiates pluggable combat rules from configuration.
 * <p>
 * A plugin block names an implementation class and an optional options block, which is passed
 * to the class's {@code (Config)} constructor:
 * <pre>{@code
 * end-condition {
 *   className = "org.tactica.runtime.combat.impl.LastFactionStanding"
 *   options { minimum-factions = 2 }
 * }
 * }</pre>
 */
public final class PluginFactory {

    private PluginFactory() {}

    /**
     * @param pluginConfig The plugin block.
     * @param type The interface the plugin must implement.
     * @return The new plugin instance.
     * @throws IllegalArgumentException if the class is missing, does not implement {@code type},
     *         or cannot be instantiated.
     */
    public static <T> T create(Config pluginConfig, Class<T> type) {
        String className = pluginConfig.getString("className");
        Config options = pluginConfig.hasPath("options") ? pluginConfig.getConfig("options") : ConfigFactory.empty();
        try {
            Class<?> clazz = Class.forName(className);
            if (!type.isAssignableFrom(clazz)) {
                throw new IllegalArgumentException("Class " + className + " does not implement " + type.getSimpleName());
            }
            return type.cast(clazz.getConstructor(Config.class).newInstance(options));
        } catch (ReflectiveOperationException e) {
            throw new IllegalArgumentException("Failed to instantiate " + type.getSimpleName() + ": " + className, e);
        }
    }
}
