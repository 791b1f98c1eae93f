package io.github.manjago.snakeescape.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import io.github.manjago.snakeescape.core.SnakeColor;

import java.nio.file.Path;

/**
 * Rule configuration for a game session.
 * 
 * Loads from HOCON files using typesafe-config.
 * Default values are in reference.conf.
 */
public record SessionConfig(
    // Snake abilities
    SnakeColor reversibleColor,   // the only color that may move its tail
    SnakeColor wrappingColor,     // the only color that wraps around the board edges
    
    // Safety bounds
    int slideStepLimit,           // max cells an ice cube may slide in one push
    int refreshPassLimit,         // max state refresh passes per mutation
    
    // Rules
    boolean fruitSpawnOnExit      // spawn a fruit for the remaining snakes on a used exit
) {
    
    public SessionConfig {
        if (reversibleColor == null || wrappingColor == null) {
            throw new IllegalArgumentException("Reversible and wrapping colors are required");
        }
        if (slideStepLimit <= 0) {
            throw new IllegalArgumentException("slide-step-limit must be positive: " + slideStepLimit);
        }
        if (refreshPassLimit <= 0) {
            throw new IllegalArgumentException("refresh-pass-limit must be positive: " + refreshPassLimit);
        }
    }
    
    /**
     * Load default configuration.
     */
    public static SessionConfig defaults() {
        return fromConfig(ConfigFactory.load());
    }
    
    /**
     * Load configuration from a specific file.
     */
    public static SessionConfig fromFile(Path configFile) {
        Config fileConfig = ConfigFactory.parseFile(configFile.toFile());
        Config merged = fileConfig.withFallback(ConfigFactory.load()).resolve();
        return fromConfig(merged);
    }
    
    /**
     * Load from Config object.
     */
    public static SessionConfig fromConfig(Config config) {
        Config c = config.getConfig("snake-escape");
        
        return new SessionConfig(
            c.getEnum(SnakeColor.class, "rules.reversible-color"),
            c.getEnum(SnakeColor.class, "rules.wrapping-color"),
            c.getInt("rules.slide-step-limit"),
            c.getInt("rules.refresh-pass-limit"),
            c.getBoolean("rules.fruit-spawn-on-exit")
        );
    }
    
    /**
     * Builder for programmatic configuration.
     */
    public static Builder builder() {
        return new Builder();
    }
    
    /**
     * Builder pre-filled from an existing configuration.
     */
    public Builder toBuilder() {
        return new Builder()
                .reversibleColor(reversibleColor)
                .wrappingColor(wrappingColor)
                .slideStepLimit(slideStepLimit)
                .refreshPassLimit(refreshPassLimit)
                .fruitSpawnOnExit(fruitSpawnOnExit);
    }
    
    public static class Builder {
        private SnakeColor reversibleColor = SnakeColor.RED;
        private SnakeColor wrappingColor = SnakeColor.GREEN;
        private int slideStepLimit = 50;
        private int refreshPassLimit = 8;
        private boolean fruitSpawnOnExit = true;
        
        public Builder reversibleColor(SnakeColor color) { this.reversibleColor = color; return this; }
        public Builder wrappingColor(SnakeColor color) { this.wrappingColor = color; return this; }
        public Builder slideStepLimit(int limit) { this.slideStepLimit = limit; return this; }
        public Builder refreshPassLimit(int limit) { this.refreshPassLimit = limit; return this; }
        public Builder fruitSpawnOnExit(boolean spawn) { this.fruitSpawnOnExit = spawn; return this; }
        
        public SessionConfig build() {
            return new SessionConfig(
                reversibleColor, wrappingColor, slideStepLimit, refreshPassLimit, fruitSpawnOnExit
            );
        }
    }
    
    @Override
    public String toString() {
        return String.format("""
            SessionConfig:
              rules.reversible-color:   %s
              rules.wrapping-color:     %s
              rules.slide-step-limit:   %d
              rules.refresh-pass-limit: %d
              rules.fruit-spawn-on-exit: %s
            """,
            reversibleColor,
            wrappingColor,
            slideStepLimit,
            refreshPassLimit,
            fruitSpawnOnExit
        );
    }
}
