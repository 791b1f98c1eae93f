package io.github.manjago.snakeescape.level;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigParseOptions;
import com.typesafe.config.ConfigValue;
import io.github.manjago.snakeescape.core.Cell;
import io.github.manjago.snakeescape.core.GroupColor;
import io.github.manjago.snakeescape.core.PortalColor;
import io.github.manjago.snakeescape.core.SnakeColor;
import io.github.manjago.snakeescape.level.LevelData.ExitSpec;
import io.github.manjago.snakeescape.level.LevelData.FruitSpec;
import io.github.manjago.snakeescape.level.LevelData.GroupSpec;
import io.github.manjago.snakeescape.level.LevelData.PortalSpec;
import io.github.manjago.snakeescape.level.LevelData.SnakeSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Reads levels from HOCON.
 * 
 * <h2>Format:</h2>
 * <pre>
 * level {
 *   name = "First steps"
 *   width = 8
 *   height = 6
 *   walls = [[0,0], [1,0]]
 *   snakes = [
 *     { color = RED, body = [[2,2], [1,2], [0,2]] }   # head first
 *     { color = BLUE, head = [5,5], tail = [5,4] }     # two-cell snake
 *   ]
 *   fruits = [{ position = [4,4], colors = [RED, BLUE] }]
 *   exits = [{ position = [7,2], color = RED, min-length = 3 }]
 *   boxes = [{ position = [3,2] }, { cells = [[3,4], [4,4]] }]
 *   ice-cubes = [{ position = [5,1] }]
 *   holes = [[6,1]]
 *   plates = [{ position = [1,1], color = YELLOW }]
 *   lift-gates = [{ position = [6,3], color = YELLOW }]
 *   laser-gates = [{ position = [6,4], color = PURPLE }]
 *   portals = [{ position = [0,5], color = CYAN }, { position = [7,5], color = CYAN }]
 * }
 * </pre>
 * Every list is optional. Cells are {@code [x, y]} pairs.
 */
public final class LevelLoader {
    
    private static final Logger log = LoggerFactory.getLogger(LevelLoader.class);
    
    private static final String ROOT = "level";
    private static final ConfigParseOptions STRICT = ConfigParseOptions.defaults().setAllowMissing(false);
    
    private LevelLoader() {
    }
    
    /**
     * Load a level file.
     */
    public static LevelData load(Path file) {
        try {
            LevelData level = fromConfig(ConfigFactory.parseFile(file.toFile(), STRICT).resolve());
            log.info("Loaded {} from {}", level, file);
            return level;
        } catch (ConfigException e) {
            throw new LevelFormatException("Cannot load level " + file + ": " + e.getMessage(), e);
        }
    }
    
    /**
     * Load a level from the classpath.
     */
    public static LevelData fromResource(String resource) {
        try {
            return fromConfig(ConfigFactory.parseResources(resource, STRICT).resolve());
        } catch (ConfigException e) {
            throw new LevelFormatException("Cannot load level resource " + resource + ": " + e.getMessage(), e);
        }
    }
    
    /**
     * Parse a level from HOCON text.
     */
    public static LevelData parse(String hocon) {
        try {
            return fromConfig(ConfigFactory.parseString(hocon).resolve());
        } catch (ConfigException e) {
            throw new LevelFormatException("Cannot parse level: " + e.getMessage(), e);
        }
    }
    
    /**
     * Build level data from a parsed config holding a {@code level} object.
     */
    public static LevelData fromConfig(Config root) {
        Config c = root.getConfig(ROOT);
        
        return new LevelData(
            c.hasPath("name") ? c.getString("name") : "unnamed",
            c.getInt("width"),
            c.getInt("height"),
            cells(c, "walls"),
            snakes(c),
            fruits(c),
            exits(c),
            footprints(c, "boxes"),
            footprints(c, "ice-cubes"),
            cells(c, "holes"),
            groups(c, "plates"),
            groups(c, "lift-gates"),
            groups(c, "laser-gates"),
            portals(c)
        );
    }
    
    // ========== Sections ==========
    
    private static List<SnakeSpec> snakes(Config c) {
        List<SnakeSpec> result = new ArrayList<>();
        for (Config s : objects(c, "snakes")) {
            SnakeColor color = s.getEnum(SnakeColor.class, "color");
            List<Cell> body;
            if (s.hasPath("body")) {
                body = cells(s, "body");
            } else {
                Cell head = cell(s.getValue("head"), "snake head");
                Cell tail = s.hasPath("tail") ? cell(s.getValue("tail"), "snake tail") : head;
                body = head.equals(tail) ? List.of(head) : List.of(head, tail);
            }
            if (body.isEmpty()) {
                throw new LevelFormatException(color + " snake has an empty body");
            }
            result.add(new SnakeSpec(color, body));
        }
        return result;
    }
    
    private static List<FruitSpec> fruits(Config c) {
        List<FruitSpec> result = new ArrayList<>();
        for (Config f : objects(c, "fruits")) {
            List<SnakeColor> colors = f.getEnumList(SnakeColor.class, "colors");
            if (colors.isEmpty()) {
                throw new LevelFormatException("Fruit at " + cell(f.getValue("position"), "fruit") + " allows no color");
            }
            Set<SnakeColor> allowed = EnumSet.copyOf(colors);
            result.add(new FruitSpec(cell(f.getValue("position"), "fruit"), allowed));
        }
        return result;
    }
    
    private static List<ExitSpec> exits(Config c) {
        List<ExitSpec> result = new ArrayList<>();
        for (Config e : objects(c, "exits")) {
            result.add(new ExitSpec(
                    cell(e.getValue("position"), "exit"),
                    e.getEnum(SnakeColor.class, "color"),
                    e.hasPath("min-length") ? e.getInt("min-length") : 1));
        }
        return result;
    }
    
    private static List<List<Cell>> footprints(Config c, String path) {
        List<List<Cell>> result = new ArrayList<>();
        for (Config o : objects(c, path)) {
            if (o.hasPath("cells")) {
                result.add(cells(o, "cells"));
            } else {
                result.add(List.of(cell(o.getValue("position"), path)));
            }
        }
        return result;
    }
    
    private static List<GroupSpec> groups(Config c, String path) {
        List<GroupSpec> result = new ArrayList<>();
        for (Config g : objects(c, path)) {
            result.add(new GroupSpec(cell(g.getValue("position"), path), g.getEnum(GroupColor.class, "color")));
        }
        return result;
    }
    
    private static List<PortalSpec> portals(Config c) {
        List<PortalSpec> result = new ArrayList<>();
        for (Config p : objects(c, "portals")) {
            result.add(new PortalSpec(cell(p.getValue("position"), "portal"), p.getEnum(PortalColor.class, "color")));
        }
        return result;
    }
    
    // ========== Helpers ==========
    
    private static List<? extends Config> objects(Config c, String path) {
        return c.hasPath(path) ? c.getConfigList(path) : List.of();
    }
    
    private static List<Cell> cells(Config c, String path) {
        if (!c.hasPath(path)) {
            return List.of();
        }
        List<Cell> result = new ArrayList<>();
        for (ConfigValue value : c.getList(path)) {
            result.add(cell(value, path));
        }
        return result;
    }
    
    private static Cell cell(ConfigValue value, String what) {
        Object raw = value.unwrapped();
        if (raw instanceof List<?> pair && pair.size() == 2
                && pair.get(0) instanceof Number x && pair.get(1) instanceof Number y) {
            return Cell.of(x.intValue(), y.intValue());
        }
        throw new LevelFormatException(String.format("Bad %s cell %s at %s, expected [x, y]",
                what, value.render(), value.origin().description()));
    }
    
    /**
     * Level text that cannot be turned into a level.
     */
    public static class LevelFormatException extends RuntimeException {
        public LevelFormatException(String message) {
            super(message);
        }
        
        public LevelFormatException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
