package io.github.manjago.snakeescape.cli;

import io.github.manjago.snakeescape.level.LevelData;
import io.github.manjago.snakeescape.level.LevelLoader;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Resolves a level argument: a HOCON file path, or the name of a bundled level.
 */
final class LevelSource {
    
    static final String BUNDLED_DIR = "levels/";
    
    private LevelSource() {
    }
    
    static LevelData resolve(String level) {
        Path path = Path.of(level);
        if (Files.isRegularFile(path)) {
            return LevelLoader.load(path);
        }
        return LevelLoader.fromResource(BUNDLED_DIR + level + ".conf");
    }
}
