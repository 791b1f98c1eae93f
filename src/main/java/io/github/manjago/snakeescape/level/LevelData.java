package io.github.manjago.snakeescape.level;

import io.github.manjago.snakeescape.core.Cell;
import io.github.manjago.snakeescape.core.GroupColor;
import io.github.manjago.snakeescape.core.PortalColor;
import io.github.manjago.snakeescape.core.SnakeColor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Static description of a level, as handed over by the loader.
 * 
 * Immutable; a session keeps it to rebuild the board on reload.
 */
public record LevelData(
    String name,
    int width,
    int height,
    List<Cell> walls,
    List<SnakeSpec> snakes,
    List<FruitSpec> fruits,
    List<ExitSpec> exits,
    List<List<Cell>> boxes,        // footprints
    List<List<Cell>> iceCubes,     // footprints
    List<Cell> holes,
    List<GroupSpec> plates,
    List<GroupSpec> liftGates,
    List<GroupSpec> laserGates,
    List<PortalSpec> portals
) {
    
    public LevelData {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Level size must be positive: " + width + "x" + height);
        }
        name = name != null ? name : "unnamed";
        walls = List.copyOf(walls);
        snakes = List.copyOf(snakes);
        fruits = List.copyOf(fruits);
        exits = List.copyOf(exits);
        boxes = boxes.stream().map(List::copyOf).toList();
        iceCubes = iceCubes.stream().map(List::copyOf).toList();
        holes = List.copyOf(holes);
        plates = List.copyOf(plates);
        liftGates = List.copyOf(liftGates);
        laserGates = List.copyOf(laserGates);
        portals = List.copyOf(portals);
    }
    
    /**
     * A snake: color and body cells, head first.
     */
    public record SnakeSpec(SnakeColor color, List<Cell> body) {
        public SnakeSpec {
            body = List.copyOf(body);
        }
    }
    
    public record FruitSpec(Cell position, Set<SnakeColor> colors) {
        public FruitSpec {
            colors = Set.copyOf(colors);
        }
    }
    
    public record ExitSpec(Cell position, SnakeColor color, int minLength) {}
    
    /**
     * Plate, lift gate or laser gate: a position in a color group.
     */
    public record GroupSpec(Cell position, GroupColor color) {}
    
    public record PortalSpec(Cell position, PortalColor color) {}
    
    /**
     * Builder for programmatic levels (tests, tools).
     */
    public static Builder builder(int width, int height) {
        return new Builder(width, height);
    }
    
    public static class Builder {
        private final int width;
        private final int height;
        private String name = "unnamed";
        private final List<Cell> walls = new ArrayList<>();
        private final List<SnakeSpec> snakes = new ArrayList<>();
        private final List<FruitSpec> fruits = new ArrayList<>();
        private final List<ExitSpec> exits = new ArrayList<>();
        private final List<List<Cell>> boxes = new ArrayList<>();
        private final List<List<Cell>> iceCubes = new ArrayList<>();
        private final List<Cell> holes = new ArrayList<>();
        private final List<GroupSpec> plates = new ArrayList<>();
        private final List<GroupSpec> liftGates = new ArrayList<>();
        private final List<GroupSpec> laserGates = new ArrayList<>();
        private final List<PortalSpec> portals = new ArrayList<>();
        
        private Builder(int width, int height) {
            this.width = width;
            this.height = height;
        }
        
        public Builder name(String name) { this.name = name; return this; }
        public Builder wall(int x, int y) { walls.add(Cell.of(x, y)); return this; }
        public Builder snake(SnakeColor color, Cell... body) { snakes.add(new SnakeSpec(color, Arrays.asList(body))); return this; }
        public Builder fruit(int x, int y, SnakeColor... colors) { fruits.add(new FruitSpec(Cell.of(x, y), EnumSet.copyOf(Arrays.asList(colors)))); return this; }
        public Builder exit(int x, int y, SnakeColor color, int minLength) { exits.add(new ExitSpec(Cell.of(x, y), color, minLength)); return this; }
        public Builder box(Cell... footprint) { boxes.add(Arrays.asList(footprint)); return this; }
        public Builder iceCube(Cell... footprint) { iceCubes.add(Arrays.asList(footprint)); return this; }
        public Builder hole(int x, int y) { holes.add(Cell.of(x, y)); return this; }
        public Builder plate(int x, int y, GroupColor color) { plates.add(new GroupSpec(Cell.of(x, y), color)); return this; }
        public Builder liftGate(int x, int y, GroupColor color) { liftGates.add(new GroupSpec(Cell.of(x, y), color)); return this; }
        public Builder laserGate(int x, int y, GroupColor color) { laserGates.add(new GroupSpec(Cell.of(x, y), color)); return this; }
        public Builder portal(int x, int y, PortalColor color) { portals.add(new PortalSpec(Cell.of(x, y), color)); return this; }
        
        public LevelData build() {
            return new LevelData(name, width, height, walls, snakes, fruits, exits,
                    boxes, iceCubes, holes, plates, liftGates, laserGates, portals);
        }
    }
    
    @Override
    public String toString() {
        return String.format("Level[%s, %dx%d, %d snakes, %d walls, %d boxes, %d ice, %d portals]",
                name, width, height, snakes.size(), walls.size(), boxes.size(), iceCubes.size(), portals.size());
    }
}
