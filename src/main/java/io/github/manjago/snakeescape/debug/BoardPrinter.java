package io.github.manjago.snakeescape.debug;

import io.github.manjago.snakeescape.core.Board;
import io.github.manjago.snakeescape.core.Cell;
import io.github.manjago.snakeescape.core.Entity;
import io.github.manjago.snakeescape.core.LaserGate;
import io.github.manjago.snakeescape.core.LiftGate;
import io.github.manjago.snakeescape.core.Portal;
import io.github.manjago.snakeescape.core.PressurePlate;
import io.github.manjago.snakeescape.core.Snake;
import io.github.manjago.snakeescape.sim.GameEvent;
import io.github.manjago.snakeescape.sim.LevelState;

import java.io.PrintStream;
import java.util.List;

/**
 * Prints the board and events in human-readable format.
 * 
 * One character per cell, top row first (y grows upward). Snakes win over
 * objects, objects over floor entities.
 */
public class BoardPrinter {
    
    private static final String LEGEND = """
            Legend: # wall  . floor  B box  I ice cube  O hole  F fruit  E exit
                    _/= plate pressed/up  |/- lift gate closed/open  !/: laser armed/off
                    @/o portal active/inactive  R G U Y snake head (blue is U), lowercase body""";
    
    private final PrintStream out;
    private boolean showLegend = true;
    private boolean showSnakes = true;
    
    public BoardPrinter() {
        this(System.out);
    }
    
    public BoardPrinter(PrintStream out) {
        this.out = out;
    }
    
    public BoardPrinter showLegend(boolean show) {
        this.showLegend = show;
        return this;
    }
    
    public BoardPrinter showSnakes(boolean show) {
        this.showSnakes = show;
        return this;
    }
    
    /**
     * Print the grid, then the snake list.
     */
    public void print(LevelState state) {
        out.print(render(state));
        if (showSnakes) {
            out.println();
            out.println("Snakes (" + state.getSnakes().size() + "):");
            for (Snake snake : state.getSnakes()) {
                out.printf("  #%d %s len=%d %s%n", snake.getId(), snake.getColor(), snake.length(), snake.getBody());
            }
        }
        if (showLegend) {
            out.println();
            out.println(LEGEND);
        }
    }
    
    /**
     * Grid only, one line per row, top row first.
     */
    public String render(LevelState state) {
        Board board = state.getBoard();
        StringBuilder sb = new StringBuilder();
        for (int y = board.getHeight() - 1; y >= 0; y--) {
            for (int x = 0; x < board.getWidth(); x++) {
                sb.append(symbol(state, Cell.of(x, y)));
            }
            sb.append('\n');
        }
        return sb.toString();
    }
    
    /**
     * One line per event.
     */
    public void printEvents(List<GameEvent> events) {
        for (GameEvent event : events) {
            out.println("  " + describe(event));
        }
    }
    
    // ========== Private helpers ==========
    
    private char symbol(LevelState state, Cell cell) {
        Snake snake = state.snakeOccupying(cell);
        if (snake != null) {
            char c = switch (snake.getColor()) {
                case RED -> 'R';
                case GREEN -> 'G';
                case BLUE -> 'U';
                case YELLOW -> 'Y';
            };
            return snake.getHead().equals(cell) ? c : Character.toLowerCase(c);
        }
        
        char best = '.';
        int bestRank = 0;
        for (Entity entity : state.getBoard().get(cell)) {
            int rank = rank(entity);
            if (rank > bestRank) {
                bestRank = rank;
                best = symbol(entity);
            }
        }
        return best;
    }
    
    private static char symbol(Entity entity) {
        return switch (entity.getKind()) {
            case WALL -> '#';
            case BOX -> 'B';
            case ICE_CUBE -> 'I';
            case HOLE -> 'O';
            case FRUIT -> 'F';
            case EXIT -> 'E';
            case PRESSURE_PLATE -> ((PressurePlate) entity).isActive() ? '_' : '=';
            case LIFT_GATE -> ((LiftGate) entity).isOpen() ? '-' : '|';
            case LASER_GATE -> ((LaserGate) entity).isActive() ? '!' : ':';
            case PORTAL -> ((Portal) entity).isActive() ? '@' : 'o';
        };
    }
    
    private static int rank(Entity entity) {
        return switch (entity.getKind()) {
            case WALL -> 9;
            case BOX, ICE_CUBE -> 8;
            case LIFT_GATE -> 7;
            case LASER_GATE -> 6;
            case FRUIT, EXIT -> 5;
            case PORTAL -> 4;
            case HOLE -> 3;
            case PRESSURE_PLATE -> 2;
        };
    }
    
    static String describe(GameEvent event) {
        if (event instanceof GameEvent.LevelLoaded e) {
            return String.format("Level '%s' loaded (%dx%d)", e.levelName(), e.width(), e.height());
        } else if (event instanceof GameEvent.EntityRelocated e) {
            return String.format("%s #%d moved %s -> %s", e.kind(), e.entityId(), e.from(), e.to());
        } else if (event instanceof GameEvent.EntityDestroyed e) {
            return String.format("%s #%d destroyed by %s at %s", e.kind(), e.entityId(), e.cause(), e.cells());
        } else if (event instanceof GameEvent.HoleFilled e) {
            return String.format("Hole %s filled from %s", e.hole(), e.filler());
        } else if (event instanceof GameEvent.SnakeMoved e) {
            return "Snake #" + e.snakeId() + " moved";
        } else if (event instanceof GameEvent.SnakeGrew e) {
            return "Snake #" + e.snakeId() + " grew";
        } else if (event instanceof GameEvent.SnakeSliced e) {
            return "Snake #" + e.snakeId() + " sliced";
        } else if (event instanceof GameEvent.SnakeRemoved e) {
            return "Snake #" + e.snakeId() + " removed";
        } else if (event instanceof GameEvent.FruitConsumed e) {
            return "Fruit eaten at " + e.position();
        } else if (event instanceof GameEvent.FruitSpawned e) {
            return String.format("Fruit #%d spawned at %s for %s", e.fruitId(), e.position(), e.colors());
        } else if (event instanceof GameEvent.ExitConsumed e) {
            return "Exit used at " + e.position();
        } else if (event instanceof GameEvent.PlateStateChanged e) {
            return String.format("Plate #%d %s", e.plateId(), e.active() ? "pressed" : "released");
        } else if (event instanceof GameEvent.LiftGateStateChanged e) {
            return String.format("Lift gate #%d %s", e.gateId(), e.open() ? "opened" : "closed");
        } else if (event instanceof GameEvent.LaserGateStateChanged e) {
            return String.format("Laser #%d %s", e.gateId(), e.active() ? "armed" : "disarmed");
        } else if (event instanceof GameEvent.PortalStateChanged e) {
            return String.format("Portal #%d %s", e.portalId(), e.active() ? "active" : "inactive");
        } else if (event instanceof GameEvent.LevelWon) {
            return "LEVEL WON";
        }
        return event.toString();
    }
}
