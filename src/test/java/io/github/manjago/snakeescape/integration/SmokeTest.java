package io.github.manjago.snakeescape.integration;

import io.github.manjago.snakeescape.debug.BoardPrinter;
import io.github.manjago.snakeescape.debug.EventRecorder;
import io.github.manjago.snakeescape.level.LevelData;
import io.github.manjago.snakeescape.level.LevelLoader;
import io.github.manjago.snakeescape.sim.GameEvent;
import io.github.manjago.snakeescape.sim.GameSession;
import io.github.manjago.snakeescape.sim.MoveRequest;
import io.github.manjago.snakeescape.sim.MoveResult;
import io.github.manjago.snakeescape.sim.SessionStats;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end checks: levels load from the classpath, sessions start,
 * and the tutorial can be played to a win.
 */
@DisplayName("Smoke Tests")
class SmokeTest {
    
    @ParameterizedTest
    @ValueSource(strings = {"levels/tutorial.conf", "levels/gates.conf", "levels/ice-portal.conf"})
    @DisplayName("Every level loads, renders and reloads")
    void loadAndReload(String resource) {
        LevelData level = LevelLoader.fromResource(resource);
        GameSession session = new GameSession(level);
        session.start();
        
        String before = new BoardPrinter().render(session.getState());
        assertEquals(level.height(), before.split("\n").length);
        
        session.reloadLevel();
        assertEquals(before, new BoardPrinter().render(session.getState()));
        assertFalse(session.isWon());
    }
    
    @Test
    @DisplayName("Play the tutorial to a win")
    void playTutorial() {
        GameSession session = new GameSession(LevelLoader.fromResource("levels/tutorial.conf"));
        EventRecorder recorder = new EventRecorder();
        session.addListener(recorder);
        session.start();
        
        for (MoveRequest move : List.of(
                MoveRequest.head(0, 3, 2),
                MoveRequest.head(0, 4, 2),
                MoveRequest.head(0, 5, 2),
                MoveRequest.head(0, 6, 2))) {
            assertEquals(MoveResult.ACCEPTED, session.requestMove(move), move.toString());
        }
        
        assertTrue(session.isWon());
        assertTrue(session.getSnakes().isEmpty());
        assertEquals(1, recorder.count(GameEvent.LevelWon.class));
        assertEquals(1, recorder.count(GameEvent.ExitConsumed.class));
        assertEquals(0, recorder.count(GameEvent.FruitSpawned.class));
        
        // the plate goes down on move two and back up once the snake has left
        List<GameEvent.PlateStateChanged> plate = recorder.ofType(GameEvent.PlateStateChanged.class);
        assertEquals(2, plate.size());
        assertTrue(plate.get(0).active());
        assertFalse(plate.get(1).active());
        
        SessionStats stats = session.getStats();
        assertEquals(4, stats.movesAccepted());
        assertEquals(1, stats.snakesExited());
        assertEquals(0, stats.snakesLost());
        assertTrue(stats.won());
        
        // won levels take no further moves of removed snakes
        assertEquals(MoveResult.UNKNOWN_SNAKE, session.requestMove(MoveRequest.head(0, 7, 2)));
    }
    
    @Test
    @DisplayName("A closed gate keeps the tutorial exit out of reach")
    void gateBlocksWithoutPlate() {
        GameSession session = new GameSession(LevelLoader.fromResource("levels/tutorial.conf"));
        session.start();
        
        assertEquals(MoveResult.ACCEPTED, session.requestMove(MoveRequest.head(0, 2, 3)));
        assertEquals(MoveResult.ACCEPTED, session.requestMove(MoveRequest.head(0, 3, 3)));
        assertEquals(MoveResult.ACCEPTED, session.requestMove(MoveRequest.head(0, 4, 3)));
        assertEquals(MoveResult.OBSTRUCTED, session.requestMove(MoveRequest.head(0, 5, 3)));
        assertFalse(session.isWon());
    }
}
