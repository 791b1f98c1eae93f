package io.github.manjago.snakeescape.sim;

import io.github.manjago.snakeescape.config.SessionConfig;
import io.github.manjago.snakeescape.core.Box;
import io.github.manjago.snakeescape.core.Cell;
import io.github.manjago.snakeescape.core.EntityKind;
import io.github.manjago.snakeescape.core.GroupColor;
import io.github.manjago.snakeescape.core.Hole;
import io.github.manjago.snakeescape.core.IceCube;
import io.github.manjago.snakeescape.core.PortalColor;
import io.github.manjago.snakeescape.core.SnakeColor;
import io.github.manjago.snakeescape.debug.EventRecorder;
import io.github.manjago.snakeescape.level.LevelData;
import io.github.manjago.snakeescape.level.LevelLoader;
import io.github.manjago.snakeescape.sim.GameEvent.DestroyCause;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PushAndSlideTest {
    
    private EventRecorder recorder;
    
    private GameSession start(LevelData level) {
        return start(level, SessionConfig.builder().build());
    }
    
    private GameSession start(LevelData level, SessionConfig config) {
        GameSession session = new GameSession(level, config);
        session.start();
        recorder = new EventRecorder();
        session.addListener(recorder);
        return session;
    }
    
    private static Cell c(int x, int y) {
        return Cell.of(x, y);
    }
    
    private static Box box(GameSession session) {
        return session.getBoard().getStore().ofType(Box.class).get(0);
    }
    
    private static IceCube cube(GameSession session) {
        return session.getBoard().getStore().ofType(IceCube.class).get(0);
    }
    
    // ========== Box ==========
    
    @Nested
    @DisplayName("Box push")
    class BoxPush {
        
        @Test
        @DisplayName("Pushing N times in an open direction moves the box N cells")
        void pushConservation() {
            GameSession session = start(LevelData.builder(10, 3)
                    .snake(SnakeColor.BLUE, c(1, 1), c(0, 1))
                    .box(c(2, 1))
                    .build());
            Box box = box(session);
            
            for (int i = 0; i < 4; i++) {
                assertEquals(MoveResult.ACCEPTED, session.requestMove(MoveRequest.head(0, 2 + i, 1)));
            }
            
            assertEquals(c(6, 1), box.getAnchor());
            assertEquals(c(5, 1), session.getSnakes().get(0).getHead());
            assertEquals(4, recorder.count(GameEvent.EntityRelocated.class));
        }
        
        @Test
        @DisplayName("Wall, box, snake or closed gate behind the box obstructs")
        void blockedLanding() {
            LevelData.Builder base = LevelData.builder(8, 8)
                    .snake(SnakeColor.BLUE, c(1, 1), c(0, 1))
                    .box(c(2, 1))
                    .snake(SnakeColor.YELLOW, c(1, 4), c(0, 4))
                    .box(c(2, 4))
                    .box(c(3, 4))
                    .snake(SnakeColor.RED, c(1, 6), c(0, 6))
                    .box(c(2, 6))
                    .snake(SnakeColor.GREEN, c(3, 6), c(3, 7));
            GameSession session = start(base.wall(3, 1).build());
            
            assertEquals(MoveResult.OBSTRUCTED, session.requestMove(MoveRequest.head(0, 2, 1)));
            assertEquals(MoveResult.OBSTRUCTED, session.requestMove(MoveRequest.head(1, 2, 4)));
            assertEquals(MoveResult.OBSTRUCTED, session.requestMove(MoveRequest.head(2, 2, 6)));
            assertEquals(c(1, 1), session.getSnakes().get(0).getHead());
            assertTrue(recorder.getEvents().isEmpty());
        }
        
        @Test
        @DisplayName("Closed lift gate stops the box, an open one lets it through")
        void liftGateLanding() {
            GameSession closed = start(LevelData.builder(8, 4)
                    .snake(SnakeColor.BLUE, c(1, 1), c(0, 1))
                    .box(c(2, 1))
                    .liftGate(3, 1, GroupColor.ORANGE)
                    .plate(6, 3, GroupColor.ORANGE)
                    .build());
            assertEquals(MoveResult.OBSTRUCTED, closed.requestMove(MoveRequest.head(0, 2, 1)));
            
            GameSession open = start(LevelData.builder(8, 4)
                    .snake(SnakeColor.BLUE, c(1, 1), c(0, 1))
                    .snake(SnakeColor.YELLOW, c(6, 3))
                    .box(c(2, 1))
                    .liftGate(3, 1, GroupColor.ORANGE)
                    .plate(6, 3, GroupColor.ORANGE)
                    .build());
            assertEquals(MoveResult.ACCEPTED, open.requestMove(MoveRequest.head(0, 2, 1)));
            assertEquals(c(3, 1), box(open).getAnchor());
        }
        
        @Test
        @DisplayName("Tail may not push")
        void tailPush() {
            GameSession session = start(LevelData.builder(8, 3)
                    .snake(SnakeColor.RED, c(2, 1), c(1, 1))
                    .box(c(0, 1))
                    .build());
            
            assertEquals(MoveResult.OBSTRUCTED, session.requestMove(MoveRequest.tail(0, 0, 1)));
            assertEquals(c(0, 1), box(session).getAnchor());
        }
        
        @Test
        @DisplayName("Box onto a hole fills it and both disappear")
        void boxIntoHole() {
            GameSession session = start(LevelData.builder(8, 3)
                    .snake(SnakeColor.BLUE, c(1, 1), c(0, 1))
                    .box(c(2, 1))
                    .hole(3, 1)
                    .build());
            Box box = box(session);
            
            assertEquals(MoveResult.ACCEPTED, session.requestMove(MoveRequest.head(0, 2, 1)));
            
            assertEquals(List.of(new GameEvent.HoleFilled(c(3, 1), c(2, 1))), recorder.ofType(GameEvent.HoleFilled.class));
            assertEquals(List.of(new GameEvent.EntityDestroyed(box.getId(), EntityKind.BOX, List.of(c(3, 1)), DestroyCause.HOLE)),
                    recorder.ofType(GameEvent.EntityDestroyed.class));
            assertTrue(session.getBoard().isEmpty(c(3, 1)));
            assertFalse(session.getBoard().getStore().isLive(box.getId()));
            
            // the filled hole is floor now
            assertEquals(MoveResult.ACCEPTED, session.requestMove(MoveRequest.head(0, 3, 1)));
        }
        
        @Test
        @DisplayName("Partially supported footprint does not fall")
        void partialHoleSupport() {
            GameSession session = start(LevelData.builder(8, 4)
                    .snake(SnakeColor.BLUE, c(1, 1), c(0, 1))
                    .box(c(2, 1), c(2, 2))
                    .hole(3, 1)
                    .build());
            
            assertEquals(MoveResult.ACCEPTED, session.requestMove(MoveRequest.head(0, 2, 1)));
            
            assertEquals(List.of(c(3, 1), c(3, 2)), box(session).getFootprint());
            assertNotNull(session.getBoard().firstOfKind(c(3, 1), Hole.class));
            assertEquals(0, recorder.count(GameEvent.HoleFilled.class));
        }
        
        @Test
        @DisplayName("Fully supported footprint fills every hole under it")
        void fullHoleSupport() {
            GameSession session = start(LevelData.builder(8, 4)
                    .snake(SnakeColor.BLUE, c(1, 1), c(0, 1))
                    .box(c(2, 1), c(2, 2))
                    .hole(3, 1)
                    .hole(3, 2)
                    .build());
            
            assertEquals(MoveResult.ACCEPTED, session.requestMove(MoveRequest.head(0, 2, 1)));
            
            assertEquals(2, recorder.count(GameEvent.HoleFilled.class));
            assertEquals(1, recorder.count(GameEvent.EntityDestroyed.class));
            assertTrue(session.getBoard().getStore().ofType(Hole.class).isEmpty());
        }
        
        @Test
        @DisplayName("Box onto an armed laser is destroyed")
        void boxOntoLaser() {
            GameSession session = start(LevelData.builder(8, 3)
                    .snake(SnakeColor.BLUE, c(1, 1), c(0, 1))
                    .box(c(2, 1))
                    .laserGate(3, 1, GroupColor.PURPLE)
                    .build());
            Box box = box(session);
            
            assertEquals(MoveResult.ACCEPTED, session.requestMove(MoveRequest.head(0, 2, 1)));
            
            List<GameEvent.EntityDestroyed> destroyed = recorder.ofType(GameEvent.EntityDestroyed.class);
            assertEquals(1, destroyed.size());
            assertEquals(DestroyCause.LASER, destroyed.get(0).cause());
            assertFalse(session.getBoard().getStore().isLive(box.getId()));
        }
        
        @Test
        @DisplayName("Box pushed into an active portal lands at the partner cell")
        void boxThroughPortal() {
            GameSession session = start(LevelData.builder(10, 8)
                    .snake(SnakeColor.BLUE, c(1, 1), c(0, 1))
                    .box(c(2, 1))
                    .portal(3, 1, PortalColor.ORANGE)
                    .portal(8, 6, PortalColor.ORANGE)
                    .build());
            Box box = box(session);
            
            assertEquals(MoveResult.ACCEPTED, session.requestMove(MoveRequest.head(0, 2, 1)));
            
            assertEquals(c(8, 6), box.getAnchor());
            assertEquals(c(2, 1), session.getSnakes().get(0).getHead());
            assertEquals(List.of(new GameEvent.EntityRelocated(box.getId(), EntityKind.BOX, c(2, 1), c(8, 6))),
                    recorder.ofType(GameEvent.EntityRelocated.class));
            // the box now blocks the far side
            assertTrue(recorder.getEvents().stream().anyMatch(e -> e instanceof GameEvent.PortalStateChanged p && !p.active()));
        }
        
        @Test
        @DisplayName("Portal whose partner the box itself covers is plain floor for the box")
        void inactivePortalIsFloor() {
            GameSession session = start(LevelData.builder(10, 8)
                    .snake(SnakeColor.BLUE, c(1, 1), c(0, 1))
                    .box(c(2, 1))
                    .portal(3, 1, PortalColor.ORANGE)
                    .portal(2, 1, PortalColor.ORANGE)
                    .build());
            
            assertEquals(MoveResult.ACCEPTED, session.requestMove(MoveRequest.head(0, 2, 1)));
            assertEquals(c(3, 1), box(session).getAnchor());
            // the head stays on the far portal: its partner is now under the box
            assertEquals(c(2, 1), session.getSnakes().get(0).getHead());
        }
    }
    
    // ========== Ice cube ==========
    
    @Nested
    @DisplayName("Ice slide")
    class IceSlide {
        
        @Test
        @DisplayName("Cube slides until the cell before the wall")
        void slideToWall() {
            GameSession session = start(LevelData.builder(10, 3)
                    .snake(SnakeColor.BLUE, c(1, 1), c(0, 1))
                    .iceCube(c(2, 1))
                    .wall(7, 1)
                    .build());
            IceCube cube = cube(session);
            
            assertEquals(MoveResult.ACCEPTED, session.requestMove(MoveRequest.head(0, 2, 1)));
            
            assertEquals(c(6, 1), cube.getAnchor());
            assertEquals(List.of(new GameEvent.EntityRelocated(cube.getId(), EntityKind.ICE_CUBE, c(2, 1), c(6, 1))),
                    recorder.ofType(GameEvent.EntityRelocated.class));
        }
        
        @Test
        @DisplayName("Blocked start: cannot slide, nothing moves")
        void blockedStart() {
            GameSession session = start(LevelData.builder(10, 3)
                    .snake(SnakeColor.BLUE, c(1, 1), c(0, 1))
                    .iceCube(c(2, 1))
                    .wall(3, 1)
                    .build());
            IceCube cube = cube(session);
            
            assertFalse(session.getResolver().getPushProtocol().canSlideIceCube(cube, c(1, 0)));
            assertEquals(MoveResult.OBSTRUCTED, session.requestMove(MoveRequest.head(0, 2, 1)));
            assertEquals(c(2, 1), cube.getAnchor());
        }
        
        @Test
        @DisplayName("Cube stops in the first hole and fills it")
        void slideIntoHole() {
            GameSession session = start(LevelData.builder(10, 3)
                    .snake(SnakeColor.BLUE, c(1, 1), c(0, 1))
                    .iceCube(c(2, 1))
                    .hole(5, 1)
                    .hole(6, 1)
                    .build());
            
            assertEquals(MoveResult.ACCEPTED, session.requestMove(MoveRequest.head(0, 2, 1)));
            
            assertEquals(List.of(new GameEvent.HoleFilled(c(5, 1), c(2, 1))), recorder.ofType(GameEvent.HoleFilled.class));
            assertNotNull(session.getBoard().firstOfKind(c(6, 1), Hole.class));
            assertTrue(session.getBoard().getStore().ofType(IceCube.class).isEmpty());
        }
        
        @Test
        @DisplayName("Cube slides over a laser and dies only if it stops there")
        void slideOverLaser() {
            GameSession session = start(LevelData.builder(10, 3)
                    .snake(SnakeColor.BLUE, c(1, 1), c(0, 1))
                    .iceCube(c(2, 1))
                    .laserGate(4, 1, GroupColor.YELLOW)
                    .wall(7, 1)
                    .build());
            
            session.requestMove(MoveRequest.head(0, 2, 1));
            
            assertEquals(c(6, 1), cube(session).getAnchor());
            assertEquals(0, recorder.count(GameEvent.EntityDestroyed.class));
        }
        
        @Test
        @DisplayName("Slide stops at the configured step limit")
        void stepLimit() {
            GameSession session = start(LevelData.builder(20, 3)
                    .snake(SnakeColor.BLUE, c(1, 1), c(0, 1))
                    .iceCube(c(2, 1))
                    .build(), SessionConfig.builder().slideStepLimit(3).build());
            
            session.requestMove(MoveRequest.head(0, 2, 1));
            
            assertEquals(c(5, 1), cube(session).getAnchor());
        }
        
        @Test
        @DisplayName("Cube through a portal to (10,10) keeps sliding three cells past it")
        void slideThroughPortal() {
            GameSession session = start(LevelLoader.fromResource("levels/ice-portal.conf"));
            IceCube cube = cube(session);
            
            assertEquals(MoveResult.ACCEPTED, session.requestMove(MoveRequest.head(0, 3, 2)));
            
            assertEquals(c(13, 10), cube.getAnchor());
            assertEquals(List.of(new GameEvent.EntityRelocated(cube.getId(), EntityKind.ICE_CUBE, c(3, 2), c(13, 10))),
                    recorder.ofType(GameEvent.EntityRelocated.class));
            assertEquals(c(3, 2), session.getSnakes().get(0).getHead());
        }
    }
    
    // ========== Portal under a pushed box ==========
    
    @Nested
    @DisplayName("Box pushed off a portal")
    class BoxOffPortal {
        
        @Test
        @DisplayName("Head follows into the freed portal and arrives at the partner cell")
        void headTeleports() {
            GameSession session = start(LevelData.builder(10, 8)
                    .snake(SnakeColor.BLUE, c(1, 1), c(0, 1))
                    .box(c(2, 1))
                    .portal(2, 1, PortalColor.CYAN)
                    .portal(7, 4, PortalColor.CYAN)
                    .build());
            
            assertEquals(MoveResult.ACCEPTED, session.requestMove(MoveRequest.head(0, 2, 1)));
            
            assertEquals(c(3, 1), box(session).getAnchor());
            assertEquals(List.of(c(7, 4), c(1, 1)), session.getSnakes().get(0).getBody());
        }
        
        @Test
        @DisplayName("Head stays on the portal cell when the partner cell is taken")
        void partnerTaken() {
            GameSession session = start(LevelData.builder(10, 8)
                    .snake(SnakeColor.BLUE, c(1, 1), c(0, 1))
                    .snake(SnakeColor.RED, c(7, 4), c(7, 5))
                    .box(c(2, 1))
                    .portal(2, 1, PortalColor.CYAN)
                    .portal(7, 4, PortalColor.CYAN)
                    .build());
            
            assertEquals(MoveResult.ACCEPTED, session.requestMove(MoveRequest.head(0, 2, 1)));
            
            assertEquals(c(3, 1), box(session).getAnchor());
            assertEquals(List.of(c(2, 1), c(1, 1)), session.getSnakes().get(0).getBody());
            assertEquals(List.of(c(7, 4), c(7, 5)), session.getSnakes().get(1).getBody());
        }
        
        @Test
        @DisplayName("Push query matches what a move would do")
        void canPushBox() {
            GameSession session = start(LevelData.builder(10, 3)
                    .snake(SnakeColor.BLUE, c(1, 1), c(0, 1))
                    .box(c(2, 1))
                    .wall(2, 0)
                    .build());
            PushProtocol protocol = session.getResolver().getPushProtocol();
            Box box = box(session);
            
            assertTrue(protocol.canPushBox(box, c(1, 0)));
            assertFalse(protocol.canPushBox(box, c(-1, 0)), "snake behind the box");
            assertFalse(protocol.canPushBox(box, c(0, -1)), "wall below the box");
            assertEquals(c(2, 1), box.getAnchor());
        }
    }
    
    // ========== Multi-cell ice cube ==========
    
    @Nested
    @DisplayName("Two-cell ice cube")
    class WideIceCube {
        
        @Test
        @DisplayName("Whole shape stops before the wall")
        void stopsBeforeWall() {
            GameSession session = start(LevelData.builder(10, 3)
                    .snake(SnakeColor.BLUE, c(1, 1), c(0, 1))
                    .iceCube(c(2, 1), c(3, 1))
                    .wall(8, 1)
                    .build());
            IceCube cube = cube(session);
            
            assertEquals(MoveResult.ACCEPTED, session.requestMove(MoveRequest.head(0, 2, 1)));
            
            assertEquals(List.of(c(6, 1), c(7, 1)), cube.getFootprint());
            assertEquals(List.of(new GameEvent.EntityRelocated(cube.getId(), EntityKind.ICE_CUBE, c(2, 1), c(6, 1))),
                    recorder.ofType(GameEvent.EntityRelocated.class));
        }
        
        @Test
        @DisplayName("Footprint fully on holes fills them in footprint order")
        void fallsIntoHoles() {
            GameSession session = start(LevelData.builder(10, 3)
                    .snake(SnakeColor.BLUE, c(1, 1), c(0, 1))
                    .iceCube(c(2, 1), c(3, 1))
                    .hole(6, 1)
                    .hole(7, 1)
                    .build());
            int cubeId = cube(session).getId();
            
            assertEquals(MoveResult.ACCEPTED, session.requestMove(MoveRequest.head(0, 2, 1)));
            
            assertEquals(List.of(
                    new GameEvent.EntityRelocated(cubeId, EntityKind.ICE_CUBE, c(2, 1), c(6, 1)),
                    new GameEvent.HoleFilled(c(6, 1), c(2, 1)),
                    new GameEvent.HoleFilled(c(7, 1), c(3, 1)),
                    new GameEvent.EntityDestroyed(cubeId, EntityKind.ICE_CUBE, List.of(c(6, 1), c(7, 1)), DestroyCause.HOLE),
                    new GameEvent.SnakeMoved(0)), recorder.getEvents());
            assertTrue(session.getBoard().getStore().ofType(Hole.class).isEmpty());
        }
        
        @Test
        @DisplayName("Portal shifts the whole shape and the slide goes on from the far side")
        void throughPortal() {
            GameSession session = start(LevelData.builder(16, 10)
                    .snake(SnakeColor.BLUE, c(1, 1), c(0, 1))
                    .iceCube(c(2, 1), c(3, 1))
                    .portal(5, 1, PortalColor.CYAN)
                    .portal(10, 6, PortalColor.CYAN)
                    .wall(14, 6)
                    .build());
            IceCube cube = cube(session);
            
            assertEquals(MoveResult.ACCEPTED, session.requestMove(MoveRequest.head(0, 2, 1)));
            
            assertEquals(List.of(c(12, 6), c(13, 6)), cube.getFootprint());
            assertEquals(List.of(new GameEvent.EntityRelocated(cube.getId(), EntityKind.ICE_CUBE, c(2, 1), c(12, 6))),
                    recorder.ofType(GameEvent.EntityRelocated.class));
            assertEquals(c(2, 1), session.getSnakes().get(0).getHead());
        }
    }
}
