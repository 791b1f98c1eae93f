package io.github.manjago.snakeescape.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BoardTest {
    
    private EntityStore store;
    private Board board;
    
    @BeforeEach
    void setUp() {
        store = new EntityStore();
        board = new Board(6, 4, store);
    }
    
    // ========== Lookup ==========
    
    @Nested
    @DisplayName("Lookup")
    class Lookup {
        
        @Test
        @DisplayName("Empty cell is open floor")
        void emptyCellIsFloor() {
            assertTrue(board.get(Cell.of(2, 2)).isEmpty());
            assertTrue(board.isEmpty(Cell.of(2, 2)));
            assertFalse(board.hasKind(Cell.of(2, 2), EntityKind.WALL));
        }
        
        @Test
        @DisplayName("Out of bounds reads as a wall and never throws")
        void outOfBoundsIsWall() {
            for (Cell cell : List.of(Cell.of(-1, 0), Cell.of(6, 0), Cell.of(0, -1), Cell.of(0, 4))) {
                List<Entity> entities = board.get(cell);
                assertEquals(1, entities.size());
                assertEquals(EntityKind.WALL, entities.get(0).getKind());
                assertTrue(board.hasKind(cell, EntityKind.WALL));
                assertFalse(board.hasKind(cell, EntityKind.HOLE));
                assertFalse(board.isEmpty(cell));
            }
        }
        
        @Test
        @DisplayName("Cells stack several entities in insertion order")
        void stacking() {
            Cell cell = Cell.of(1, 1);
            PressurePlate plate = store.create(id -> new PressurePlate(id, cell, GroupColor.YELLOW));
            LaserGate laser = store.create(id -> new LaserGate(id, cell, GroupColor.YELLOW));
            board.add(cell, plate);
            board.add(cell, laser);
            
            assertEquals(List.of(plate, laser), board.get(cell));
            assertSame(laser, board.firstOfKind(cell, LaserGate.class));
            assertNull(board.firstOfKind(cell, Portal.class));
        }
        
        @Test
        @DisplayName("Wrap maps any cell onto the torus")
        void wrap() {
            assertEquals(Cell.of(5, 0), board.wrap(Cell.of(-1, 0)));
            assertEquals(Cell.of(0, 3), board.wrap(Cell.of(6, -1)));
            assertEquals(Cell.of(2, 2), board.wrap(Cell.of(2, 2)));
        }
    }
    
    // ========== Mutation ==========
    
    @Nested
    @DisplayName("Mutation")
    class Mutation {
        
        @Test
        @DisplayName("Add outside the board throws")
        void addOutOfBoundsThrows() {
            Wall wall = store.create(Wall::new);
            assertThrows(IllegalArgumentException.class, () -> board.add(Cell.of(9, 9), wall));
        }
        
        @Test
        @DisplayName("Add of an entity from another store throws")
        void addForeignEntityThrows() {
            Wall foreign = new EntityStore().create(Wall::new);
            Wall local = store.create(id -> new Wall(id));
            assertNotSame(foreign, local);
            assertThrows(IllegalArgumentException.class, () -> board.add(Cell.of(0, 0), foreign));
        }
        
        @Test
        @DisplayName("Remove reports whether the entity was there")
        void remove() {
            Wall wall = store.create(Wall::new);
            board.add(Cell.of(0, 0), wall);
            
            assertTrue(board.remove(Cell.of(0, 0), wall));
            assertFalse(board.remove(Cell.of(0, 0), wall));
            assertFalse(board.remove(Cell.of(-3, 0), wall));
        }
        
        @Test
        @DisplayName("Relocate moves a multi-cell footprint and keeps identity")
        void relocateFootprint() {
            Box box = store.create(id -> new Box(id, List.of(Cell.of(1, 1), Cell.of(2, 1))));
            board.place(box);
            
            board.relocate(box, box.shifted(Cell.of(0, 1)));
            
            assertEquals(List.of(Cell.of(1, 2), Cell.of(2, 2)), box.getFootprint());
            assertSame(box, board.firstOfKind(Cell.of(1, 2), Box.class));
            assertSame(box, board.firstOfKind(Cell.of(2, 2), Box.class));
            assertTrue(board.isEmpty(Cell.of(1, 1)));
            assertTrue(board.isEmpty(Cell.of(2, 1)));
        }
        
        @Test
        @DisplayName("Relocate outside the board throws and leaves the object in place")
        void relocateOutOfBounds() {
            Box box = store.create(id -> new Box(id, List.of(Cell.of(5, 0))));
            board.place(box);
            
            assertThrows(IllegalArgumentException.class, () -> board.relocate(box, box.shifted(Cell.of(1, 0))));
            assertEquals(Cell.of(5, 0), box.getAnchor());
            assertSame(box, board.firstOfKind(Cell.of(5, 0), Box.class));
        }
        
        @Test
        @DisplayName("Destroy removes from the board and tombstones the id")
        void destroy() {
            Hole hole = store.create(id -> new Hole(id, Cell.of(3, 3)));
            Hole other = store.create(id -> new Hole(id, Cell.of(4, 3)));
            board.add(hole.getPosition(), hole);
            board.add(other.getPosition(), other);
            
            board.destroy(hole, List.of(hole.getPosition()));
            
            assertTrue(board.isEmpty(Cell.of(3, 3)));
            assertFalse(store.isLive(hole.getId()));
            assertTrue(store.isLive(other.getId()));
            assertEquals(1, store.size());
            assertEquals(List.of(other), store.ofType(Hole.class));
        }
    }
    
    @Test
    @DisplayName("Non-positive size is rejected")
    void invalidSize() {
        assertThrows(IllegalArgumentException.class, () -> new Board(0, 3, store));
        assertThrows(IllegalArgumentException.class, () -> new Board(3, -1, store));
    }
}
