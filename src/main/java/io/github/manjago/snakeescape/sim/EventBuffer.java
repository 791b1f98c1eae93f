package io.github.manjago.snakeescape.sim;

import java.util.ArrayList;
import java.util.List;

/**
 * Outbound event queue. The core appends, the session drains and dispatches.
 */
public class EventBuffer {
    
    private final List<GameEvent> pending = new ArrayList<>();
    
    public void add(GameEvent event) {
        pending.add(event);
    }
    
    /**
     * Take every pending event, oldest first, and empty the buffer.
     */
    public List<GameEvent> drain() {
        List<GameEvent> events = new ArrayList<>(pending);
        pending.clear();
        return events;
    }
}
