package io.github.manjago.snakeescape.debug;

import io.github.manjago.snakeescape.sim.GameEvent;
import io.github.manjago.snakeescape.sim.MoveRequest;
import io.github.manjago.snakeescape.sim.MoveResult;
import io.github.manjago.snakeescape.sim.SessionListener;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Records everything a session publishes, for debugging and tests.
 * 
 * Usage:
 * <pre>
 * EventRecorder recorder = new EventRecorder();
 * session.addListener(recorder);
 * session.requestMove(MoveRequest.head(0, 3, 2));
 * List&lt;GameEvent&gt; events = recorder.getEvents();
 * </pre>
 */
public class EventRecorder implements SessionListener {
    
    /**
     * A refused request and its reason.
     */
    public record Rejection(MoveRequest request, MoveResult reason) {}
    
    private final List<GameEvent> events = new ArrayList<>();
    private final List<Rejection> rejections = new ArrayList<>();
    
    @Override
    public void onEvent(GameEvent event) {
        events.add(event);
    }
    
    @Override
    public void onMoveRejected(MoveRequest request, MoveResult reason) {
        rejections.add(new Rejection(request, reason));
    }
    
    public List<GameEvent> getEvents() {
        return Collections.unmodifiableList(events);
    }
    
    public List<Rejection> getRejections() {
        return Collections.unmodifiableList(rejections);
    }
    
    /**
     * Recorded events of one type, in order.
     */
    public <T extends GameEvent> List<T> ofType(Class<T> type) {
        List<T> result = new ArrayList<>();
        for (GameEvent event : events) {
            if (type.isInstance(event)) {
                result.add(type.cast(event));
            }
        }
        return result;
    }
    
    public int count(Class<? extends GameEvent> type) {
        return ofType(type).size();
    }
    
    public void clear() {
        events.clear();
        rejections.clear();
    }
}
