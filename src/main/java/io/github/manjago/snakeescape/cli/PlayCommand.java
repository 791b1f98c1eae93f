package io.github.manjago.snakeescape.cli;

import com.typesafe.config.ConfigException;
import io.github.manjago.snakeescape.config.SessionConfig;
import io.github.manjago.snakeescape.core.Cell;
import io.github.manjago.snakeescape.core.SnakeEnd;
import io.github.manjago.snakeescape.debug.BoardPrinter;
import io.github.manjago.snakeescape.debug.EventRecorder;
import io.github.manjago.snakeescape.level.LevelData;
import io.github.manjago.snakeescape.level.LevelLoader.LevelFormatException;
import io.github.manjago.snakeescape.sim.GameSession;
import io.github.manjago.snakeescape.sim.MoveRequest;
import io.github.manjago.snakeescape.sim.MoveResult;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Apply a sequence of moves to a level.
 * 
 * Exit code 0 if the level was won, 2 if not, 1 on bad input.
 * 
 * Examples:
 *   snake-escape play tutorial -m "0 HEAD 3 2" -m "0 HEAD 4 2"
 *   snake-escape play my-level.conf --script moves.txt --verbose
 *   snake-escape play tutorial -f rules.conf --script moves.txt -q
 */
@Command(
    name = "play",
    description = "Apply moves to a level and report the outcome",
    mixinStandardHelpOptions = true
)
public class PlayCommand implements Callable<Integer> {
    
    static final int EXIT_WON = 0;
    static final int EXIT_BAD_INPUT = 1;
    static final int EXIT_NOT_WON = 2;
    
    @Parameters(index = "0", description = "Level file (HOCON) or bundled level name")
    private String level;
    
    @Option(names = {"-m", "--move"}, description = "Move as \"<snake-id> <HEAD|TAIL> <x> <y>\" (repeatable)")
    private List<String> moves = new ArrayList<>();
    
    @Option(names = {"-s", "--script"}, description = "File with one move per line ('#' starts a comment)")
    private Path script;
    
    @Option(names = {"-f", "--config"}, description = "Rule configuration file (HOCON)")
    private Path configFile;
    
    @Option(names = {"-v", "--verbose"}, description = "Print events and the board after every move")
    private boolean verbose;
    
    @Option(names = {"-q", "--quiet"}, description = "Quiet mode (no board, no statistics)")
    private boolean quiet;
    
    @Override
    public Integer call() {
        LevelData data;
        List<MoveRequest> requests;
        GameSession session;
        EventRecorder recorder = new EventRecorder();
        try {
            data = LevelSource.resolve(level);
            requests = collectMoves();
            SessionConfig config = configFile != null ? SessionConfig.fromFile(configFile) : SessionConfig.defaults();
            session = new GameSession(data, config);
            session.addListener(recorder);
            session.start();
        } catch (LevelFormatException | ConfigException | IllegalArgumentException | IllegalStateException e) {
            System.err.println("❌ " + e.getMessage());
            return EXIT_BAD_INPUT;
        } catch (IOException e) {
            System.err.println("❌ Cannot read move script " + script + ": " + e.getMessage());
            return EXIT_BAD_INPUT;
        }
        
        BoardPrinter printer = new BoardPrinter().showLegend(false).showSnakes(verbose);
        
        if (!quiet) {
            System.out.println(data);
            System.out.println();
            System.out.print(printer.render(session.getState()));
            System.out.println();
        }
        
        for (MoveRequest request : requests) {
            if (session.isWon()) {
                break;
            }
            recorder.clear();
            MoveResult result = session.requestMove(request);
            if (!quiet) {
                System.out.printf("%s -> %s%n", request, result);
            }
            if (verbose) {
                printer.printEvents(recorder.getEvents());
                printer.print(session.getState());
                System.out.println();
            }
        }
        
        if (!quiet) {
            if (!verbose) {
                System.out.println();
                System.out.print(printer.render(session.getState()));
            }
            System.out.println();
            System.out.println(session.getStats());
        }
        
        System.out.println(session.isWon() ? "🏆 Level won" : "Level not won");
        return session.isWon() ? EXIT_WON : EXIT_NOT_WON;
    }
    
    private List<MoveRequest> collectMoves() throws IOException {
        List<MoveRequest> result = new ArrayList<>();
        for (String move : moves) {
            result.add(parseMove(move));
        }
        if (script != null) {
            for (String line : Files.readAllLines(script)) {
                int comment = line.indexOf('#');
                String text = (comment >= 0 ? line.substring(0, comment) : line).trim();
                if (!text.isEmpty()) {
                    result.add(parseMove(text));
                }
            }
        }
        return result;
    }
    
    /**
     * Parse {@code "<snake-id> <HEAD|TAIL> <x> <y>"}; commas also separate.
     * 
     * @throws IllegalArgumentException if the text is not a move
     */
    static MoveRequest parseMove(String text) {
        String[] parts = text.trim().split("[\\s,]+");
        if (parts.length != 4) {
            throw new IllegalArgumentException("Bad move '" + text + "', expected <snake-id> <HEAD|TAIL> <x> <y>");
        }
        try {
            int snakeId = Integer.parseInt(parts[0]);
            SnakeEnd end = SnakeEnd.valueOf(parts[1].toUpperCase(Locale.ROOT));
            Cell target = Cell.of(Integer.parseInt(parts[2]), Integer.parseInt(parts[3]));
            return new MoveRequest(snakeId, end, target);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Bad move '" + text + "': " + e.getMessage(), e);
        }
    }
}
