package io.github.manjago.snakeescape.cli;

import io.github.manjago.snakeescape.debug.BoardPrinter;
import io.github.manjago.snakeescape.level.LevelData;
import io.github.manjago.snakeescape.level.LevelLoader.LevelFormatException;
import io.github.manjago.snakeescape.sim.GameSession;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * Print a level's initial board.
 * 
 * Examples:
 *   snake-escape show tutorial           # bundled level
 *   snake-escape show my-level.conf      # level file
 */
@Command(
    name = "show",
    description = "Print the initial board of a level",
    mixinStandardHelpOptions = true
)
public class ShowCommand implements Callable<Integer> {
    
    @Parameters(index = "0", description = "Level file (HOCON) or bundled level name")
    private String level;
    
    @Option(names = {"--no-legend"}, description = "Omit the symbol legend")
    private boolean noLegend;
    
    @Override
    public Integer call() {
        LevelData data;
        GameSession session;
        try {
            data = LevelSource.resolve(level);
            session = new GameSession(data);
            session.start();
        } catch (LevelFormatException | IllegalArgumentException | IllegalStateException e) {
            System.err.println("❌ " + e.getMessage());
            return 1;
        }
        
        System.out.println(data);
        System.out.println();
        new BoardPrinter().showLegend(!noLegend).print(session.getState());
        return 0;
    }
}
