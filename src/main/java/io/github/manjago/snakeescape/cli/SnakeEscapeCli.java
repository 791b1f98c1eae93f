package io.github.manjago.snakeescape.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Snake Escape CLI - play and inspect puzzle levels from the terminal.
 * 
 * Usage:
 *   snake-escape show &lt;level&gt;            - Print the board
 *   snake-escape play &lt;level&gt; [moves]    - Apply moves and report the outcome
 *   snake-escape info                    - Show version and config
 */
@Command(
    name = "snake-escape",
    description = "Grid puzzle simulation: snakes, boxes, ice, portals and gates",
    mixinStandardHelpOptions = true,
    version = "Snake Escape 1.0.0",
    subcommands = {
        ShowCommand.class,
        PlayCommand.class,
        InfoCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class SnakeEscapeCli implements Runnable {
    
    @Override
    public void run() {
        // If no subcommand, show help
        CommandLine.usage(this, System.out);
    }
    
    public static void main(String[] args) {
        System.exit(newCommandLine().execute(args));
    }
    
    static CommandLine newCommandLine() {
        return new CommandLine(new SnakeEscapeCli())
                .setCaseInsensitiveEnumValuesAllowed(true);
    }
}
