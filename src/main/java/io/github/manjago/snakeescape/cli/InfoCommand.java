package io.github.manjago.snakeescape.cli;

import io.github.manjago.snakeescape.config.SessionConfig;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * Show information about Snake Escape.
 */
@Command(
    name = "info",
    description = "Show version and rule configuration",
    mixinStandardHelpOptions = true
)
public class InfoCommand implements Callable<Integer> {
    
    @Override
    public Integer call() {
        System.out.println();
        System.out.println("╔═══════════════════════════════════════╗");
        System.out.println("║             SNAKE ESCAPE              ║");
        System.out.println("║       Grid Puzzle Simulation          ║");
        System.out.println("║          Version 1.0.0                ║");
        System.out.println("╚═══════════════════════════════════════╝");
        System.out.println();
        
        System.out.println("Default Configuration:");
        System.out.println(SessionConfig.defaults());
        
        System.out.println("Move syntax (play -m):");
        System.out.println("  <snake-id> <HEAD|TAIL> <x> <y>    e.g. \"0 HEAD 3 2\"");
        System.out.println();
        return 0;
    }
}
