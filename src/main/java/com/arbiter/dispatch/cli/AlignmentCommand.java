package com.arbiter.dispatch.cli;

import com.arbiter.core.value.AlignmentRecord;
import com.arbiter.core.value.AlignmentStatistics;
import com.arbiter.core.value.GlobalValueMemory;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;
import java.util.Locale;

/**
 * CLI command: arbiter alignment
 * <p>
 * Displays alignment statistics and the most recent alignment records.
 */
@Command(name = "alignment", mixinStandardHelpOptions = true, description = "Show alignment statistics and drift")
@Component
public class AlignmentCommand implements Runnable {

    @Option(names = {"--limit", "-n"}, description = "Number of recent records to show", defaultValue = "10")
    private int limit;

    private final GlobalValueMemory valueMemory;

    public AlignmentCommand(GlobalValueMemory valueMemory) {
        this.valueMemory = valueMemory;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        valueMemory.initialize();

        AlignmentStatistics stats = valueMemory.getAlignmentStatistics();
        if (stats.totalActions() == 0) {
            ConsoleOutput.info("No alignment records yet.");
            return;
        }

        System.out.printf(Locale.ROOT, "Actions validated: %d (%d aligned, %.1f%%)%n",
                stats.totalActions(), stats.alignedActions(), stats.alignmentRate() * 100);
        System.out.printf(Locale.ROOT, "Average alignment score: %.2f%n", stats.averageAlignmentScore());
        if (stats.driftEvents() > 0) {
            ConsoleOutput.warn("Drift events: " + stats.driftEvents());
            var last = stats.lastDrift();
            if (last != null) {
                ConsoleOutput.warn(String.format(Locale.ROOT, "Last drift: %s %s on %s (score %.2f)",
                        last.timestamp(), last.agentId(), last.actionType(), last.alignmentScore()));
            }
        } else {
            ConsoleOutput.success("No drift detected");
        }

        List<AlignmentRecord> history = valueMemory.alignmentHistory();
        int from = Math.max(0, history.size() - Math.max(0, limit));
        ConsoleOutput.section("RECENT:");
        for (AlignmentRecord record : history.subList(from, history.size())) {
            String mark = record.aligned() ? "@|fg(green) +|@" : "@|fg(red) x|@";
            System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(Locale.ROOT,
                    "  %s %s %-20s %-16s %.2f", mark, record.timestamp(), record.agentId(),
                    record.actionType(), record.alignmentScore())));
        }
    }
}
