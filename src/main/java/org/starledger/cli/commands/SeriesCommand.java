package org.starledger.cli.commands;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

import org.starledger.cli.CommandLineInterface;
import org.starledger.parser.model.GameDate;
import org.starledger.timeline.model.SeriesSummary;
import org.starledger.timeline.store.h2.H2TimelineStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Lists the stored series with their snapshot counts and covered dates.
 */
@Command(
    name = "series",
    mixinStandardHelpOptions = true,
    description = "List the imported series"
)
public class SeriesCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(SeriesCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try (H2TimelineStore store = new H2TimelineStore(parent.getConfig().getConfig("starledger.database"))) {
            List<SeriesSummary> all = store.listSeries();
            if (all.isEmpty()) {
                out.println("No series imported yet.");
                return 0;
            }
            out.printf("%-40s %9s  %-11s %-11s%n", "SERIES", "SNAPSHOTS", "FIRST", "LAST");
            for (SeriesSummary summary : all) {
                out.printf("%-40s %9d  %-11s %-11s%n",
                        summary.series().name(),
                        summary.snapshots(),
                        formatDay(summary.firstDay()),
                        formatDay(summary.lastDay()));
            }
            return 0;
        } catch (Exception e) {
            log.error("Listing series failed", e);
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private static String formatDay(Integer day) {
        return day == null ? "-" : GameDate.fromDays(day);
    }
}
