package org.starledger.cli.commands;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import org.starledger.cli.CommandLineInterface;
import org.starledger.parser.model.GameDate;
import org.starledger.timeline.model.EventFilter;
import org.starledger.timeline.model.EventKind;
import org.starledger.timeline.model.EventSubject;
import org.starledger.timeline.model.HistoricalEvent;
import org.starledger.timeline.store.h2.H2TimelineStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Prints the events of one series, oldest first.
 */
@Command(
    name = "history",
    mixinStandardHelpOptions = true,
    description = "Print the recorded events of a series"
)
public class HistoryCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(HistoryCommand.class);

    @Parameters(index = "0", description = "Series name")
    private String series;

    @Option(names = {"--kind"}, description = "Event kind, e.g. ruled_empire")
    private String kind;

    @Option(names = {"--country"}, description = "Country id the events belong to")
    private Long country;

    @Option(names = {"--leader"}, description = "Leader id the events refer to")
    private Long leader;

    @Option(names = {"--system"}, description = "System id the events refer to")
    private Long system;

    @Option(names = {"--war"}, description = "War id the events refer to")
    private Long war;

    @Option(names = {"--from"}, description = "First date, e.g. 2200.01.01")
    private String from;

    @Option(names = {"--to"}, description = "Last date, e.g. 2250.12.30")
    private String to;

    @Option(names = {"--known-only"}, description = "Only events known to the observer")
    private boolean knownOnly;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        EventFilter filter;
        try {
            filter = EventFilter.all()
                    .withKind(kind == null ? null : EventKind.fromId(kind))
                    .withCountry(country)
                    .withSubject(subjectPattern())
                    .between(from == null ? null : GameDate.toDays(from), to == null ? null : GameDate.toDays(to))
                    .knownOnly(knownOnly);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return 2;
        }

        try (H2TimelineStore store = new H2TimelineStore(parent.getConfig().getConfig("starledger.database"))) {
            if (store.findSeries(series).isEmpty()) {
                err.println("Error: unknown series '" + series + "'");
                return 1;
            }
            List<HistoricalEvent> events = store.events(series, filter);
            for (HistoricalEvent event : events) {
                out.println(format(event));
            }
            out.println(events.size() + " event(s)");
            return 0;
        } catch (Exception e) {
            log.error("Reading history of {} failed", series, e);
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private EventSubject subjectPattern() {
        if (leader == null && system == null && war == null) {
            return null;
        }
        return EventSubject.NONE.withLeader(leader).withSystem(system).withWar(war);
    }

    static String format(HistoricalEvent event) {
        String start = GameDate.fromDays(event.startDay());
        String end = event.isOpen() ? "..." : GameDate.fromDays(event.endDay().getAsInt());
        StringBuilder line = new StringBuilder()
                .append(start).append(" - ").append(end).append("  ")
                .append(event.kind().id());
        String subject = describe(event.subject());
        if (!subject.isEmpty()) {
            line.append(" [").append(subject).append(']');
        }
        event.description().ifPresent(d -> line.append(' ').append(d));
        if (!event.knownToObserver()) {
            line.append(" (unknown to observer)");
        }
        return line.toString();
    }

    private static String describe(EventSubject subject) {
        List<String> parts = new ArrayList<>();
        addPart(parts, "country", subject.country());
        addPart(parts, "target", subject.targetCountry());
        addPart(parts, "leader", subject.leader());
        addPart(parts, "system", subject.system());
        addPart(parts, "planet", subject.planet());
        addPart(parts, "faction", subject.faction());
        addPart(parts, "war", subject.war());
        return String.join(" ", parts);
    }

    private static void addPart(List<String> parts, String name, Long id) {
        if (id != null) {
            parts.add(name + "=" + id);
        }
    }
}
