// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.heap;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.base.Stopwatch;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.BiPredicate;
import java.util.stream.Collectors;

public class Main {
    private static final Logger log = LogManager.getFormatterLogger(Main.class);
    private static Joiner spaceJoiner = Joiner.on(' ');
    private static Splitter commaSplitter = Splitter.on(',').trimResults().omitEmptyStrings();

    private static Options options() {
        return new Options()
                .addOption("task", true, "one of heapify, insert, sort, remove")
                .addOption("values", true, "comma-separated integers")
                .addOption("order", true, "max (default) or min")
                .addOption("index", true, "position to remove, for -task remove");
    }

    private static List<Integer> values(CommandLine cmd) {
        if (!cmd.hasOption("values")) throw new IllegalArgumentException("Must specify -values");
        return commaSplitter.splitToList(cmd.getOptionValue("values")).stream()
                .map(Integer::valueOf)
                .collect(Collectors.toList());
    }

    private static BiPredicate<Integer, Integer> order(CommandLine cmd) {
        String o = cmd.getOptionValue("order", "max");
        switch (o) {
            case "max": return (a, b) -> a > b;
            case "min": return (a, b) -> a < b;
            default: throw new IllegalArgumentException("Unknown order: " + o);
        }
    }

    public static void main(String[] args) throws ParseException {
        run(args, System.out);
    }

    static void run(String[] args, PrintStream out) throws ParseException {
        CommandLine cmd = new DefaultParser().parse(options(), args);
        if (!cmd.hasOption("task")) throw new IllegalArgumentException("Must specify -task");
        String task = cmd.getOptionValue("task");
        List<Integer> vs = values(cmd);
        BiPredicate<Integer, Integer> order = order(cmd);
        Stopwatch sw = Stopwatch.createStarted();
        switch (task) {
            case "heapify":
                out.println(spaceJoiner.join(Heap.from(vs, order).nodes()));
                break;
            case "insert": {
                Heap<Integer> h = new Heap<>(order);
                h.insertAll(vs);
                out.println(spaceJoiner.join(h.nodes()));
                break;
            }
            case "sort": {
                Heap<Integer> h = Heap.from(vs, order);
                List<Integer> sorted = new ArrayList<>(h.size());
                for (Optional<Integer> v = h.removeRoot(); v.isPresent(); v = h.removeRoot()) sorted.add(v.get());
                out.println(spaceJoiner.join(sorted));
                break;
            }
            case "remove": {
                if (!cmd.hasOption("index")) throw new IllegalArgumentException("Must specify -index");
                Heap<Integer> h = Heap.from(vs, order);
                Optional<Integer> removed = h.removeAt(Integer.parseInt(cmd.getOptionValue("index")));
                out.println(removed.map(String::valueOf).orElse("none"));
                out.println(spaceJoiner.join(h.nodes()));
                break;
            }
            default:
                throw new IllegalArgumentException("unknown task: " + task);
        }
        sw.stop();
        log.info("%s of %d values took %s", task, vs.size(), sw);
    }
}
