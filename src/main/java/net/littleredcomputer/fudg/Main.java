package net.littleredcomputer.fudg;

import com.google.common.base.Joiner;
import com.google.common.base.Stopwatch;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.config.Configurator;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.Set;
import java.util.stream.Collectors;

public class Main {
    private static final Logger log = LogManager.getFormatterLogger(Main.class);
    private static Joiner spaceJoiner = Joiner.on(' ');

    private static Options options() {
        return new Options()
                .addOption("task", true, "what to compute: candidates, projective or json")
                .addOption("input", true, "filename of JSON graph record (- for stdin)")
                .addOption("nosimplify", false, "leave coordination nodes in place")
                .addOption("verbose", false, "log progress");
    }

    private static Reader input(CommandLine cmd) throws FileNotFoundException {
        if (!cmd.hasOption("input")) throw new IllegalArgumentException("Must specify -input");
        String p = cmd.getOptionValue("input");
        return new BufferedReader(p.equals("-")
                ? new InputStreamReader(System.in, StandardCharsets.UTF_8)
                : new InputStreamReader(new FileInputStream(p), StandardCharsets.UTF_8));
    }

    private static String names(Set<Node> nodes) {
        return spaceJoiner.join(nodes.stream().map(Node::name).collect(Collectors.toList()));
    }

    public static void main(String[] args) throws ParseException, IOException {
        CommandLine cmd = new DefaultParser().parse(options(), args);
        if (!cmd.hasOption("task")) throw new IllegalArgumentException("Must specify -task");
        if (cmd.hasOption("verbose")) Configurator.setRootLevel(Level.INFO);
        String task = cmd.getOptionValue("task");

        Stopwatch sw = Stopwatch.createStarted();
        FudgGraph g;
        try (Reader r = input(cmd)) {
            g = FudgGraph.parseFrom(r);
        }
        log.info("read %d nodes over %d tokens in %s", g.nodes().size(), g.tokens().size(), sw);
        if (!cmd.hasOption("nosimplify")) {
            new CoordinationSimplifier(g).simplify();
            log.info("coordination simplified in %s", sw);
        }
        switch (task) {
            case "candidates": {
                new CandidatePropagation(g).run();
                log.info("candidates computed in %s", sw);
                for (CbbNode b : Node.sorted(g.bundles(), Node.BY_NAME)) {
                    System.out.println(b.name() + " top: " + names(b.topCandidates()) + " parent: " + names(b.parentCandidates()));
                }
                for (Node n : Node.sorted(g.lexicalNodes(), Node.BY_NAME)) {
                    System.out.println(n.name() + " parent: " + names(n.parentCandidates()));
                }
                break;
            }
            case "projective":
                System.out.println(g.nonProjectiveNode().map(n -> "nonprojective at " + n.name()).orElse("projective"));
                break;
            case "json":
                System.out.println(g.toRecord().toJson());
                break;
            default:
                throw new IllegalArgumentException("unknown task: " + task);
        }
    }
}
