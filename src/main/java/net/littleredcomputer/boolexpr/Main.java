package net.littleredcomputer.boolexpr;

import com.google.common.base.Joiner;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;

import static java.util.stream.Collectors.toList;

public class Main {
    private static final Logger log = LogManager.getFormatterLogger(Main.class);
    private static final Joiner spaceJoiner = Joiner.on(' ');

    private static Options options() {
        return new Options()
                .addOption("task", true, "one of eval, solve, truthtable, demorgan")
                .addOption(Option.builder("expr").hasArg().desc("expression in canonical form; repeat for truthtable").build())
                .addOption("target", true, "value to solve for: true or false");
    }

    private static List<Node> expressions(CommandLine cmd) {
        if (!cmd.hasOption("expr")) throw new IllegalArgumentException("Must specify -expr");
        return Arrays.stream(cmd.getOptionValues("expr")).map(ExpressionParser::parse).collect(toList());
    }

    private static Node expression(CommandLine cmd) {
        List<Node> es = expressions(cmd);
        if (es.size() != 1) throw new IllegalArgumentException("Exactly one -expr expected");
        return es.get(0);
    }

    private static boolean target(CommandLine cmd) {
        String t = cmd.getOptionValue("target", "true");
        switch (t) {
            case "true": return true;
            case "false": return false;
            default: throw new IllegalArgumentException("target must be true or false: " + t);
        }
    }

    private static String assignments(Node n) {
        return spaceJoiner.join(Trees.findVariables(n).distinct().map(Variable::assignment).iterator());
    }

    static void run(String[] args, PrintStream out) throws ParseException {
        CommandLine cmd = new DefaultParser().parse(options(), args);
        if (!cmd.hasOption("task")) throw new IllegalArgumentException("Must specify -task");
        String task = cmd.getOptionValue("task");
        log.info("task %s", task);
        switch (task) {
            case "eval": {
                Node e = expression(cmd);
                out.println(e.evaluate().map(v -> v ? "1" : "0").orElse("?"));
                break;
            }
            case "solve": {
                Node e = expression(cmd);
                boolean target = target(cmd);
                try {
                    e.setState(target);
                    out.println("s SATISFIED");
                } catch (ConstraintException x) {
                    log.debug("solve failed: %s", x.getMessage());
                    out.println("s UNSATISFIABLE");
                }
                out.println("v " + assignments(e));
                break;
            }
            case "truthtable": {
                TruthTable t = TruthTable.of(expressions(cmd).toArray(new Node[0]));
                out.print(t.format());
                out.println(t.allAgree() ? "equivalent" : "not equivalent");
                break;
            }
            case "demorgan":
                out.println(Trees.deMorgan(expression(cmd)));
                break;
            default:
                throw new IllegalArgumentException("unknown task: " + task);
        }
    }

    public static void main(String[] args) throws ParseException {
        run(args, System.out);
    }
}
