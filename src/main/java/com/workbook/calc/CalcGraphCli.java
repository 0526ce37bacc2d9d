package com.workbook.calc;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;

import com.workbook.calc.engine.AnalysisOptions;
import com.workbook.calc.io.WorkbookJsonLoader;
import com.workbook.calc.report.ReportWriter;

import lombok.extern.log4j.Log4j2;

/**
 * Command-line entry point.
 *
 * <pre>
 * CalcGraphCli &lt;workbook.json&gt; [dependencies|lod|fields|tree|mermaid] [--options options.json]
 * </pre>
 *
 * Reports print to stdout; logging goes to stderr.
 */
@Log4j2
public final class CalcGraphCli {
    static final int OK = 0;
    static final int USAGE = 2;
    static final int FAILED = 1;

    private static final String USAGE_TEXT =
            "Usage: CalcGraphCli <workbook.json> [dependencies|lod|fields|tree|mermaid] [--options options.json]";

    private CalcGraphCli() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out));
    }

    static int run(String[] args, PrintStream out) {
        Path workbook = null;
        Path optionsPath = null;
        String command = "dependencies";
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--options".equals(arg)) {
                if (i + 1 >= args.length) {
                    log.error("--options needs a file argument");
                    return USAGE;
                }
                optionsPath = Path.of(args[++i]);
            } else if (workbook == null) {
                workbook = Path.of(arg);
            } else {
                command = arg;
            }
        }
        if (workbook == null) {
            log.error(USAGE_TEXT);
            return USAGE;
        }

        try {
            AnalysisOptions options = optionsPath != null
                    ? WorkbookJsonLoader.loadOptions(optionsPath)
                    : AnalysisOptions.defaults();
            CalcGraph calc = CalcGraph.load(workbook, options);
            ReportWriter writer = new ReportWriter();
            switch (command) {
                case "dependencies" -> out.println(writer.toJson(calc.dependencyReport()));
                case "lod" -> out.println(writer.toJson(calc.scopedAggregationReport()));
                case "fields" -> out.println(writer.toJson(calc.fieldCatalog()));
                case "tree" -> out.println(calc.tree());
                case "mermaid" -> out.println(calc.mermaid());
                default -> {
                    log.error("Unknown command '{}'. {}", command, USAGE_TEXT);
                    return USAGE;
                }
            }
            return OK;
        } catch (IOException e) {
            log.error("Failed to read {}", workbook, e);
            return FAILED;
        } catch (IllegalArgumentException e) {
            log.error("Invalid input: {}", e.getMessage());
            return FAILED;
        }
    }
}
