package com.iimsoft.gantt.app;

import com.iimsoft.gantt.api.dto.ChartRequest;
import com.iimsoft.gantt.config.ChartConfig;
import com.iimsoft.gantt.log.ChartLog;
import com.iimsoft.gantt.log.Slf4jChartLog;
import com.iimsoft.gantt.persistence.ChartFileIO;
import com.iimsoft.gantt.service.GanttChartService;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 命令行入口：JSON 图表描述 -> SVG 甘特图。
 *
 * 用法：
 * - mvn exec:java -Dexec.args="chart.json chart.svg"
 * - 读取 stdin / 写 stdout：mvn exec:java -Dexec.args="-" < chart.json > chart.svg
 * - 选项：-t/--title-width W, -m/--max-month-width W, -r/--add-resource-table
 */
public class GanttChartApp {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    static final String USAGE = "Usage: gantt-chart [OPTIONS] [INPUT_FILE|-] [OUTPUT_FILE]\n"
            + "  -t, --title-width <WIDTH>      The width of the item title column [default: 210]\n"
            + "  -m, --max-month-width <WIDTH>  The maximum width of each month [default: 80]\n"
            + "  -r, --add-resource-table       Add a resource table at the bottom of the graph\n"
            + "  -h, --help                     Print help";

    private final GanttChartService service;
    private final ChartFileIO fileIO;
    private final ChartLog log;

    public GanttChartApp() {
        this(new GanttChartService(), new ChartFileIO(), new Slf4jChartLog(GanttChartApp.class));
    }

    GanttChartApp(GanttChartService service, ChartFileIO fileIO, ChartLog log) {
        this.service = service;
        this.fileIO = fileIO;
        this.log = log;
    }

    public static void main(String[] args) {
        int status = new GanttChartApp().run(args, System.in, System.out, System.err);
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }

    /**
     * stdout 只放 SVG（或 --help 的输出），用法错误的提示写到 stderr。
     */
    public int run(String[] args, InputStream stdin, PrintStream stdout, PrintStream stderr) {
        Arguments arguments;
        try {
            arguments = Arguments.parse(args, ChartConfig.fromSystemProperties());
        } catch (IllegalArgumentException e) {
            log.error("{}", e.getMessage());
            stderr.println(USAGE);
            return EXIT_USAGE;
        }
        if (arguments.help) {
            stdout.println(USAGE);
            return EXIT_OK;
        }

        try {
            ChartRequest request = readRequest(arguments.input, stdin);
            String svg = service.renderSvg(request, arguments.config);
            writeSvg(arguments.output, svg, stdout);
            if (arguments.output != null) {
                log.output("Wrote {}", arguments.output.toAbsolutePath());
            }
            return EXIT_OK;
        } catch (IOException e) {
            log.error("I/O error: {}", e.getMessage());
            return EXIT_FAILED;
        } catch (IllegalArgumentException e) {
            log.error("{}", e.getMessage());
            return EXIT_FAILED;
        }
    }

    private ChartRequest readRequest(Path input, InputStream stdin) throws IOException {
        if (input == null) {
            return fileIO.read(stdin);
        }
        return fileIO.read(input);
    }

    private static void writeSvg(Path output, String svg, PrintStream stdout) throws IOException {
        if (output == null) {
            Writer w = new OutputStreamWriter(stdout, StandardCharsets.UTF_8);
            w.write(svg);
            w.flush();
            return;
        }
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null && !Files.exists(parent)) {
            Files.createDirectories(parent);
        }
        try (Writer w = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
            w.write(svg);
        } catch (IOException e) {
            throw new IOException("Unable to create file '" + output + "'", e);
        }
    }

    /**
     * Parsed command line. {@code input}/{@code output} are null for stdin/stdout.
     */
    static final class Arguments {
        Path input;
        Path output;
        boolean help;
        final ChartConfig config;

        private Arguments(ChartConfig config) {
            this.config = config;
        }

        static Arguments parse(String[] args, ChartConfig base) {
            ChartConfig config = new ChartConfig(base.getTitleWidth(), base.getMaxMonthWidth(), base.isAddResourceTable());
            Arguments a = new Arguments(config);
            int positional = 0;
            String[] safeArgs = args == null ? new String[0] : args;
            for (int i = 0; i < safeArgs.length; i++) {
                String arg = safeArgs[i];
                switch (arg) {
                    case "-h":
                    case "--help":
                        a.help = true;
                        break;
                    case "-r":
                    case "--add-resource-table":
                        config.setAddResourceTable(true);
                        break;
                    case "-t":
                    case "--title-width":
                        config.setTitleWidth(number(arg, safeArgs, ++i));
                        break;
                    case "-m":
                    case "--max-month-width":
                        config.setMaxMonthWidth(number(arg, safeArgs, ++i));
                        break;
                    default:
                        if (arg.startsWith("-") && !"-".equals(arg)) {
                            throw new IllegalArgumentException("Unknown option: " + arg);
                        }
                        if (positional == 0) {
                            a.input = "-".equals(arg) ? null : Path.of(arg);
                        } else if (positional == 1) {
                            a.output = "-".equals(arg) ? null : Path.of(arg);
                        } else {
                            throw new IllegalArgumentException("Unexpected argument: " + arg);
                        }
                        positional++;
                }
            }
            config.validate();
            return a;
        }

        private static double number(String option, String[] args, int i) {
            if (i >= args.length) {
                throw new IllegalArgumentException("Missing value for " + option);
            }
            try {
                return Double.parseDouble(args[i]);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + option + ": '" + args[i] + "'", e);
            }
        }
    }
}
