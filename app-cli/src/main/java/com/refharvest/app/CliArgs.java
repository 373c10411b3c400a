package com.refharvest.app;

import java.nio.file.Path;
import java.util.List;

/**
 * 명령행 인자. 형식 오류는 IllegalArgumentException(종료 코드 64).
 * <pre>
 * refharvest [--config file] [--profile name] [--seed url] [--depth n] [--out dir]
 *            [--user u] [--password p] [--no-report] [--verbose] [--help]
 * </pre>
 */
final class CliArgs {

    static final String USAGE = String.join(System.lineSeparator(),
            "Usage: refharvest [options]",
            "  --config <file>     YAML config (default: ./harvest.yml when present)",
            "  --profile <name>    bundled site profile: " + String.join(", ", App.PROFILES),
            "  --seed <url>        seed URL (overrides config target)",
            "  --depth <n>         maximum crawl depth",
            "  --out <dir>         output directory",
            "  --user <name>       login user (or RH_USERNAME)",
            "  --password <pw>     login password (or RH_PASSWORD)",
            "  --no-report         do not write the JSON run report",
            "  --verbose           debug logging",
            "  --help              show this help");

    Path config;
    String profile;
    String seed;
    Integer depth;
    Path out;
    String user;
    String password;
    boolean noReport;
    boolean verbose;
    boolean help;

    static CliArgs parse(String[] args) {
        CliArgs a = new CliArgs();
        List<String> list = List.of(args);
        for (int i = 0; i < list.size(); i++) {
            String arg = list.get(i);
            switch (arg) {
                case "--config":   a.config = Path.of(value(list, ++i, arg)); break;
                case "--profile":  a.profile = value(list, ++i, arg); break;
                case "--seed":     a.seed = value(list, ++i, arg); break;
                case "--depth":    a.depth = intValue(value(list, ++i, arg), arg); break;
                case "--out":      a.out = Path.of(value(list, ++i, arg)); break;
                case "--user":     a.user = value(list, ++i, arg); break;
                case "--password": a.password = value(list, ++i, arg); break;
                case "--no-report": a.noReport = true; break;
                case "--verbose":
                case "-v":         a.verbose = true; break;
                case "--help":
                case "-h":         a.help = true; break;
                default:
                    throw new IllegalArgumentException("Unknown option: " + arg);
            }
        }
        return a;
    }

    private static String value(List<String> list, int i, String opt) {
        if (i >= list.size() || list.get(i).startsWith("--"))
            throw new IllegalArgumentException("Missing value for " + opt);
        return list.get(i);
    }

    private static int intValue(String v, String opt) {
        try {
            int n = Integer.parseInt(v.trim());
            if (n < 0) throw new IllegalArgumentException(opt + " must be >= 0");
            return n;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(opt + " expects a number: " + v, e);
        }
    }
}
