package com.refharvest.app;

import com.refharvest.app.logging.LogSetup;
import com.refharvest.core.error.NetworkFailureException;
import com.refharvest.core.model.HarvestConfig;
import com.refharvest.core.model.HarvestReport;
import com.refharvest.core.service.HarvestService;
import com.refharvest.core.util.DefaultSleeper;
import com.refharvest.core.util.ProgressListener;
import com.refharvest.core.util.YamlConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/** 명령행 진입점: 설정 조립 → 로그 초기화 → HarvestService 실행 → 종료 코드 */
public final class App {

    private static final Logger LOG = LoggerFactory.getLogger(App.class);

    static final int EXIT_OK = 0;
    static final int EXIT_SEED_UNREACHABLE = 2;
    static final int EXIT_USAGE = 64;
    static final int EXIT_INTERRUPTED = 130;

    static final List<String> PROFILES = List.of("cms-hcpcs", "loinc");
    static final Path DEFAULT_CONFIG = Path.of("harvest.yml");

    private App() {}

    public static void main(String[] args) {
        System.exit(run(args, System.getenv(), System.out, System.err));
    }

    static int run(String[] args, Map<String, String> env, PrintStream out, PrintStream err) {
        CliArgs cli;
        HarvestConfig cfg;
        try {
            cli = CliArgs.parse(args);
            if (cli.help) {
                out.println(CliArgs.USAGE);
                return EXIT_OK;
            }
            cfg = buildConfig(cli, env, DEFAULT_CONFIG);
        } catch (IllegalArgumentException | IOException e) {
            err.println("refharvest: " + e.getMessage());
            err.println(CliArgs.USAGE);
            return EXIT_USAGE;
        }

        LogSetup.configure(cfg.getOutputDir(), cli.verbose);

        HarvestService service;
        try {
            service = new HarvestService(cfg, new DefaultSleeper(), null, new ConsoleProgress(out));
        } catch (IllegalArgumentException | NullPointerException e) {
            err.println("refharvest: invalid configuration: " + e.getMessage());
            return EXIT_USAGE;
        }

        try {
            HarvestReport report = service.run();
            out.printf("Done: %d pages, %d downloaded, %d skipped, %d failed (%,d bytes)%n",
                    report.getPagesVisited(), report.getFilesDownloaded(), report.getFilesSkipped(),
                    report.getFilesFailed(), report.getBytesDownloaded());
            if (service.getLastReport() != null) out.println("Report: " + service.getLastReport());
            return EXIT_OK;
        } catch (NetworkFailureException e) {
            LOG.error("Seed unreachable: {}", e.getMessage());
            err.println("refharvest: seed unreachable: " + e.getResource() + " (" + e.getMessage() + ")");
            return EXIT_SEED_UNREACHABLE;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("refharvest: interrupted");
            return EXIT_INTERRUPTED;
        }
    }

    /**
     * 설정 조립 순서: 기본값 → 프로파일 → 설정 파일 → CLI 플래그/환경변수.
     * 프로파일/설정 파일/시드가 모두 없으면 작업 디렉터리의 harvest.yml을 읽는다.
     */
    static HarvestConfig buildConfig(CliArgs cli, Map<String, String> env, Path defaultConfig) throws IOException {
        HarvestConfig cfg = HarvestConfig.defaults();

        if (cli.profile != null) {
            String res = "profiles/" + cli.profile + ".yml";
            try (InputStream in = App.class.getClassLoader().getResourceAsStream(res)) {
                if (in == null) throw new IllegalArgumentException("Unknown profile: " + cli.profile
                        + " (available: " + String.join(", ", PROFILES) + ")");
                YamlConfigLoader.merge(cfg, in);
            }
        }

        Path file = cli.config;
        if (file == null && cli.profile == null && cli.seed == null && Files.exists(defaultConfig)) {
            file = defaultConfig;
        }
        if (file != null) {
            if (!Files.exists(file)) throw new IOException("config not found: " + file.toAbsolutePath());
            try (InputStream in = Files.newInputStream(file)) {
                YamlConfigLoader.merge(cfg, in);
            }
        }

        if (cli.seed != null) cfg.setTarget(cli.seed);
        if (cli.depth != null) cfg.setMaxDepth(cli.depth);
        if (cli.out != null) cfg.setOutputDir(cli.out);
        if (cli.noReport) cfg.setWriteReport(false);

        String user = firstNonBlank(cli.user, env.get("RH_USERNAME"), cfg.auth().getUsername());
        String pass = firstNonBlank(cli.password, env.get("RH_PASSWORD"), cfg.auth().getPassword());
        cfg.auth().setUsername(user).setPassword(pass);

        if (cfg.getTarget() == null)
            throw new IllegalArgumentException("No seed URL: use --seed, --profile or --config");
        return cfg;
    }

    private static String firstNonBlank(String... vs) {
        for (String v : vs) if (v != null && !v.isBlank()) return v;
        return null;
    }

    /** 페이지 진입마다 한 줄 진행 표시 */
    static final class ConsoleProgress implements ProgressListener {
        private final PrintStream out;

        ConsoleProgress(PrintStream out) { this.out = out; }

        @Override
        public void onProgress(String phase, String subject, long pages, long files) {
            if ("crawl".equals(phase) || "login".equals(phase) || "terms".equals(phase)) {
                out.printf("[%-5s] pages=%d files=%d %s%n", phase, pages, files, subject == null ? "" : subject);
            }
        }
    }
}
