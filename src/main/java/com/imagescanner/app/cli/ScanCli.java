package com.imagescanner.app.cli;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.imagescanner.app.config.ScannerSettings;
import com.imagescanner.app.database.CatalogDatabase;
import com.imagescanner.app.database.JdbiScanLog;
import com.imagescanner.app.database.ScanLogDao.ScanSummary;
import com.imagescanner.app.inventory.CancellationToken;
import com.imagescanner.app.inventory.FileDiscoverer;
import com.imagescanner.app.inventory.ImageScanner;
import com.imagescanner.app.inventory.ScanConfig;
import com.imagescanner.app.inventory.ScanReport;
import com.imagescanner.app.inventory.ScanStatus;
import com.imagescanner.app.metadata.ImageFileMetadataExtractor;

public final class ScanCli {

    private static final Logger logger = LoggerFactory.getLogger(ScanCli.class);

    static final int EXIT_USAGE = 2;
    private static final long SHUTDOWN_GRACE_SECONDS = 30;

    private ScanCli() {}

    public static void main(String[] args) {
        int exitCode = execute(args);
        if (exitCode != 0) System.exit(exitCode);
    }

    public static int execute(String[] args) {
        if (args == null || args.length == 0) {
            printUsage();
            return 0;
        }

        String cmd = StringUtils.trimToEmpty(args[0]).toLowerCase(Locale.ROOT);
        String[] rest = Arrays.copyOfRange(args, 1, args.length);

        try {
            return switch (cmd) {
                case "scan" -> runScan(rest);
                case "history" -> runHistory(rest);
                case "help", "-h", "--help" -> {
                    printUsage();
                    yield 0;
                }
                default -> {
                    System.err.println("Comando invalido: " + args[0]);
                    printUsage();
                    yield EXIT_USAGE;
                }
            };
        } catch (RuntimeException e) {
            logger.error("Erro fatal", e);
            System.err.println("Erro fatal: " + safeMsg(e));
            return ScanStatus.FAILED.exitCode();
        }
    }

    // ----------------- scan -----------------

    private static int runScan(String[] args) {
        ParseResult<ScanArgs> parsed = ScanArgs.parse(args);
        if (parsed.help()) {
            printScanUsage();
            return 0;
        }
        if (parsed.error() != null) {
            System.err.println(parsed.error());
            printScanUsage();
            return EXIT_USAGE;
        }

        ScanArgs a = parsed.value();
        Path root;
        try {
            root = Path.of(a.folder()).toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            System.err.println("Caminho invalido: " + safeMsg(e));
            return EXIT_USAGE;
        }
        // pré-checagem: "raiz inválida" é diferente de "zero arquivos"
        if (!Files.isDirectory(root)) {
            System.err.println("Pasta nao existe: " + root);
            return EXIT_USAGE;
        }

        ScanConfig config = a.toConfig(root, ScannerSettings.load());
        CancellationToken cancel = CancellationToken.create();

        CountDownLatch finished = new CountDownLatch(1);

        // cancelamento via Ctrl+C / kill; segura o shutdown até o último lote ser gravado
        Thread cancelHook = new Thread(() -> {
            cancel.cancel();
            System.err.println("Cancelamento solicitado (shutdown hook) em " + Instant.now());
            try {
                if (!finished.await(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
                    System.err.println("Scan nao terminou em " + SHUTDOWN_GRACE_SECONDS + "s; encerrando.");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "image-scanner-cli-cancel");
        Runtime.getRuntime().addShutdownHook(cancelHook);

        ScanReport report;
        try (CatalogDatabase db = CatalogDatabase.open()) {
            log(">> Catálogo: " + db.dbFile().toAbsolutePath());
            ImageScanner scanner = new ImageScanner(db.catalogStore(), db.scanLog(),
                    new ImageFileMetadataExtractor(), ScanCli::log);
            report = scanner.run(config, cancel);
        } finally {
            finished.countDown();
            try {
                Runtime.getRuntime().removeShutdownHook(cancelHook);
            } catch (IllegalStateException e) {
                // JVM já está encerrando; o hook já rodou
                logger.debug("Shutdown em andamento; hook mantido");
            }
        }

        if (a.summary() || report.status() != ScanStatus.COMPLETED) {
            printSummary(report);
        }
        return report.status().exitCode();
    }

    static void printSummary(ScanReport r) {
        System.out.println("----------------------------------------");
        System.out.printf("Status      : %s%n", r.status());
        System.out.printf("Encontrados : %d%n", r.found());
        System.out.printf("Inalterados : %d%n", r.unchanged());
        System.out.printf("Novos       : %d%n", r.added());
        System.out.printf("Modificados : %d%n", r.modified());
        System.out.printf("Movidos     : %d%n", r.moved());
        System.out.printf("Ignorados   : %d%n", r.skipped());
        System.out.printf("Erros       : %d%n", r.errors());
        if (r.abandoned() > 0) System.out.printf("Abandonados : %d%n", r.abandoned());
        System.out.printf("Bytes       : %s%n", FileUtils.byteCountToDisplaySize(r.bytesCounted()));
        System.out.printf("Tempo       : %.1fs%n", r.elapsed().toMillis() / 1000.0);
        if (r.cancelled()) System.out.println("Cancelado   : sim (lote pendente gravado)");
        if (r.message() != null) System.out.printf("Mensagem    : %s%n", r.message());
        System.out.println("----------------------------------------");
    }

    // ----------------- history -----------------

    private static int runHistory(String[] args) {
        ParseResult<HistoryArgs> parsed = HistoryArgs.parse(args);
        if (parsed.help()) {
            printHistoryUsage();
            return 0;
        }
        if (parsed.error() != null) {
            System.err.println(parsed.error());
            printHistoryUsage();
            return EXIT_USAGE;
        }

        List<ScanSummary> rows;
        try (CatalogDatabase db = CatalogDatabase.open()) {
            JdbiScanLog scanLog = db.scanLog();
            rows = scanLog.recent(parsed.value().limit());
        }

        if (rows.isEmpty()) {
            System.out.println("Sem historico de scans.");
            return 0;
        }

        System.out.println("id | status | inicio | fim | encontrados | novos | modificados | movidos | erros | abandonados | bytes | root");
        for (ScanSummary row : rows) {
            System.out.printf(
                    "%d | %s | %s | %s | %d | %d | %d | %d | %d | %d | %s | %s%n",
                    row.scanId(),
                    safeText(row.status()),
                    safeText(row.startedAt()),
                    safeText(row.finishedAt()),
                    zero(row.filesFound()),
                    zero(row.filesAdded()),
                    zero(row.filesModified()),
                    zero(row.filesMoved()),
                    zero(row.errors()),
                    zero(row.filesAbandoned()),
                    FileUtils.byteCountToDisplaySize(zero(row.bytesCounted())),
                    StringUtils.abbreviateMiddle(safeText(row.rootPath()), "...", 60)
            );
        }
        return 0;
    }

    // ----------------- usage -----------------

    private static void printUsage() {
        System.out.println("""
                ImageScanner CLI
                Comandos:
                  scan --folder <pasta> [opcoes]
                  history [--limit <n>]
                  help
                """);
    }

    private static void printScanUsage() {
        System.out.println("""
                Uso:
                  scan --folder <pasta> [--extensions .png,.jpg] [--min-size <bytes>] [--max-size <bytes>]
                       [--no-subdirs] [--batch-size <n>] [--workers <n>] [--summary]

                  --max-size 0 significa sem limite.

                Exemplos:
                  scan --folder /home/fotos --summary
                  scan --folder D:\\Fotos --extensions .jpg,.jpeg --min-size 1024 --workers 4
                """);
    }

    private static void printHistoryUsage() {
        System.out.println("""
                Uso:
                  history [--limit <n>]

                Exemplo:
                  history --limit 50
                """);
    }

    // ----------------- parsing -----------------

    private static final class ArgCursor {
        private final String[] args;
        private int i;

        ArgCursor(String[] args) {
            this.args = args == null ? new String[0] : args;
        }

        boolean hasNext() { return i < args.length; }

        String next() { return args[i++]; }

        String requireNext(String opt) {
            if (!hasNext()) throw new IllegalArgumentException("Valor ausente para " + opt);
            return next();
        }

        long requireLong(String opt) {
            String v = requireNext(opt);
            try {
                return Long.parseLong(v.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Valor invalido para " + opt + ": " + v);
            }
        }
    }

    record ParseResult<T>(T value, boolean help, String error) {
        static <T> ParseResult<T> okResult(T v) { return new ParseResult<>(v, false, null); }
        static <T> ParseResult<T> helpResult() { return new ParseResult<>(null, true, null); }
        static <T> ParseResult<T> errorResult(String e) { return new ParseResult<>(null, false, e); }
    }

    /** Opções nulas herdam o padrão de {@link ScannerSettings}. */
    record ScanArgs(
            String folder,
            List<String> extensions,
            Long minSize,
            Long maxSize,
            boolean noSubdirs,
            Integer batchSize,
            Integer workers,
            boolean summary
    ) {
        static ParseResult<ScanArgs> parse(String[] args) {
            String folder = null;
            List<String> extensions = null;
            Long minSize = null, maxSize = null;
            Integer batchSize = null, workers = null;
            boolean noSubdirs = false, summary = false;

            try {
                ArgCursor c = new ArgCursor(args);
                while (c.hasNext()) {
                    String t = c.next();
                    switch (t) {
                        case "-h", "--help" -> { return ParseResult.helpResult(); }
                        case "--folder" -> folder = c.requireNext("--folder");
                        case "--extensions" -> extensions = List.copyOf(
                                FileDiscoverer.normalizeExtensions(Arrays.asList(c.requireNext("--extensions").split(","))));
                        case "--min-size" -> minSize = c.requireLong("--min-size");
                        case "--max-size" -> maxSize = c.requireLong("--max-size");
                        case "--no-subdirs" -> noSubdirs = true;
                        case "--batch-size" -> batchSize = (int) c.requireLong("--batch-size");
                        case "--workers" -> workers = (int) c.requireLong("--workers");
                        case "--summary" -> summary = true;
                        default -> { return ParseResult.errorResult("Opcao invalida: " + t); }
                    }
                }
            } catch (IllegalArgumentException e) {
                return ParseResult.errorResult(safeMsg(e));
            }

            if (StringUtils.isBlank(folder)) {
                return ParseResult.errorResult("Parametro obrigatorio: --folder");
            }
            if (extensions != null && extensions.isEmpty()) {
                return ParseResult.errorResult("--extensions sem nenhuma extensao");
            }
            if ((minSize != null && minSize < 0) || (maxSize != null && maxSize < 0)) {
                return ParseResult.errorResult("Tamanhos devem ser >= 0");
            }
            if (minSize != null && maxSize != null && maxSize != 0 && minSize > maxSize) {
                return ParseResult.errorResult("--min-size maior que --max-size");
            }
            if (batchSize != null && batchSize < 1) {
                return ParseResult.errorResult("--batch-size deve ser >= 1");
            }
            if (workers != null && workers < 1) {
                return ParseResult.errorResult("--workers deve ser >= 1");
            }
            return ParseResult.okResult(new ScanArgs(folder, extensions, minSize, maxSize, noSubdirs,
                    batchSize, workers, summary));
        }

        ScanConfig toConfig(Path root, ScannerSettings defaults) {
            return new ScanConfig(
                    root,
                    extensions != null ? extensions : defaults.extensions(),
                    !noSubdirs && defaults.recursive(),
                    minSize != null ? minSize : defaults.minFileSize(),
                    maxSize != null ? maxSize : defaults.maxFileSize(),
                    batchSize != null ? batchSize : defaults.batchSize(),
                    defaults.metadataFields(),
                    workers != null ? workers : defaults.hashWorkers()
            );
        }
    }

    record HistoryArgs(int limit) {
        static ParseResult<HistoryArgs> parse(String[] args) {
            int limit = 20;

            try {
                ArgCursor c = new ArgCursor(args);
                while (c.hasNext()) {
                    String t = c.next();
                    switch (t) {
                        case "-h", "--help" -> { return ParseResult.helpResult(); }
                        case "--limit" -> limit = (int) Math.max(1, c.requireLong("--limit"));
                        default -> { return ParseResult.errorResult("Opcao invalida: " + t); }
                    }
                }
            } catch (IllegalArgumentException e) {
                return ParseResult.errorResult(safeMsg(e));
            }

            return ParseResult.okResult(new HistoryArgs(limit));
        }
    }

    // ----------------- misc -----------------

    private static String safeMsg(Throwable t) {
        String m = (t == null) ? null : t.getMessage();
        return StringUtils.isBlank(m)
                ? (t == null ? "Erro" : t.getClass().getSimpleName())
                : m;
    }

    private static String safeText(String v) {
        return StringUtils.isBlank(v) ? "-" : v;
    }

    private static long zero(Long v) {
        return v == null ? 0 : v;
    }

    private static void log(String msg) {
        if (StringUtils.isNotBlank(msg)) System.out.println(msg);
    }
}
