package com.junctionvision.app;

import com.junctionvision.core.db.Pg;
import com.junctionvision.core.db.PgProfileStore;
import com.junctionvision.core.db.PgViolationSink;
import com.junctionvision.core.detection.StopLine;
import com.junctionvision.core.evidence.ClipMerger;
import com.junctionvision.core.evidence.FileEvidenceWriter;
import com.junctionvision.core.fine.FineCalculator;
import com.junctionvision.core.fine.ZoneFactors;
import com.junctionvision.core.ocr.PlateReader;
import com.junctionvision.core.ocr.PlateReaderChain;
import com.junctionvision.core.ocr.TesseractPlateReader;
import com.junctionvision.core.pipeline.LoggingViolationSink;
import com.junctionvision.core.pipeline.RunSummary;
import com.junctionvision.core.pipeline.ViolationPipeline;
import com.junctionvision.core.pipeline.ViolationSink;
import com.junctionvision.core.profile.InMemoryProfileStore;
import com.junctionvision.core.profile.ProfileStore;
import com.junctionvision.core.signal.FrameTimeline;
import com.junctionvision.core.signal.RedInterval;
import com.junctionvision.core.signal.SignalIntervals;
import com.junctionvision.core.tracking.MotionVehicleTracker;
import com.junctionvision.core.video.AnnotatedVideoWriter;
import com.junctionvision.core.video.FfmpegFrameSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Точка входа CLI.
 * <pre>
 *   process --video=in.mp4 --stop-line=x1,y1,x2,y2 [--signal-json=signals.json]
 *           [--output=output/annotated_video.mp4] [--force-red] [--school-zone]
 *   merge   --out=merged.mp4 clip1.mp4 clip2.mp4 ...
 * </pre>
 * Коды выхода: 0 - успех, 1 - фатальная ошибка, 2 - ошибка аргументов.
 */
public final class ViolationApp {
    private static final Logger log = LoggerFactory.getLogger(ViolationApp.class);

    static final int OK = 0;
    static final int FATAL = 1;
    static final int USAGE = 2;

    private static final String USAGE_TEXT = """
            usage:
              process --video=<file> --stop-line=x1,y1,x2,y2 [--signal-json=<file>] [--output=<file>] [--force-red] [--school-zone]
              merge --out=<file> <clip> [<clip> ...]
            """;

    record Args(String command, Map<String, String> options, List<String> positional) {}

    record Storage(ProfileStore profiles, ViolationSink sink) {}

    private ViolationApp() {}

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        Args a;
        try {
            a = parseArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.print(USAGE_TEXT);
            return USAGE;
        }
        try {
            return switch (a.command()) {
                case "process" -> process(a, Config.load());
                case "merge" -> merge(a);
                default -> throw new IllegalArgumentException("unknown command: " + a.command());
            };
        } catch (IllegalArgumentException e) {
            log.error("Invalid arguments: {}", e.getMessage());
            System.err.print(USAGE_TEXT);
            return USAGE;
        } catch (IOException | RuntimeException e) {
            log.error("Fatal: {}", e.getMessage(), e);
            return FATAL;
        }
    }

    static int process(Args a, Config cfg) throws IOException {
        Path video = Path.of(req(a.options(), "video"));
        StopLine stopLine = StopLine.parse(req(a.options(), "stop-line"));
        Path output = Path.of(a.options().getOrDefault("output", "output/annotated_video.mp4"));
        boolean forceRed = a.options().containsKey("force-red");
        boolean schoolZone = a.options().containsKey("school-zone") || cfg.location().schoolZone();

        List<RedInterval> intervals = List.of();
        String signalJson = a.options().get("signal-json");
        if (signalJson != null) {
            intervals = SignalIntervals.load(Path.of(signalJson), cfg.location().zone());
        }
        if (forceRed) log.warn("Force red mode enabled: every frame is treated as red light");

        PlateReaderChain ocr = ocrChain(cfg.ocr());
        Storage storage = storage(cfg);
        ProfileStore profiles = storage.profiles();
        ViolationSink sink = storage.sink();
        FileEvidenceWriter evidence = new FileEvidenceWriter(
                Path.of(cfg.output().images()), Path.of(cfg.output().clips()), cfg.location().zone());

        Config.Fine f = cfg.fine();
        Config.Pipeline p = cfg.pipeline();
        ViolationPipeline.Settings settings = new ViolationPipeline.Settings(
                stopLine,
                cfg.location().id(),
                new ZoneFactors(schoolZone),
                cfg.location().zone(),
                new FineCalculator.Params(f.baseFine(), f.repeatMultiplier(), f.schoolZoneFactor(),
                        f.nightHourStart(), f.nightHourEnd(), f.nightFactor()),
                p.historySize(), p.bufferSeconds(), p.clipSeconds(), p.staleTrackFrames(), p.progressEveryFrames());

        Config.Tracker t = cfg.tracker();
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        try (FfmpegFrameSource source = FfmpegFrameSource.open(video);
             MotionVehicleTracker tracker = new MotionVehicleTracker(t.minArea(), t.history(), t.varThreshold(),
                     t.maxDistance(), t.maxMissedFrames());
             AnnotatedVideoWriter writer = new AnnotatedVideoWriter(output, source.width(), source.height(), source.fps())) {
            FrameTimeline timeline = new FrameTimeline(Instant.now(), source.fps(), intervals, forceRed);
            ViolationPipeline pipeline = new ViolationPipeline(settings, timeline, tracker, ocr, profiles, evidence, sink);
            RunSummary summary = pipeline.run(source, r -> {
                try {
                    writer.write(r.rendered());
                } catch (IOException e) {
                    throw new IllegalStateException("annotated video write failed at frame " + r.frameIndex(), e);
                }
            });
            log.info("Annotated video saved to: {} ({})", output, summary);
            System.out.println("Done. " + summary);
        }
        return OK;
    }

    static int merge(Args a) throws IOException {
        Path out = Path.of(req(a.options(), "out"));
        if (a.positional().isEmpty()) throw new IllegalArgumentException("no clips to merge");
        List<Path> clips = new ArrayList<>();
        for (String s : a.positional()) clips.add(Path.of(s));
        int merged = ClipMerger.merge(clips, out);
        if (merged == 0) {
            log.error("Nothing merged into {}", out);
            return FATAL;
        }
        System.out.printf("Done. merged=%d of %d -> %s%n", merged, clips.size(), out);
        return OK;
    }

    /**
     * Профили и приёмник по sink.mode. Недоступная БД не фатальна: видео обрабатывается,
     * а каждое нарушение отчитывается как сбой профиля и приёмника.
     */
    static Storage storage(Config cfg) {
        if (!"db".equalsIgnoreCase(cfg.sink().mode())) {
            return new Storage(new InMemoryProfileStore(), new LoggingViolationSink());
        }
        try {
            Pg.init(cfg.db());
            Runtime.getRuntime().addShutdownHook(new Thread(Pg::close));
        } catch (RuntimeException e) {
            log.error("Could not connect to database ({}): {}. Violations will not be stored",
                    cfg.db().url(), e.getMessage());
        }
        return new Storage(new PgProfileStore(Clock.systemUTC()), new PgViolationSink());
    }

    /** WORDS → TEXT; при отключённом OCR или ошибке инициализации - пустая цепочка. */
    static PlateReaderChain ocrChain(Config.Ocr o) {
        if (!o.enabled()) {
            log.info("OCR disabled by config");
            return PlateReaderChain.disabled();
        }
        try {
            TesseractPlateReader.Config tc = new TesseractPlateReader.Config(
                    o.datapath(), o.languages(), o.psm(), o.oem(), o.whitelist());
            List<PlateReader> readers = List.of(
                    new TesseractPlateReader(tc, TesseractPlateReader.Mode.WORDS),
                    new TesseractPlateReader(tc, TesseractPlateReader.Mode.TEXT));
            return new PlateReaderChain(readers);
        } catch (RuntimeException e) {
            log.error("OCR init failed: {}. Plates will be reported as UNKNOWN", e.getMessage());
            return PlateReaderChain.disabled();
        }
    }

    /** "--key=value" → options, "--flag" → options(flag, "true"), остальное → positional. */
    static Args parseArgs(String[] args) {
        if (args == null || args.length == 0) throw new IllegalArgumentException("missing command");
        Map<String, String> m = new HashMap<>();
        List<String> positional = new ArrayList<>();
        for (int k = 1; k < args.length; k++) {
            String s = args[k];
            if (!s.startsWith("--")) {
                positional.add(s);
                continue;
            }
            int i = s.indexOf('=');
            if (i > 0) m.put(s.substring(2, i), s.substring(i + 1));
            else m.put(s.substring(2), "true");
        }
        return new Args(args[0], m, positional);
    }

    static String req(Map<String, String> a, String k) {
        String v = a.get(k);
        if (v == null || v.isBlank()) throw new IllegalArgumentException("missing --" + k);
        return v;
    }
}
