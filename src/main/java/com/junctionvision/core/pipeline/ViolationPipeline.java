package com.junctionvision.core.pipeline;

import com.junctionvision.core.detection.BoundingBox;
import com.junctionvision.core.detection.CrossingDetector;
import com.junctionvision.core.detection.CrossingEvent;
import com.junctionvision.core.detection.StopLine;
import com.junctionvision.core.detection.TrackObservation;
import com.junctionvision.core.detection.TrackedBox;
import com.junctionvision.core.evidence.EvidenceException;
import com.junctionvision.core.evidence.EvidenceWindow;
import com.junctionvision.core.evidence.EvidenceWriter;
import com.junctionvision.core.fine.FineCalculator;
import com.junctionvision.core.fine.ZoneFactors;
import com.junctionvision.core.ocr.OcrReading;
import com.junctionvision.core.ocr.PlateNormalizer;
import com.junctionvision.core.ocr.PlateReaderChain;
import com.junctionvision.core.profile.ProfileAggregate;
import com.junctionvision.core.profile.ProfileStore;
import com.junctionvision.core.signal.FrameTimeline;
import com.junctionvision.core.tracking.VehicleTracker;
import com.junctionvision.core.video.FrameSource;
import com.junctionvision.core.video.VideoFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Конвейер нарушений: кадр → светофор → трекер → детектор пересечений →
 * (на новом пересечении) OCR, штраф, доказательства, профиль, приёмник.
 *
 * Главный инвариант: не более одной {@link ViolationRecord} на trackId за прогон.
 * Сбои внешних частей (трекер, OCR, запись файлов, профиль, приёмник) не прерывают цикл кадров:
 * подставляется нейтральный результат, ошибка попадает в {@link ViolationOutcome} и {@link RunSummary}.
 *
 * Кадры обрабатываются строго последовательно; экземпляр на один прогон, не потокобезопасен
 * (кроме {@link #stop()}).
 */
public final class ViolationPipeline {
    private static final Logger log = LoggerFactory.getLogger(ViolationPipeline.class);

    public record Settings(StopLine stopLine,
                           String locationId,
                           ZoneFactors zoneFactors,
                           ZoneId timeZone,
                           FineCalculator.Params fine,
                           int historySize,
                           int bufferSeconds,
                           int clipSeconds,
                           int staleTrackFrames,
                           int progressEveryFrames) {
        public Settings {
            Objects.requireNonNull(stopLine, "stopLine");
            Objects.requireNonNull(locationId, "locationId");
            Objects.requireNonNull(timeZone, "timeZone");
            Objects.requireNonNull(fine, "fine");
            if (zoneFactors == null) zoneFactors = ZoneFactors.NONE;
            if (historySize < 2) throw new IllegalArgumentException("historySize must be >= 2, got " + historySize);
            if (bufferSeconds < 1) throw new IllegalArgumentException("bufferSeconds must be >= 1, got " + bufferSeconds);
            if (clipSeconds < 0) throw new IllegalArgumentException("clipSeconds must be >= 0, got " + clipSeconds);
            if (staleTrackFrames < 1) {
                throw new IllegalArgumentException("staleTrackFrames must be >= 1, got " + staleTrackFrames);
            }
            if (progressEveryFrames < 1) {
                throw new IllegalArgumentException("progressEveryFrames must be >= 1, got " + progressEveryFrames);
            }
        }
    }

    /** Колбэк на каждый обработанный кадр (запись выходного видео, прогресс в UI). */
    @FunctionalInterface
    public interface Listener {
        Listener NONE = r -> { };

        void onFrame(FrameResult result);
    }

    private final Settings settings;
    private final FrameTimeline timeline;
    private final VehicleTracker tracker;
    private final PlateReaderChain ocr;
    private final ProfileStore profiles;
    private final EvidenceWriter evidence;
    private final ViolationSink sink;
    private final Supplier<String> ids;

    private final CrossingDetector detector;
    private final EvidenceWindow<BufferedImage> window;
    private final FrameAnnotator annotator = new FrameAnnotator();
    private final long clipHalfFrames;
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);

    private long lastFrameIndex = -1;
    private long frames;
    private int violations;
    private int profileFailures;
    private int sinkFailures;

    public ViolationPipeline(Settings settings, FrameTimeline timeline, VehicleTracker tracker,
                             PlateReaderChain ocr, ProfileStore profiles, EvidenceWriter evidence,
                             ViolationSink sink) {
        this(settings, timeline, tracker, ocr, profiles, evidence, sink, () -> UUID.randomUUID().toString());
    }

    public ViolationPipeline(Settings settings, FrameTimeline timeline, VehicleTracker tracker,
                             PlateReaderChain ocr, ProfileStore profiles, EvidenceWriter evidence,
                             ViolationSink sink, Supplier<String> ids) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.timeline = Objects.requireNonNull(timeline, "timeline");
        this.tracker = Objects.requireNonNull(tracker, "tracker");
        this.ocr = Objects.requireNonNull(ocr, "ocr");
        this.profiles = Objects.requireNonNull(profiles, "profiles");
        this.evidence = Objects.requireNonNull(evidence, "evidence");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.ids = Objects.requireNonNull(ids, "ids");
        this.detector = new CrossingDetector(settings.historySize());
        this.window = EvidenceWindow.forDuration(timeline.fps(), settings.bufferSeconds());
        this.clipHalfFrames = (long) (timeline.fps() * settings.clipSeconds() / 2);
        log.info("Pipeline: location={} stopLine={} thrY={} fps={} window={} frames clipHalf={} frames ocr={}",
                settings.locationId(), settings.stopLine(), settings.stopLine().thresholdY(),
                timeline.fps(), window.capacity(), clipHalfFrames, ocr.isEnabled() ? "on" : "off");
    }

    /** Обработать кадры источника до конца или до {@link #stop()}. */
    public RunSummary run(FrameSource source, Listener listener) throws IOException {
        Listener l = listener == null ? Listener.NONE : listener;
        while (!stopRequested.get()) {
            Optional<VideoFrame> next = source.next();
            if (next.isEmpty()) break;
            l.onFrame(processFrame(next.get()));
        }
        RunSummary s = summary();
        log.info("Processing complete. {}", s);
        return s;
    }

    /** Остановка между кадрами: текущий кадр (и его нарушения) дорабатывается целиком. */
    public void stop() {
        stopRequested.set(true);
    }

    public RunSummary summary() {
        return new RunSummary(frames, violations, profileFailures, sinkFailures, stopRequested.get());
    }

    public FrameResult processFrame(VideoFrame frame) {
        long idx = frame.index();
        if (idx <= lastFrameIndex) {
            throw new IllegalStateException("frames must arrive in increasing order: " + idx + " after " + lastFrameIndex);
        }
        lastFrameIndex = idx;
        frames++;

        Instant ts = timeline.timestampAt(idx);
        boolean isRed = timeline.isRed(ts);
        List<TrackedBox> tracks = trackSafely(frame);

        List<CrossingEvent> crossings = new ArrayList<>();
        for (TrackedBox t : tracks) {
            TrackObservation obs = TrackObservation.of(t, idx);
            detector.observe(obs);
            if (!isRed || detector.isLogged(obs.trackId())) continue;
            if (detector.evaluate(obs.trackId(), obs.centroid(), settings.stopLine(), isRed)
                    && detector.markLogged(obs.trackId())) {
                log.warn("Red-Light Violation detected for ID {} at frame {}.", obs.trackId(), idx);
                crossings.add(CrossingEvent.of(obs));
            }
        }

        Set<Integer> violators = new LinkedHashSet<>();
        for (CrossingEvent c : crossings) violators.add(c.trackId());
        BufferedImage rendered = annotator.render(frame.image(), tracks, violators, settings.stopLine(), isRed);
        // кадр нарушения входит в клип
        window.push(idx, rendered, ts);

        List<ViolationOutcome> outcomes = new ArrayList<>(crossings.size());
        for (CrossingEvent c : crossings) {
            outcomes.add(handleViolation(c, frame.image(), rendered, ts));
        }

        if (idx > 0 && idx % settings.progressEveryFrames() == 0) {
            detector.releaseStale(idx, settings.staleTrackFrames());
            log.info("Processing frame {} (tracks={}, violations={})", idx, detector.trackCount(), violations);
        }
        return new FrameResult(idx, rendered, outcomes);
    }

    private List<TrackedBox> trackSafely(VideoFrame frame) {
        try {
            List<TrackedBox> t = tracker.track(frame.image());
            return t == null ? List.of() : t;
        } catch (RuntimeException e) {
            log.error("Tracker failed on frame {}: {}. Continuing without observations", frame.index(), e.toString());
            return List.of();
        }
    }

    private ViolationOutcome handleViolation(CrossingEvent c, BufferedImage raw, BufferedImage rendered, Instant ts) {
        String violationId = ids.get();

        OcrReading reading = resolvePlate(ocr.read(crop(raw, c.box())));
        String plate = reading.text();

        ProfileAggregate before = null;
        try {
            before = profiles.get(plate).orElse(null);
        } catch (RuntimeException e) {
            log.error("Profile lookup failed for {}: {}. Fine computed without history", plate, e.toString());
        }
        double fine = FineCalculator.compute(before, settings.zoneFactors(),
                LocalDateTime.ofInstant(ts, settings.timeZone()), settings.fine());

        String imagePath;
        try {
            imagePath = evidence.writeSnapshot(rendered, plate, ts);
        } catch (EvidenceException e) {
            log.error("Snapshot for violation {} failed: {}", violationId, e.getMessage());
            imagePath = EvidenceWriter.SNAPSHOT_FAILED;
        }
        String clipPath;
        try {
            List<BufferedImage> clip = window.extractClip(c.frameIndex(), clipHalfFrames);
            clipPath = evidence.writeClip(clip, plate, ts, timeline.fps());
        } catch (EvidenceException e) {
            log.error("Clip for violation {} failed: {}", violationId, e.getMessage());
            clipPath = EvidenceWriter.CLIP_FAILED;
        }

        boolean profileUpdated = false;
        String profileError = null;
        try {
            profiles.upsert(plate, violationId);
            profileUpdated = true;
        } catch (RuntimeException e) {
            profileFailures++;
            profileError = e.getMessage() == null ? e.toString() : e.getMessage();
            log.error("Profile update failed for {} (violation {}): {}", plate, violationId, profileError);
        }

        ViolationRecord record = new ViolationRecord(violationId, c.trackId(), c.frameIndex(), ts,
                settings.locationId(), plate, fine, imagePath, clipPath, reading.confidence());
        boolean submitted;
        try {
            submitted = sink.submit(record);
        } catch (RuntimeException e) {
            log.error("Sink rejected violation {}: {}", violationId, e.toString());
            submitted = false;
        }
        if (submitted) {
            log.info("Violation successfully logged. Plate: {} fine={}", plate, String.format("%.2f", fine));
        } else {
            sinkFailures++;
            log.error("Violation {} for plate {} was not logged", violationId, plate);
        }
        violations++;
        return new ViolationOutcome(record, profileUpdated, submitted, profileError);
    }

    /**
     * Номер для записи: нормализация и обрезка до допустимой длины.
     * Нечитаемый номер - всегда UNKNOWN с уверенностью 0.0.
     */
    static OcrReading resolvePlate(OcrReading reading) {
        if (OcrReading.UNKNOWN_TEXT.equals(reading.text())) return OcrReading.UNKNOWN;
        String p = PlateNormalizer.normalize(reading.text());
        if (p.isEmpty()) return OcrReading.UNKNOWN;
        if (p.length() > ViolationRecord.MAX_PLATE_LENGTH) p = p.substring(0, ViolationRecord.MAX_PLATE_LENGTH);
        return new OcrReading(p, reading.confidence());
    }

    /** Вырез рамки из исходного кадра с обрезкой по границам; null, если пересечение пусто. */
    static BufferedImage crop(BufferedImage frame, BoundingBox b) {
        int x1 = Math.max(0, b.x1()), y1 = Math.max(0, b.y1());
        int x2 = Math.min(frame.getWidth(), b.x2()), y2 = Math.min(frame.getHeight(), b.y2());
        if (x2 <= x1 || y2 <= y1) return null;
        return frame.getSubimage(x1, y1, x2 - x1, y2 - y1);
    }
}
