package com.junctionvision.core.ocr;

import net.sourceforge.tess4j.ITessAPI;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;
import net.sourceforge.tess4j.Word;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.*;
import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * OCR номера через Tess4J.
 * WORDS - лучший токен по уверенности Tesseract (conf/100);
 * TEXT  - весь текст строки, уверенность фиксированная (Tesseract в этом режиме её не отдаёт).
 * Экземпляр Tesseract не потокобезопасен, поэтому {@link #read} синхронизирован.
 */
public final class TesseractPlateReader implements PlateReader {
    private static final Logger log = LoggerFactory.getLogger(TesseractPlateReader.class);

    public enum Mode { WORDS, TEXT }

    static final double TEXT_MODE_CONFIDENCE = 0.7;
    private static final int MIN_WIDTH = 420;

    private final Tesseract tess;
    private final Mode mode;

    public static final class Config {
        public final String datapath;  // каталог с *.traineddata
        public final String languages; // "eng", "eng+rus"
        public final int psm;          // Page Segmentation Mode
        public final int oem;          // OCR Engine Mode
        public final String whitelist;

        public Config(String datapath, String languages, int psm, int oem, String whitelist) {
            this.datapath = Objects.requireNonNull(datapath, "datapath");
            this.languages = Objects.requireNonNull(languages, "languages");
            this.psm = psm;
            this.oem = oem;
            this.whitelist = whitelist;
        }
    }

    public TesseractPlateReader(Config cfg, Mode mode) {
        // Путь к tessdata: cfg.datapath → ENV TESSDATA_PREFIX
        String dir = cfg.datapath;
        if (dir.isBlank()) dir = System.getenv("TESSDATA_PREFIX");
        Path dp = Path.of(Objects.requireNonNull(dir, "tessdataDir is required"))
                .toAbsolutePath().normalize();
        if (!Files.isDirectory(dp)) {
            throw new IllegalStateException("tessdataDir not found: " + dp);
        }
        Tesseract t = new Tesseract();
        t.setDatapath(dp.toString());
        t.setLanguage(cfg.languages);
        t.setPageSegMode(cfg.psm);
        t.setOcrEngineMode(cfg.oem);
        // узкий алфавит и без словарей: номер - не текст на естественном языке
        if (cfg.whitelist != null && !cfg.whitelist.isBlank()) {
            t.setVariable("tessedit_char_whitelist", cfg.whitelist);
        }
        t.setVariable("load_system_dawg", "F");
        t.setVariable("load_freq_dawg", "F");
        t.setVariable("user_defined_dpi", "300");

        this.tess = t;
        this.mode = Objects.requireNonNull(mode, "mode");
        log.info("OCR: init datapath={} languages={} psm={} oem={} mode={}",
                dp, cfg.languages, cfg.psm, cfg.oem, mode);
    }

    @Override
    public String name() {
        return "tesseract-" + mode.name().toLowerCase(Locale.ROOT);
    }

    @Override
    public synchronized Optional<OcrReading> read(BufferedImage roi) {
        if (roi == null) return Optional.empty();
        BufferedImage prepared = preparedForOcr(roi);
        try {
            return mode == Mode.WORDS ? bestWord(prepared) : wholeText(prepared);
        } catch (TesseractException e) {
            throw new OcrException("tesseract doOCR failed", e);
        } catch (Error | RuntimeException e) {
            // нативная часть (libtesseract) падает как UnsatisfiedLinkError / RuntimeException
            throw new OcrException("tesseract failed: " + e, e);
        }
    }

    private Optional<OcrReading> bestWord(BufferedImage img) {
        List<Word> words = tess.getWords(img, ITessAPI.TessPageIteratorLevel.RIL_WORD);
        String best = null;
        float conf = -1f;
        for (Word w : words) {
            String s = w.getText();
            if (s == null || s.isBlank()) continue;
            if (w.getConfidence() > conf) {
                conf = w.getConfidence();
                best = s.trim();
            }
        }
        return best == null
                ? Optional.empty()
                : Optional.of(new OcrReading(best, conf / 100.0));
    }

    private Optional<OcrReading> wholeText(BufferedImage img) throws TesseractException {
        String raw = tess.doOCR(img);
        if (raw == null) return Optional.empty();
        String norm = raw.replace('\n', ' ').replace('\r', ' ').trim();
        return norm.isEmpty()
                ? Optional.empty()
                : Optional.of(new OcrReading(norm, TEXT_MODE_CONFIDENCE));
    }

    /** Подготовка: серый → апскейл до MIN_WIDTH → Отсу. */
    static BufferedImage preparedForOcr(BufferedImage src) {
        int w = src.getWidth(), h = src.getHeight();
        BufferedImage gray = new BufferedImage(w, h, BufferedImage.TYPE_BYTE_GRAY);
        Graphics2D g0 = gray.createGraphics();
        g0.drawImage(src, 0, 0, null);
        g0.dispose();

        BufferedImage scaled = gray;
        if (w < MIN_WIDTH) {
            int newW = MIN_WIDTH;
            int newH = Math.max(1, (int) Math.round(h * (newW / (double) w)));
            scaled = new BufferedImage(newW, newH, BufferedImage.TYPE_BYTE_GRAY);
            Graphics2D g = scaled.createGraphics();
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.drawImage(gray, 0, 0, newW, newH, null);
            g.dispose();
        }

        int thr = otsuThreshold(scaled);
        int W = scaled.getWidth(), H = scaled.getHeight();
        BufferedImage bin = new BufferedImage(W, H, BufferedImage.TYPE_BYTE_BINARY);
        for (int y = 0; y < H; y++)
            for (int x = 0; x < W; x++) {
                int v = scaled.getRaster().getSample(x, y, 0);
                int b = (v >= thr ? 0xFFFFFF : 0x000000);
                bin.setRGB(x, y, (0xFF << 24) | b);
            }
        return bin;
    }

    static int otsuThreshold(BufferedImage gray) {
        int W = gray.getWidth(), H = gray.getHeight();
        int[] hist = new int[256];
        for (int y = 0; y < H; y++)
            for (int x = 0; x < W; x++) {
                hist[gray.getRaster().getSample(x, y, 0)]++;
            }
        long total = (long) W * H, sum = 0;
        for (int t = 0; t < 256; t++) sum += (long) t * hist[t];
        long sumB = 0, wB = 0;
        double maxVar = -1;
        int thr = 127;
        for (int t = 0; t < 256; t++) {
            wB += hist[t];
            if (wB == 0) continue;
            long wF = total - wB;
            if (wF == 0) break;
            sumB += (long) t * hist[t];
            double mB = sumB / (double) wB;
            double mF = (sum - sumB) / (double) wF;
            double varBetween = (double) wB * wF * (mB - mF) * (mB - mF);
            if (varBetween > maxVar) {
                maxVar = varBetween;
                thr = t;
            }
        }
        return thr;
    }
}
