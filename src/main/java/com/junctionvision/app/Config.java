package com.junctionvision.app;

import org.yaml.snakeyaml.Yaml;

import java.io.InputStream;
import java.time.ZoneId;
import java.util.Map;


public record Config(Db db, Location location, Fine fine, Pipeline pipeline,
                     Ocr ocr, Tracker tracker, Output output, Sink sink) {
    public record Db(String url, String user, String pass) {}
    public record Location(String id, boolean schoolZone, ZoneId zone) {}
    public record Fine(double baseFine, double repeatMultiplier, double schoolZoneFactor,
                       int nightHourStart, int nightHourEnd, double nightFactor) {}
    public record Pipeline(int historySize, int bufferSeconds, int clipSeconds,
                           int staleTrackFrames, int progressEveryFrames) {}
    public record Ocr(boolean enabled, String datapath, String languages, int psm, int oem, String whitelist) {}
    public record Tracker(int minArea, int maxDistance, int maxMissedFrames, int history, double varThreshold) {}
    public record Output(String images, String clips) {}
    public record Sink(String mode) {}

    public static Config load() {
        try (InputStream in = Config.class.getResourceAsStream("/application.yaml")) {
            if (in == null) {
                throw new IllegalStateException("application.yaml not found on classpath");
            }
            Yaml yaml = new Yaml();
            Map<String, Object> root = yaml.load(in);
            return parse(root == null ? Map.of() : root);
        } catch (Exception e) {
            throw new RuntimeException("Failed to load application.yaml", e);
        }
    }

    /** Разбор уже загруженного YAML-дерева. Отсутствующие ключи → значения по умолчанию. */
    @SuppressWarnings("unchecked")
    public static Config parse(Map<String, Object> root) {
        Map<String, Object> db  = (Map<String, Object>) root.getOrDefault("db", Map.of());
        Map<String, Object> loc = (Map<String, Object>) root.getOrDefault("location", Map.of());
        Map<String, Object> fn  = (Map<String, Object>) root.getOrDefault("fine", Map.of());
        Map<String, Object> pl  = (Map<String, Object>) root.getOrDefault("pipeline", Map.of());
        Map<String, Object> ocr = (Map<String, Object>) root.getOrDefault("ocr", Map.of());
        Map<String, Object> tr  = (Map<String, Object>) root.getOrDefault("tracker", Map.of());
        Map<String, Object> out = (Map<String, Object>) root.getOrDefault("output", Map.of());
        Map<String, Object> snk = (Map<String, Object>) root.getOrDefault("sink", Map.of());

        // -Djv.* приоритетнее YAML
        double baseFine      = dblProp("jv.fine.base", dbl(fn, "baseFine", 100.0));
        double repeatMult    = dblProp("jv.fine.repeatMultiplier", dbl(fn, "repeatMultiplier", 1.5));
        double schoolFactor  = dblProp("jv.fine.schoolZoneFactor", dbl(fn, "schoolZoneFactor", 2.0));
        int nightStart       = Integer.getInteger("jv.fine.nightStart", integer(fn, "nightHourStart", 22));
        int nightEnd         = Integer.getInteger("jv.fine.nightEnd", integer(fn, "nightHourEnd", 6));
        double nightFactor   = dblProp("jv.fine.nightFactor", dbl(fn, "nightFactor", 1.2));

        String zoneStr = System.getProperty("jv.zone", str(loc, "zone", ""));
        ZoneId zone = zoneStr.isBlank() ? ZoneId.systemDefault() : ZoneId.of(zoneStr);

        return new Config(
                new Db(str(db, "url", null), str(db, "user", null), str(db, "pass", null)),
                new Location(
                        System.getProperty("jv.location", str(loc, "id", "DEFAULT_LOCATION_000")),
                        bool(loc, "schoolZone", false),
                        zone),
                new Fine(baseFine, repeatMult, schoolFactor, nightStart, nightEnd, nightFactor),
                new Pipeline(
                        Math.max(2, integer(pl, "historySize", 5)),
                        Math.max(1, integer(pl, "bufferSeconds", 10)),
                        Math.max(0, integer(pl, "clipSeconds", 3)),
                        Math.max(1, integer(pl, "staleTrackFrames", 150)),
                        Math.max(1, integer(pl, "progressEveryFrames", 100))),
                new Ocr(
                        Boolean.parseBoolean(System.getProperty("jv.ocr.enabled",
                                String.valueOf(bool(ocr, "enabled", true)))),
                        System.getProperty("jv.ocr.tessdataDir", str(ocr, "datapath", "./tessdata")),
                        System.getProperty("jv.ocr.lang", str(ocr, "languages", "eng")),
                        Integer.getInteger("jv.ocr.psm", integer(ocr, "psm", 7)),
                        Integer.getInteger("jv.ocr.oem", integer(ocr, "oem", 1)),
                        System.getProperty("jv.ocr.whitelist",
                                str(ocr, "whitelist", "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZ"))),
                new Tracker(
                        integer(tr, "minArea", 1500),
                        integer(tr, "maxDistance", 80),
                        integer(tr, "maxMissedFrames", 15),
                        integer(tr, "history", 500),
                        dbl(tr, "varThreshold", 16.0)),
                new Output(str(out, "images", "output/images"), str(out, "clips", "output/clips")),
                new Sink(System.getProperty("jv.sink", str(snk, "mode", "db")))
        );
    }

    private static int integer(Map<String, Object> m, String key, int def) {
        Object v = m.get(key);
        return v != null ? ((Number) v).intValue() : def;
    }

    private static double dbl(Map<String, Object> m, String key, double def) {
        Object v = m.get(key);
        return v != null ? ((Number) v).doubleValue() : def;
    }

    private static boolean bool(Map<String, Object> m, String key, boolean def) {
        Object v = m.get(key);
        return v != null ? (Boolean) v : def;
    }

    private static String str(Map<String, Object> m, String key, String def) {
        Object v = m.get(key);
        return v != null ? v.toString() : def;
    }

    private static double dblProp(String name, double def) {
        String v = System.getProperty(name);
        return v == null || v.isBlank() ? def : Double.parseDouble(v);
    }
}
