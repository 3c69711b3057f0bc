package com.junctionvision.core.signal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;

/**
 * Загрузка интервалов красного сигнала из JSON:
 * <pre>{"red_intervals": [{"start": "2024-05-01T08:00:00", "end": "2024-05-01T08:00:30"}]}</pre>
 * Верхнеуровневый список интервалов тоже принимается.
 * JSON читаем через SnakeYAML (JSON - подмножество YAML).
 *
 * Любая ошибка (нет файла, битый документ, нет поля, end &lt; start) → пустой список:
 * прогон тогда считает сигнал всегда зелёным, если не включён forceRed.
 */
public final class SignalIntervals {
    private static final Logger log = LoggerFactory.getLogger(SignalIntervals.class);

    private SignalIntervals() {
    }

    public static List<RedInterval> load(Path json, ZoneId zone) {
        if (json == null) return List.of();
        try (Reader r = Files.newBufferedReader(json, StandardCharsets.UTF_8)) {
            Object root = new Yaml().load(r);
            List<RedInterval> intervals = parse(root, zone);
            log.info("Loaded {} red light intervals from {}.", intervals.size(), json);
            return intervals;
        } catch (NoSuchFileException e) {
            log.error("Signal timestamps file not found at: {}", json);
        } catch (IOException e) {
            log.error("Cannot read signal timestamps {}: {}", json, e.toString());
        } catch (RuntimeException e) {
            // YAMLException, ClassCastException, DateTimeParseException, IllegalArgumentException
            log.error("Signal timestamps JSON failed validation ({}): {}", json, e.getMessage());
        }
        return List.of();
    }

    /** Разбор уже загруженного дерева. Бросает RuntimeException на любом нарушении формата. */
    @SuppressWarnings("unchecked")
    static List<RedInterval> parse(Object root, ZoneId zone) {
        List<Object> raw;
        if (root instanceof Map<?, ?> m) {
            Object v = m.get("red_intervals");
            if (!(v instanceof List<?>)) {
                throw new IllegalArgumentException("red_intervals: list expected");
            }
            raw = (List<Object>) v;
        } else if (root instanceof List<?> l) {
            raw = (List<Object>) l;
        } else {
            throw new IllegalArgumentException("document must be an object or a list");
        }
        List<RedInterval> out = new ArrayList<>(raw.size());
        for (Object item : raw) {
            if (!(item instanceof Map<?, ?> iv)) {
                throw new IllegalArgumentException("interval must be an object: " + item);
            }
            out.add(new RedInterval(toInstant(iv.get("start"), "start", zone), toInstant(iv.get("end"), "end", zone)));
        }
        return List.copyOf(out);
    }

    static Instant toInstant(Object v, String field, ZoneId zone) {
        if (v == null) throw new IllegalArgumentException(field + ": required");
        // SnakeYAML сам превращает нецитированные YAML-таймстемпы в Date
        if (v instanceof Date d) return d.toInstant();
        String s = v.toString().trim();
        try {
            return OffsetDateTime.parse(s).toInstant();
        } catch (DateTimeParseException e) {
            // без смещения → локальное время в зоне перекрёстка
            return LocalDateTime.parse(s).atZone(zone).toInstant();
        }
    }
}
