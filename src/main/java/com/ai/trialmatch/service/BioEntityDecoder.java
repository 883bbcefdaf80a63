package com.ai.trialmatch.service;

import com.ai.trialmatch.model.ExtractedEntities;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rebuilds entity spans from per-word BIO labels such as {@code B-LOCATION}, {@code I-LOCATION}, {@code O}.
 * An {@code I-} word extends the open span only when its type matches; a later span of the same
 * type replaces an earlier one.
 */
public class BioEntityDecoder {

    enum EntityType {
        CANCER_TYPE,
        LOCATION,
        AGE,
        SEX
    }

    private static final Pattern DIGITS = Pattern.compile("\\d{1,3}");

    public ExtractedEntities decode(List<String> words, List<String> labels) {
        Map<EntityType, String> found = new EnumMap<>(EntityType.class);
        EntityType current = null;
        List<String> span = new ArrayList<>();

        for (int i = 0; i < words.size() && i < labels.size(); i++) {
            String word = words.get(i);
            String label = StringUtils.defaultString(labels.get(i)).toUpperCase(Locale.ROOT);

            if (label.startsWith("B-")) {
                flush(found, current, span);
                current = typeOf(label.substring(2));
                span = new ArrayList<>();
                if (current != null) span.add(word);
            } else if (label.startsWith("I-") && current != null) {
                if (current == typeOf(label.substring(2))) {
                    span.add(word);
                }
            } else {
                flush(found, current, span);
                current = null;
                span = new ArrayList<>();
            }
        }
        flush(found, current, span);

        return ExtractedEntities.builder()
                .cancerType(found.get(EntityType.CANCER_TYPE))
                .location(found.get(EntityType.LOCATION))
                .age(parseAge(found.get(EntityType.AGE)))
                .sex(normalizeSex(found.get(EntityType.SEX)))
                .build();
    }

    private static void flush(Map<EntityType, String> found, EntityType type, List<String> span) {
        if (type == null || span.isEmpty()) return;
        String text = StringUtils.strip(String.join(" ", span), " ,.;:!?");
        if (StringUtils.isNotBlank(text)) {
            found.put(type, text);
        }
    }

    private static EntityType typeOf(String name) {
        try {
            return EntityType.valueOf(name);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    static Integer parseAge(String raw) {
        if (raw == null) return null;
        Matcher m = DIGITS.matcher(raw);
        return m.find() ? Integer.valueOf(m.group()) : null;
    }

    static String normalizeSex(String raw) {
        if (StringUtils.isBlank(raw)) return null;
        String s = raw.trim().toLowerCase(Locale.ROOT);
        switch (s) {
            case "m":
            case "man":
            case "men":
            case "male":
                return "male";
            case "f":
            case "woman":
            case "women":
            case "female":
                return "female";
            default:
                return s;
        }
    }
}
