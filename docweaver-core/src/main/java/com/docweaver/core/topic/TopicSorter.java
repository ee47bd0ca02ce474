package com.docweaver.core.topic;

import com.docweaver.core.util.FileUtils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Orders topics for display.
 *
 * <p>Topics named in the explicit order come first, in that order. Entries are relative
 * paths with or without extension, e.g. {@code getting-started.md} or
 * {@code guides/advanced}, compared case-insensitively. The remaining topics follow,
 * sorted by title ignoring case.
 */
public final class TopicSorter {

    private static final Comparator<FileTopic> BY_TITLE =
        Comparator.comparing(FileTopic::title, String.CASE_INSENSITIVE_ORDER);

    private TopicSorter() {
        // Utility class
    }

    /**
     * Sorts topics.
     *
     * @param topics topics in discovery order
     * @param explicitOrder relative paths of topics to place first, possibly empty
     * @return sorted topics
     */
    public static List<FileTopic> sort(List<FileTopic> topics, List<String> explicitOrder) {
        Objects.requireNonNull(topics, "topics must not be null");
        Objects.requireNonNull(explicitOrder, "explicitOrder must not be null");

        List<FileTopic> remaining = new ArrayList<>(topics);
        List<FileTopic> ordered = new ArrayList<>();
        for (String entry : explicitOrder) {
            if (entry == null || entry.isBlank()) {
                continue;
            }
            String wanted = normalize(entry);
            Iterator<FileTopic> candidates = remaining.iterator();
            while (candidates.hasNext()) {
                FileTopic topic = candidates.next();
                if (matches(topic, wanted)) {
                    ordered.add(topic);
                    candidates.remove();
                    break;
                }
            }
        }

        remaining.sort(BY_TITLE);
        ordered.addAll(remaining);
        return ordered;
    }

    private static boolean matches(FileTopic topic, String wanted) {
        if (topic.id().equalsIgnoreCase(wanted)) {
            return true;
        }
        return topic.id().equalsIgnoreCase(FileUtils.removeExtension(wanted));
    }

    private static String normalize(String entry) {
        String path = entry.trim().replace('\\', '/');
        while (path.startsWith("./")) {
            path = path.substring(2);
        }
        return path;
    }
}
