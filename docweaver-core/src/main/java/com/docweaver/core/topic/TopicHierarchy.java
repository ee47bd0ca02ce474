package com.docweaver.core.topic;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Strategy deriving a topic tree from the layout of topic files.
 *
 * <p>Each strategy assigns at most one parent to every topic; parents are always
 * "shorter" than their children, so the result is a forest. Ids are compared
 * case-insensitively. Siblings keep the order of the sorted input.
 */
public enum TopicHierarchy {

    /** All topics are top-level. */
    NONE {
        @Override
        String parentOf(FileTopic topic, Map<String, FileTopic> byId) {
            return null;
        }
    },

    /**
     * A file named like a directory parents the files in that directory, e.g.
     * {@code guides.md} parents {@code guides/install.md}. Without such a file the
     * nearest enclosing directory with one is used.
     */
    DIRECTORY {
        @Override
        String parentOf(FileTopic topic, Map<String, FileTopic> byId) {
            String directory = topic.directory();
            while (!directory.isEmpty()) {
                if (byId.containsKey(key(directory))) {
                    return key(directory);
                }
                directory = parent(directory);
            }
            return null;
        }
    },

    /**
     * A file named {@code overview} parents the other files in its directory and the
     * overview files of its subdirectories. Files of a directory without an overview
     * attach to the nearest enclosing one.
     */
    INDEX {
        @Override
        String parentOf(FileTopic topic, Map<String, FileTopic> byId) {
            String directory = topic.directory();
            if (topic.fileName().equalsIgnoreCase(INDEX_NAME)) {
                if (directory.isEmpty()) {
                    return null;
                }
                directory = parent(directory);
            }
            while (true) {
                String candidate = key(directory.isEmpty() ? INDEX_NAME : directory + "/" + INDEX_NAME);
                if (byId.containsKey(candidate) && !candidate.equals(key(topic.id()))) {
                    return candidate;
                }
                if (directory.isEmpty()) {
                    return null;
                }
                directory = parent(directory);
            }
        }
    },

    /**
     * A file whose name extends another file's name by dot-separated parts is its child,
     * e.g. {@code setup.linux.md} is a child of {@code setup.md}. The nearest existing
     * prefix in the same directory wins.
     */
    PREFIX {
        @Override
        String parentOf(FileTopic topic, Map<String, FileTopic> byId) {
            String directory = topic.directory();
            String name = topic.fileName();
            int dot = name.lastIndexOf('.');
            while (dot > 0) {
                name = name.substring(0, dot);
                String candidate = key(directory.isEmpty() ? name : directory + "/" + name);
                if (byId.containsKey(candidate)) {
                    return candidate;
                }
                dot = name.lastIndexOf('.');
            }
            return null;
        }
    };

    private static final String INDEX_NAME = "overview";

    /**
     * Returns the key of the parent of {@code topic}, or null for a top-level topic.
     */
    abstract String parentOf(FileTopic topic, Map<String, FileTopic> byId);

    /**
     * Arranges sorted topics into a tree.
     *
     * @param topics topics in display order
     * @return top-level topics in display order
     */
    public List<TopicNode> arrange(List<FileTopic> topics) {
        Map<String, FileTopic> byId = new LinkedHashMap<>();
        for (FileTopic topic : topics) {
            byId.putIfAbsent(key(topic.id()), topic);
        }

        Map<String, List<FileTopic>> children = new HashMap<>();
        List<FileTopic> roots = new ArrayList<>();
        for (FileTopic topic : byId.values()) {
            String parent = parentOf(topic, byId);
            if (parent == null) {
                roots.add(topic);
            } else {
                children.computeIfAbsent(parent, k -> new ArrayList<>()).add(topic);
            }
        }

        List<TopicNode> nodes = new ArrayList<>();
        for (FileTopic root : roots) {
            nodes.add(toNode(root, children));
        }
        return nodes;
    }

    private static TopicNode toNode(FileTopic topic, Map<String, List<FileTopic>> children) {
        List<TopicNode> subtopics = new ArrayList<>();
        for (FileTopic child : children.getOrDefault(key(topic.id()), List.of())) {
            subtopics.add(toNode(child, children));
        }
        return new TopicNode(topic, subtopics);
    }

    private static String key(String id) {
        return id.toLowerCase(Locale.ROOT);
    }

    private static String parent(String directory) {
        int slash = directory.lastIndexOf('/');
        return slash >= 0 ? directory.substring(0, slash) : "";
    }

    /**
     * A topic with its arranged subtopics.
     *
     * @param topic the topic
     * @param subtopics child nodes in display order
     */
    public record TopicNode(FileTopic topic, List<TopicNode> subtopics) {
        /**
         * Compact constructor copying the children.
         */
        public TopicNode {
            subtopics = List.copyOf(subtopics);
        }
    }
}
