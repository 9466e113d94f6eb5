package com.williamcallahan.citations.service.citation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Character trie over every search variant of a rewrite pass, so the body is walked once
 * regardless of how many citations are being located.
 */
final class VariantTrie {

    private static final class Node {
        private final Map<Character, Node> children = new HashMap<>();
        private String variant;
    }

    private final Node root = new Node();

    VariantTrie(Collection<String> variants) {
        for (String variant : variants) {
            if (variant != null && !variant.isEmpty()) {
                insert(variant);
            }
        }
    }

    private void insert(String variant) {
        Node node = root;
        for (int index = 0; index < variant.length(); index++) {
            node = node.children.computeIfAbsent(variant.charAt(index), key -> new Node());
        }
        node.variant = variant;
    }

    /**
     * Finds every occurrence of every variant, overlapping ones included.
     *
     * @param text text to scan
     * @return start offsets per variant, ascending; variants that never occur are absent
     */
    Map<String, List<Integer>> findOccurrences(String text) {
        Map<String, List<Integer>> occurrences = new HashMap<>();
        for (int start = 0; start < text.length(); start++) {
            Node node = root;
            for (int cursor = start; cursor < text.length(); cursor++) {
                node = node.children.get(text.charAt(cursor));
                if (node == null) {
                    break;
                }
                if (node.variant != null) {
                    occurrences.computeIfAbsent(node.variant, key -> new ArrayList<>()).add(start);
                }
            }
        }
        return occurrences;
    }
}
