package com.raditha.approx.search;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The subset lattice of the modifiable lines, arranged as a tree and stored as an arena
 * keyed by each node's sorted modification list.
 * <p>
 * The parent of a set is the set without its largest element, so the children of
 * {@code S} are {@code S + {x}} for every modifiable {@code x > max(S)}. Nodes are kept in
 * breadth-first order: by level, then lexicographically.
 */
public class VariantTree {

    /**
     * Keeps the eagerly built lattice within memory.
     */
    public static final int MAX_MODIFIABLE_LINES = 24;

    private final List<Integer> modifiableLines;
    private final Map<List<Integer>, TreeNode> nodes = new LinkedHashMap<>();

    private VariantTree(List<Integer> modifiableLines) {
        this.modifiableLines = modifiableLines.stream().sorted().distinct().toList();
    }

    public static VariantTree build(List<Integer> modifiableLines) {
        if (modifiableLines.size() > MAX_MODIFIABLE_LINES) {
            throw new IllegalArgumentException("Too many modifiable lines for a pruning tree: "
                    + modifiableLines.size() + " (maximum " + MAX_MODIFIABLE_LINES + ")");
        }
        VariantTree tree = new VariantTree(modifiableLines);
        Deque<List<Integer>> queue = new ArrayDeque<>();
        queue.add(List.of());
        while (!queue.isEmpty()) {
            List<Integer> key = queue.poll();
            tree.nodes.put(key, new TreeNode(key));
            queue.addAll(tree.childKeys(key));
        }
        return tree;
    }

    public TreeNode root() {
        return nodes.get(List.of());
    }

    public TreeNode node(List<Integer> key) {
        TreeNode node = nodes.get(key);
        if (node == null) {
            throw new IllegalArgumentException("No node for " + key);
        }
        return node;
    }

    public List<TreeNode> children(List<Integer> key) {
        return childKeys(key).stream().map(nodes::get).toList();
    }

    public Optional<TreeNode> parent(List<Integer> key) {
        if (key.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(nodes.get(key.subList(0, key.size() - 1)));
    }

    /**
     * All nodes below {@code key}, breadth first.
     */
    public List<TreeNode> descendants(List<Integer> key) {
        List<TreeNode> result = new ArrayList<>();
        Deque<List<Integer>> queue = new ArrayDeque<>(childKeys(key));
        while (!queue.isEmpty()) {
            List<Integer> next = queue.poll();
            result.add(nodes.get(next));
            queue.addAll(childKeys(next));
        }
        return result;
    }

    /**
     * Mark every still-pending node below {@code key} as pruned.
     *
     * @return how many nodes were marked
     */
    public int pruneDescendants(List<Integer> key, String reason) {
        int pruned = 0;
        for (TreeNode node : descendants(key)) {
            if (node.getStatus() == NodeStatus.PENDING) {
                node.setStatus(NodeStatus.PRUNED);
                node.setReason(reason);
                pruned++;
            }
        }
        return pruned;
    }

    public List<TreeNode> level(int level) {
        return nodes.values().stream().filter(n -> n.getLevel() == level).toList();
    }

    public List<TreeNode> nodes() {
        return List.copyOf(nodes.values());
    }

    public int size() {
        return nodes.size();
    }

    public List<Integer> getModifiableLines() {
        return modifiableLines;
    }

    public Map<NodeStatus, Integer> countByStatus() {
        Map<NodeStatus, Integer> counts = new EnumMap<>(NodeStatus.class);
        for (NodeStatus status : NodeStatus.values()) {
            counts.put(status, 0);
        }
        nodes.values().forEach(n -> counts.merge(n.getStatus(), 1, Integer::sum));
        return counts;
    }

    private List<List<Integer>> childKeys(List<Integer> key) {
        int max = key.isEmpty() ? Integer.MIN_VALUE : key.get(key.size() - 1);
        List<List<Integer>> children = new ArrayList<>();
        for (Integer line : modifiableLines) {
            if (line > max) {
                List<Integer> child = new ArrayList<>(key);
                child.add(line);
                children.add(List.copyOf(child));
            }
        }
        return children;
    }
}
