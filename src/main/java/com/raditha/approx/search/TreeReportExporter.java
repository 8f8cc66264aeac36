package com.raditha.approx.search;

import com.raditha.approx.hashing.CanonicalHasher;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Writes a finished tree as an indented text report and as a Graphviz digraph.
 */
public class TreeReportExporter {

    private static final Map<NodeStatus, String> COLORS = Map.of(
            NodeStatus.COMPLETED, "lightgreen",
            NodeStatus.PRUNED, "lightcoral",
            NodeStatus.FAILED, "orangered",
            NodeStatus.PENDING, "lightblue",
            NodeStatus.SIMULATING, "yellow");

    public Path exportText(VariantTree tree, Path target) throws IOException {
        Files.createDirectories(target.toAbsolutePath().getParent());
        Files.writeString(target, renderText(tree), StandardCharsets.UTF_8);
        return target;
    }

    public Path exportDot(VariantTree tree, Path target) throws IOException {
        Files.createDirectories(target.toAbsolutePath().getParent());
        Files.writeString(target, renderDot(tree), StandardCharsets.UTF_8);
        return target;
    }

    public String renderText(VariantTree tree) {
        StringBuilder out = new StringBuilder();
        Map<NodeStatus, Integer> counts = tree.countByStatus();
        out.append(String.format("Pruning tree: %d nodes (completed=%d, pruned=%d, failed=%d, pending=%d)\n",
                tree.size(), counts.get(NodeStatus.COMPLETED), counts.get(NodeStatus.PRUNED),
                counts.get(NodeStatus.FAILED), counts.get(NodeStatus.PENDING)));
        TreeNode root = tree.root();
        out.append(describe(root)).append('\n');
        appendChildren(tree, root, "", out);
        return out.toString();
    }

    private void appendChildren(VariantTree tree, TreeNode parent, String indent, StringBuilder out) {
        List<TreeNode> children = tree.children(parent.getModifications());
        for (int i = 0; i < children.size(); i++) {
            TreeNode child = children.get(i);
            boolean last = i == children.size() - 1;
            out.append(indent).append(last ? "└── " : "├── ").append(describe(child))
                    .append('\n');
            appendChildren(tree, child, indent + (last ? "    " : "│   "), out);
        }
    }

    String describe(TreeNode node) {
        StringBuilder line = new StringBuilder(node.getName())
                .append(" [status=").append(node.getStatus())
                .append(", error=").append(format(node.getError()))
                .append(", energy=").append(format(node.getEnergy()))
                .append(", cost=").append(format(node.getCost()))
                .append(", hash=").append(CanonicalHasher.shortHash(node.getIdentityHash()));
        if (node.getReason() != null) {
            line.append(", reason=").append(node.getReason());
        }
        return line.append(']').toString();
    }

    public String renderDot(VariantTree tree) {
        StringBuilder out = new StringBuilder("digraph PruningTree {\n");
        out.append("    node [shape=box, style=filled, fontname=\"Helvetica\"];\n");
        for (TreeNode node : tree.nodes()) {
            out.append(String.format("    \"%s\" [label=\"%s\\n%s\\nerror=%s\\nenergy=%s\\ncost=%s\", fillcolor=%s];\n",
                    node.getName(), node.getName(), node.getStatus(), format(node.getError()),
                    format(node.getEnergy()), format(node.getCost()), COLORS.get(node.getStatus())));
        }
        for (TreeNode node : tree.nodes()) {
            for (TreeNode child : tree.children(node.getModifications())) {
                out.append(String.format("    \"%s\" -> \"%s\";\n", node.getName(), child.getName()));
            }
        }
        return out.append("}\n").toString();
    }

    private static String format(Double value) {
        return value == null ? "-" : String.format(Locale.ROOT, "%.4f", value);
    }
}
