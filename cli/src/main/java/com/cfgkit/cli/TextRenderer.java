package com.cfgkit.cli;

import com.cfgkit.core.cnf.CnfGrammar;
import com.cfgkit.core.cnf.Provenance;
import com.cfgkit.core.grammar.Grammar.NT;
import com.cfgkit.core.tree.DerivationTree;
import com.cfgkit.core.tree.DerivationTree.Node;
import java.util.List;

/** Plain-text rendering of trees, string lists and normalized grammars. */
final class TextRenderer {

    private static final String EPSILON = "ε";

    private TextRenderer() {}

    /**
     * One line per node, two spaces of indentation per level. A nonterminal with a single terminal
     * child is folded into {@code A -> a}; an epsilon node prints as {@code A -> ε}.
     */
    static String tree(DerivationTree tree) {
        StringBuilder sb = new StringBuilder();
        appendNode(sb, tree.root, 0);
        return sb.toString();
    }

    private static void appendNode(StringBuilder sb, Node node, int depth) {
        String pad = "  ".repeat(depth);
        if (node.isLeaf()) {
            sb.append(pad).append(node.symbol.name()).append('\n');
        } else if (node.children.isEmpty()) {
            sb.append(pad).append(node.symbol.name()).append(" -> ").append(EPSILON).append('\n');
        } else if (node.children.size() == 1 && node.children.get(0).isLeaf()) {
            sb.append(pad)
                    .append(node.symbol.name())
                    .append(" -> ")
                    .append(node.children.get(0).symbol.name())
                    .append('\n');
        } else {
            sb.append(pad).append(node.symbol.name()).append('\n');
            for (Node child : node.children) {
                appendNode(sb, child, depth + 1);
            }
        }
    }

    static String strings(List<String> strings) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < strings.size(); i++) {
            String text = strings.get(i).isEmpty() ? EPSILON : strings.get(i);
            sb.append(i + 1).append(". '").append(text).append("'\n");
        }
        return sb.toString();
    }

    static String normalized(CnfGrammar grammar) {
        StringBuilder sb = new StringBuilder(grammar.toString()).append('\n');
        Provenance provenance = grammar.provenance();
        if (!provenance.syntheticSymbols().isEmpty()) {
            sb.append("Helpers:\n");
            for (NT nt : provenance.syntheticSymbols().keySet()) {
                sb.append("  ").append(provenance.synthetic(nt).orElseThrow()).append('\n');
            }
        }
        return sb.toString();
    }
}
