package com.cfgkit.core.tree;

import com.cfgkit.core.cnf.CnfGrammar;
import com.cfgkit.core.cnf.ConversionException;
import com.cfgkit.core.cnf.DerivationTemplate;
import com.cfgkit.core.cnf.DerivationTemplate.Expansion;
import com.cfgkit.core.cnf.DerivationTemplate.Hole;
import com.cfgkit.core.cnf.Provenance;
import com.cfgkit.core.cyk.Backpointer;
import com.cfgkit.core.cyk.CykTable;
import com.cfgkit.core.grammar.Grammar.NT;
import com.cfgkit.core.grammar.Grammar.Production;
import com.cfgkit.core.tree.DerivationTree.Node;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Reads one derivation out of a filled {@link CykTable} and maps it back onto the original
 * grammar.
 *
 * <p>Each CNF node produces a forest: the subtrees of its right-hand side are substituted into the
 * {@link DerivationTemplate}s recorded for its production. Start, binarization and terminal-proxy
 * helpers carry bare holes and so vanish into their parent, unit chains re-expand into their
 * intermediate nodes, and nullable symbols removed during normalization come back as epsilon
 * subtrees.
 */
public final class TreeReconstructor {

    private static final class Frame {
        final NT symbol;
        final int start;
        final int length;
        boolean expanded;

        Frame(NT symbol, int start, int length) {
            this.symbol = symbol;
            this.start = start;
            this.length = length;
        }
    }

    /** Tree for the whole input; the table must have accepted it. */
    public DerivationTree reconstruct(CykTable table) {
        if (!table.accepted()) {
            throw new IllegalArgumentException("input was not accepted");
        }
        CnfGrammar grammar = table.grammar();
        List<Node> forest;
        if (table.size() == 0) {
            Production epsilon = grammar.epsilonProduction().orElseThrow();
            forest = instantiate(grammar.provenance().templates(epsilon), List.of(), 0);
        } else {
            forest = reconstruct(table, grammar.start(), 0, table.size());
        }
        if (forest.size() != 1) {
            throw new ConversionException("start symbol expanded to " + forest.size() + " roots");
        }
        return new DerivationTree(forest.get(0));
    }

    /**
     * Forest derived by {@code symbol} over the given span. Original nonterminals yield a single
     * node; binarization helpers yield the sequence of siblings they stand for.
     */
    public List<Node> reconstruct(CykTable table, NT symbol, int start, int length) {
        Provenance provenance = table.grammar().provenance();
        Deque<Frame> stack = new ArrayDeque<>();
        Deque<List<Node>> results = new ArrayDeque<>();
        stack.push(new Frame(symbol, start, length));
        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            Backpointer backpointer =
                    table.backpointer(frame.symbol, frame.start, frame.length)
                            .orElseThrow(
                                    () ->
                                            new IllegalArgumentException(
                                                    frame.symbol.name()
                                                            + " does not derive span ("
                                                            + frame.start
                                                            + ", "
                                                            + frame.length
                                                            + ")"));
            List<DerivationTemplate> templates = provenance.templates(backpointer.production());
            if (backpointer instanceof Backpointer.Leaf leaf) {
                Node token = Node.leaf(leaf.terminal(), frame.start);
                results.push(instantiate(templates, List.of(token), frame.start));
            } else if (!frame.expanded) {
                Backpointer.Split split = (Backpointer.Split) backpointer;
                frame.expanded = true;
                stack.push(frame);
                stack.push(new Frame(split.right(), frame.start + split.k(), frame.length - split.k()));
                stack.push(new Frame(split.left(), frame.start, split.k()));
            } else {
                List<Node> right = results.pop();
                List<Node> left = results.pop();
                List<Node> fillers = new ArrayList<>(left.size() + right.size());
                fillers.addAll(left);
                fillers.addAll(right);
                results.push(instantiate(templates, fillers, frame.start));
            }
        }
        return results.pop();
    }

    private static List<Node> instantiate(
            List<DerivationTemplate> templates, List<Node> fillers, int start) {
        int holes = 0;
        for (DerivationTemplate template : templates) {
            holes += DerivationTemplate.holeCount(template);
        }
        if (holes != fillers.size()) {
            throw new ConversionException(
                    "template expects " + holes + " subtrees but " + fillers.size() + " were derived");
        }
        int[] cursor = {start};
        List<Node> forest = new ArrayList<>(templates.size());
        for (DerivationTemplate template : templates) {
            forest.add(instantiate(template, fillers, cursor));
        }
        return forest;
    }

    private static Node instantiate(DerivationTemplate template, List<Node> fillers, int[] cursor) {
        if (template instanceof Hole hole) {
            Node filler = fillers.get(hole.position());
            cursor[0] = filler.end();
            return filler;
        }
        Expansion expansion = (Expansion) template;
        int begin = cursor[0];
        List<Node> children = new ArrayList<>(expansion.children().size());
        for (DerivationTemplate child : expansion.children()) {
            children.add(instantiate(child, fillers, cursor));
        }
        return new Node(expansion.symbol(), expansion.production(), begin, cursor[0] - begin, children);
    }
}
