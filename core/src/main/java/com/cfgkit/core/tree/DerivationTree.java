package com.cfgkit.core.tree;

import com.cfgkit.core.grammar.Grammar.NT;
import com.cfgkit.core.grammar.Grammar.Production;
import com.cfgkit.core.grammar.Grammar.Symbol;
import com.cfgkit.core.grammar.Grammar.T;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.ListIterator;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Immutable derivation tree. Internal nodes are nonterminals expanded by a production of the
 * original grammar; leaves are the matched terminals. Every node records the input span it covers.
 */
public final class DerivationTree {

    public static final class Node {
        public final Symbol symbol;
        public final Production production;
        public final int start;
        public final int length;
        public final List<Node> children;

        public Node(Symbol symbol, Production production, int start, int length, List<Node> children) {
            this.symbol = Objects.requireNonNull(symbol, "symbol");
            this.production = production;
            this.start = start;
            this.length = length;
            this.children = List.copyOf(children);
            if (symbol instanceof NT && production == null) {
                throw new IllegalArgumentException("nonterminal node needs a production: " + symbol);
            }
        }

        public static Node leaf(T terminal, int position) {
            return new Node(terminal, null, position, 1, List.of());
        }

        public boolean isLeaf() {
            return symbol instanceof T;
        }

        public int end() {
            return start + length;
        }

        public List<Node> preOrder() {
            List<Node> result = new ArrayList<>();
            Deque<Node> stack = new ArrayDeque<>();
            stack.push(this);
            while (!stack.isEmpty()) {
                Node current = stack.pop();
                result.add(current);
                ListIterator<Node> iterator = current.children.listIterator(current.children.size());
                while (iterator.hasPrevious()) {
                    stack.push(iterator.previous());
                }
            }
            return result;
        }

        public List<Node> postOrder() {
            List<Node> result = new ArrayList<>();
            Deque<Node> stack = new ArrayDeque<>();
            Deque<Node> reverse = new ArrayDeque<>();
            stack.push(this);
            while (!stack.isEmpty()) {
                Node current = stack.pop();
                reverse.push(current);
                for (Node child : current.children) {
                    stack.push(child);
                }
            }
            while (!reverse.isEmpty()) {
                result.add(reverse.pop());
            }
            return result;
        }

        /** Terminals at the leaves, left to right. */
        public List<T> yield() {
            List<T> result = new ArrayList<>();
            for (Node node : preOrder()) {
                if (node.symbol instanceof T terminal) {
                    result.add(terminal);
                }
            }
            return result;
        }

        @Override
        public boolean equals(Object other) {
            if (!(other instanceof Node node)) {
                return false;
            }
            return start == node.start
                    && length == node.length
                    && symbol.equals(node.symbol)
                    && Objects.equals(production, node.production)
                    && children.equals(node.children);
        }

        @Override
        public int hashCode() {
            return Objects.hash(symbol, production, start, length, children);
        }

        /** Bracketed form, e.g. {@code S(A(a),B(b))}; an epsilon node prints as {@code A()}. */
        @Override
        public String toString() {
            if (isLeaf()) {
                return symbol.name();
            }
            return symbol.name()
                    + children.stream().map(Node::toString).collect(Collectors.joining(",", "(", ")"));
        }
    }

    public final Node root;

    public DerivationTree(Node root) {
        this.root = Objects.requireNonNull(root, "root");
    }

    public List<T> yield() {
        return root.yield();
    }

    /** Concatenation of the leaf terminal names. */
    public String text() {
        return root.yield().stream().map(T::name).collect(Collectors.joining());
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof DerivationTree tree && root.equals(tree.root);
    }

    @Override
    public int hashCode() {
        return root.hashCode();
    }

    @Override
    public String toString() {
        return root.toString();
    }
}
