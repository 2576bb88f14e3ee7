package com.cfgkit.core.cyk;

import com.cfgkit.core.cnf.CnfGrammar;
import com.cfgkit.core.grammar.Grammar.NT;
import com.cfgkit.core.grammar.Grammar.Production;
import com.cfgkit.core.grammar.Grammar.T;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cocke-Younger-Kasami recognizer over a {@link CnfGrammar}. Runs in O(n³·|P|) time and fills a
 * {@link CykTable} from which one derivation can be read back.
 */
public final class CykParser {

    private static final Logger log = LoggerFactory.getLogger(CykParser.class);

    /** Maps token names to terminals, failing on the first name outside T. */
    public List<T> resolve(CnfGrammar grammar, List<String> tokens) {
        List<T> resolved = new ArrayList<>(tokens.size());
        for (String token : tokens) {
            resolved.add(grammar.terminal(token).orElseThrow(() -> new UnknownSymbolException(token)));
        }
        return resolved;
    }

    public CykTable recognize(CnfGrammar grammar, List<T> tokens) {
        Objects.requireNonNull(grammar, "grammar");
        for (T token : tokens) {
            if (!grammar.terminals().contains(token)) {
                throw new UnknownSymbolException(token.name());
            }
        }
        CykTable table = new CykTable(grammar, tokens);
        int n = tokens.size();
        if (n == 0) {
            return table;
        }

        Map<T, List<Production>> lexical = new HashMap<>();
        List<Production> binary = new ArrayList<>();
        for (Production production : grammar.productions()) {
            if (production.rhs().size() == 1) {
                lexical.computeIfAbsent((T) production.rhs().get(0), key -> new ArrayList<>())
                        .add(production);
            } else if (production.rhs().size() == 2) {
                binary.add(production);
            }
        }

        for (int i = 0; i < n; i++) {
            T token = tokens.get(i);
            for (Production production : lexical.getOrDefault(token, List.of())) {
                table.putIfAbsent(i, 1, production.lhs(), new Backpointer.Leaf(token, production));
            }
        }

        // Split points ascend and productions come in index order, so the first entry stored for
        // a nonterminal is the preferred one.
        for (int length = 2; length <= n; length++) {
            for (int i = 0; i + length <= n; i++) {
                for (int k = 1; k < length; k++) {
                    if (table.isEmpty(i, k) || table.isEmpty(i + k, length - k)) {
                        continue;
                    }
                    Map<NT, Backpointer> left = table.cell(i, k);
                    Map<NT, Backpointer> right = table.cell(i + k, length - k);
                    for (Production production : binary) {
                        NT b = (NT) production.rhs().get(0);
                        NT c = (NT) production.rhs().get(1);
                        if (left.containsKey(b) && right.containsKey(c)) {
                            table.putIfAbsent(
                                    i, length, production.lhs(), new Backpointer.Split(k, b, c, production));
                        }
                    }
                }
            }
        }
        log.debug("CYK filled chart for {} tokens, accepted={}", n, table.accepted());
        return table;
    }
}
