package com.cfgkit.core.cnf;

import com.cfgkit.core.cnf.DerivationTemplate.Hole;
import com.cfgkit.core.cnf.Provenance.Kind;
import com.cfgkit.core.cnf.Provenance.Synthetic;
import com.cfgkit.core.grammar.Grammar;
import com.cfgkit.core.grammar.Grammar.NT;
import com.cfgkit.core.grammar.Grammar.Production;
import com.cfgkit.core.grammar.Grammar.Symbol;
import com.cfgkit.core.grammar.Grammar.T;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts a grammar to Chomsky Normal Form. The stages run in a fixed order: start isolation,
 * epsilon elimination, unit-chain elimination, removal of non-generating symbols, and finally
 * terminal proxies plus binarization of long right-hand sides.
 *
 * <p>Every intermediate rule carries the {@link DerivationTemplate}s describing which part of an
 * original derivation it abbreviates, so parse trees can be mapped back afterwards. Fresh names
 * come from counters local to one call; normalizing the same grammar twice gives identical output.
 */
public final class CnfNormalizer {

    private static final Logger log = LoggerFactory.getLogger(CnfNormalizer.class);

    static final String PROXY_PREFIX = "T_";
    static final String HELPER_PREFIX = "X_";
    /** Each right-hand side expands into 2^n variants for n nullable positions. */
    static final int MAX_NULLABLE_POSITIONS = 20;

    public CnfGrammar normalize(Grammar grammar) {
        Objects.requireNonNull(grammar, "grammar");
        grammar.validate();
        return new Pass(grammar).run();
    }

    private record Rule(NT lhs, List<Symbol> rhs, List<DerivationTemplate> origin) {
        Rule {
            rhs = List.copyOf(rhs);
            origin = List.copyOf(origin);
        }

        Rule(NT lhs, List<Symbol> rhs, DerivationTemplate origin) {
            this(lhs, rhs, List.of(origin));
        }

        boolean isUnit() {
            return rhs.size() == 1 && rhs.get(0) instanceof NT;
        }

        DerivationTemplate single() {
            if (origin.size() != 1) {
                throw new ConversionException("Expected a single template for " + lhs.name());
            }
            return origin.get(0);
        }

        Key key() {
            return new Key(lhs, rhs);
        }
    }

    private record Key(NT lhs, List<Symbol> rhs) {}

    /** State of one normalization call. */
    private static final class Pass {
        private final Grammar source;
        private final Set<String> usedNames = new HashSet<>();
        private final Map<NT, Synthetic> synthetic = new LinkedHashMap<>();
        private final Map<T, NT> proxies = new LinkedHashMap<>();
        private NT start;
        private int proxyCounter;
        private int helperCounter;

        Pass(Grammar source) {
            this.source = source;
            this.start = source.start();
            source.nonTerminals().forEach(nt -> usedNames.add(nt.name()));
            source.terminals().forEach(t -> usedNames.add(t.name()));
        }

        CnfGrammar run() {
            List<Rule> rules = new ArrayList<>();
            for (Production production : source.productions()) {
                rules.add(new Rule(production.lhs(), production.rhs(), DerivationTemplate.of(production)));
            }
            rules = isolateStart(rules);
            log.debug("start isolation: start={} rules={}", start.name(), rules.size());
            rules = eliminateEpsilon(rules);
            log.debug("epsilon elimination: rules={}", rules.size());
            rules = eliminateUnitChains(rules);
            log.debug("unit-chain elimination: rules={}", rules.size());
            rules = removeNonGenerating(rules);
            log.debug("non-generating cleanup: rules={}", rules.size());
            rules = reduce(rules);
            log.debug("binarization: rules={} synthetic={}", rules.size(), synthetic.size());
            return build(rules);
        }

        private List<Rule> isolateStart(List<Rule> rules) {
            boolean onRhs = rules.stream().anyMatch(rule -> rule.rhs().contains(start));
            if (!onRhs) {
                return rules;
            }
            NT original = start;
            start = fresh(original.name() + "0");
            synthetic.put(start, new Synthetic(start, Kind.START, List.of(original), null));
            List<Rule> result = new ArrayList<>();
            result.add(new Rule(start, List.of(original), DerivationTemplate.identity()));
            result.addAll(rules);
            return result;
        }

        private List<Rule> eliminateEpsilon(List<Rule> rules) {
            // Rounds only see symbols proven nullable in earlier rounds, so every witness
            // bottoms out in a direct epsilon rule.
            Map<NT, Rule> witness = new LinkedHashMap<>();
            boolean changed = true;
            while (changed) {
                Set<NT> known = new HashSet<>(witness.keySet());
                changed = false;
                for (Rule rule : rules) {
                    if (witness.containsKey(rule.lhs())) {
                        continue;
                    }
                    boolean nullable =
                            rule.rhs().stream().allMatch(s -> s instanceof NT nt && known.contains(nt));
                    if (nullable) {
                        witness.put(rule.lhs(), rule);
                        changed = true;
                    }
                }
            }
            Map<NT, DerivationTemplate> epsilon = new HashMap<>();

            List<Rule> result = new ArrayList<>();
            Set<Key> seen = new HashSet<>();
            if (witness.containsKey(start)) {
                Rule rule = new Rule(start, List.of(), epsilonTemplate(start, witness, epsilon));
                seen.add(rule.key());
                result.add(rule);
            }
            for (Rule rule : rules) {
                List<Integer> positions = new ArrayList<>();
                for (int i = 0; i < rule.rhs().size(); i++) {
                    if (rule.rhs().get(i) instanceof NT nt && witness.containsKey(nt)) {
                        positions.add(i);
                    }
                }
                if (positions.size() > MAX_NULLABLE_POSITIONS) {
                    throw new ConversionException(
                            "Production for "
                                    + rule.lhs().name()
                                    + " has "
                                    + positions.size()
                                    + " nullable positions, at most "
                                    + MAX_NULLABLE_POSITIONS
                                    + " are supported");
                }
                for (int mask = 0; mask < (1 << positions.size()); mask++) {
                    Set<Integer> dropped = new HashSet<>();
                    for (int bit = 0; bit < positions.size(); bit++) {
                        if ((mask >> bit & 1) != 0) {
                            dropped.add(positions.get(bit));
                        }
                    }
                    List<Symbol> rhs = new ArrayList<>();
                    int[] renumbered = new int[rule.rhs().size()];
                    for (int i = 0; i < rule.rhs().size(); i++) {
                        if (!dropped.contains(i)) {
                            renumbered[i] = rhs.size();
                            rhs.add(rule.rhs().get(i));
                        }
                    }
                    if (rhs.isEmpty()) {
                        continue;
                    }
                    DerivationTemplate template =
                            DerivationTemplate.substitute(
                                    rule.single(),
                                    hole ->
                                            dropped.contains(hole)
                                                    ? epsilonTemplate(
                                                            (NT) rule.rhs().get(hole), witness, epsilon)
                                                    : new Hole(renumbered[hole]));
                    Rule variant = new Rule(rule.lhs(), rhs, template);
                    if (seen.add(variant.key())) {
                        result.add(variant);
                    }
                }
            }
            return result;
        }

        private DerivationTemplate epsilonTemplate(
                NT nt, Map<NT, Rule> witness, Map<NT, DerivationTemplate> memo) {
            DerivationTemplate cached = memo.get(nt);
            if (cached != null) {
                return cached;
            }
            Rule rule = witness.get(nt);
            if (rule == null) {
                throw new ConversionException(nt.name() + " is not nullable");
            }
            DerivationTemplate template =
                    DerivationTemplate.substitute(
                            rule.single(),
                            hole -> epsilonTemplate((NT) rule.rhs().get(hole), witness, memo));
            memo.put(nt, template);
            return template;
        }

        private List<Rule> eliminateUnitChains(List<Rule> rules) {
            Map<NT, List<Rule>> byLhs = new LinkedHashMap<>();
            for (Rule rule : rules) {
                byLhs.computeIfAbsent(rule.lhs(), key -> new ArrayList<>()).add(rule);
            }
            List<Rule> result = new ArrayList<>();
            Set<Key> seen = new HashSet<>();
            for (Map.Entry<NT, List<Rule>> entry : byLhs.entrySet()) {
                NT lhs = entry.getKey();
                for (Rule rule : entry.getValue()) {
                    if (!rule.isUnit() && seen.add(rule.key())) {
                        result.add(rule);
                    }
                }
                // Breadth-first over unit chains so each reachable symbol uses its shortest chain.
                Set<NT> visited = new HashSet<>();
                visited.add(lhs);
                Deque<Map.Entry<NT, DerivationTemplate>> queue = new ArrayDeque<>();
                enqueueUnitTargets(entry.getValue(), DerivationTemplate.identity(), visited, queue);
                while (!queue.isEmpty()) {
                    Map.Entry<NT, DerivationTemplate> next = queue.pollFirst();
                    DerivationTemplate chain = next.getValue();
                    List<Rule> targetRules = byLhs.getOrDefault(next.getKey(), List.of());
                    for (Rule rule : targetRules) {
                        if (rule.isUnit()) {
                            continue;
                        }
                        DerivationTemplate template =
                                DerivationTemplate.substitute(chain, hole -> rule.single());
                        Rule copy = new Rule(lhs, rule.rhs(), template);
                        if (seen.add(copy.key())) {
                            result.add(copy);
                        }
                    }
                    enqueueUnitTargets(targetRules, chain, visited, queue);
                }
            }
            return result;
        }

        private static void enqueueUnitTargets(
                List<Rule> rules,
                DerivationTemplate chain,
                Set<NT> visited,
                Deque<Map.Entry<NT, DerivationTemplate>> queue) {
            for (Rule rule : rules) {
                if (rule.isUnit() && visited.add((NT) rule.rhs().get(0))) {
                    DerivationTemplate extended =
                            DerivationTemplate.substitute(chain, hole -> rule.single());
                    queue.addLast(Map.entry((NT) rule.rhs().get(0), extended));
                }
            }
        }

        private List<Rule> removeNonGenerating(List<Rule> rules) {
            Set<NT> generating = new HashSet<>();
            boolean changed = true;
            while (changed) {
                changed = false;
                for (Rule rule : rules) {
                    if (!generating.contains(rule.lhs()) && allGenerating(rule, generating)) {
                        generating.add(rule.lhs());
                        changed = true;
                    }
                }
            }
            List<Rule> result = new ArrayList<>();
            for (Rule rule : rules) {
                if (generating.contains(rule.lhs()) && allGenerating(rule, generating)) {
                    result.add(rule);
                }
            }
            return result;
        }

        private static boolean allGenerating(Rule rule, Set<NT> generating) {
            for (Symbol symbol : rule.rhs()) {
                if (symbol instanceof NT nt && !generating.contains(nt)) {
                    return false;
                }
            }
            return true;
        }

        private List<Rule> reduce(List<Rule> rules) {
            List<Rule> result = new ArrayList<>();
            List<Rule> proxyRules = new ArrayList<>();
            for (Rule rule : rules) {
                if (rule.rhs().size() < 2) {
                    result.add(rule);
                    continue;
                }
                List<Symbol> rhs = new ArrayList<>();
                for (Symbol symbol : rule.rhs()) {
                    rhs.add(symbol instanceof T terminal ? proxy(terminal, proxyRules) : symbol);
                }
                NT lhs = rule.lhs();
                List<DerivationTemplate> origin = rule.origin();
                for (int i = 0; i < rhs.size() - 2; i++) {
                    NT helper = fresh(HELPER_PREFIX + helperCounter++);
                    synthetic.put(
                            helper,
                            new Synthetic(
                                    helper,
                                    Kind.BINARIZATION,
                                    rule.rhs().subList(i + 1, rule.rhs().size()),
                                    DerivationTemplate.holeOwner(rule.single()).orElse(null)));
                    result.add(new Rule(lhs, List.of(rhs.get(i), helper), origin));
                    lhs = helper;
                    origin = List.of(new Hole(0), new Hole(1));
                }
                result.add(new Rule(lhs, rhs.subList(rhs.size() - 2, rhs.size()), origin));
            }
            result.addAll(proxyRules);
            return result;
        }

        private NT proxy(T terminal, List<Rule> proxyRules) {
            NT existing = proxies.get(terminal);
            if (existing != null) {
                return existing;
            }
            NT nt = fresh(PROXY_PREFIX + proxyCounter++);
            proxies.put(terminal, nt);
            synthetic.put(nt, new Synthetic(nt, Kind.TERMINAL_PROXY, List.of(terminal), null));
            proxyRules.add(new Rule(nt, List.of(terminal), DerivationTemplate.identity()));
            return nt;
        }

        private NT fresh(String base) {
            String name = base;
            int suffix = 1;
            while (!usedNames.add(name)) {
                name = base + "_" + suffix++;
            }
            return new NT(name);
        }

        private CnfGrammar build(List<Rule> rules) {
            Set<NT> nonTerminals = new LinkedHashSet<>();
            nonTerminals.add(start);
            List<Production> productions = new ArrayList<>();
            List<List<DerivationTemplate>> templates = new ArrayList<>();
            for (Rule rule : rules) {
                nonTerminals.add(rule.lhs());
                productions.add(new Production(rule.lhs(), rule.rhs()));
                templates.add(rule.origin());
            }
            Map<NT, Synthetic> kept = new LinkedHashMap<>();
            synthetic.forEach((nt, info) -> {
                if (nonTerminals.contains(nt)) {
                    kept.put(nt, info);
                }
            });
            return new CnfGrammar(
                    source, nonTerminals, start, productions, new Provenance(templates, kept));
        }
    }
}
