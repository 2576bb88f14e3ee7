package com.cfgkit.core.io;

import com.cfgkit.core.grammar.Grammar;
import com.cfgkit.core.grammar.Grammar.Production;
import com.cfgkit.core.grammar.Grammar.Symbol;
import com.cfgkit.core.grammar.GrammarType;
import com.cfgkit.core.grammar.InvalidGrammarException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes grammars in the JSON interchange layout:
 *
 * <pre>
 * {"N": ["S"], "T": ["a"], "S": "S", "type": "2",
 *  "P": [{"lhs": "S", "rhs": ["a", "S"]}, {"lhs": "S", "rhs": []}]}
 * </pre>
 *
 * <p>Reading also accepts the older layout with the start symbol under {@code S0} and productions
 * written as strings ({@code "S -> a S"}, see {@link ProductionText}). When both {@code S0} and
 * {@code S} are present, {@code S0} wins.
 */
public final class GrammarJson {

    private static final ObjectMapper MAPPER =
            new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private GrammarJson() {}

    public static Grammar read(Path path) throws IOException {
        return read(Files.readString(path, StandardCharsets.UTF_8));
    }

    public static Grammar read(String json) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new InvalidGrammarException("Grammar is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new InvalidGrammarException("Grammar document must be a JSON object");
        }
        Grammar.Builder builder = Grammar.builder()
                .nonTerminals(names(root, "N"))
                .terminals(names(root, "T"))
                .start(startSymbol(root));
        JsonNode type = root.get("type");
        if (type != null && !type.isNull()) {
            builder.type(GrammarType.fromCode(type.asText()));
        }
        JsonNode productions = root.get("P");
        if (productions == null || !productions.isArray()) {
            throw new InvalidGrammarException("Field 'P' must be an array of productions");
        }
        for (JsonNode production : productions) {
            if (production.isTextual()) {
                Map.Entry<String, List<String>> parsed = ProductionText.parse(production.asText());
                builder.production(parsed.getKey(), parsed.getValue());
            } else if (production.isObject()) {
                JsonNode lhs = production.get("lhs");
                if (lhs == null || !lhs.isTextual()) {
                    throw new InvalidGrammarException("Production without a textual 'lhs': " + production);
                }
                builder.production(lhs.asText(), names(production, "rhs"));
            } else {
                throw new InvalidGrammarException("Unsupported production entry: " + production);
            }
        }
        return builder.build();
    }

    public static void write(Grammar grammar, Path path) throws IOException {
        Files.writeString(path, write(grammar), StandardCharsets.UTF_8);
    }

    public static String write(Grammar grammar) {
        ObjectNode root = MAPPER.createObjectNode();
        ArrayNode n = root.putArray("N");
        grammar.nonTerminals().forEach(nt -> n.add(nt.name()));
        ArrayNode t = root.putArray("T");
        grammar.terminals().forEach(terminal -> t.add(terminal.name()));
        root.put("S", grammar.start().name());
        root.put("type", grammar.type().code());
        ArrayNode p = root.putArray("P");
        for (Production production : grammar.productions()) {
            ObjectNode entry = p.addObject();
            entry.put("lhs", production.lhs().name());
            ArrayNode rhs = entry.putArray("rhs");
            for (Symbol symbol : production.rhs()) {
                rhs.add(symbol.name());
            }
        }
        try {
            return MAPPER.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize grammar", e);
        }
    }

    private static String startSymbol(JsonNode root) {
        JsonNode start = root.get("S0");
        if (start == null || start.isNull()) {
            start = root.get("S");
        }
        if (start == null || !start.isTextual()) {
            throw new InvalidGrammarException("Field 'S0' or 'S' must name the start symbol");
        }
        return start.asText();
    }

    private static List<String> names(JsonNode node, String field) {
        JsonNode array = node.get(field);
        if (array == null || !array.isArray()) {
            throw new InvalidGrammarException("Field '" + field + "' must be an array of names");
        }
        List<String> names = new ArrayList<>();
        for (JsonNode element : array) {
            if (!element.isTextual()) {
                throw new InvalidGrammarException("Field '" + field + "' contains a non-string: " + element);
            }
            names.add(element.asText());
        }
        return names;
    }
}
