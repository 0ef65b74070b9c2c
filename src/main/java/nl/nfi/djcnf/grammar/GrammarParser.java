package nl.nfi.djcnf.grammar;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static java.nio.charset.StandardCharsets.UTF_8;
import static nl.nfi.djcnf.grammar.Symbols.ARROW;
import static nl.nfi.djcnf.grammar.Symbols.ASCII_ARROW;
import static nl.nfi.djcnf.grammar.Symbols.EPSILON;
import static nl.nfi.djcnf.grammar.Symbols.EPSILON_ALIAS;

/**
 * Reads grammars written one rule per line, e.g.:
 * <pre>
 *     S -> A B | a
 *     A → a A | ε
 * </pre>
 * An alternative containing whitespace is split on whitespace, any other alternative is
 * read as one symbol per character ({@code AB} is {@code A B}). A standalone {@code E} or
 * {@code ε} is the empty production.
 *
 * <p>Parsing stops at the first malformed line with a {@link MalformedRuleException}.
 */
public final class GrammarParser {

    private static final Logger LOG = LoggerFactory.getLogger(GrammarParser.class);

    private GrammarParser() {
    }

    public static Grammar parse(final Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IllegalArgumentException("Grammar file path does not exist: %s".formatted(path));
        }
        return parse(Files.readString(path, UTF_8));
    }

    public static Grammar parse(final String text, final String start) {
        return withStart(parse(text), start);
    }

    public static Grammar withStart(final Grammar grammar, final String start) {
        UndefinedStartException.requireDeclared(grammar, start);
        return grammar.toBuilder().start(start).build();
    }

    public static Grammar parse(final String text) {
        final Grammar.Builder builder = Grammar.builder();
        boolean empty = true;

        final List<String> lines = text.lines().toList();
        for (int i = 0; i < lines.size(); i++) {
            final String line = lines.get(i).trim();
            if (line.isEmpty()) {
                continue;
            }
            parseRule(i + 1, line, builder);
            empty = false;
        }

        if (empty) {
            throw new EmptyGrammarException("No rules found in grammar text");
        }

        final Grammar grammar = builder.build();
        LOG.debug("Parsed grammar: {} nonterminals, {} productions", grammar.nonTerminals().size(), grammar.productionCount());
        return grammar;
    }

    private static void parseRule(final int lineNumber, final String line, final Grammar.Builder builder) {
        final int ascii = line.indexOf(ASCII_ARROW);
        final int unicode = line.indexOf(ARROW);
        if (ascii < 0 && unicode < 0) {
            throw new MalformedRuleException(lineNumber, line, "no derivation arrow");
        }

        // split on whichever arrow comes first
        final int arrowIndex;
        final int arrowLength;
        if (unicode < 0 || (ascii >= 0 && ascii < unicode)) {
            arrowIndex = ascii;
            arrowLength = ASCII_ARROW.length();
        } else {
            arrowIndex = unicode;
            arrowLength = ARROW.length();
        }

        final String lhs = line.substring(0, arrowIndex).trim();
        final String rhs = line.substring(arrowIndex + arrowLength).trim();
        if (lhs.isEmpty()) {
            throw new MalformedRuleException(lineNumber, line, "missing left-hand side");
        }
        if (lhs.chars().anyMatch(Character::isWhitespace)) {
            throw new MalformedRuleException(lineNumber, line, "left-hand side must be a single symbol");
        }

        for (final String alternative : rhs.split("\\|", -1)) {
            builder.add(lhs, parseAlternative(lineNumber, line, alternative.trim()));
        }
    }

    private static Production parseAlternative(final int lineNumber, final String line, final String alternative) {
        if (alternative.isEmpty()) {
            throw new MalformedRuleException(lineNumber, line, "empty alternative");
        }
        if (alternative.equals(EPSILON_ALIAS) || alternative.equals(EPSILON)) {
            return Production.epsilon();
        }

        final List<String> symbols = new ArrayList<>();
        if (alternative.chars().anyMatch(Character::isWhitespace)) {
            symbols.addAll(List.of(alternative.split("\\s+")));
        } else {
            alternative.codePoints().forEach(codePoint -> symbols.add(Character.toString(codePoint)));
        }

        if (symbols.contains(EPSILON)) {
            throw new MalformedRuleException(lineNumber, line, EPSILON + " must stand alone");
        }
        return new Production(symbols);
    }
}
