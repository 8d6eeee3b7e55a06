package leftfactor.grammar;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.logging.Logger;

import leftfactor.LeftFactorException;

/**
 * Reads grammars written in a simple line based format:
 *
 * <pre>
 * # comment
 * expr = term PLUS expr | term MINUS expr | term
 *      | LPAREN expr RPAREN
 * term = ID | ε
 * </pre>
 *
 * Names that appear on a left hand side are non terminals, all other names are terminals.
 * An empty alternative or "ε" is an epsilon production. The first rule defines the start non terminal.
 */
public class GrammarReader {

	private static final Logger LOG = Logger.getLogger(GrammarReader.class.getName());

	public static final String EPSILON = "ε";

	private static class Rule {
		final String left;
		final List<List<String>> alternatives = new ArrayList<>();

		Rule(String left) {
			this.left = left;
		}
	}

	public Grammar read(Path file) throws IOException {
		try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
			return read(reader);
		}
	}

	public Grammar read(String grammar) {
		try {
			return read(new StringReader(grammar));
		} catch (IOException e) {
			throw new LeftFactorException("Can't read grammar string", e);
		}
	}

	public Grammar read(Reader input) throws IOException {
		List<Rule> rules = parseRules(new BufferedReader(input));
		if (rules.isEmpty()){
			throw new LeftFactorException("The grammar doesn't contain any rule");
		}
		Set<String> nonTerminals = new HashSet<>();
		for (Rule rule : rules){
			nonTerminals.add(rule.left);
		}
		GrammarBuilder builder = new GrammarBuilder();
		for (Rule rule : rules){
			for (List<String> alternative : rule.alternatives){
				for (String name : alternative){
					if (!nonTerminals.contains(name)){
						builder.terminals(name);
					}
				}
			}
		}
		for (Rule rule : rules){
			for (List<String> alternative : rule.alternatives){
				builder.add(rule.left, alternative.toArray(new String[0]));
			}
		}
		Grammar grammar = builder.toGrammar(rules.get(0).left);
		LOG.fine(() -> String.format("Read grammar with %d productions", grammar.getProductions().size()));
		return grammar;
	}

	private List<Rule> parseRules(BufferedReader reader) throws IOException {
		Map<String, Rule> rules = new LinkedHashMap<>();
		Rule current = null;
		String line;
		int lineNumber = 0;
		while ((line = reader.readLine()) != null){
			lineNumber++;
			int commentStart = line.indexOf('#');
			if (commentStart != -1){
				line = line.substring(0, commentStart);
			}
			line = line.trim();
			if (line.isEmpty()){
				continue;
			}
			String body;
			if (line.startsWith("|")){
				if (current == null){
					throw new LeftFactorException(String.format("line %d: alternative without a rule", lineNumber));
				}
				body = line.substring(1);
			} else {
				int eq = line.indexOf('=');
				if (eq == -1){
					throw new LeftFactorException(String.format("line %d: expected 'name = alternatives'", lineNumber));
				}
				String left = line.substring(0, eq).trim();
				if (left.isEmpty() || left.contains(" ") || left.contains("|")){
					throw new LeftFactorException(String.format("line %d: invalid rule name '%s'", lineNumber, left));
				}
				current = rules.computeIfAbsent(left, Rule::new);
				body = line.substring(eq + 1);
			}
			for (String alternative : body.split("\\|", -1)){
				current.alternatives.add(parseAlternative(alternative));
			}
		}
		return new ArrayList<>(rules.values());
	}

	private List<String> parseAlternative(String alternative){
		List<String> names = new ArrayList<>();
		for (String name : alternative.trim().split("\\s+")){
			if (!name.isEmpty() && !name.equals(EPSILON)){
				names.add(name);
			}
		}
		return names;
	}
}
