package leftfactor;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.*;

import leftfactor.grammar.Grammar;
import leftfactor.grammar.GrammarReader;
import leftfactor.grammar.NonTerminal;
import leftfactor.prefix.FactoringPlan;

/**
 * Prints the factoring plans of the non terminals of a grammar file.
 *
 * <pre>
 * java leftfactor.Main GRAMMAR_FILE [NON_TERMINAL...]
 * </pre>
 */
public class Main {

	public static void main(String[] args) {
		System.exit(run(args, System.out, System.err));
	}

	static int run(String[] args, PrintStream out, PrintStream err){
		if (args.length == 0){
			err.println("Usage: leftfactor GRAMMAR_FILE [NON_TERMINAL...]");
			return 2;
		}
		Path file = Paths.get(args[0]);
		try {
			Grammar grammar = new GrammarReader().read(file);
			Map<NonTerminal, FactoringPlan> plans = LeftFactoring.planAll(grammar);
			List<NonTerminal> selected = new ArrayList<>();
			if (args.length == 1){
				selected.addAll(plans.keySet());
			} else {
				for (String name : Arrays.asList(args).subList(1, args.length)){
					selected.add(grammar.getNonTerminal(name));
				}
			}
			for (NonTerminal nonTerminal : selected){
				FactoringPlan plan = plans.get(nonTerminal);
				if (plan == null){
					out.println(nonTerminal + ": only epsilon productions");
					continue;
				}
				for (FactoringPlan.Group group : plan){
					out.println(nonTerminal + ": " + group);
				}
			}
			return 0;
		} catch (IOException e) {
			err.println("Can't read " + file + ": " + e.getMessage());
			return 1;
		} catch (LeftFactorException e) {
			err.println(e.getMessage());
			return 1;
		}
	}
}
