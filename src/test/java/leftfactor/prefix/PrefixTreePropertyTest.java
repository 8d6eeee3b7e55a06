package leftfactor.prefix;

import com.pholser.junit.quickcheck.*;
import com.pholser.junit.quickcheck.generator.*;
import com.pholser.junit.quickcheck.random.SourceOfRandomness;
import com.pholser.junit.quickcheck.runner.JUnitQuickcheck;

import org.junit.runner.RunWith;

import java.lang.annotation.*;
import java.util.*;

import leftfactor.grammar.NonTerminal;
import leftfactor.grammar.Production;

import static java.lang.annotation.ElementType.*;
import static java.lang.annotation.RetentionPolicy.RUNTIME;
import static leftfactor.GrammarFixtures.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@RunWith(JUnitQuickcheck.class)
public class PrefixTreePropertyTest {

	@Target({PARAMETER, FIELD, ANNOTATION_TYPE, TYPE_USE})
	@Retention(RUNTIME)
	@GeneratorConfiguration
	public @interface AltConfig {

		int maxAlternatives() default 8;

		int maxLength() default 4;

		int alphabetSize() default 3;
	}

	public static class AlternativeSet {
		public final List<String> alternatives;

		public AlternativeSet(List<String> alternatives) {
			this.alternatives = alternatives;
		}

		public NonTerminal toNonTerminal(){
			return fromChars(alternatives.toArray(new String[0]));
		}

		@Override
		public String toString() {
			return String.join(" | ", alternatives);
		}
	}

	public static class AlternativeSets extends Generator<AlternativeSet> {

		private int maxAlternatives = 8;
		private int maxLength = 4;
		private int alphabetSize = 3;

		public AlternativeSets() {
			super(AlternativeSet.class);
		}

		public void configure(AltConfig config) {
			maxAlternatives = config.maxAlternatives();
			maxLength = config.maxLength();
			alphabetSize = config.alphabetSize();
			assert maxAlternatives > 0 && maxLength > 0 && alphabetSize > 0 && alphabetSize <= 26;
		}

		@Override
		public AlternativeSet generate(SourceOfRandomness random, GenerationStatus status) {
			int count = random.nextInt(1, maxAlternatives);
			List<String> alternatives = new ArrayList<>();
			for (int i = 0; i < count; i++){
				int length = random.nextInt(1, maxLength);
				StringBuilder builder = new StringBuilder();
				for (int j = 0; j < length; j++){
					builder.append((char)('a' + random.nextInt(0, alphabetSize - 1)));
				}
				alternatives.add(builder.toString());
			}
			return new AlternativeSet(alternatives);
		}
	}

	@Property(trials = 300)
	public void checkCoverageAndExclusivity(@AltConfig @From(AlternativeSets.class) AlternativeSet set) {
		NonTerminal nonTerminal = set.toNonTerminal();
		FactoringPlan plan = PrefixTree.build(nonTerminal).calculateFactoringPlan();
		assertEquals(nonTerminal.getProductions().size(), plan.alternativeCount(), "Lost or duplicated alternatives in " + plan);
		Set<Production> seen = Collections.newSetFromMap(new IdentityHashMap<>());
		for (FactoringPlan.Group group : plan){
			for (Production alt : group.alternatives){
				assertTrue(seen.add(alt), String.format("%s is in two groups of %s", alt, plan));
			}
		}
		assertEquals(nonTerminal.getProductions().size(), seen.size());
	}

	@Property(trials = 300)
	public void checkGroupKeysArePrefixes(@AltConfig(maxLength = 6, alphabetSize = 2) @From(AlternativeSets.class) AlternativeSet set) {
		FactoringPlan plan = PrefixTree.build(set.toNonTerminal()).calculateFactoringPlan();
		Set<Prefix> prefixes = new HashSet<>();
		for (FactoringPlan.Group group : plan){
			assertFalse(group.prefix.isEmpty());
			assertFalse(group.alternatives.isEmpty());
			assertTrue(prefixes.add(group.prefix), "Duplicated group " + group.prefix);
			for (Production alt : group.alternatives){
				assertTrue(group.prefix.isPrefixOf(alt), String.format("'%s' isn't a prefix of %s", group.prefix, alt));
			}
			if (!group.needsFactoring()){
				assertTrue(group.prefix.matches(group.alternatives.get(0)), "Single alternative groups are keyed by the alternative");
			}
		}
	}

	@Property(trials = 100)
	public void checkDeterminism(@AltConfig(maxAlternatives = 12) @From(AlternativeSets.class) AlternativeSet set) {
		String first = render(PrefixTree.build(set.toNonTerminal()).calculateFactoringPlan());
		String second = render(PrefixTree.build(set.toNonTerminal()).calculateFactoringPlan());
		assertEquals(first, second);
	}
}
