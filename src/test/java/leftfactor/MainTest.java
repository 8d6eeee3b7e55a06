package leftfactor;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class MainTest {

	private final ByteArrayOutputStream out = new ByteArrayOutputStream();
	private final ByteArrayOutputStream err = new ByteArrayOutputStream();

	private int run(String... args){
		return Main.run(args, new PrintStream(out, true, StandardCharsets.UTF_8),
				new PrintStream(err, true, StandardCharsets.UTF_8));
	}

	private String grammarFile() throws Exception {
		return Paths.get(getClass().getResource("/grammars/expr.grammar").toURI()).toString();
	}

	@Test
	public void testUsage(){
		assertEquals(2, run());
		assertTrue(err.toString(StandardCharsets.UTF_8).startsWith("Usage"));
	}

	@Test
	public void testAllNonTerminals() throws Exception {
		assertEquals(0, run(grammarFile()));
		String[] lines = out.toString(StandardCharsets.UTF_8).split("\\R");
		assertEquals(5, lines.length);
		assertEquals("expr: term -> [term, term PLUS expr, term MINUS expr] (epsilon)", lines[0]);
		assertEquals("factor: LPAREN expr RPAREN -> [LPAREN expr RPAREN]", lines[3]);
	}

	@Test
	public void testSelectedNonTerminal() throws Exception {
		assertEquals(0, run(grammarFile(), "args"));
		assertEquals("args: expr -> [expr, expr COMMA args] (epsilon)", out.toString(StandardCharsets.UTF_8).trim());
	}

	@Test
	public void testUnknownNonTerminal() throws Exception {
		assertEquals(1, run(grammarFile(), "nope"));
		assertTrue(err.toString(StandardCharsets.UTF_8).contains("nope"));
	}

	@Test
	public void testMissingFile(){
		assertEquals(1, run("does/not/exist.grammar"));
		assertTrue(err.toString(StandardCharsets.UTF_8).startsWith("Can't read"));
	}
}
