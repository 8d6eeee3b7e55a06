package leftfactor;

import java.util.logging.Level;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ConfigTest {

	@Test
	public void testDefaults(){
		assertTrue(Config.checkInvariants());
		assertFalse(Config.parallelPlanning());
		assertEquals(Level.INFO, Config.logLevel());
	}

	@Test
	public void testSet(){
		String old = Config.get("logLevel");
		try {
			Config.set("logLevel", "FINE");
			assertEquals(Level.FINE, Config.logLevel());
			Config.set("logLevel", "no level");
			assertEquals(Level.INFO, Config.logLevel());
		} finally {
			Config.set("logLevel", old);
		}
	}

	@Test
	public void testUnknownKey(){
		assertThrows(LeftFactorException.class, () -> Config.set("unknown", "yes"));
		assertThrows(LeftFactorException.class, () -> Config.get("unknown"));
	}
}
