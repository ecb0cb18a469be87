package eson.lexer;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ProgramCharsTest {

	@Test
	public void testConsume(){
		ProgramChars chars = new ProgramChars("{\"a\":1}");
		chars.consume("{");
		chars.consume("\"a\"");
		assertEquals(":1}", chars.remaining());
		chars.consume(":1}");
		assertTrue(chars.isEmpty());
		chars.verifyConsumed();
	}

	@Test
	public void testIncomplete(){
		ProgramChars chars = new ProgramChars("{}");
		chars.consume("{");
		TokenizationIncomplete error = assertThrows(TokenizationIncomplete.class, chars::verifyConsumed);
		assertEquals("}", error.remaining);
		assertTrue(error.getMessage().contains("bug report"));
	}

	@Test
	public void testConsumeTooMuch(){
		ProgramChars chars = new ProgramChars("{}");
		TokenizationIncomplete error = assertThrows(TokenizationIncomplete.class, () -> chars.consume("{}{}"));
		assertEquals("{}", error.remaining);
		assertFalse(chars.isEmpty());
	}

	@Test
	public void testConsumeOtherCharacters(){
		ProgramChars chars = new ProgramChars("{\"a\":1}");
		chars.consume("{");
		TokenizationIncomplete error = assertThrows(TokenizationIncomplete.class, () -> chars.consume("\"b\""));
		assertEquals("\"a\":1}", error.remaining);
		assertTrue(error.getMessage().contains("\"b\""));
		chars.consume("\"a\"");
		assertEquals(":1}", chars.remaining());
	}
}
