package eson.lexer;

import java.util.*;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import eson.grammar.EsonGrammars;

import static org.junit.jupiter.api.Assertions.*;

public class TokenSeqTest {

	private static TokenSeq sequence(){
		return TokenSeq.of(
				new Token("{", "program_start"),
				new Token("\"&let\"", "special_form_identifier"),
				new Token(":", "colon"),
				new Token("\"x\"", "attribute_name"),
				new Token(":", "colon"),
				new Token("}", "program_end"));
	}

	@Nested
	class TakeWithSeq {

		@Test
		public void testPrefixThroughMatch(){
			Optional<TokenSeq> prefix = sequence().takeWithSeq("attribute_name", "colon");
			assertTrue(prefix.isPresent());
			assertEquals(5, prefix.get().size());
			assertEquals("colon", prefix.get().last().name);
			assertEquals(sequence().get(3), prefix.get().get(3));
		}

		@Test
		public void testEarliestMatchWins(){
			Optional<TokenSeq> prefix = sequence().takeWithSeq("colon");
			assertTrue(prefix.isPresent());
			assertEquals(3, prefix.get().size());
		}

		@Test
		public void testNoMatch(){
			assertEquals(Optional.empty(), sequence().takeWithSeq("colon", "attribute_name", "program_end"));
			assertEquals(Optional.empty(), sequence().takeWithSeq("array_start"));
			assertEquals(Optional.empty(), sequence().takeWithSeq());
			assertEquals(Optional.empty(), new TokenSeq().takeWithSeq("colon"));
		}
	}

	@Nested
	class SeqMatch {

		@Test
		public void testMatchesTheEnd(){
			assertTrue(sequence().seqMatch("colon", "program_end"));
			assertTrue(sequence().seqMatch("attribute_name", "colon", "program_end"));
			assertTrue(sequence().seqMatch("program_end"));
		}

		@Test
		public void testDoesNotMatchEarlierRuns(){
			assertFalse(sequence().seqMatch("attribute_name", "colon"));
			assertFalse(sequence().seqMatch("program_start"));
		}

		@Test
		public void testTooLongOrEmpty(){
			TokenSeq seq = TokenSeq.of(new Token(":", "colon"));
			assertFalse(seq.seqMatch("attribute_name", "colon"));
			assertFalse(seq.seqMatch());
			assertFalse(new TokenSeq().seqMatch("colon"));
		}
	}

	@Nested
	class SpecialForms {

		@Test
		public void testKnownSpecialForms(){
			TokenSeq seq = sequence();
			assertSame(seq, seq.verifySpecialForms(EsonGrammars.SPECIAL_FORMS));
		}

		@Test
		public void testUnknownSpecialForm(){
			Token launch = new Token("\"&launch\"", "special_form_identifier");
			launch.setAttribute(Token.LINE_NO, 3);
			TokenSeq seq = TokenSeq.of(new Token("{", "program_start"), launch);
			UnknownSpecialForm error = assertThrows(UnknownSpecialForm.class,
					() -> seq.verifySpecialForms(EsonGrammars.SPECIAL_FORMS));
			assertEquals("launch", error.specialForm);
			assertSame(launch, error.errorToken);
			assertEquals(3, error.errorLine);
		}

		@Test
		public void testProceduresAreNotChecked(){
			TokenSeq seq = TokenSeq.of(new Token("\"&Math.max\"", "unreserved_procedure_identifier"));
			seq.verifySpecialForms(Collections.emptySet());
		}
	}

	@Test
	public void testNamesAndLexemes(){
		assertEquals(Arrays.asList("program_start", "special_form_identifier", "colon", "attribute_name",
				"colon", "program_end"), sequence().names());
		assertEquals("{\"&let\":\"x\":}", sequence().lexemes());
		assertEquals(sequence(), sequence());
	}
}
