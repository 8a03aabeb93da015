package org.lokray.checker.parser;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.lokray.checker.environment.Environment;
import org.lokray.checker.environment.IntegrityException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExportParserTest
{
	private static final String IDENTITY = String.join("\n",
			"1 #NS 0 id",
			"2 #NS 0 x",
			"1 #ES 0",
			"2 #EV 0",
			"3 #EL #BD 2 1 2",
			"#DEF 1 1 3");

	@Test
	@DisplayName("A well formed export is read completely")
	void parse_wellFormedExport() throws ExportParseException
	{
		ExportParser parser = new ExportParser();
		Environment env = parser.parse(new StringReader(IDENTITY + "\n"));

		assertThat(parser.getLinesRead()).isEqualTo(6);
		assertThat(env.nameCount()).isEqualTo(2);
		assertThat(env.exprCount()).isEqualTo(3);
		assertThat(env.renderDeclaration(1)).isEqualTo("definition id Sort 0 := (x : Sort 0), x");
	}

	@Test
	@DisplayName("An empty input yields an empty environment")
	void parse_emptyInput() throws ExportParseException
	{
		ExportParser parser = new ExportParser();
		Environment env = parser.parse(new StringReader(""));

		assertThat(parser.getLinesRead()).isZero();
		assertThat(env.nameCount()).isZero();
		assertThat(env.levelCount()).isEqualTo(1);
	}

	@Test
	@DisplayName("The first bad line aborts with its 1-based line number")
	void parse_reportsLineNumber()
	{
		String input = String.join("\n",
				"1 #NS 0 a",
				"2 #NS 1 b",
				"3 #NS 9 c",
				"4 #NS 0 d");
		ExportParser parser = new ExportParser();

		assertThatThrownBy(() -> parser.parse(new StringReader(input)))
				.isInstanceOf(ExportParseException.class)
				.hasMessage("Parse error at line 3: Reference to undefined name 9")
				.hasCauseInstanceOf(IntegrityException.class)
				.satisfies(e -> assertThat(((ExportParseException) e).getLineNumber()).isEqualTo(3));
		assertThat(parser.getLinesRead()).isEqualTo(2);
	}

	@Test
	@DisplayName("Lines after a failure are not applied")
	void parse_stopsAtFirstError()
	{
		Environment env = new Environment();
		ExportParser parser = new ExportParser(env);
		String input = "1 #NS 0 a\n1 #ES 0 junk\n2 #NS 0 b\n";

		assertThatThrownBy(() -> parser.parse(new StringReader(input)))
				.isInstanceOf(ExportParseException.class)
				.hasCauseInstanceOf(GrammarException.class)
				.hasMessage("Parse error at line 2: Expecting end of line, found 'junk'");
		assertThat(env.nameCount()).isEqualTo(1);
		assertThat(env.exprCount()).isZero();
	}

	@Test
	@DisplayName("Unsupported commands abort the read")
	void parse_unsupportedCommand()
	{
		String input = "1 #NS 0 a\n#AX 1 1\n";

		assertThatThrownBy(() -> new ExportParser().parse(new StringReader(input)))
				.isInstanceOf(ExportParseException.class)
				.hasCauseInstanceOf(UnsupportedFeatureException.class)
				.hasMessage("Parse error at line 2: Command #AX is not supported");
	}

	@Test
	@DisplayName("A blank line is an error")
	void parse_blankLine()
	{
		assertThatThrownBy(() -> new ExportParser().parse(new StringReader("1 #NS 0 a\n\n")))
				.isInstanceOf(ExportParseException.class)
				.hasMessage("Parse error at line 2: Expecting index or command");
	}

	@Test
	@DisplayName("Read failures are reported with the line being read")
	void parse_wrapsIoErrors()
	{
		Reader failing = new Reader()
		{
			@Override
			public int read(char[] cbuf, int off, int len) throws IOException
			{
				throw new IOException("disk gone");
			}

			@Override
			public void close()
			{
			}
		};

		assertThatThrownBy(() -> new ExportParser().parse(failing))
				.isInstanceOf(ExportParseException.class)
				.hasCauseInstanceOf(IOException.class)
				.hasMessage("Parse error at line 1: Read failed: disk gone");
	}

	@Test
	@DisplayName("Successive reads continue numbering and share the environment")
	void parse_continuesAcrossReads() throws ExportParseException
	{
		ExportParser parser = new ExportParser();
		parser.parse(new StringReader("1 #NS 0 a\n2 #NS 1 b\n"));

		assertThatThrownBy(() -> parser.parse(new StringReader("3 #NS 2 c\n3 #NS 2 d\n")))
				.isInstanceOf(ExportParseException.class)
				.hasMessage("Parse error at line 4: Name index 3 is already defined");
		assertThat(parser.getLinesRead()).isEqualTo(3);
	}

	@Test
	@DisplayName("A deeply nested term read from an export can be rendered")
	void parse_deepNesting() throws ExportParseException
	{
		int depth = 10_000;
		StringBuilder input = new StringBuilder("1 #NS 0 x\n1 #ES 0\n2 #EV 0\n");
		for (int i = 3; i < depth + 3; i++)
		{
			input.append(i).append(" #EL #BD 1 1 ").append(i - 1).append('\n');
		}

		Environment env = new ExportParser().parse(new StringReader(input.toString()));

		assertThat(env.renderExpr(depth + 2)).isEqualTo("(x : Sort 0), ".repeat(depth) + "x");
	}

	@Test
	@DisplayName("Invalid UTF-8 is a read failure, not a silently replaced character")
	void parse_rejectsMalformedUtf8()
	{
		byte[] bytes = {'1', ' ', '#', 'N', 'S', ' ', '0', ' ', (byte) 0xFF, (byte) 0xFE, '\n'};
		Reader reader = new InputStreamReader(new ByteArrayInputStream(bytes), StandardCharsets.UTF_8.newDecoder());

		assertThatThrownBy(() -> new ExportParser().parse(reader))
				.isInstanceOf(ExportParseException.class)
				.hasCauseInstanceOf(CharacterCodingException.class)
				.hasMessageStartingWith("Parse error at line 1: Read failed");
	}

	@Test
	@DisplayName("Lines end at line feeds only, any other Unicode whitespace separates fields")
	void parse_lineEndingsAndWhitespace() throws ExportParseException
	{
		ExportParser parser = new ExportParser();
		Environment env = parser.parse(new StringReader("1 #NS 0 a\r\n2 #NS 1\rb\n3\u00A0#NS 0\u2003d"));

		assertThat(parser.getLinesRead()).isEqualTo(3);
		assertThat(env.renderName(2)).isEqualTo("a.b");
		assertThat(env.renderName(3)).isEqualTo("d");
	}
}
