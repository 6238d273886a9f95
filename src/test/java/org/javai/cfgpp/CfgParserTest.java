package org.javai.cfgpp;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.javai.cfgpp.value.CfgValue;
import org.javai.cfgpp.value.ValueKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

class CfgParserTest {

	private final CfgParser parser = new CfgParser();

	@Nested
	@DisplayName("Scalar documents")
	class Scalars {

		@Test
		void parsesInteger() {
			assertThat(parser.parse("42")).isEqualTo(CfgValue.of(42L));
		}

		@Test
		void parsesDouble() {
			assertThat(parser.parse("3.5")).isEqualTo(CfgValue.of(3.5));
		}

		@Test
		void parsesString() {
			assertThat(parser.parse("\"hello\\tworld\"")).isEqualTo(CfgValue.of("hello\tworld"));
		}

		@Test
		void parsesBooleansAndNull() {
			assertThat(parser.parse("true")).isEqualTo(CfgValue.of(true));
			assertThat(parser.parse("false")).isEqualTo(CfgValue.of(false));
			assertThat(parser.parse("null").isNull()).isTrue();
		}

		@Test
		void bareIdentifierIsEnumLiteral() {
			CfgValue value = parser.parse("debug");

			assertThat(value.kind()).isEqualTo(ValueKind.ENUM);
			assertThat(value.asString()).contains("debug");
		}

		@Test
		void parsesNegativeNumbers() {
			assertThat(parser.parse("-7")).isEqualTo(CfgValue.of(-7L));
			assertThat(parser.parse("-2.5")).isEqualTo(CfgValue.of(-2.5));
			assertThat(parser.parse("-9223372036854775808")).isEqualTo(CfgValue.of(Long.MIN_VALUE));
		}

		@Test
		void trailingSemicolonIsAllowed() {
			assertThat(parser.parse("42;")).isEqualTo(CfgValue.of(42L));
		}

		@Test
		void exponentNumbersAreDoubles() {
			assertThat(parser.parse("1e3")).isEqualTo(CfgValue.of(1000.0));
		}
	}

	@Nested
	@DisplayName("Objects and documents")
	class ObjectsAndDocuments {

		@Test
		void parsesObjectLiteral() {
			CfgValue value = parser.parse("{ name = \"app\"; port = 8080; debug = true }");

			assertThat(value.kind()).isEqualTo(ValueKind.OBJECT);
			assertThat(value.size()).isEqualTo(3);
			assertThat(value.get("name")).contains(CfgValue.of("app"));
			assertThat(value.get("port")).contains(CfgValue.of(8080L));
			assertThat(value.get("debug")).contains(CfgValue.of(true));
		}

		@Test
		void separatorsAreOptional() {
			CfgValue value = parser.parse("{\n  a = 1\n  b = 2;\n}");

			assertThat(value.get("a")).contains(CfgValue.of(1L));
			assertThat(value.get("b")).contains(CfgValue.of(2L));
		}

		@Test
		void topLevelFieldListBecomesObject() {
			CfgValue value = parser.parse("name = \"app\"\nport = 8080\n");

			assertThat(value.kind()).isEqualTo(ValueKind.OBJECT);
			assertThat(value.get("name")).contains(CfgValue.of("app"));
			assertThat(value.get("port")).contains(CfgValue.of(8080L));
		}

		@Test
		void namedBlockIsNavigableByPath() {
			String config = """
					// primary store
					database {
					    host = "localhost"
					    port = 5432
					    replicas = ["r1", "r2"]
					}
					""";

			CfgValue value = parser.parse(config);

			assertThat(value.getPath("database.host")).contains(CfgValue.of("localhost"));
			assertThat(value.getPath("database.port")).contains(CfgValue.of(5432L));
			assertThat(value.getPath("database.replicas[1]")).contains(CfgValue.of("r2"));
		}

		@Test
		void typedObjectValue() {
			CfgValue value = parser.parse("server = Server { port = 80 }");

			assertThat(value.getPath("server.port")).contains(CfgValue.of(80L));
		}

		@Test
		void duplicateKeyKeepsLastValue() {
			CfgValue value = parser.parse("{ a = 1; a = 2 }");

			assertThat(value.size()).isEqualTo(1);
			assertThat(value.get("a")).contains(CfgValue.of(2L));
		}

		@Test
		void emptyObject() {
			CfgValue value = parser.parse("{}");

			assertThat(value.kind()).isEqualTo(ValueKind.OBJECT);
			assertThat(value.isEmpty()).isTrue();
		}

		@Test
		void keepsFieldOrder() {
			CfgValue value = parser.parse("{ zeta = 1; alpha = 2; mid = 3 }");

			assertThat(value.asMap().orElseThrow().keySet()).containsExactly("zeta", "alpha", "mid");
		}
	}

	@Nested
	@DisplayName("Arrays")
	class ArrayValues {

		@Test
		void parsesArray() {
			CfgValue value = parser.parse("[1, 2, 3]");

			assertThat(value.asList().orElseThrow()).containsExactly(
					CfgValue.of(1L), CfgValue.of(2L), CfgValue.of(3L));
		}

		@Test
		void commasAreOptionalAndMayTrail() {
			assertThat(parser.parse("[1 2 3]")).isEqualTo(parser.parse("[1, 2, 3,]"));
		}

		@Test
		void mixedAndNestedElements() {
			CfgValue value = parser.parse("[\"a\", [1, 2], { k = v }, null]");

			assertThat(value.size()).isEqualTo(4);
			assertThat(value.getPath("[1][0]")).contains(CfgValue.of(1L));
			assertThat(value.getPath("[2].k")).contains(CfgValue.enumValue("v"));
			assertThat(value.get(3).orElseThrow().isNull()).isTrue();
		}

		@Test
		void emptyArray() {
			assertThat(parser.parse("[]").isEmpty()).isTrue();
		}
	}

	@Nested
	@DisplayName("Syntax errors")
	class SyntaxErrors {

		@Test
		void emptyInputHasNoValue() {
			assertThatThrownBy(() -> parser.parse(""))
					.isInstanceOfSatisfying(CfgSyntaxException.class, e -> {
						assertThat(e.detail()).isEqualTo("Unexpected end of input, expected a value");
						assertThat(e.line()).isEqualTo(1);
						assertThat(e.column()).isEqualTo(1);
					});
		}

		@Test
		void unclosedObject() {
			assertThatThrownBy(() -> parser.parse("{ a = 1"))
					.isInstanceOfSatisfying(CfgSyntaxException.class,
							e -> assertThat(e.detail()).isEqualTo("Expected '}', found end of input"));
		}

		@Test
		void unclosedArray() {
			assertThatThrownBy(() -> parser.parse("[1, 2"))
					.isInstanceOfSatisfying(CfgSyntaxException.class,
							e -> assertThat(e.detail()).isEqualTo("Expected ']', found end of input"));
		}

		@Test
		void missingEquals() {
			assertThatThrownBy(() -> parser.parse("{ a 1 }"))
					.isInstanceOfSatisfying(CfgSyntaxException.class, e -> {
						assertThat(e.detail()).isEqualTo("Expected '=' after field 'a', found token '1'");
						assertThat(e.column()).isEqualTo(5);
					});
		}

		@Test
		void strayPunctuation() {
			assertThatThrownBy(() -> parser.parse(";"))
					.isInstanceOfSatisfying(CfgSyntaxException.class,
							e -> assertThat(e.detail()).isEqualTo("Unexpected token ';'"));
		}

		@Test
		void contentAfterTopLevelValue() {
			assertThatThrownBy(() -> parser.parse("42 43"))
					.isInstanceOfSatisfying(CfgSyntaxException.class,
							e -> assertThat(e.detail()).isEqualTo("Unexpected token '43' after top-level value"));
		}

		@Test
		void doubleDotIsNotANumber() {
			assertThatThrownBy(() -> parser.parse("1..2"))
					.isInstanceOfSatisfying(CfgSyntaxException.class,
							e -> assertThat(e.detail()).isEqualTo("Unexpected token '.' after top-level value"));
		}

		@Test
		void integerOverflow() {
			assertThatThrownBy(() -> parser.parse("99999999999999999999"))
					.isInstanceOf(CfgSyntaxException.class)
					.hasMessageContaining("Invalid integer: 99999999999999999999");
		}

		@Test
		void exponentWithoutDigits() {
			assertThatThrownBy(() -> parser.parse("1e"))
					.isInstanceOf(CfgSyntaxException.class)
					.hasMessageContaining("Invalid double: 1e");
		}

		@Test
		void minusWithoutNumber() {
			assertThatThrownBy(() -> parser.parse("- x"))
					.isInstanceOf(CfgSyntaxException.class)
					.hasMessageContaining("Unexpected token '-'");
		}

		@Test
		void errorsReportLineOfOffendingToken() {
			assertThatThrownBy(() -> parser.parse("a = 1\nb = 2\nc = ]"))
					.isInstanceOfSatisfying(CfgSyntaxException.class, e -> {
						assertThat(e.line()).isEqualTo(3);
						assertThat(e.column()).isEqualTo(5);
					});
		}

		@Test
		void syntaxErrorsAreParseExceptions() {
			assertThatThrownBy(() -> parser.parse("{"))
					.isInstanceOf(CfgParseException.class)
					.isInstanceOf(CfgException.class);
		}
	}

	@Nested
	@DisplayName("Environment references")
	@ExtendWith(MockitoExtension.class)
	class EnvironmentReferences {

		@Mock
		private EnvironmentLookup lookup;

		private final CfgParser envParser = new CfgParser(ParserOptions.defaults(),
				EnvironmentLookup.of(Map.of("DB_HOST", "db.internal", "EMPTY", "")));

		@Test
		void expandsSetVariable() {
			CfgValue value = envParser.parse("host = ${DB_HOST}");

			assertThat(value.get("host")).contains(CfgValue.of("db.internal"));
		}

		@Test
		void setVariableWinsOverDefault() {
			assertThat(envParser.parse("${DB_HOST:-localhost}")).isEqualTo(CfgValue.of("db.internal"));
		}

		@Test
		void emptyVariableIsStillSet() {
			assertThat(envParser.parse("${EMPTY:-fallback}")).isEqualTo(CfgValue.of(""));
		}

		@Test
		void unsetVariableUsesDefault() {
			assertThat(envParser.parse("${PORT:-5432}")).isEqualTo(CfgValue.of("5432"));
			assertThat(envParser.parse("${PORT:-}")).isEqualTo(CfgValue.of(""));
		}

		@Test
		void unsetVariableWithoutDefaultFails() {
			assertThatThrownBy(() -> envParser.parse("host = ${MISSING}"))
					.isInstanceOfSatisfying(CfgEnvVarException.class,
							e -> assertThat(e.variable()).isEqualTo("MISSING"))
					.hasMessageContaining("Environment variable not found");
		}

		@Test
		void disabledExpansionKeepsRawTextAndNeverConsultsEnvironment() {
			CfgParser raw = new CfgParser(ParserOptions.builder().expandEnvVars(false).build(), lookup);

			CfgValue value = raw.parse("host = ${DB_HOST:-localhost}");

			assertThat(value.get("host")).contains(CfgValue.of("${DB_HOST:-localhost}"));
			verifyNoInteractions(lookup);
		}

		@Test
		void defaultMayContainBraces() {
			CfgParser braces = new CfgParser(ParserOptions.defaults(), EnvironmentLookup.of(Map.of()));

			assertThat(braces.parse("${A:-{x}}")).isEqualTo(CfgValue.of("{x}"));
			assertThat(braces.parse("v = ${A:-{x}}").get("v")).contains(CfgValue.of("{x}"));
		}
	}

	@Nested
	@DisplayName("Parser options")
	class Options {

		@Test
		void syntaxOnlyReturnsNullValue() {
			CfgParser checker = new CfgParser(ParserOptions.builder().syntaxOnly(true).build());

			assertThat(checker.parse("{ a = [1, 2]; b { c = 3 } }").isNull()).isTrue();
		}

		@Test
		void syntaxOnlyReturnsNullValueForTopLevelScalars() {
			CfgParser checker = new CfgParser(ParserOptions.builder().syntaxOnly(true).build(),
					EnvironmentLookup.of(Map.of("X", "v")));

			assertThat(checker.parse("\"hello\"").isNull()).isTrue();
			assertThat(checker.parse("42").isNull()).isTrue();
			assertThat(checker.parse("${X}").isNull()).isTrue();
			assertThat(checker.parse("debug;").isNull()).isTrue();
		}

		@Test
		void syntaxOnlyStillReportsErrors() {
			CfgParser checker = new CfgParser(ParserOptions.builder().syntaxOnly(true).build());

			assertThatThrownBy(() -> checker.parse("{ a = }"))
					.isInstanceOf(CfgSyntaxException.class);
		}

		@Test
		void validateSyntaxLeavesParserUsable() {
			assertThatCode(() -> parser.validateSyntax("a = 1\nb = [2, 3]")).doesNotThrowAnyException();
			assertThatThrownBy(() -> parser.validateSyntax("a = ")).isInstanceOf(CfgSyntaxException.class);

			assertThat(parser.parse("a = 1").get("a")).contains(CfgValue.of(1L));
		}

		@Test
		void disabledIncludesAreSyntaxErrors() {
			CfgParser noIncludes = new CfgParser(ParserOptions.builder().processIncludes(false).build());

			assertThatThrownBy(() -> noIncludes.parse("@include \"other.cfg\""))
					.isInstanceOfSatisfying(CfgSyntaxException.class,
							e -> assertThat(e.detail()).isEqualTo("Include directives are disabled"));
		}

		@Test
		void defaults() {
			ParserOptions options = ParserOptions.defaults();

			assertThat(options.expandEnvVars()).isTrue();
			assertThat(options.processIncludes()).isTrue();
			assertThat(options.maxIncludeDepth()).isEqualTo(ParserOptions.DEFAULT_MAX_INCLUDE_DEPTH).isEqualTo(10);
			assertThat(options.includePaths()).containsExactly(Path.of("."));
			assertThat(options.syntaxOnly()).isFalse();
			assertThat(options.detectIncludeCycles()).isTrue();
		}

		@Test
		void emptyIncludePathsFallBackToWorkingDirectory() {
			ParserOptions options = ParserOptions.builder().includePaths(List.of()).build();

			assertThat(options.includePaths()).containsExactly(Path.of("."));
		}

		@Test
		void negativeDepthIsRejected() {
			assertThatThrownBy(() -> ParserOptions.builder().maxIncludeDepth(-1).build())
					.isInstanceOf(IllegalArgumentException.class);
		}

		@Test
		void toBuilderCopiesEverySetting() {
			ParserOptions options = ParserOptions.builder()
					.expandEnvVars(false)
					.maxIncludeDepth(3)
					.includePath(Path.of("conf"))
					.detectIncludeCycles(false)
					.build();

			assertThat(options.toBuilder().build()).isEqualTo(options);
			assertThat(options.toBuilder().syntaxOnly(true).build().maxIncludeDepth()).isEqualTo(3);
		}
	}

	@Nested
	@DisplayName("Readers")
	class Readers {

		@Test
		void parsesFromReader() {
			CfgValue value = parser.parse(new StringReader("{ a = 1 }"));

			assertThat(value.get("a")).contains(CfgValue.of(1L));
		}

		@Test
		void readFailureIsIoException() {
			Reader failing = new Reader() {
				@Override
				public int read(char[] buffer, int offset, int length) throws IOException {
					throw new IOException("disk gone");
				}

				@Override
				public void close() {
				}
			};

			assertThatThrownBy(() -> parser.parse(failing))
					.isInstanceOf(CfgIoException.class)
					.hasMessageContaining("disk gone")
					.hasCauseInstanceOf(IOException.class);
		}
	}
}
