package org.lokray.checker.parser;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.lokray.checker.environment.Environment;
import org.lokray.checker.environment.IntegrityException;
import org.lokray.checker.environment.decl.Constructor;
import org.lokray.checker.environment.decl.Inductive;
import org.lokray.checker.environment.term.*;
import org.lokray.checker.util.LineException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CommandDispatcherTest
{
	private Environment env;
	private CommandDispatcher dispatcher;

	@BeforeEach
	void setUp()
	{
		env = new Environment();
		dispatcher = new CommandDispatcher(env);
	}

	private void apply(String... lines) throws LineException
	{
		for (String line : lines)
		{
			dispatcher.dispatch(line);
		}
	}

	@Test
	@DisplayName("#NS and #NI build hierarchical names")
	void names() throws LineException
	{
		apply("1 #NS 0 foo", "2 #NS 1 bla", "3 #NI 2 1", "4 #NS 3 boo");

		assertThat(env.renderName(4)).isEqualTo("foo.bla.1.boo");
		assertThat(env.getName(1).getParent()).isEmpty();
		assertThat(env.getName(3)).isInstanceOf(NumericName.class);
		assertThat(env.getName(3).getParent()).contains(2);
	}

	@Test
	@DisplayName("A text segment may itself be all digits")
	void nameString_acceptsDigits() throws LineException
	{
		apply("1 #NS 0 123");

		assertThat(env.getName(1)).isInstanceOf(StringName.class);
		assertThat(env.renderName(1)).isEqualTo("123");
	}

	@Test
	@DisplayName("#US #UM #UIM #UP build levels")
	void levels() throws LineException
	{
		apply("1 #NS 0 l1", "2 #NS 0 l2",
				"1 #US 0", "2 #US 1", "3 #UP 1", "4 #UP 2", "5 #UM 2 3", "6 #UIM 5 4");

		assertThat(env.renderLevel(6)).isEqualTo("(imax (max (succ (succ 0)) l1) l2)");
	}

	@Test
	@DisplayName("Expression commands build every expression kind")
	void expressions() throws LineException
	{
		apply("1 #NS 0 x", "2 #NS 0 f", "1 #US 0",
				"1 #ES 1",
				"2 #EV 0",
				"3 #EC 2 0 1",
				"4 #EA 3 2",
				"5 #EL #BI 1 1 4",
				"6 #EP #BC 1 1 2");

		assertThat(env.getExpr(1)).isInstanceOf(SortExpr.class);
		assertThat(env.getExpr(3)).isInstanceOf(ConstantExpr.class);
		assertThat(((ConstantExpr) env.getExpr(3)).getLevels()).containsExactly(0, 1);
		assertThat(env.getExpr(5)).isInstanceOf(LambdaExpr.class);
		assertThat(((BinderExpr) env.getExpr(6)).getInfo()).isEqualTo(BinderInfo.INST_IMPLICIT);
		assertThat(env.renderExpr(5)).isEqualTo("{x : Sort (succ 0)}, (f.{0,(succ 0)} x)");
		assertThat(env.renderExpr(6)).isEqualTo("[x : Sort (succ 0)], x");
	}

	@Test
	@DisplayName("A constant without level arguments")
	void constant_withoutLevels() throws LineException
	{
		apply("1 #NS 0 nat", "1 #EC 1");

		assertThat(((ConstantExpr) env.getExpr(1)).getLevels()).isEmpty();
		assertThat(env.renderExpr(1)).isEqualTo("nat");
	}

	@Test
	@DisplayName("#DEF with and without level parameters")
	void definition() throws LineException
	{
		apply("1 #NS 0 id", "2 #NS 0 x", "3 #NS 0 u", "4 #NS 0 id2",
				"1 #ES 0", "2 #EV 0", "3 #EL #BD 2 1 2",
				"#DEF 1 1 3",
				"#DEF 4 1 3 3");

		assertThat(env.renderDeclaration(1)).isEqualTo("definition id Sort 0 := (x : Sort 0), x");
		assertThat(env.renderDeclaration(4)).isEqualTo("definition id2.{u} Sort 0 := (x : Sort 0), x");
	}

	@Test
	@DisplayName("#IND reads exactly the announced number of constructors, then level parameters")
	void inductive() throws LineException
	{
		apply("1 #NS 0 nat", "2 #NS 1 zero", "3 #NS 1 succ", "4 #NS 0 n", "5 #NS 0 u",
				"1 #US 0", "1 #ES 1", "2 #EC 1", "3 #EP #BD 4 2 2",
				"#IND 0 1 1 2 2 2 3 3 5");

		Inductive ind = (Inductive) env.getDeclaration(1);
		assertThat(ind.getConstructors()).containsExactly(new Constructor(2, 2), new Constructor(3, 3));
		assertThat(ind.getLevelParams()).containsExactly(5);
		assertThat(env.renderDeclaration(1)).isEqualTo(
				"inductive nat {u} Sort (succ 0)\n| nat.zero : nat\n| nat.succ : (n : nat), nat");
	}

	@Test
	@DisplayName("#IND fails when fewer constructor fields than announced are present")
	void inductive_missingConstructorFields() throws LineException
	{
		apply("1 #NS 0 nat", "2 #NS 1 zero", "1 #ES 0");

		assertThatThrownBy(() -> dispatcher.dispatch("#IND 0 1 1 2 2 1"))
				.isInstanceOf(GrammarException.class)
				.hasMessage("Expecting constructor name index");
		assertThat(env.declarationCount()).isZero();
	}

	@ParameterizedTest
	@ValueSource(strings = {
			"2 #NS 0 foo extra",
			"2 #NI 0 5 6",
			"1 #US 0 0",
			"1 #UM 0 0 0",
			"1 #UP 1 x",
			"2 #ES 0 0",
			"2 #EV 0 1",
			"2 #EA 1 1 1",
			"2 #EC 1 0 foo",
			"2 #EL #BD 1 1 1 1",
			"#DEF 1 1 1 1 zz"
	})
	@DisplayName("Trailing tokens are rejected and nothing is inserted")
	void trailingTokens_areRejected(String line) throws LineException
	{
		apply("1 #NS 0 a", "1 #ES 0");
		int names = env.nameCount();
		int levels = env.levelCount();
		int exprs = env.exprCount();

		assertThatThrownBy(() -> dispatcher.dispatch(line))
				.isInstanceOf(GrammarException.class)
				.hasMessageStartingWith("Expecting end of line");
		assertThat(env.nameCount()).isEqualTo(names);
		assertThat(env.levelCount()).isEqualTo(levels);
		assertThat(env.exprCount()).isEqualTo(exprs);
		assertThat(env.declarationCount()).isZero();
	}

	@Test
	@DisplayName("Missing and malformed fields are grammar errors")
	void malformedFields() throws LineException
	{
		apply("1 #NS 0 a");

		assertThatThrownBy(() -> dispatcher.dispatch("2 #NS 0"))
				.isInstanceOf(GrammarException.class)
				.hasMessage("Expecting identifier");
		assertThatThrownBy(() -> dispatcher.dispatch("2 #NI 0 x"))
				.isInstanceOf(GrammarException.class)
				.hasMessage("Expecting integer, found 'x'");
		assertThatThrownBy(() -> dispatcher.dispatch("1 #US"))
				.isInstanceOf(GrammarException.class)
				.hasMessage("Expecting level index");
		assertThatThrownBy(() -> dispatcher.dispatch("2 #EV -1"))
				.isInstanceOf(GrammarException.class)
				.hasMessage("Expecting integer, found '-1'");
		assertThatThrownBy(() -> dispatcher.dispatch("2"))
				.isInstanceOf(GrammarException.class)
				.hasMessage("Expecting index command");
		assertThatThrownBy(() -> dispatcher.dispatch(""))
				.isInstanceOf(GrammarException.class)
				.hasMessage("Expecting index or command");
	}

	@Test
	@DisplayName("Binder info must be one of the four annotations")
	void binderInfo_isValidated() throws LineException
	{
		apply("1 #NS 0 x", "1 #ES 0");

		assertThatThrownBy(() -> dispatcher.dispatch("2 #EL #BX 1 1 1"))
				.isInstanceOf(GrammarException.class)
				.hasMessageContaining("found '#BX'");
		assertThatThrownBy(() -> dispatcher.dispatch("2 #EP 1 1 1 1"))
				.isInstanceOf(GrammarException.class)
				.hasMessageContaining("Expecting binder info");
		assertThat(env.lookupExpr(2)).isEmpty();
	}

	@Test
	@DisplayName("Unknown tags and misplaced tags are grammar errors")
	void unknownTags() throws LineException
	{
		assertThatThrownBy(() -> dispatcher.dispatch("1 #XX 0"))
				.isInstanceOf(GrammarException.class)
				.hasMessage("Unknown index command '#XX'");
		assertThatThrownBy(() -> dispatcher.dispatch("#XX 0"))
				.isInstanceOf(GrammarException.class)
				.hasMessage("Unknown command '#XX'");
		assertThatThrownBy(() -> dispatcher.dispatch("#NS 0 foo"))
				.isInstanceOf(GrammarException.class)
				.hasMessage("Expecting index before #NS");
		assertThatThrownBy(() -> dispatcher.dispatch("1 #DEF 1 1 1"))
				.isInstanceOf(GrammarException.class)
				.hasMessage("Command #DEF does not take an index");
	}

	@ParameterizedTest
	@ValueSource(strings = {"1 #EJ 1 0 1", "1 #ELN 5", "1 #ELS 68 69", "1 #EZ 1 1 1 1",
			"#AX 1 1", "#QUOT", "#PREFIX 1 10 +", "#POSTFIX 1 10 !", "#INFIX 1 65 +"})
	@DisplayName("Recognised but unsupported commands are reported as such")
	void unsupportedTags(String line)
	{
		assertThatThrownBy(() -> dispatcher.dispatch(line))
				.isInstanceOf(UnsupportedFeatureException.class)
				.hasMessageEndingWith("is not supported");
	}

	@Test
	@DisplayName("Integrity errors from the environment propagate unchanged")
	void integrityErrors_propagate() throws LineException
	{
		apply("1 #NS 0 a");

		assertThatThrownBy(() -> dispatcher.dispatch("1 #NS 0 b"))
				.isInstanceOf(IntegrityException.class)
				.hasMessage("Name index 1 is already defined");
		assertThatThrownBy(() -> dispatcher.dispatch("2 #NS 7 b"))
				.isInstanceOf(IntegrityException.class)
				.hasMessage("Reference to undefined name 7");
		assertThatThrownBy(() -> dispatcher.dispatch("1 #EC 1 3"))
				.isInstanceOf(IntegrityException.class)
				.hasMessage("Reference to undefined level 3");
		assertThat(env.renderName(1)).isEqualTo("a");
		assertThat(env.exprCount()).isZero();
	}
}
