package org.javai.latexify.expr;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Construction invariants of the expression tree records.
 */
class ExpressionTreeTest {

	@Test
	void compareRequiresMatchingOperatorsAndComparators() {
		assertThatThrownBy(() -> new Compare(new Identifier("a"),
				List.of(Compare.Operator.LT, Compare.Operator.LT),
				List.of(new Identifier("b"))))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("2 operators but 1 comparators");
	}

	@Test
	void compareRequiresAtLeastOneOperator() {
		assertThatThrownBy(() -> new Compare(new Identifier("a"), List.of(), List.of()))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void boolOpRequiresTwoOperands() {
		assertThatThrownBy(() -> new BoolOp(BoolOp.Operator.AND, List.of(new Identifier("a"))))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("at least two");
	}

	@Test
	void identifierMustHaveName() {
		assertThatThrownBy(() -> new Identifier("")).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> new Identifier(null)).isInstanceOf(NullPointerException.class);
	}

	@Test
	void constantRejectsForeignValueTypes() {
		assertThatThrownBy(() -> new Constant(List.of()))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void constantTypeNames() {
		assertThat(Constant.ofInteger(1).typeName()).isEqualTo("int");
		assertThat(Constant.ofFloat(1.0).typeName()).isEqualTo("float");
		assertThat(Constant.ofString("s").typeName()).isEqualTo("str");
		assertThat(Constant.ofBoolean(false).typeName()).isEqualTo("bool");
		assertThat(Constant.none().typeName()).isEqualTo("NoneType");
	}

	@Test
	void argumentListsAreCopied() {
		List<Expression> args = new ArrayList<>();
		args.add(new Identifier("x"));
		Call call = new Call(new Identifier("f"), args);
		args.add(new Identifier("y"));

		assertThat(call.args()).hasSize(1);
		assertThatThrownBy(() -> call.args().add(new Identifier("z")))
				.isInstanceOf(UnsupportedOperationException.class);
	}

	@Test
	void withNameLeavesOriginalUntouched() {
		Call call = Call.of("f", new Identifier("x"));
		Call renamed = call.withName("f'");

		assertThat(call.name()).isEqualTo("f");
		assertThat(renamed.name()).isEqualTo("f'");
		assertThat(renamed.args()).isEqualTo(call.args());
	}

	@Test
	void visitorDispatchesByKind() {
		ExpressionVisitor<String> kinds = new ExpressionVisitor<>() {
			@Override public String visitConstant(Constant constant) { return "constant"; }
			@Override public String visitIdentifier(Identifier identifier) { return "identifier"; }
			@Override public String visitCall(Call call) { return "call"; }
			@Override public String visitUnaryOp(UnaryOp unaryOp) { return "unary"; }
			@Override public String visitBinOp(BinOp binOp) { return "binary"; }
			@Override public String visitBoolOp(BoolOp boolOp) { return "boolean"; }
			@Override public String visitCompare(Compare compare) { return "compare"; }
			@Override public String visitSet(SetLiteral set) { return "set"; }
			@Override public String visitTuple(TupleLiteral tuple) { return "tuple"; }
			@Override public String visitUnsupported(Unsupported unsupported) { return "unsupported"; }
		};
		Identifier x = new Identifier("x");

		assertThat(Constant.ofInteger(1).accept(kinds)).isEqualTo("constant");
		assertThat(x.accept(kinds)).isEqualTo("identifier");
		assertThat(Call.of("f").accept(kinds)).isEqualTo("call");
		assertThat(new UnaryOp(UnaryOp.Operator.MINUS, x).accept(kinds)).isEqualTo("unary");
		assertThat(new BinOp(BinOp.Operator.ADD, x, x).accept(kinds)).isEqualTo("binary");
		assertThat(new BoolOp(BoolOp.Operator.OR, List.of(x, x)).accept(kinds)).isEqualTo("boolean");
		assertThat(new Compare(x, List.of(Compare.Operator.EQ), List.of(x)).accept(kinds)).isEqualTo("compare");
		assertThat(new SetLiteral(List.of(x)).accept(kinds)).isEqualTo("set");
		assertThat(new TupleLiteral(List.of(x)).accept(kinds)).isEqualTo("tuple");
		assertThat(new Unsupported("List", List.of()).accept(kinds)).isEqualTo("unsupported");
	}
}
