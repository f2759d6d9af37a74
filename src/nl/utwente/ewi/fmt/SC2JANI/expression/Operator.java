package nl.utwente.ewi.fmt.SC2JANI.expression;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import nl.utwente.ewi.fmt.SC2JANI.UnknownOperatorException;

/**
 * The closed table of operators an {@link OperatorExpression} may
 * use, with the names of the operands each of them takes.
 *
 * Macro operators are not part of the JANI format and must be
 * removed by {@link MacroExpansion} before a model is written.
 * The array value operator ("av") has its own expression class,
 * {@link ArrayValueExpression}, since its operand is a list.
 */
public enum Operator {
	EQUALS("=", true, "left", "right"),
	NOT_EQUALS("≠", true, "left", "right"),
	LESS("<", true, "left", "right"),
	LESS_OR_EQUAL("≤", true, "left", "right"),
	GREATER(">", true, "left", "right"),
	GREATER_OR_EQUAL("≥", true, "left", "right"),
	AND("∧", true, "left", "right"),
	OR("∨", true, "left", "right"),
	IMPLIES("⇒", true, "left", "right"),
	NOT("¬", true, "exp"),
	ADD("+", false, "left", "right"),
	SUBTRACT("-", false, "left", "right"),
	MULTIPLY("*", false, "left", "right"),
	DIVIDE("/", false, "left", "right"),
	MODULO("%", false, "left", "right"),
	POW("pow", false, "left", "right"),
	LOG("log", false, "left", "right"),
	MIN("min", false, "left", "right"),
	MAX("max", false, "left", "right"),
	FLOOR("floor", false, "exp"),
	CEIL("ceil", false, "exp"),
	ABS("abs", false, "exp"),
	SIN("sin", false, "exp"),
	COS("cos", false, "exp"),
	ITE("ite", false, "if", "then", "else"),
	ARRAY_ACCESS("aa", false, "exp", "index"),
	ARRAY_CONSTRUCTOR("ac", false, "var", "length", "exp"),

	NORM2D("norm2d", false, true, "x", "y"),
	DOT2D("dot2d", false, true, "x1", "y1", "x2", "y2"),
	CROSS2D("cross2d", false, true, "x1", "y1", "x2", "y2"),
	ROUND("round", false, true, "exp"),
	TO_CM("to_cm", false, true, "exp"),
	TO_M("to_m", false, true, "exp"),
	TO_DEG("to_deg", false, true, "exp"),
	TO_RAD("to_rad", false, true, "exp"),
	INTERSECT("intersect", false, true, "robot", "barrier"),
	DISTANCE("distance", false, true, "robot", "barrier"),
	DISTANCE_TO_POINT("distance_to_point", false, true, "robot", "x", "y"),
	;

	/** Symbol used for the operator in JANI files. */
	public final String symbol;
	public final boolean returnsBoolean;
	public final boolean macro;
	public final List<String> operands;

	Operator(String symb, boolean ret, String... operands) {
		this(symb, ret, false, operands);
	}

	Operator(String symb, boolean ret, boolean macro, String... operands) {
		symbol = symb;
		returnsBoolean = ret;
		this.macro = macro;
		this.operands = List.of(operands);
	}

	private static final Map<String, Operator> BY_SYMBOL = new TreeMap<>();
	static {
		for (Operator op : values())
			BY_SYMBOL.put(op.symbol, op);
		BY_SYMBOL.put("!", NOT);
		BY_SYMBOL.put("&&", AND);
		BY_SYMBOL.put("and", AND);
		BY_SYMBOL.put("||", OR);
		BY_SYMBOL.put("or", OR);
		BY_SYMBOL.put("==", EQUALS);
		BY_SYMBOL.put("!=", NOT_EQUALS);
		BY_SYMBOL.put(">=", GREATER_OR_EQUAL);
		BY_SYMBOL.put("<=", LESS_OR_EQUAL);
		BY_SYMBOL.put("=>", IMPLIES);
	}

	/** Look up an operator by its JANI symbol or one of the accepted
	 * aliases ("&&", "==", "!", ...).
	 */
	public static Operator fromSymbol(String symbol) {
		Operator ret = BY_SYMBOL.get(symbol);
		if (ret == null)
			throw new UnknownOperatorException(symbol);
		return ret;
	}
}
