package nl.utwente.ewi.fmt.SC2JANI.expression;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import nl.utwente.ewi.fmt.SC2JANI.ExpressionSyntaxException;

/** Splits expression-language source text into tokens. */
class ExpressionLexer
{
	enum TokenType { NUMBER, STRING, IDENTIFIER, PUNCTUATION, END }

	static class Token {
		final TokenType type;
		final String text;
		final Object value;
		final int position;

		Token(TokenType type, String text, Object value, int position) {
			this.type = type;
			this.text = text;
			this.value = value;
			this.position = position;
		}

		boolean is(String punct) {
			return type == TokenType.PUNCTUATION && text.equals(punct);
		}

		public String toString() {
			return type == TokenType.END ? "end of input" : "'" + text + "'";
		}
	}

	/* Longest first, so that "<=" is not read as "<" followed by "=". */
	private static final String[] PUNCTUATION = {
		"===", "!==",
		"==", "!=", "<=", ">=", "&&", "||", "=>",
		"(", ")", "[", "]", ",", ".", "?", ":", ";",
		"!", "-", "+", "*", "/", "%", "<", ">",
	};

	private final String source;
	private int pos;

	private ExpressionLexer(String source) {
		this.source = source;
	}

	static List<Token> tokenize(String source) {
		return new ExpressionLexer(source).run();
	}

	private List<Token> run() {
		ArrayList<Token> ret = new ArrayList<>();
		while (true) {
			while (pos < source.length() && Character.isWhitespace(source.charAt(pos)))
				pos++;
			if (pos >= source.length()) {
				ret.add(new Token(TokenType.END, "", null, pos));
				return ret;
			}
			char c = source.charAt(pos);
			if (Character.isDigit(c))
				ret.add(number());
			else if (c == '"' || c == '\'')
				ret.add(string(c));
			else if (Character.isLetter(c) || c == '_' || c == '$')
				ret.add(identifier());
			else
				ret.add(punctuation());
		}
	}

	private Token number() {
		int start = pos;
		boolean real = false;
		while (pos < source.length() && Character.isDigit(source.charAt(pos)))
			pos++;
		if (pos + 1 < source.length() && source.charAt(pos) == '.'
		    && Character.isDigit(source.charAt(pos + 1)))
		{
			real = true;
			pos++;
			while (pos < source.length() && Character.isDigit(source.charAt(pos)))
				pos++;
		}
		if (pos < source.length() && (source.charAt(pos) == 'e' || source.charAt(pos) == 'E')) {
			int save = pos++;
			if (pos < source.length() && (source.charAt(pos) == '+' || source.charAt(pos) == '-'))
				pos++;
			if (pos < source.length() && Character.isDigit(source.charAt(pos))) {
				real = true;
				while (pos < source.length() && Character.isDigit(source.charAt(pos)))
					pos++;
			} else {
				pos = save;
			}
		}
		String text = source.substring(start, pos);
		if (pos < source.length() && Character.isLetter(source.charAt(pos)))
			throw new ExpressionSyntaxException("Invalid number at position " + start, source);
		Object value;
		try {
			if (real)
				value = Double.valueOf(text);
			else
				value = longOrBig(text);
		} catch (NumberFormatException e) {
			throw new ExpressionSyntaxException("Invalid number '" + text + "'", source);
		}
		return new Token(TokenType.NUMBER, text, value, start);
	}

	/* Magnitudes beyond Long.MAX_VALUE are kept, as the negation of
	 * 9223372036854775808 is still a long. */
	private static Object longOrBig(String text) {
		BigInteger v = new BigInteger(text);
		if (v.bitLength() < 64)
			return v.longValue();
		return v;
	}

	private Token string(char quote) {
		int start = pos++;
		StringBuilder ret = new StringBuilder();
		while (true) {
			if (pos >= source.length())
				throw new ExpressionSyntaxException("Unterminated string literal", source);
			char c = source.charAt(pos++);
			if (c == quote)
				break;
			if (c == '\\') {
				if (pos >= source.length())
					throw new ExpressionSyntaxException("Unterminated string literal", source);
				char escaped = source.charAt(pos++);
				switch (escaped) {
				case 'n': ret.append('\n'); break;
				case 't': ret.append('\t'); break;
				case 'r': ret.append('\r'); break;
				case '0': ret.append('\0'); break;
				default: ret.append(escaped);
				}
			} else {
				ret.append(c);
			}
		}
		return new Token(TokenType.STRING, source.substring(start, pos), ret.toString(), start);
	}

	private Token identifier() {
		int start = pos;
		while (pos < source.length()) {
			char c = source.charAt(pos);
			if (!Character.isLetterOrDigit(c) && c != '_' && c != '$')
				break;
			pos++;
		}
		String text = source.substring(start, pos);
		return new Token(TokenType.IDENTIFIER, text, text, start);
	}

	private Token punctuation() {
		for (String p : PUNCTUATION) {
			if (source.startsWith(p, pos)) {
				int start = pos;
				pos += p.length();
				return new Token(TokenType.PUNCTUATION, p, p, start);
			}
		}
		throw new ExpressionSyntaxException("Unexpected character '" + source.charAt(pos) + "' at position " + pos, source);
	}
}
