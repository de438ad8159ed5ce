package org.javai.latexify.render;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Formats floating point values the way the expression language prints them:
 * the shortest round-tripping digits, positional notation for decimal exponents
 * from -4 to 15 (always with a fractional part) and {@code 1.5e-05} style otherwise.
 */
final class PythonNumberFormat {

	private static final int MIN_POSITIONAL_EXPONENT = -4;
	private static final int MAX_POSITIONAL_EXPONENT = 16;
	private static final int MAX_SIGNIFICANT_DIGITS = 17;

	private PythonNumberFormat() {
	}

	static String format(double value) {
		if (Double.isNaN(value)) {
			return "nan";
		}
		if (Double.isInfinite(value)) {
			return value > 0 ? "inf" : "-inf";
		}
		String sign = (value < 0 || (value == 0.0 && 1.0 / value < 0)) ? "-" : "";
		double magnitude = Math.abs(value);
		if (magnitude == 0.0) {
			return sign + "0.0";
		}

		BigDecimal decimal = shortestDigits(magnitude);
		String digits = decimal.unscaledValue().toString();
		int exponent = digits.length() - 1 - decimal.scale();

		if (exponent >= MIN_POSITIONAL_EXPONENT && exponent < MAX_POSITIONAL_EXPONENT) {
			String plain = decimal.toPlainString();
			return sign + (plain.indexOf('.') < 0 ? plain + ".0" : plain);
		}

		StringBuilder sb = new StringBuilder(sign);
		sb.append(digits.charAt(0));
		if (digits.length() > 1) {
			sb.append('.').append(digits, 1, digits.length());
		}
		sb.append('e').append(exponent < 0 ? '-' : '+');
		int absExponent = Math.abs(exponent);
		if (absExponent < 10) {
			sb.append('0');
		}
		sb.append(absExponent);
		return sb.toString();
	}

	/**
	 * Fewest significant digits that read back as the same double. Among candidates of
	 * that length the one nearest the exact binary value wins.
	 */
	private static BigDecimal shortestDigits(double magnitude) {
		BigDecimal exact = new BigDecimal(magnitude);
		for (int precision = 1; precision < MAX_SIGNIFICANT_DIGITS; precision++) {
			BigDecimal candidate = exact.round(new MathContext(precision, RoundingMode.HALF_EVEN));
			if (Double.parseDouble(candidate.toString()) == magnitude) {
				return candidate.stripTrailingZeros();
			}
		}
		return exact.round(new MathContext(MAX_SIGNIFICANT_DIGITS, RoundingMode.HALF_EVEN)).stripTrailingZeros();
	}
}
