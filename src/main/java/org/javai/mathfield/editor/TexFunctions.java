package org.javai.mathfield.editor;

import java.util.List;
import org.javai.mathfield.tex.ArgumentKind;
import org.javai.mathfield.tex.TexFunction;

/**
 * Factories for the function shapes a math keyboard commonly inserts.
 * Every call returns a fresh function with empty arguments.
 */
public final class TexFunctions {

	private TexFunctions() {
		// Utility class - no instantiation
	}

	/**
	 * <code>\frac{numerator}{denominator}</code>
	 */
	public static TexFunction fraction() {
		return new TexFunction("\\frac", List.of(ArgumentKind.BRACES, ArgumentKind.BRACES));
	}

	/**
	 * <code>\sqrt{radicand}</code>
	 */
	public static TexFunction squareRoot() {
		return new TexFunction("\\sqrt", List.of(ArgumentKind.BRACES));
	}

	/**
	 * <code>\sqrt[index]{radicand}</code>
	 */
	public static TexFunction nthRoot() {
		return new TexFunction("\\sqrt", List.of(ArgumentKind.BRACKETS, ArgumentKind.BRACES));
	}

	/**
	 * <code>^{exponent}</code>, attached to whatever precedes it.
	 */
	public static TexFunction power() {
		return new TexFunction("^", List.of(ArgumentKind.BRACES));
	}

	/**
	 * <code>\log_{base}(argument)</code>
	 */
	public static TexFunction logarithm() {
		return new TexFunction("\\log_", List.of(ArgumentKind.BRACES, ArgumentKind.PARENTHESES));
	}

	/**
	 * <code>\ln(argument)</code>
	 */
	public static TexFunction naturalLogarithm() {
		return new TexFunction("\\ln", List.of(ArgumentKind.PARENTHESES));
	}

	/**
	 * <code>|argument|</code>
	 */
	public static TexFunction absoluteValue() {
		return new TexFunction("", List.of(ArgumentKind.VERTICAL_BARS));
	}

	/**
	 * <code>\int _{lower}^{upper}</code>. The middle slot is the power separator.
	 */
	public static TexFunction definiteIntegral() {
		return new TexFunction("\\int _", List.of(ArgumentKind.BRACES, ArgumentKind.POWER, ArgumentKind.BRACES));
	}

	/**
	 * <code>\sum_{lower}^{upper}</code>. The middle slot is the power separator.
	 */
	public static TexFunction sum() {
		return new TexFunction("\\sum_", List.of(ArgumentKind.BRACES, ArgumentKind.POWER, ArgumentKind.BRACES));
	}

	/**
	 * <code>name(argument)</code>, e.g. {@code f(x)}.
	 *
	 * @param name the function name
	 * @return the function
	 */
	public static TexFunction namedFunction(String name) {
		return new TexFunction(name, List.of(ArgumentKind.PARENTHESES));
	}
}
