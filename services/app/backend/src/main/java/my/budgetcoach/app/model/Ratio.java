package my.budgetcoach.app.model;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * A ratio that may be undefined because its denominator is zero.
 * Undefined ratios always carry a value of {@code 0.0}.
 */
@Schema(description = "Ratio with an explicit defined flag; value is 0 when undefined.")
public record Ratio(boolean defined, double value) {
	private static final Ratio UNDEFINED = new Ratio(false, 0.0d);

	public static Ratio of(double numerator, double denominator) {
		if (denominator == 0.0d) {
			return UNDEFINED;
		}
		return new Ratio(true, numerator / denominator);
	}

	public static Ratio undefined() {
		return UNDEFINED;
	}

	public boolean isBelow(double threshold) {
		return defined && value < threshold;
	}

	public boolean isAbove(double threshold) {
		return defined && value > threshold;
	}
}
