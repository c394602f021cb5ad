package my.exitwaterfall.app.service.util;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Collection;

public final class Amounts {
	public static final MathContext MATH = MathContext.DECIMAL128;
	public static final BigDecimal ZERO = BigDecimal.ZERO;
	public static final BigDecimal ONE_HUNDRED = new BigDecimal("100");
	public static final int MONEY_SCALE = 8;
	public static final int RATIO_SCALE = 4;

	private Amounts() {
	}

	public static BigDecimal safe(BigDecimal value) {
		return value == null ? ZERO : value;
	}

	public static BigDecimal percentOf(BigDecimal base, BigDecimal percent) {
		return safe(base).multiply(safe(percent)).divide(ONE_HUNDRED, MATH);
	}

	public static BigDecimal min(BigDecimal left, BigDecimal right) {
		return left.compareTo(right) <= 0 ? left : right;
	}

	public static BigDecimal floorAtZero(BigDecimal value) {
		return value.signum() < 0 ? ZERO : value;
	}

	public static BigDecimal sum(Collection<BigDecimal> values) {
		BigDecimal total = ZERO;
		for (BigDecimal value : values) {
			if (value != null) {
				total = total.add(value);
			}
		}
		return total;
	}

	public static BigDecimal money(BigDecimal value) {
		return safe(value).setScale(MONEY_SCALE, RoundingMode.HALF_EVEN);
	}

	public static BigDecimal ratio(BigDecimal numerator, BigDecimal denominator, int scale) {
		if (denominator == null || denominator.signum() == 0) {
			return ZERO.setScale(scale);
		}
		return safe(numerator).divide(denominator, scale, RoundingMode.HALF_UP);
	}

	public static String format(BigDecimal value) {
		return safe(value).setScale(2, RoundingMode.HALF_UP).toPlainString();
	}
}
