package my.exitwaterfall.app.service;

import my.exitwaterfall.app.service.util.Amounts;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Pays claims one after the other until the proceeds run out.
 */
public class StandardPreferencePayoutStrategy implements PreferencePayoutStrategy {

	@Override
	public List<BigDecimal> resolve(List<BigDecimal> claims, BigDecimal available) {
		List<BigDecimal> paid = new ArrayList<>(claims.size());
		BigDecimal left = Amounts.floorAtZero(Amounts.safe(available));
		for (BigDecimal claim : claims) {
			BigDecimal amount = Amounts.min(Amounts.floorAtZero(Amounts.safe(claim)), left);
			paid.add(amount);
			left = left.subtract(amount);
		}
		return paid;
	}
}
