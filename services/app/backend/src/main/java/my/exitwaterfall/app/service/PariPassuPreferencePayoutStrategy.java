package my.exitwaterfall.app.service;

import my.exitwaterfall.app.service.util.Amounts;
import my.exitwaterfall.app.service.util.ProRata;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pools the claims of one seniority rank and pays each the same fraction of its claim.
 */
public class PariPassuPreferencePayoutStrategy implements PreferencePayoutStrategy {

	@Override
	public List<BigDecimal> resolve(List<BigDecimal> claims, BigDecimal available) {
		Map<Integer, BigDecimal> byIndex = new LinkedHashMap<>();
		for (int i = 0; i < claims.size(); i++) {
			byIndex.put(i, Amounts.floorAtZero(Amounts.safe(claims.get(i))));
		}
		BigDecimal pooled = Amounts.sum(byIndex.values());
		BigDecimal payable = Amounts.min(pooled, Amounts.floorAtZero(Amounts.safe(available)));
		Map<Integer, BigDecimal> allocated = payable.compareTo(pooled) == 0
				? byIndex
				: ProRata.allocate(byIndex, payable);
		List<BigDecimal> paid = new ArrayList<>(claims.size());
		for (int i = 0; i < claims.size(); i++) {
			paid.add(allocated.getOrDefault(i, BigDecimal.ZERO));
		}
		return paid;
	}
}
