package my.exitwaterfall.app.service;

import my.exitwaterfall.app.model.CarveOutBeneficiary;
import my.exitwaterfall.app.model.ShareholderSummary;
import my.exitwaterfall.app.model.WaterfallConfig;
import my.exitwaterfall.app.service.util.Amounts;
import my.exitwaterfall.app.service.util.ProRata;
import my.exitwaterfall.app.service.util.ShareClasses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reserves a percentage of the distributable proceeds for a beneficiary group, split pro-rata by
 * shares plus options.
 */
public class CarveOutDistributor {
	private static final Logger logger = LoggerFactory.getLogger(CarveOutDistributor.class);
	private static final String LABEL = "Carve-Out";

	void distribute(WaterfallLedger ledger, WaterfallConfig config) {
		BigDecimal percent = Amounts.safe(config.carveOutPercent());
		if (percent.signum() <= 0) {
			return;
		}
		CarveOutBeneficiary beneficiary = config.carveOutBeneficiary() == null
				? CarveOutBeneficiary.EVERYONE
				: config.carveOutBeneficiary();
		int stepNumber = ledger.nextStepNumber();
		BigDecimal available = ledger.remaining();
		BigDecimal carveOut = Amounts.percentOf(available, percent);
		ledger.deduct(carveOut);

		Map<String, BigDecimal> weights = new LinkedHashMap<>();
		for (ShareholderAccount account : ledger.accounts()) {
			ShareholderSummary summary = account.summary();
			if (beneficiary.includes(summary.role()) && summary.fullyDilutedShares() > 0) {
				weights.put(account.shareholderId(), BigDecimal.valueOf(summary.fullyDilutedShares()));
			}
		}
		Map<String, BigDecimal> allocations = ProRata.allocate(weights, carveOut);
		if (allocations.isEmpty()) {
			ledger.abandon(carveOut);
			ledger.note("Carve-out of " + Amounts.format(carveOut) + " has no eligible shares for "
					+ beneficiary.name().toLowerCase() + "; amount left unallocated");
		}

		Map<String, Map<String, BigDecimal>> byClass = new LinkedHashMap<>();
		for (Map.Entry<String, BigDecimal> entry : allocations.entrySet()) {
			ShareholderAccount account = ledger.account(entry.getKey());
			account.addCarveOut(entry.getValue());
			Map<String, BigDecimal> holdings = new LinkedHashMap<>();
			ShareClasses.withOptions(account.summary())
					.forEach((shareClass, shares) -> holdings.put(shareClass, BigDecimal.valueOf(shares)));
			ProRata.allocate(holdings, entry.getValue()).forEach((shareClass, amount) ->
					byClass.computeIfAbsent(shareClass, key -> new LinkedHashMap<>())
							.merge(account.shareholderId(), amount, BigDecimal::add));
		}

		BigDecimal running = available;
		for (String shareClass : ShareClasses.displayOrder(byClass.keySet())) {
			Map<String, BigDecimal> recipients = byClass.get(shareClass);
			BigDecimal classTotal = Amounts.sum(recipients.values());
			running = running.subtract(classTotal);
			ledger.appendStep(stepNumber, LABEL, shareClass + " shares", shareClass, classTotal, running, false, recipients);
		}
		ledger.appendTotal(stepNumber, LABEL,
				percent.stripTrailingZeros().toPlainString() + "% allocation (" + beneficiary.name().toLowerCase() + ")",
				carveOut, ledger.remaining());
		logger.debug("Carve-out of {} to {} holders, remaining {}", carveOut, allocations.size(), ledger.remaining());
	}
}
