package my.exitwaterfall.app.service.util;

import my.exitwaterfall.app.model.ShareholderSummary;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

public final class ShareClasses {
	public static final String ORDINARY = "Ordinary";

	private ShareClasses() {
	}

	/**
	 * Display order of share classes in the step trace: reverse-alphabetical, "Ordinary" last.
	 */
	public static List<String> displayOrder(Collection<String> classes) {
		List<String> ordered = new ArrayList<>(new LinkedHashSet<>(classes));
		ordered.sort(Comparator.<String, Boolean>comparing(ORDINARY::equals)
				.thenComparing(Comparator.<String>reverseOrder()));
		return ordered;
	}

	/**
	 * Holdings per class with every option counted as an ordinary share.
	 */
	public static Map<String, Long> withOptions(ShareholderSummary summary) {
		Map<String, Long> holdings = new LinkedHashMap<>();
		summary.sharesByClass().forEach((shareClass, shares) -> {
			if (shares != null && shares > 0) {
				holdings.merge(shareClass, shares, Long::sum);
			}
		});
		if (summary.totalOptions() > 0) {
			holdings.merge(ORDINARY, summary.totalOptions(), Long::sum);
		}
		return holdings;
	}
}
