package my.exitwaterfall.app.service.util;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ProRataTest {

	@Test
	void allocatesProportionallyToWeights() {
		Map<String, BigDecimal> weights = new LinkedHashMap<>();
		weights.put("a", new BigDecimal("1"));
		weights.put("b", new BigDecimal("2"));

		Map<String, BigDecimal> allocated = ProRata.allocate(weights, new BigDecimal("100"));

		assertThat(allocated.get("a")).isCloseTo(new BigDecimal("33.3333333333"), within(new BigDecimal("0.0000001")));
		assertThat(allocated.get("b")).isCloseTo(new BigDecimal("66.6666666667"), within(new BigDecimal("0.0000001")));
		assertThat(Amounts.sum(allocated.values())).isCloseTo(new BigDecimal("100"), within(new BigDecimal("0.0000001")));
	}

	@Test
	void returnsNothingWhenWeightsSumToZero() {
		assertThat(ProRata.allocate(Map.of("a", BigDecimal.ZERO), new BigDecimal("100"))).isEmpty();
		assertThat(ProRata.allocate(Map.<String, BigDecimal>of(), new BigDecimal("100"))).isEmpty();
	}

	@Test
	void scalePaysZeroForZeroTotal() {
		Map<String, BigDecimal> scaled = ProRata.scale(Map.of("a", new BigDecimal("10")), new BigDecimal("5"), BigDecimal.ZERO);

		assertThat(scaled.get("a")).isEqualByComparingTo("0");
	}
}
