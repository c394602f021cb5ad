package my.exitwaterfall.app.service;

import my.exitwaterfall.app.config.AppProperties;
import my.exitwaterfall.app.dto.WaterfallRequest;
import my.exitwaterfall.app.dto.WaterfallValidateResponse;
import my.exitwaterfall.app.model.CapTable;
import my.exitwaterfall.app.model.CarveOutBeneficiary;
import my.exitwaterfall.app.model.PayoutStructure;
import my.exitwaterfall.app.model.ShareholderRole;
import my.exitwaterfall.app.model.WaterfallConfig;
import my.exitwaterfall.app.model.WaterfallResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;

import static my.exitwaterfall.app.service.CapTableFixtures.investment;
import static my.exitwaterfall.app.service.CapTableFixtures.round;
import static my.exitwaterfall.app.service.CapTableFixtures.shareholder;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WaterfallServiceTest {
	@Mock
	private WaterfallEngine engine;

	private WaterfallService service;

	@BeforeEach
	void setUp() {
		AppProperties properties = new AppProperties(
				new AppProperties.Waterfall(PayoutStructure.PARI_PASSU, false, true, 2, 5),
				new AppProperties.Scenarios("classpath:scenarios/demo-scenario.yaml"));
		service = new WaterfallService(engine, properties);
	}

	@Test
	void missingConfigFallsBackToServerDefaults() {
		when(engine.calculate(any(), any(), any(), any())).thenReturn(emptyResult());

		service.calculate(new WaterfallRequest(capTable(2), new BigDecimal("1000"), null, null));

		ArgumentCaptor<WaterfallConfig> captor = ArgumentCaptor.forClass(WaterfallConfig.class);
		verify(engine).calculate(any(), any(), any(), captor.capture());
		WaterfallConfig config = captor.getValue();
		assertThat(config.payoutStructure()).isEqualTo(PayoutStructure.PARI_PASSU);
		assertThat(config.conversionAnalysis()).isFalse();
		assertThat(config.deductOptionStrike()).isTrue();
		assertThat(config.carveOutPercent()).isEqualByComparingTo("0");
		assertThat(config.carveOutBeneficiary()).isEqualTo(CarveOutBeneficiary.EVERYONE);
	}

	@Test
	void explicitConfigValuesWin() {
		WaterfallConfig requested = new WaterfallConfig(new BigDecimal("5"), CarveOutBeneficiary.TEAM, PayoutStructure.COMMON_ONLY,
				null, null, null, false, null);

		WaterfallConfig applied = service.applyDefaults(requested);

		assertThat(applied.payoutStructure()).isEqualTo(PayoutStructure.COMMON_ONLY);
		assertThat(applied.carveOutBeneficiary()).isEqualTo(CarveOutBeneficiary.TEAM);
		assertThat(applied.deductOptionStrike()).isFalse();
		assertThat(applied.conversionAnalysis()).isFalse();
	}

	@Test
	void rejectsCapTablesAboveConfiguredLimits() {
		WaterfallRequest request = new WaterfallRequest(capTable(3), new BigDecimal("1000"), null, null);

		assertThatThrownBy(() -> service.calculate(request))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("capTable.shareholders");
		verifyNoInteractions(engine);
	}

	@Test
	void validateCollectsErrorsWithoutCalculating() {
		WaterfallValidateResponse response = service.validate(
				new WaterfallRequest(capTable(3), new BigDecimal("-1"), null, null));

		assertThat(response.valid()).isFalse();
		assertThat(response.errors()).anyMatch(e -> e.contains("capTable.shareholders"));
		assertThat(response.errors()).anyMatch(e -> e.contains("exitValuation"));
		verifyNoInteractions(engine);
	}

	private static CapTable capTable(int shareholders) {
		List<String> ids = List.of("s1", "s2", "s3", "s4").subList(0, shareholders);
		return new CapTable("Acme",
				List.of(round("founding", "Ordinary", investment("s1", 0, 1_000))),
				ids.stream().map(id -> shareholder(id, ShareholderRole.FOUNDER)).toList(),
				List.of());
	}

	private static WaterfallResult emptyResult() {
		return new WaterfallResult(new BigDecimal("1000"), new BigDecimal("1000"), List.of(), List.of(), List.of(),
				BigDecimal.ZERO, List.of("Liquidation preference references unknown round 'x'; skipped"));
	}
}
