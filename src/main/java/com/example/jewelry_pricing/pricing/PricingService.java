package com.example.jewelry_pricing.pricing;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.example.jewelry_pricing.catalog.CatalogResolver;
import com.example.jewelry_pricing.dto.CalculatePriceRequest;
import com.example.jewelry_pricing.dto.StoneSelection;
import com.example.jewelry_pricing.fx.ExchangeRateProvider;
import com.example.jewelry_pricing.gold.GoldPriceProvider;
import com.example.jewelry_pricing.market.MarketReading;

import lombok.RequiredArgsConstructor;

/**
 * Resolves a request against the catalog, reads both market caches without waiting on the
 * network, and hands everything to {@link PriceCalculator}.
 */
@Service
@RequiredArgsConstructor
public class PricingService {

    private static final Logger log = LoggerFactory.getLogger(PricingService.class);

    private final CatalogResolver catalog;
    private final GoldPriceProvider goldPriceProvider;
    private final ExchangeRateProvider exchangeRateProvider;
    private final PriceCalculator calculator;

    public PricingResult calculate(CalculatePriceRequest req) {
        // invalid input propagates as IllegalArgumentException (400)
        Optional<MetalComponent> metal = catalog.resolveMetal(req.getMetalTypeId(), req.getMetalWeight());
        if (req.getMetalWeight() != null && req.getMetalWeight().signum() < 0) {
            throw new IllegalArgumentException("metalWeight must not be negative: " + req.getMetalWeight());
        }
        StoneComponent primary = stone(req.getPrimaryStone());
        List<StoneComponent> secondary = new ArrayList<>();
        if (req.getSecondaryStones() != null) {
            for (StoneSelection sel : req.getSecondaryStones()) {
                StoneComponent s = stone(sel);
                if (s != null) {
                    secondary.add(s);
                }
            }
        }
        StoneComponent other = stone(req.getOtherStone());

        MarketReading gold = goldPriceProvider.current();
        MarketReading fx = exchangeRateProvider.current();

        PricingInput input = PricingInput.builder()
                .metal(metal.orElse(null))
                .primaryStone(primary)
                .secondaryStones(secondary)
                .otherStone(other)
                .goldPricePerGram(gold.value())
                .exchangeRate(fx.value())
                .build();

        PriceQuote quote;
        try {
            quote = calculator.calculate(input);
        } catch (IllegalArgumentException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Price calculation failed metal={} gold={} fx={}", req.getMetalTypeId(), gold.value(), fx.value(), e);
            throw new PricingCalculationException("Failed to calculate price", e);
        }

        log.info("Calculated price metal={} weight={} inr={} usd={} (gold {} {}, fx {} {})",
                req.getMetalTypeId(), req.getMetalWeight(), quote.inr().price(), quote.usd().price(),
                gold.value(), gold.status().tag(), fx.value(), fx.status().tag());

        return new PricingResult(quote, inputs(input), gold, fx);
    }

    /**
     * A stone with no selection or zero carats is dropped here so it never reaches the breakdown.
     * The id is still checked so a typo is reported rather than priced at zero.
     */
    private StoneComponent stone(StoneSelection sel) {
        if (sel == null) {
            return null;
        }
        Optional<StoneComponent> resolved = catalog.resolveStone(sel.getStoneTypeId(), sel.getCaratWeight());
        if (resolved.isEmpty()) {
            return null;
        }
        BigDecimal carats = resolved.get().caratWeight();
        if (carats == null || carats.signum() == 0) {
            return null;
        }
        return resolved.get();
    }

    private static Map<String, Object> inputs(PricingInput in) {
        Map<String, Object> m = new LinkedHashMap<>();
        if (in.getMetal() != null) {
            MetalComponent metal = in.getMetal();
            Map<String, Object> metalInfo = new LinkedHashMap<>();
            metalInfo.put("name", metal.name());
            metalInfo.put("weightGrams", metal.weightGrams());
            metalInfo.put("purityFactor", metal.purityFactor());
            metalInfo.put("typeMultiplier", metal.typeMultiplier());
            m.put("metal", metalInfo);
        }
        if (in.getPrimaryStone() != null) {
            m.put("primaryStone", stoneInfo(in.getPrimaryStone()));
        }
        if (!in.getSecondaryStones().isEmpty()) {
            m.put("secondaryStones", in.getSecondaryStones().stream().map(PricingService::stoneInfo).toList());
        }
        if (in.getOtherStone() != null) {
            m.put("otherStone", stoneInfo(in.getOtherStone()));
        }
        m.put("goldPricePerGram", in.getGoldPricePerGram());
        m.put("exchangeRate", in.getExchangeRate());
        return m;
    }

    private static Map<String, Object> stoneInfo(StoneComponent s) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("name", s.name());
        m.put("caratWeight", s.caratWeight());
        m.put("pricePerCarat", s.pricePerCarat());
        return m;
    }
}
