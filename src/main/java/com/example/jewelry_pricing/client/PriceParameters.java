package com.example.jewelry_pricing.client;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import com.example.jewelry_pricing.catalog.CatalogResolver;
import com.example.jewelry_pricing.dto.CalculatePriceRequest;
import com.example.jewelry_pricing.dto.StoneSelection;

/**
 * Immutable, normalized copy of a calculate-price request used as the dedup key. Weights are
 * compared by value, so {@code 5} and {@code 5.00} are the same tuple, and empty stone slots all
 * normalize to null.
 */
public record PriceParameters(
        String metalTypeId,
        BigDecimal metalWeight,
        Stone primaryStone,
        List<Stone> secondaryStones,
        Stone otherStone) {

    public record Stone(String stoneTypeId, BigDecimal caratWeight) {
    }

    public PriceParameters {
        secondaryStones = secondaryStones == null ? List.of() : List.copyOf(secondaryStones);
    }

    public static PriceParameters of(CalculatePriceRequest req) {
        List<Stone> secondary = new ArrayList<>();
        if (req.getSecondaryStones() != null) {
            for (StoneSelection s : req.getSecondaryStones()) {
                Stone stone = stone(s);
                if (stone != null) {
                    secondary.add(stone);
                }
            }
        }
        return new PriceParameters(
                trim(req.getMetalTypeId()),
                normalize(req.getMetalWeight()),
                stone(req.getPrimaryStone()),
                secondary,
                stone(req.getOtherStone()));
    }

    public CalculatePriceRequest toRequest() {
        CalculatePriceRequest req = new CalculatePriceRequest();
        req.setMetalTypeId(metalTypeId);
        req.setMetalWeight(metalWeight);
        req.setPrimaryStone(selection(primaryStone));
        req.setSecondaryStones(new ArrayList<>(secondaryStones.stream().map(PriceParameters::selection).toList()));
        req.setOtherStone(selection(otherStone));
        return req;
    }

    private static Stone stone(StoneSelection s) {
        if (s == null || CatalogResolver.isNoSelection(s.getStoneTypeId())) {
            return null;
        }
        BigDecimal carats = normalize(s.getCaratWeight());
        if (carats == null || carats.signum() == 0) {
            return null;
        }
        return new Stone(s.getStoneTypeId().trim(), carats);
    }

    private static StoneSelection selection(Stone s) {
        return s == null ? null : new StoneSelection(s.stoneTypeId(), s.caratWeight());
    }

    private static BigDecimal normalize(BigDecimal v) {
        if (v == null) {
            return null;
        }
        return v.signum() == 0 ? BigDecimal.ZERO : v.stripTrailingZeros();
    }

    private static String trim(String s) {
        return s == null ? null : s.trim();
    }
}
