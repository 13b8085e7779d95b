package com.example.jewelry_pricing.catalog;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;
import java.util.Set;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.example.jewelry_pricing.entity.MetalType;
import com.example.jewelry_pricing.entity.StoneType;
import com.example.jewelry_pricing.pricing.MetalComponent;
import com.example.jewelry_pricing.pricing.StoneComponent;
import com.example.jewelry_pricing.repo.MetalTypeRepository;
import com.example.jewelry_pricing.repo.StoneTypeRepository;

import lombok.RequiredArgsConstructor;

/**
 * Turns the ids sent by UI surfaces into catalog-priced components. A numeric id is a primary
 * key, anything else is matched against the name.
 */
@Service
@RequiredArgsConstructor
public class CatalogResolver {

    public static final String NONE_SELECTED = "none_selected";

    private static final Set<String> NO_SELECTION = Set.of(NONE_SELECTED, "none");
    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private final MetalTypeRepository metalTypeRepo;
    private final StoneTypeRepository stoneTypeRepo;

    public static boolean isNoSelection(String id) {
        return id == null || id.isBlank() || NO_SELECTION.contains(id.trim().toLowerCase());
    }

    @Transactional(readOnly = true)
    public Optional<MetalComponent> resolveMetal(String metalTypeId, BigDecimal weightGrams) {
        if (isNoSelection(metalTypeId)) {
            return Optional.empty();
        }
        MetalType metal = findMetal(metalTypeId.trim())
                .orElseThrow(() -> new UnknownCatalogItemException("metal type", metalTypeId));

        MetalFactors factors = factorsOf(metal);
        return Optional.of(new MetalComponent(metal.getName(), weightGrams,
                factors.purityFactor(), factors.typeMultiplier()));
    }

    @Transactional(readOnly = true)
    public Optional<StoneComponent> resolveStone(String stoneTypeId, BigDecimal caratWeight) {
        if (isNoSelection(stoneTypeId)) {
            return Optional.empty();
        }
        StoneType stone = findStone(stoneTypeId.trim())
                .orElseThrow(() -> new UnknownCatalogItemException("stone type", stoneTypeId));
        return Optional.of(new StoneComponent(stone.getName(), caratWeight, stone.getPricePerCarat()));
    }

    /**
     * Explicit factors win; then the stored percentage modifier; then the naming convention.
     */
    static MetalFactors factorsOf(MetalType metal) {
        BigDecimal purity = metal.getPurityFactor();
        BigDecimal multiplier = metal.getTypeMultiplier();

        if (purity != null || multiplier != null) {
            MetalFactors byName = MetalPurity.fromName(metal.getName());
            return new MetalFactors(
                    purity != null ? purity : byName.purityFactor(),
                    multiplier != null ? multiplier : byName.typeMultiplier());
        }

        BigDecimal percent = metal.getPriceModifierPercent();
        if (percent != null && percent.signum() > 0) {
            BigDecimal combined = percent.divide(HUNDRED, 6, RoundingMode.HALF_UP);
            // purity is capped at 1, anything above is a type markup
            return combined.compareTo(BigDecimal.ONE) <= 0
                    ? new MetalFactors(combined, BigDecimal.ONE)
                    : new MetalFactors(BigDecimal.ONE, combined);
        }

        return MetalPurity.fromName(metal.getName());
    }

    private Optional<MetalType> findMetal(String id) {
        if (id.matches("\\d+")) {
            return metalTypeRepo.findById(Long.parseLong(id));
        }
        return metalTypeRepo.findByNameIgnoreCase(id);
    }

    private Optional<StoneType> findStone(String id) {
        if (id.matches("\\d+")) {
            return stoneTypeRepo.findById(Long.parseLong(id));
        }
        return stoneTypeRepo.findByNameIgnoreCase(id);
    }
}
