package com.example.jewelry_pricing.catalog;

import java.util.List;
import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.example.jewelry_pricing.entity.MetalType;
import com.example.jewelry_pricing.entity.StoneType;
import com.example.jewelry_pricing.repo.MetalTypeRepository;
import com.example.jewelry_pricing.repo.StoneTypeRepository;

import lombok.RequiredArgsConstructor;

/**
 * Read-only catalog listings for the price calculator's selectors.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class CatalogController {

    private final MetalTypeRepository metalTypeRepo;
    private final StoneTypeRepository stoneTypeRepo;

    @GetMapping("/metal-types")
    public List<Map<String, Object>> metalTypes() {
        return metalTypeRepo.findByActiveTrueOrderByDisplayOrderAscNameAsc().stream()
                .map(this::toRow)
                .toList();
    }

    @GetMapping("/stone-types")
    public List<Map<String, Object>> stoneTypes() {
        return stoneTypeRepo.findByActiveTrueOrderByDisplayOrderAscNameAsc().stream()
                .map(this::toRow)
                .toList();
    }

    @GetMapping("/metal-types/{id}")
    public ResponseEntity<?> metalType(@PathVariable Long id) {
        return metalTypeRepo.findById(id)
                .<ResponseEntity<?>>map(m -> ResponseEntity.ok(toRow(m)))
                .orElseThrow(() -> new UnknownCatalogItemException("metal type", String.valueOf(id)));
    }

    @GetMapping("/stone-types/{id}")
    public ResponseEntity<?> stoneType(@PathVariable Long id) {
        return stoneTypeRepo.findById(id)
                .<ResponseEntity<?>>map(s -> ResponseEntity.ok(toRow(s)))
                .orElseThrow(() -> new UnknownCatalogItemException("stone type", String.valueOf(id)));
    }

    private Map<String, Object> toRow(MetalType m) {
        MetalFactors f = CatalogResolver.factorsOf(m);
        return Map.of(
                "id", m.getId(),
                "name", m.getName(),
                "purityFactor", f.purityFactor(),
                "typeMultiplier", f.typeMultiplier(),
                "displayOrder", m.getDisplayOrder() == null ? 0 : m.getDisplayOrder(),
                "color", m.getColor() == null ? "" : m.getColor());
    }

    private Map<String, Object> toRow(StoneType s) {
        return Map.of(
                "id", s.getId(),
                "name", s.getName(),
                "pricePerCarat", s.getPricePerCarat(),
                "category", s.getCategory() == null ? "" : s.getCategory(),
                "quality", s.getQuality() == null ? "" : s.getQuality(),
                "size", s.getSize() == null ? "" : s.getSize(),
                "displayOrder", s.getDisplayOrder() == null ? 0 : s.getDisplayOrder());
    }
}
