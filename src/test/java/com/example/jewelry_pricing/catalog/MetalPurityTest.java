package com.example.jewelry_pricing.catalog;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class MetalPurityTest {

    @Test
    void karatNames() {
        assertThat(MetalPurity.fromName("24K Yellow Gold").purityFactor()).isEqualByComparingTo("1.0");
        assertThat(MetalPurity.fromName("22K Yellow Gold").purityFactor()).isEqualByComparingTo("0.916");
        assertThat(MetalPurity.fromName("18K Yellow Gold").purityFactor()).isEqualByComparingTo("0.75");
        assertThat(MetalPurity.fromName("14kt yellow gold").purityFactor()).isEqualByComparingTo("0.585");
    }

    @Test
    void colourMultipliers() {
        MetalFactors white = MetalPurity.fromName("18K White Gold");
        MetalFactors rose = MetalPurity.fromName("14 Karat Rose Gold");
        MetalFactors yellow = MetalPurity.fromName("18K Yellow Gold");

        assertThat(white.typeMultiplier()).isEqualByComparingTo("1.1");
        assertThat(rose.purityFactor()).isEqualByComparingTo("0.585");
        assertThat(rose.typeMultiplier()).isEqualByComparingTo("1.05");
        assertThat(yellow.typeMultiplier()).isEqualByComparingTo("1");
    }

    @Test
    void platinum() {
        MetalFactors pt = MetalPurity.fromName("Platinum 950");

        assertThat(pt.purityFactor()).isEqualByComparingTo("0.95");
        assertThat(pt.typeMultiplier()).isEqualByComparingTo("1.4");
        assertThat(pt.combined()).isEqualByComparingTo("1.33");
    }

    @Test
    void unrecognisedName_usesDefaultPurity() {
        MetalFactors f = MetalPurity.fromName("Mystery Alloy");

        assertThat(f.purityFactor()).isEqualByComparingTo("0.75");
        assertThat(f.typeMultiplier()).isEqualByComparingTo("1");
        assertThat(MetalPurity.fromName(null).purityFactor()).isEqualByComparingTo("0.75");
    }
}
