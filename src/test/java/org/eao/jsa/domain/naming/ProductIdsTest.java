package org.eao.jsa.domain.naming;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.eao.jsa.domain.error.IdentifierException;
import org.junit.jupiter.api.Test;

class ProductIdsTest {

  @Test
  void continuumAppendsMicronsToKnownFilters() throws IdentifierException {
    assertEquals("reduced-850um", ProductIds.continuum("reduced", "850"));
    assertEquals("reduced-450um", ProductIds.continuum("reduced", " 450 "));
    assertEquals("healpix-868GHz", ProductIds.continuum("healpix", "868GHz"));
  }

  @Test
  void continuumRequiresFilter() {
    assertThrows(IdentifierException.class, () -> ProductIds.continuum("reduced", " "));
  }

  @Test
  void heterodyneRoundsRestFrequencyToMegahertz() throws IdentifierException {
    assertEquals("cube-230538MHz-250MHzx8192-1",
        ProductIds.heterodyne("cube", 230.538e9, "250MHzx8192", "1"));
  }

  @Test
  void heterodyneRequiresEveryInput() {
    assertThrows(IdentifierException.class, () -> ProductIds.heterodyne("cube", null, "250MHzx8192", "1"));
    assertThrows(IdentifierException.class, () -> ProductIds.heterodyne("cube", 230.538e9, null, "1"));
    assertThrows(IdentifierException.class, () -> ProductIds.heterodyne("cube", 230.538e9, "250MHzx8192", ""));
    assertThrows(IdentifierException.class, () -> ProductIds.heterodyne("", 230.538e9, "250MHzx8192", "1"));
  }

  @Test
  void scienceProductIsTextBeforeFirstHyphen() {
    assertEquals("peak", ProductIds.scienceProductOf("peak-cat-850um"));
    assertEquals("reduced", ProductIds.scienceProductOf("reduced"));
  }
}
