package com.example.recipematch;

import com.example.recipematch.services.UnitConverter;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;
import java.util.*;

public class UnitConverterTests {
  private final UnitConverter u = new UnitConverter();

  @Test
  void identicalUnitsPassThroughWithoutNote() {
    var c = u.convert(2.5, "kg", "KG");
    assertEquals(2.5, c.quantity, 1e-9);
    assertNull(c.note);
  }

  @Test
  void cupToMillilitres() {
    var c = u.convert(1, "cup", "ml");
    assertEquals(240.0, c.quantity, 1e-9);
    assertEquals("1 cup ≈ 240 ml", c.note);
  }

  @Test
  void weightConversionsRoundToTwoDecimals() {
    assertEquals(500.0, u.convert(0.5, "kg", "g").quantity, 1e-9);
    assertEquals("0.5 kg ≈ 500 g", u.convert(0.5, "kg", "g").note);
    assertEquals(0.45, u.convert(1, "lb", "kg").quantity, 1e-9);
    assertEquals(30.0, u.convert(2, "tbsp", "g").quantity, 1e-9);
  }

  @Test
  void spellingVariantsAreNormalized() {
    var c = u.convert(2, "Cups", "ML");
    assertEquals(480.0, c.quantity, 1e-9);
    assertEquals("2 Cups ≈ 480 ML", c.note);
    assertNull(u.convert(3, "grams", "g").note);
    assertTrue(u.isKnownUnit("Litres"));
  }

  @Test
  void pieceUnitsConvertOneToOne() {
    var c = u.convert(4, "pieces", "pc");
    assertEquals(4.0, c.quantity, 1e-9);
    assertNotNull(c.note);
  }

  @Test
  void unknownPairKeepsQuantityAndWarns() {
    var c = u.convert(3, "pinch", "g");
    assertEquals(3.0, c.quantity, 1e-9);
    assertEquals("Unit conversion (pinch → g) may be approximate", c.note);

    var weightToCount = u.convert(1.5, "kg", "piece");
    assertEquals(1.5, weightToCount.quantity, 1e-9);
    assertNotNull(weightToCount.note);
  }

  @Test
  void missingUnitsNeverThrow() {
    var c = u.convert(2, null, "kg");
    assertEquals(2.0, c.quantity, 1e-9);
    assertNotNull(c.note);
    assertNotNull(u.convert(2, "", "").note);
  }

  @Test
  void customTableIsCaseInsensitive() {
    UnitConverter custom = new UnitConverter(Map.of("Bunch", Map.of("G", 100.0)));
    assertEquals(200.0, custom.convert(2, "bunch", "g").quantity, 1e-9);
    assertFalse(custom.isKnownUnit("cup"));
  }
}
