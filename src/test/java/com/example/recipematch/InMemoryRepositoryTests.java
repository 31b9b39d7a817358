package com.example.recipematch;

import com.example.recipematch.model.*;
import com.example.recipematch.storage.*;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;
import java.util.*;

public class InMemoryRepositoryTests {

  @Test
  void searchMatchesNameOrTagIgnoringCase() {
    Fixtures f = new Fixtures();
    f.product("P1", "Fresh Milk", "Dairy", "ml", "doodh");
    f.product("P2", "Butter", "Dairy", "g", "makhan");
    f.offer("P1", "S1", 0.06);
    f.offer("P2", "S1", 0.5);
    var catalog = f.catalog();

    assertEquals("P1", catalog.searchActiveProducts("MILK", 10).get(0).product.id);
    assertEquals("P2", catalog.searchActiveProducts("makh", 10).get(0).product.id);
    assertTrue(catalog.searchActiveProducts("  ", 10).isEmpty());
    assertEquals("FreshMart", catalog.searchActiveProducts("milk", 10).get(0).seller.displayName());
  }

  @Test
  void searchSkipsInactiveUnavailableAndOrphanedOffers() {
    Fixtures f = new Fixtures();
    f.product("P1", "Rice", "Staples", "kg");
    f.product("P2", "Basmati Rice", "Staples", "kg").active = false;
    f.offer("P1", "S1", 60).currentStock = 0;
    f.offer("P1", "S2", 62).availability = false;
    f.offer("P1", "S-GONE", 58);
    f.offer("P1", "S2", 65);
    f.offer("P2", "S1", 90);

    List<CatalogListing> rows = f.catalog().searchActiveProducts("rice", 10);
    assertEquals(1, rows.size());
    assertEquals(65.0, rows.get(0).offer.sellingPrice, 1e-9);
    List<CatalogListing> direct = f.catalog().findAvailableListings("P1");
    assertEquals(2, direct.size());
    assertNull(direct.get(0).seller);
    assertEquals("S2", direct.get(1).seller.id);
  }

  @Test
  void searchHonoursLimit() {
    Fixtures f = new Fixtures();
    f.product("P1", "Onion", "Vegetables", "kg");
    f.product("P2", "Red Onion", "Vegetables", "kg");
    for (int i = 0; i < 3; i++) { f.offer("P1", "S1", 40 + i); f.offer("P2", "S2", 50 + i); }
    assertEquals(4, f.catalog().searchActiveProducts("onion", 4).size());
    assertTrue(f.catalog().searchActiveProducts("onion", 0).isEmpty());
  }

  @Test
  void recipeCountersStartFromStoredValues() {
    Recipe r = Fixtures.recipe("R", 2);
    r.viewCount = 10;
    InMemoryRecipeRepository repo = new InMemoryRecipeRepository(List.of(r));
    repo.recordView("R");
    repo.notifyShopAttempt("R");
    repo.notifyShopAttempt("unknown");
    assertEquals(11, repo.views("R"));
    assertEquals(1, repo.shopAttempts("R"));
    assertEquals(0, repo.shopAttempts("unknown"));
    assertTrue(repo.getById("unknown").isEmpty());
    assertTrue(repo.getById(null).isEmpty());
  }
}
