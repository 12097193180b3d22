package rangeq.impl.segtree;

import org.junit.jupiter.api.Test;
import rangeq.Monoids;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SqrtDecompositionTest {

  @Test
  void min_queries_across_blocks() {
    SqrtDecomposition<Long, Long> s =
      new SqrtDecomposition<>(Monoids.minWithSet(), List.of(35232L, 390942L, 649675L, 224475L, 18709L));
    assertEquals(2, s.blockLength());
    assertEquals(224475L, s.query(1, 3));
    s.update(4, 475689L);
    assertEquals(224475L, s.query(2, 3));
    assertEquals(224475L, s.query(1, 3));
    assertEquals(390942L, s.query(1, 2));
    assertEquals(224475L, s.query(3, 3));
    s.update(2, 645514L);
    s.update(2, 680746L);
    assertEquals(35232L, s.query(0, 4));
    assertEquals(680746L, s.get(2));
  }

  @Test
  void custom_block_length() {
    SqrtDecomposition<Long, Long> s = new SqrtDecomposition<>(Monoids.sumWithAdd(), List.of(1L, 2L, 3L, 4L, 5L, 6L, 7L), 3);
    assertEquals(28L, s.query(0, 6));
    assertEquals(18L, s.query(2, 5));
    s.update(6, 3L);
    assertEquals(10L, s.query(6, 6));
    assertThrows(IllegalArgumentException.class, () -> new SqrtDecomposition<>(Monoids.sumWithAdd(), List.of(1L), 0));
  }
}
