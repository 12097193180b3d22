package rangeq;

/**
 * Non-commutative action used to check that folds keep sequence order.
 */
public class TestMonoids {
  private TestMonoids() {}

  public static MonoidAction<String, String> concatWithSet() {
    return MonoidAction.of(() -> "",
                           String::concat,
                           () -> null,
                           (older, newer) -> newer == null ? older : newer,
                           (v, d, len) -> d == null ? v : d.repeat(len));
  }
}
