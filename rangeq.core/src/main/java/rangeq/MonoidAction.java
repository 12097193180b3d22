package rangeq;

import java.util.function.BinaryOperator;
import java.util.function.Supplier;

/**
 * A {@link Monoid} of values acted upon by a monoid of deltas.
 * <p>
 * Laws every implementation must satisfy:
 * <ul>
 *   <li>{@code combineDeltas} is associative and {@code apply(v, neutralDelta(), len) == v};</li>
 *   <li>applying {@code combineDeltas(d1, d2)} equals applying {@code d1} and then {@code d2};</li>
 *   <li>{@code apply(combine(v, ..len times.., v), d, len)} equals
 *   {@code combine(apply(v, d, 1), ..len times.., apply(v, d, 1))}.</li>
 * </ul>
 * Lazy propagation is correct only as long as the last law holds.
 */
public interface MonoidAction<V, D> extends Monoid<V> {

  D neutralDelta();

  /**
   * @param older delta applied first
   * @param newer delta applied second
   */
  D combineDeltas(D older, D newer);

  /**
   * Folds {@code d} into {@code v}, where {@code v} is the combined value of {@code len} slots.
   */
  V apply(V v, D d, int len);

  @FunctionalInterface
  interface Apply<V, D> {
    V apply(V v, D d, int len);
  }

  static <V, D> MonoidAction<V, D> of(Supplier<V> identity,
                                      BinaryOperator<V> combine,
                                      Supplier<D> neutralDelta,
                                      BinaryOperator<D> combineDeltas,
                                      Apply<V, D> apply) {
    return new MonoidAction<V, D>() {
      @Override
      public V identity() {
        return identity.get();
      }

      @Override
      public V combine(V a, V b) {
        return combine.apply(a, b);
      }

      @Override
      public D neutralDelta() {
        return neutralDelta.get();
      }

      @Override
      public D combineDeltas(D older, D newer) {
        return combineDeltas.apply(older, newer);
      }

      @Override
      public V apply(V v, D d, int len) {
        return apply.apply(v, d, len);
      }
    };
  }
}
