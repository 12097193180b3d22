package rangeq;

import java.util.List;
import java.util.function.BinaryOperator;
import java.util.function.Supplier;

/**
 * Values stored in range-query structures together with an associative {@link #combine} and its identity.
 * <p>
 * {@code combine(x, identity()) == combine(identity(), x) == x} must hold for every x.
 */
public interface Monoid<V> {

  V identity();

  V combine(V a, V b);

  default V combine(List<V> values) {
    V r = identity();
    for (V v : values) {
      r = combine(r, v);
    }
    return r;
  }

  static <V> Monoid<V> of(Supplier<V> identity, BinaryOperator<V> combine) {
    return new Monoid<V>() {
      @Override
      public V identity() {
        return identity.get();
      }

      @Override
      public V combine(V a, V b) {
        return combine.apply(a, b);
      }
    };
  }
}
