package rangeq;

/**
 * Ready-made monoid actions over {@code Long}.
 * <p>
 * "Set" actions use {@code null} as the neutral delta; the more recent delta prevails.
 * "Add" actions use {@code 0L} as the neutral delta; min and max add {@code d} to every value of a non-empty run,
 * {@code Long.MIN_VALUE} and {@code Long.MAX_VALUE} included.
 */
public class Monoids {
  private Monoids() {}

  public static MonoidAction<Long, Long> minWithSet() {
    return new SetAction(Long.MAX_VALUE) {
      @Override
      public Long combine(Long a, Long b) {
        return Math.min(a, b);
      }
    };
  }

  public static MonoidAction<Long, Long> maxWithSet() {
    return new SetAction(Long.MIN_VALUE) {
      @Override
      public Long combine(Long a, Long b) {
        return Math.max(a, b);
      }
    };
  }

  public static MonoidAction<Long, Long> sumWithSet() {
    return new SetAction(0L) {
      @Override
      public Long combine(Long a, Long b) {
        return a + b;
      }

      @Override
      public Long apply(Long v, Long d, int len) {
        return d == null ? v : d * len;
      }
    };
  }

  public static MonoidAction<Long, Long> minWithAdd() {
    return new AddAction(Long.MAX_VALUE) {
      @Override
      public Long combine(Long a, Long b) {
        return Math.min(a, b);
      }
    };
  }

  public static MonoidAction<Long, Long> maxWithAdd() {
    return new AddAction(Long.MIN_VALUE) {
      @Override
      public Long combine(Long a, Long b) {
        return Math.max(a, b);
      }
    };
  }

  public static MonoidAction<Long, Long> sumWithAdd() {
    return new AddAction(0L) {
      @Override
      public Long combine(Long a, Long b) {
        return a + b;
      }

      @Override
      public Long apply(Long v, Long d, int len) {
        return v + d * len;
      }
    };
  }

  /**
   * {@code v} combined with itself {@code count} times, {@code identity()} when count is zero.
   */
  public static <V> V power(Monoid<V> monoid, V v, long count) {
    if (count < 0) {
      throw new IllegalArgumentException("negative count: " + count);
    }
    V result = monoid.identity();
    V base = v;
    while (count > 0) {
      if ((count & 1) != 0) {
        result = monoid.combine(result, base);
      }
      count >>= 1;
      if (count > 0) {
        base = monoid.combine(base, base);
      }
    }
    return result;
  }

  private static abstract class SetAction implements MonoidAction<Long, Long> {
    private final Long identity;

    SetAction(Long identity) {
      this.identity = identity;
    }

    @Override
    public Long identity() {
      return identity;
    }

    @Override
    public Long neutralDelta() {
      return null;
    }

    @Override
    public Long combineDeltas(Long older, Long newer) {
      return newer == null ? older : newer;
    }

    @Override
    public Long apply(Long v, Long d, int len) {
      return d == null ? v : d;
    }
  }

  private static abstract class AddAction implements MonoidAction<Long, Long> {
    private final Long identity;

    AddAction(Long identity) {
      this.identity = identity;
    }

    @Override
    public Long identity() {
      return identity;
    }

    @Override
    public Long neutralDelta() {
      return 0L;
    }

    @Override
    public Long combineDeltas(Long older, Long newer) {
      return older + newer;
    }

    @Override
    public Long apply(Long v, Long d, int len) {
      // an empty run holds the identity
      return len == 0 ? v : v + d;
    }
  }
}
