package rangeq.sequence;

public class Ranges {
  private Ranges() {}

  public static void checkIndex(int i, int size) {
    if (i < 0 || i >= size) {
      throw new IndexOutOfBoundsException("index " + i + " out of [0, " + size + ")");
    }
  }

  /**
   * Accepts {@code 0 <= lo <= hi < size} and the empty range {@code lo == hi + 1} with {@code 0 <= lo <= size}.
   *
   * @return false for the empty range
   */
  public static boolean checkRange(int lo, int hi, int size) {
    if (lo == hi + 1 && lo >= 0 && lo <= size) {
      return false;
    }
    if (lo < 0 || hi >= size || lo > hi) {
      throw new IndexOutOfBoundsException("range [" + lo + ", " + hi + "] out of [0, " + size + ")");
    }
    return true;
  }
}
