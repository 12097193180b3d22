package rangeq.impl.util;

import java.util.Arrays;

public class IntArrayList {
  private int[] buffer;
  private int size;

  public IntArrayList() {
    this(8);
  }

  public IntArrayList(int capacity) {
    buffer = new int[Math.max(1, capacity)];
    size = 0;
  }

  public int size() {
    return size;
  }

  public boolean isEmpty() {
    return size == 0;
  }

  public int get(int idx) {
    if (idx < 0 || idx >= size) {
      throw new IndexOutOfBoundsException("index " + idx + " out of [0, " + size + ")");
    }
    return buffer[idx];
  }

  public void add(int v) {
    if (buffer.length == size) {
      this.buffer = Arrays.copyOf(buffer, buffer.length * 2);
    }
    this.buffer[this.size] = v;
    this.size += 1;
  }

  public int removeLast() {
    if (size == 0) {
      throw new IndexOutOfBoundsException();
    }
    size -= 1;
    return buffer[size];
  }

  public int[] toArray() {
    return Arrays.copyOf(buffer, size);
  }

  @Override
  public String toString() {
    return Arrays.toString(toArray());
  }
}
