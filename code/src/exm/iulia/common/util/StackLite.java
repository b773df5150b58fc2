package exm.iulia.common.util;

import java.util.ArrayList;

/**
 * Lightweight wrapper around ArrayList.  The top of the stack is the
 * end of the list.
 * @param <T>
 */
public class StackLite<T> extends ArrayList<T> {

  private static final long serialVersionUID = 1L;

  public void push(T o) {
    this.add(o);
  }

  public T pop() {
    return this.remove(this.size() - 1);
  }

  /**
   * @param depth 0 for the top of the stack, 1 for the element below, etc.
   * @return element at the given depth
   */
  public T peek(int depth) {
    return this.get(this.size() - 1 - depth);
  }
}
