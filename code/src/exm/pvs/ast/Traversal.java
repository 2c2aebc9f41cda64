package exm.pvs.ast;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Depth-first walks over a syntax tree.
 */
public class Traversal {

  /**
   * Pre-order walk: each node comes before its children, and children
   * come in source order.  The result is lazy and can be iterated any
   * number of times.
   */
  public static Iterable<Node> depthFirst(final Node root) {
    return new Iterable<Node>() {
      @Override
      public Iterator<Node> iterator() {
        return new DepthFirstIterator(root);
      }
    };
  }

  /**
   * @return number of nodes in the tree rooted at root
   */
  public static int size(Node root) {
    int count = 0;
    for (@SuppressWarnings("unused") Node n: depthFirst(root)) {
      count++;
    }
    return count;
  }

  private static class DepthFirstIterator implements Iterator<Node> {
    private final Deque<Node> stack = new ArrayDeque<Node>();

    DepthFirstIterator(Node root) {
      stack.push(root);
    }

    @Override
    public boolean hasNext() {
      return !stack.isEmpty();
    }

    @Override
    public Node next() {
      if (stack.isEmpty()) {
        throw new NoSuchElementException();
      }
      Node node = stack.pop();
      List<Node> children = node.children();
      // Push in reverse so the first child is visited first
      for (int i = children.size() - 1; i >= 0; i--) {
        stack.push(children.get(i));
      }
      return node;
    }

    @Override
    public void remove() {
      throw new UnsupportedOperationException();
    }
  }
}
