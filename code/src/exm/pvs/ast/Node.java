/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.pvs.ast;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Base class of all syntax tree nodes.  Nodes are immutable once built and
 * every node records the source span it was parsed from.
 */
public abstract class Node {

  private final SourceSpan span;

  protected Node(SourceSpan span) {
    this.span = span;
  }

  public SourceSpan getSpan() {
    return span;
  }

  public abstract NodeKind getKind();

  /**
   * @return direct children in source order
   */
  public abstract List<Node> children();

  /**
   * @return short one line description used in tree dumps
   */
  public abstract String label();

  /**
   * Build a child list from nodes and collections of nodes, skipping
   * absent (null) parts.
   */
  protected static List<Node> nodes(Object... parts) {
    List<Node> result = new ArrayList<Node>();
    for (Object part: parts) {
      if (part == null) {
        continue;
      } else if (part instanceof Node) {
        result.add((Node)part);
      } else if (part instanceof Collection) {
        for (Object o: (Collection<?>)part) {
          result.add((Node)o);
        }
      } else {
        throw new IllegalArgumentException("Not a node: " + part);
      }
    }
    return result;
  }

  @Override
  public String toString() {
    return label() + " @" + span;
  }
}
