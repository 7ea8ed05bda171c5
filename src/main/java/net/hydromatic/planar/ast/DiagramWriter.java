/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.planar.ast;

import java.util.List;

/** Context for writing a diagram out as a string. */
public class DiagramWriter {
  private final StringBuilder b = new StringBuilder();

  /** Appends a string to the output. */
  public DiagramWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends a node, with the precedence of its surroundings. */
  public DiagramWriter append(DiagramNode node, int left, int right) {
    return node.unparse(this, left, right);
  }

  /** Appends a call to an infix operator. */
  public DiagramWriter infix(int left, DiagramNode a0, Op op, DiagramNode a1,
      int right) {
    if (left > op.left || op.right < right) {
      return append("(").infix(0, a0, op, a1, 0).append(")");
    }
    a0.unparse(this, left, op.left);
    append(op.padded);
    a1.unparse(this, op.right, right);
    return this;
  }

  /** Appends a list of indices separated by commas. */
  public DiagramWriter indices(List<Index> indices) {
    for (int i = 0; i < indices.size(); i++) {
      if (i > 0) {
        b.append(", ");
      }
      b.append(indices.get(i));
    }
    return this;
  }

  /** Appends statements, one per line. */
  public DiagramWriter lines(List<? extends DiagramNode> nodes) {
    for (int i = 0; i < nodes.size(); i++) {
      if (i > 0) {
        b.append('\n');
      }
      nodes.get(i).unparse(this, 0, 0);
    }
    return this;
  }

  /** Appends a block on its own lines, indented by two spaces. */
  public DiagramWriter indent(DiagramNode block) {
    final String s = block.unparse(new DiagramWriter());
    b.append('\n');
    if (!s.isEmpty()) {
      for (String line : s.split("\n", -1)) {
        b.append("  ").append(line).append('\n');
      }
    }
    return this;
  }

  @Override
  public String toString() {
    return b.toString();
  }
}

// End DiagramWriter.java
