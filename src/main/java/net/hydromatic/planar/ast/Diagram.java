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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.planar.ast.DiagramBuilder.diagram;
import static net.hydromatic.planar.util.Static.concat;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;

/** Various sub-classes of diagram nodes. */
public class Diagram {
  private Diagram() {}

  /**
   * Base class for a statement.
   *
   * <p>A program is a {@link Block} of statements. Every expression may also
   * occur as a statement, whose value is discarded.
   */
  public abstract static class Stmt extends DiagramNode {
    Stmt(Pos pos, Op op) {
      super(pos, op);
    }

    @Override
    public abstract Stmt accept(Shuttle shuttle);
  }

  /** Base class for an expression. */
  public abstract static class Exp extends Stmt {
    Exp(Pos pos, Op op) {
      super(pos, op);
    }

    @Override
    public abstract Exp accept(Shuttle shuttle);
  }

  /**
   * Reference to a tensor object with labeled legs.
   *
   * <p>For example, {@code A[a b; c]} refers to object {@code A} with left
   * (codomain) indices {@code a, b} and right (domain) index {@code c};
   * {@code A'[c; a b]} refers to the adjoint of the same object.
   *
   * <p>Two tensor terms are equal if they have the same reference, adjoint
   * flag and indices; position is not considered.
   */
  public static class TensorTerm extends Exp {
    public final TensorRef ref;
    public final boolean adjoint;
    public final ImmutableList<Index> left;
    public final ImmutableList<Index> right;

    TensorTerm(Pos pos, TensorRef ref, boolean adjoint,
        ImmutableList<Index> left, ImmutableList<Index> right) {
      super(pos, Op.TENSOR);
      this.ref = requireNonNull(ref);
      this.adjoint = adjoint;
      this.left = requireNonNull(left);
      this.right = requireNonNull(right);
    }

    @Override
    public int hashCode() {
      return Objects.hash(ref, adjoint, left, right);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof TensorTerm
              && ref.equals(((TensorTerm) o).ref)
              && adjoint == ((TensorTerm) o).adjoint
              && left.equals(((TensorTerm) o).left)
              && right.equals(((TensorTerm) o).right);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    DiagramWriter unparse(DiagramWriter w, int left, int right) {
      w.append(ref.toString());
      if (adjoint) {
        w.append("'");
      }
      w.append("[").indices(this.left);
      if (!this.right.isEmpty()) {
        w.append("; ").indices(this.right);
      }
      return w.append("]");
    }

    /** Returns the left indices followed by the right indices; this is the
     * order in which legs are numbered. */
    public List<Index> indices() {
      return concat(left, right);
    }

    /** Returns the cyclic order of the legs when drawn in the plane: left
     * indices, then right indices in reverse. */
    public List<Index> planarOrder() {
      return concat(left, right.reverse());
    }

    /** Creates a copy of this {@code TensorTerm} with given contents,
     * or {@code this} if the contents are the same. */
    public TensorTerm copy(TensorRef ref, boolean adjoint, List<Index> left,
        List<Index> right) {
      return this.ref.equals(ref)
          && this.adjoint == adjoint
          && this.left.equals(left)
          && this.right.equals(right)
          ? this
          : diagram.tensor(pos, ref, adjoint, left, right);
    }
  }

  /**
   * Scalar factor.
   *
   * <p>For example, {@code 2}, {@code -0.5} or {@code α}. The text is either
   * a number or the name of a scalar variable.
   */
  public static class Scalar extends Exp {
    public final String text;

    Scalar(Pos pos, String text) {
      super(pos, Op.SCALAR);
      this.text = requireNonNull(text);
      checkArgument(!text.isEmpty(), "empty scalar");
    }

    /** Returns whether this scalar is a numeric literal. */
    public boolean isLiteral() {
      final char c = text.charAt(0);
      return Character.isDigit(c) || c == '.' || c == '-' && text.length() > 1;
    }

    @Override
    public int hashCode() {
      return text.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Scalar && text.equals(((Scalar) o).text);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    DiagramWriter unparse(DiagramWriter w, int left, int right) {
      return w.append(text);
    }
  }

  /** Complex conjugation of an expression, "conj(e)". */
  public static class Conj extends Exp {
    public final Exp exp;

    Conj(Pos pos, Exp exp) {
      super(pos, Op.CONJ);
      this.exp = requireNonNull(exp);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, exp);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Conj && exp.equals(((Conj) o).exp);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    DiagramWriter unparse(DiagramWriter w, int left, int right) {
      return w.append("conj(").append(exp, 0, 0).append(")");
    }

    /** Creates a copy of this {@code Conj} with given contents,
     * or {@code this} if the contents are the same. */
    public Exp copy(Exp exp) {
      return this.exp.equals(exp) ? this : diagram.conj(pos, exp);
    }
  }

  /** Product of two expressions; contracts the legs that they share. */
  public static class Product extends Exp {
    public final Exp a0;
    public final Exp a1;

    Product(Pos pos, Exp a0, Exp a1) {
      super(pos, Op.TIMES);
      this.a0 = requireNonNull(a0);
      this.a1 = requireNonNull(a1);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, a0, a1);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Product
              && a0.equals(((Product) o).a0)
              && a1.equals(((Product) o).a1);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    DiagramWriter unparse(DiagramWriter w, int left, int right) {
      return w.infix(left, a0, op, a1, right);
    }

    /** Creates a copy of this {@code Product} with given contents,
     * or {@code this} if the contents are the same. */
    public Exp copy(Exp a0, Exp a1) {
      return this.a0.equals(a0) && this.a1.equals(a1)
          ? this
          : diagram.times(pos, a0, a1);
    }
  }

  /**
   * Linear combination of expressions.
   *
   * <p>Each argument has a sign, {@link Op#PLUS} or {@link Op#MINUS}. For
   * example, "{@code A[a; b] - B[a; b]}" has arguments {@code A[a; b]} and
   * {@code B[a; b]} and signs {@code PLUS, MINUS}; "{@code -A[a; b]}" has one
   * argument with sign {@code MINUS}.
   */
  public static class Sum extends Exp {
    public final ImmutableList<Exp> args;
    public final ImmutableList<Op> signs;

    Sum(Pos pos, ImmutableList<Exp> args, ImmutableList<Op> signs) {
      super(pos, Op.SUM);
      this.args = requireNonNull(args);
      this.signs = requireNonNull(signs);
      checkArgument(!args.isEmpty(), "empty sum");
      checkArgument(args.size() == signs.size(), "signs do not match args");
      checkArgument(signs.stream().allMatch(s -> s == Op.PLUS || s == Op.MINUS),
          "invalid sign in %s", signs);
    }

    @Override
    public int hashCode() {
      return Objects.hash(args, signs);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Sum
              && args.equals(((Sum) o).args)
              && signs.equals(((Sum) o).signs);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    DiagramWriter unparse(DiagramWriter w, int left, int right) {
      if (left > op.left || op.right < right) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      for (int i = 0; i < args.size(); i++) {
        final Op sign = signs.get(i);
        if (i > 0) {
          w.append(sign.padded);
        } else if (sign == Op.MINUS) {
          w.append("-");
        }
        final int argLeft = i == 0 && sign == Op.PLUS ? left : op.right;
        final int argRight = i == args.size() - 1 ? right : op.left;
        w.append(args.get(i), argLeft, argRight);
      }
      return w;
    }

    /** Creates a copy of this {@code Sum} with given arguments and the same
     * signs, or {@code this} if the arguments are the same. */
    public Exp copy(List<Exp> args) {
      return this.args.equals(args) ? this : diagram.sum(pos, args, signs);
    }
  }

  /**
   * Assignment of a tensor expression to a tensor.
   *
   * <p>A definition, "{@code C[a; b] := A[a; c] * B[c; b]}", introduces a new
   * object; an assignment, "{@code C[a; b] = A[a; c] * B[c; b]}", overwrites
   * an object that already exists. The left-hand side is a
   * {@link TensorTerm}, or a {@link Scalar} naming a scalar variable if the
   * right-hand side has no free indices.
   */
  public static class Assignment extends Stmt {
    public final Exp lhs;
    public final Exp rhs;

    Assignment(Pos pos, Op op, Exp lhs, Exp rhs) {
      super(pos, op);
      checkArgument(op.isAssignment(), "not an assignment: %s", op);
      this.lhs = requireNonNull(lhs);
      this.rhs = requireNonNull(rhs);
      checkArgument(lhs.op == Op.TENSOR || lhs.op == Op.SCALAR,
          "invalid left-hand side %s", lhs);
    }

    /** Returns whether this statement defines a new object. */
    public boolean isDefinition() {
      return op == Op.DEFINITION;
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, lhs, rhs);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Assignment
              && op == ((Assignment) o).op
              && lhs.equals(((Assignment) o).lhs)
              && rhs.equals(((Assignment) o).rhs);
    }

    @Override
    public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    DiagramWriter unparse(DiagramWriter w, int left, int right) {
      return w.append(lhs, 0, 0).append(op.padded).append(rhs, 0, 0);
    }

    /** Creates a copy of this {@code Assignment} with given contents,
     * or {@code this} if the contents are the same. */
    public Assignment copy(Exp lhs, Exp rhs) {
      return this.lhs.equals(lhs) && this.rhs.equals(rhs)
          ? this
          : diagram.assignment(pos, op, lhs, rhs);
    }
  }

  /** Sequence of statements. */
  public static class Block extends Stmt {
    public final ImmutableList<Stmt> stmts;

    Block(Pos pos, ImmutableList<Stmt> stmts) {
      super(pos, Op.BLOCK);
      this.stmts = requireNonNull(stmts);
    }

    @Override
    public int hashCode() {
      return stmts.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Block && stmts.equals(((Block) o).stmts);
    }

    @Override
    public Block accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    DiagramWriter unparse(DiagramWriter w, int left, int right) {
      return w.lines(stmts);
    }

    /** Creates a copy of this {@code Block} with given statements,
     * or {@code this} if the statements are the same. */
    public Block copy(List<Stmt> stmts) {
      return this.stmts.equals(stmts) ? this : diagram.block(pos, stmts);
    }
  }

  /**
   * Control construct, such as a loop, whose body contains tensor statements.
   *
   * <p>The compiler rewrites the body but passes the header through
   * unchanged.
   */
  public static class OpaqueBlock extends Stmt {
    public final String header;
    public final Block body;

    OpaqueBlock(Pos pos, String header, Block body) {
      super(pos, Op.OPAQUE_BLOCK);
      this.header = requireNonNull(header);
      this.body = requireNonNull(body);
    }

    @Override
    public int hashCode() {
      return Objects.hash(header, body);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof OpaqueBlock
              && header.equals(((OpaqueBlock) o).header)
              && body.equals(((OpaqueBlock) o).body);
    }

    @Override
    public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    DiagramWriter unparse(DiagramWriter w, int left, int right) {
      return w.append(header).append(" {").indent(body).append("}");
    }

    /** Creates a copy of this {@code OpaqueBlock} with given body,
     * or {@code this} if the body is the same. */
    public OpaqueBlock copy(Block body) {
      return this.body.equals(body)
          ? this
          : diagram.opaqueBlock(pos, header, body);
    }
  }

  /** Region that the compiler does not rewrite, "notensor { ... }". */
  public static class AnnotatedBlock extends Stmt {
    public final Block body;

    AnnotatedBlock(Pos pos, Block body) {
      super(pos, Op.ANNOTATED_BLOCK);
      this.body = requireNonNull(body);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, body);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof AnnotatedBlock
              && body.equals(((AnnotatedBlock) o).body);
    }

    @Override
    public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    DiagramWriter unparse(DiagramWriter w, int left, int right) {
      return w.append("notensor {").indent(body).append("}");
    }
  }

  /** Binds a local to an object that exists before the plan runs,
   * "{@code A#0 = A}". */
  public static class Binding extends Stmt {
    public final TensorRef local;
    public final TensorRef object;

    Binding(Pos pos, TensorRef local, TensorRef object) {
      super(pos, Op.BINDING);
      this.local = requireNonNull(local);
      this.object = requireNonNull(object);
      checkArgument(local.kind == TensorRef.Kind.LOCAL);
      checkArgument(object.kind == TensorRef.Kind.NAME);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, local, object);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Binding
              && local.equals(((Binding) o).local)
              && object.equals(((Binding) o).object);
    }

    @Override
    public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    DiagramWriter unparse(DiagramWriter w, int left, int right) {
      return w.append(local.toString()).append(op.padded)
          .append(object.toString());
    }
  }

  /**
   * Checks, when the plan runs, that an object has the number of output and
   * input legs that the diagram uses, "{@code check A#0 (2, 1)}".
   */
  public static class ArityCheck extends Stmt {
    public final TensorRef local;
    public final String objectName;
    public final int numOut;
    public final int numIn;

    ArityCheck(Pos pos, TensorRef local, String objectName, int numOut,
        int numIn) {
      super(pos, Op.ARITY_CHECK);
      this.local = requireNonNull(local);
      this.objectName = requireNonNull(objectName);
      this.numOut = numOut;
      this.numIn = numIn;
    }

    @Override
    public int hashCode() {
      return Objects.hash(local, numOut, numIn);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof ArityCheck
              && local.equals(((ArityCheck) o).local)
              && objectName.equals(((ArityCheck) o).objectName)
              && numOut == ((ArityCheck) o).numOut
              && numIn == ((ArityCheck) o).numIn;
    }

    @Override
    public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    DiagramWriter unparse(DiagramWriter w, int left, int right) {
      return w.append("check ").append(local.toString())
          .append(" (").append(Integer.toString(numOut)).append(", ")
          .append(Integer.toString(numIn)).append(")");
    }
  }

  /**
   * Constructs a braiding tensor from the spaces of its two strands,
   * "{@code τ#2 = braiding(space(A#0, 1), space(B#1, 0)')}".
   */
  public static class BraidingDefinition extends Stmt {
    public final TensorRef local;
    public final SpaceRef space1;
    public final SpaceRef space2;

    BraidingDefinition(Pos pos, TensorRef local, SpaceRef space1,
        SpaceRef space2) {
      super(pos, Op.BRAIDING_DEFINITION);
      this.local = requireNonNull(local);
      this.space1 = requireNonNull(space1);
      this.space2 = requireNonNull(space2);
    }

    @Override
    public int hashCode() {
      return Objects.hash(local, space1, space2);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof BraidingDefinition
              && local.equals(((BraidingDefinition) o).local)
              && space1.equals(((BraidingDefinition) o).space1)
              && space2.equals(((BraidingDefinition) o).space2);
    }

    @Override
    public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    DiagramWriter unparse(DiagramWriter w, int left, int right) {
      return w.append(local.toString()).append(op.padded)
          .append("braiding(").append(space1.toString()).append(", ")
          .append(space2.toString()).append(")");
    }
  }

  /** Publishes a local that the plan defined under the name of a surface
   * object, "{@code C = C#2}". */
  public static class Export extends Stmt {
    public final TensorRef object;
    public final TensorRef local;

    Export(Pos pos, TensorRef object, TensorRef local) {
      super(pos, Op.EXPORT);
      this.object = requireNonNull(object);
      this.local = requireNonNull(local);
      checkArgument(local.kind == TensorRef.Kind.LOCAL);
      checkArgument(object.kind == TensorRef.Kind.NAME);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, object, local);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Export
              && object.equals(((Export) o).object)
              && local.equals(((Export) o).local);
    }

    @Override
    public Stmt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    DiagramWriter unparse(DiagramWriter w, int left, int right) {
      return w.append(object.toString()).append(op.padded)
          .append(local.toString());
    }
  }
}

// End Diagram.java
