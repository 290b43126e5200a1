/*
 * Copyright 2026 The Closure Compiler Authors.
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
 * limitations under the License.
 */

package com.google.pyfrontend.rawtree;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * A node of the raw syntax tree: a {@link Token}, a source position, ordered children, an
 * optional string payload and a handful of typed properties.
 *
 * <p>The converter only reads raw trees; it never changes one.
 */
public class RawNode {

  /** Typed properties. The value class of each is fixed. */
  public enum Prop {
    /** String: the trailing {@code # type:} comment, without the prefix. */
    TYPE_COMMENT,
    /** String: the {@code as} name of an import alias. */
    AS_NAME,
    /** Integer: number of leading dots of a relative import. */
    LEVEL,
    /** Boolean: an {@code async for} comprehension clause. */
    IS_ASYNC,
    /** {@link ExprContext}. */
    CONTEXT,
    /** {@link Operator}. */
    OPERATOR,
    /** Immutable list of {@link Operator}, one per comparator. */
    COMPARE_OPS,
    /** {@link BigInteger} or {@link Double}. */
    NUMBER,
    /** Boolean: the number is imaginary, e.g. {@code 2j}. */
    IMAGINARY,
    /** byte[]: the value of a bytes literal. */
    BYTES_VALUE,
    /** Integer: the {@code !r}-style conversion character of a formatted value, or -1. */
    CONVERSION,
  }

  private final Token token;
  private final List<RawNode> children = new ArrayList<>();
  private final Map<Prop, Object> props = new EnumMap<>(Prop.class);
  private @Nullable String string;
  private int lineno = -1;
  private int charno = -1;

  public RawNode(Token token) {
    this.token = checkNotNull(token);
  }

  public RawNode(Token token, RawNode... children) {
    this(token);
    for (RawNode child : children) {
      addChildToBack(child);
    }
  }

  public static RawNode newString(Token token, @Nullable String str) {
    RawNode n = new RawNode(token);
    n.string = str;
    return n;
  }

  public final Token getToken() {
    return token;
  }

  // Children

  public final boolean hasChildren() {
    return !children.isEmpty();
  }

  public final int getChildCount() {
    return children.size();
  }

  public final RawNode getChildAtIndex(int i) {
    return children.get(i);
  }

  public final RawNode getFirstChild() {
    checkState(hasChildren(), "%s has no children", token);
    return children.get(0);
  }

  public final RawNode getSecondChild() {
    checkState(children.size() >= 2, "%s has fewer than two children", token);
    return children.get(1);
  }

  public final RawNode getLastChild() {
    checkState(hasChildren(), "%s has no children", token);
    return children.get(children.size() - 1);
  }

  /** A read-only view of the children. */
  public final List<RawNode> children() {
    return Collections.unmodifiableList(children);
  }

  /** The children after the first {@code n}. */
  public final List<RawNode> childrenFrom(int n) {
    return Collections.unmodifiableList(children.subList(n, children.size()));
  }

  public final void addChildToBack(RawNode child) {
    children.add(checkNotNull(child));
  }

  // Payloads

  public final @Nullable String getString() {
    return string;
  }

  public final void setString(@Nullable String str) {
    this.string = str;
  }

  public final @Nullable Object getProp(Prop prop) {
    return props.get(prop);
  }

  @CanIgnoreReturnValue
  public final RawNode putProp(Prop prop, @Nullable Object value) {
    if (value == null) {
      props.remove(prop);
    } else {
      props.put(prop, value);
    }
    return this;
  }

  public final boolean getBooleanProp(Prop prop) {
    return Boolean.TRUE.equals(props.get(prop));
  }

  public final int getIntProp(Prop prop, int defaultValue) {
    Object value = props.get(prop);
    return value == null ? defaultValue : (Integer) value;
  }

  public final @Nullable String getTypeComment() {
    return (String) props.get(Prop.TYPE_COMMENT);
  }

  @CanIgnoreReturnValue
  public final RawNode setTypeComment(@Nullable String typeComment) {
    return putProp(Prop.TYPE_COMMENT, typeComment);
  }

  public final Operator getOperator() {
    return (Operator) checkNotNull(props.get(Prop.OPERATOR), "%s has no operator", token);
  }

  @SuppressWarnings("unchecked")
  public final ImmutableList<Operator> getCompareOps() {
    return (ImmutableList<Operator>) checkNotNull(props.get(Prop.COMPARE_OPS));
  }

  public final ExprContext getContext() {
    Object context = props.get(Prop.CONTEXT);
    return context == null ? ExprContext.LOAD : (ExprContext) context;
  }

  @CanIgnoreReturnValue
  public final RawNode setContext(ExprContext context) {
    return putProp(Prop.CONTEXT, context);
  }

  public final Number getNumber() {
    Object number = checkNotNull(props.get(Prop.NUMBER), "%s has no number", token);
    checkState(number instanceof BigInteger || number instanceof Double, number);
    return (Number) number;
  }

  public final byte[] getBytes() {
    return ((byte[]) checkNotNull(props.get(Prop.BYTES_VALUE))).clone();
  }

  // Position

  /** One-indexed line, or -1 when unknown. */
  public final int getLineno() {
    return lineno;
  }

  /** Zero-indexed column offset, or -1 when unknown. */
  public final int getCharno() {
    return charno;
  }

  @CanIgnoreReturnValue
  public final RawNode setLinenoCharno(int lineno, int charno) {
    checkArgument(lineno >= -1 && charno >= -1, "bad position %s:%s", lineno, charno);
    this.lineno = lineno;
    this.charno = charno;
    return this;
  }

  /** Copies the position of {@code other}. */
  @CanIgnoreReturnValue
  public final RawNode srcref(RawNode other) {
    return setLinenoCharno(other.lineno, other.charno);
  }

  // Predicates

  public final boolean isEmpty() {
    return token == Token.EMPTY;
  }

  public final boolean isList() {
    return token == Token.LIST;
  }

  public final boolean isName() {
    return token == Token.NAME;
  }

  public final boolean isAttribute() {
    return token == Token.ATTRIBUTE;
  }

  public final boolean isCall() {
    return token == Token.CALL;
  }

  public final boolean isStarred() {
    return token == Token.STARRED;
  }

  public final boolean isNameConstant(String value) {
    return token == Token.NAME_CONSTANT && value.equals(string);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(token.name());
    if (string != null) {
      sb.append(' ').append(string);
    }
    if (lineno != -1) {
      sb.append(' ').append(lineno).append(':').append(charno);
    }
    return sb.toString();
  }

  /** Prints the subtree, one node per line, for debugging. */
  public final String toStringTree() {
    StringBuilder sb = new StringBuilder();
    appendStringTree(sb, 0);
    return sb.toString();
  }

  private void appendStringTree(StringBuilder sb, int level) {
    sb.append("    ".repeat(level)).append(this);
    if (!props.isEmpty()) {
      sb.append(' ').append(props.keySet());
    }
    sb.append('\n');
    for (RawNode child : children) {
      child.appendStringTree(sb, level + 1);
    }
  }
}
