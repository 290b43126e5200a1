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

package com.google.pyfrontend.convert;

import com.google.common.collect.ImmutableList;
import com.google.pyfrontend.ast.ArgKind;
import com.google.pyfrontend.ast.Argument;
import com.google.pyfrontend.ast.AssertStmt;
import com.google.pyfrontend.ast.AssignmentStmt;
import com.google.pyfrontend.ast.Block;
import com.google.pyfrontend.ast.BreakStmt;
import com.google.pyfrontend.ast.ClassDef;
import com.google.pyfrontend.ast.ContinueStmt;
import com.google.pyfrontend.ast.Decorator;
import com.google.pyfrontend.ast.DelStmt;
import com.google.pyfrontend.ast.Expression;
import com.google.pyfrontend.ast.ExpressionStmt;
import com.google.pyfrontend.ast.ForStmt;
import com.google.pyfrontend.ast.FuncDef;
import com.google.pyfrontend.ast.GlobalDecl;
import com.google.pyfrontend.ast.IfStmt;
import com.google.pyfrontend.ast.Import;
import com.google.pyfrontend.ast.ImportAll;
import com.google.pyfrontend.ast.ImportBase;
import com.google.pyfrontend.ast.ImportBase.ImportedName;
import com.google.pyfrontend.ast.ImportFrom;
import com.google.pyfrontend.ast.NameExpr;
import com.google.pyfrontend.ast.NonlocalDecl;
import com.google.pyfrontend.ast.OperatorAssignmentStmt;
import com.google.pyfrontend.ast.PassStmt;
import com.google.pyfrontend.ast.RaiseStmt;
import com.google.pyfrontend.ast.ReturnStmt;
import com.google.pyfrontend.ast.Statement;
import com.google.pyfrontend.ast.TempNode;
import com.google.pyfrontend.ast.TryStmt;
import com.google.pyfrontend.ast.TupleExpr;
import com.google.pyfrontend.ast.Var;
import com.google.pyfrontend.ast.WhileStmt;
import com.google.pyfrontend.ast.WithStmt;
import com.google.pyfrontend.rawtree.FragmentParser;
import com.google.pyfrontend.rawtree.RawNode;
import com.google.pyfrontend.rawtree.RawSyntaxException;
import com.google.pyfrontend.rawtree.Token;
import com.google.pyfrontend.types.AnyType;
import com.google.pyfrontend.types.CallableType;
import com.google.pyfrontend.types.Type;
import com.google.pyfrontend.types.TypeOfAny;
import com.google.pyfrontend.types.UnboundType;
import com.google.pyfrontend.types.UnresolvedInstance;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/** Converts raw statements. One raw statement always becomes one semantic statement. */
final class StatementConverter {

  private final AstConverter converter;

  StatementConverter(AstConverter converter) {
    this.converter = converter;
  }

  Statement convert(RawNode n) {
    switch (n.getToken()) {
      case FUNCTION_DEF:
        return SourcePositions.tag(convertFunction(n, false), n);
      case ASYNC_FUNCTION_DEF:
        return SourcePositions.tag(convertFunction(n, true), n);
      case CLASS_DEF:
        return SourcePositions.tag(convertClass(n), n);
      case RETURN:
        return SourcePositions.tag(
            new ReturnStmt(converter.convertOptionalExpression(n.getFirstChild())), n);
      case DELETE:
        return SourcePositions.tag(convertDelete(n), n);
      case ASSIGN:
        return SourcePositions.tag(convertAssign(n), n);
      case ANN_ASSIGN:
        return SourcePositions.tag(convertAnnAssign(n), n);
      case AUG_ASSIGN:
        return SourcePositions.tag(
            new OperatorAssignmentStmt(
                Operators.symbol(n.getOperator()),
                converter.convertExpression(n.getFirstChild()),
                converter.convertExpression(n.getSecondChild())),
            n);
      case FOR:
      case ASYNC_FOR:
        return SourcePositions.tag(convertFor(n), n);
      case WHILE:
        return SourcePositions.tag(
            new WhileStmt(
                converter.convertExpression(n.getFirstChild()),
                converter.asRequiredBlock(n.getSecondChild(), n.getLineno()),
                converter.asBlock(n.getChildAtIndex(2), n.getLineno())),
            n);
      case IF:
        return SourcePositions.tag(
            new IfStmt(
                ImmutableList.of(converter.convertExpression(n.getFirstChild())),
                ImmutableList.of(converter.asRequiredBlock(n.getSecondChild(), n.getLineno())),
                converter.asBlock(n.getChildAtIndex(2), n.getLineno())),
            n);
      case WITH:
      case ASYNC_WITH:
        return SourcePositions.tag(convertWith(n), n);
      case RAISE:
        return SourcePositions.tag(
            new RaiseStmt(
                converter.convertOptionalExpression(n.getFirstChild()),
                converter.convertOptionalExpression(n.getSecondChild())),
            n);
      case TRY:
        return SourcePositions.tag(convertTry(n), n);
      case ASSERT:
        return SourcePositions.tag(
            new AssertStmt(
                converter.convertExpression(n.getFirstChild()),
                converter.convertOptionalExpression(n.getSecondChild())),
            n);
      case IMPORT:
        return SourcePositions.tag(convertImport(n), n);
      case IMPORT_FROM:
        return SourcePositions.tag(convertImportFrom(n), n);
      case GLOBAL:
        return SourcePositions.tag(new GlobalDecl(names(n)), n);
      case NONLOCAL:
        return SourcePositions.tag(new NonlocalDecl(names(n)), n);
      case EXPR:
        return SourcePositions.tag(
            new ExpressionStmt(converter.convertExpression(n.getFirstChild())), n);
      case PASS:
        return SourcePositions.tag(new PassStmt(), n);
      case BREAK:
        return SourcePositions.tag(new BreakStmt(), n);
      case CONTINUE:
        return SourcePositions.tag(new ContinueStmt(), n);
      default:
        throw new IllegalStateException("Unexpected statement: " + n);
    }
  }

  // Functions

  /**
   * Converts a {@code def}, returning the function itself or, when it has decorators, the
   * decorator statement wrapping it.
   */
  private Statement convertFunction(RawNode n, boolean isCoroutine) {
    String name = n.getString();
    RawNode body = n.getSecondChild();
    List<RawNode> decoratorList = n.getChildAtIndex(2).children();
    RawNode returns = n.getChildAtIndex(3);
    int lineno = n.getLineno();

    boolean noTypeCheck = false;
    for (RawNode d : decoratorList) {
      noTypeCheck |= isNoTypeCheckDecorator(d);
    }

    List<Argument> args = converter.transformArgs(n.getFirstChild(), noTypeCheck);

    List<ArgKind> argKinds = new ArrayList<>(args.size());
    List<@Nullable String> argNames = new ArrayList<>(args.size());
    boolean elideAll = ArgumentNames.specialFunctionElideNames(name);
    for (Argument arg : args) {
      argKinds.add(arg.getKind());
      String argName = arg.getVariable().getName();
      argNames.add(elideAll || ArgumentNames.argumentElideName(argName) ? null : argName);
    }

    List<@Nullable Type> argTypes;
    @Nullable Type returnType;
    String typeComment = n.getTypeComment();
    if (noTypeCheck) {
      argTypes = new ArrayList<>(Collections.nCopies(args.size(), null));
      returnType = null;
    } else if (typeComment != null) {
      RawNode funcType = parseFunctionTypeComment(typeComment, n);
      if (funcType == null) {
        argTypes = new ArrayList<>(Collections.nCopies(args.size(), fromError()));
        returnType = fromError();
      } else {
        List<RawNode> commentArgTypes = funcType.getFirstChild().children();
        boolean ellipsisArgs =
            commentArgTypes.size() == 1 && commentArgTypes.get(0).getToken() == Token.ELLIPSIS;
        boolean hasInline = !returns.isEmpty();
        if (!ellipsisArgs) {
          for (Argument a : args) {
            hasInline |= a.getTypeAnnotation() != null;
          }
        }
        TypeSignatures.Reconciliation choice = TypeSignatures.reconcile(hasInline, true);
        if (choice.duplicate()) {
          converter.report(lineno, n.getCharno(), ConverterDiagnostics.DUPLICATE_TYPE_SIGNATURES);
        }
        if (choice.source() == TypeSignatures.Source.INLINE) {
          argTypes = annotationTypes(args, false);
          returnType = convertReturns(returns);
        } else {
          TypeConverter typeConverter = converter.typeConverter(lineno);
          if (ellipsisArgs) {
            argTypes = annotationTypes(args, true);
          } else {
            argTypes = new ArrayList<>();
            for (Type t : typeConverter.convertAll(commentArgTypes, null)) {
              argTypes.add(t);
            }
            // Add the implicit type of self.
            if (converter.inClass() && argTypes.size() == args.size() - 1) {
              argTypes.add(0, new AnyType(TypeOfAny.SPECIAL_FORM));
            }
          }
          returnType = typeConverter.convert(funcType.getSecondChild());
        }
      }
    } else {
      argTypes = annotationTypes(args, false);
      returnType = convertReturns(returns);
    }

    for (int i = 0; i < Math.min(args.size(), argTypes.size()); i++) {
      setTypeOptional(argTypes.get(i), args.get(i).getInitializer());
    }

    CallableType funcType = null;
    if (returnType != null || argTypes.stream().anyMatch(t -> t != null)) {
      DiagnosticType problem = TypeSignatures.checkArity(argTypes, argKinds.size());
      if (problem != null) {
        converter.report(lineno, 0, problem);
      } else {
        List<Type> completeArgTypes = new ArrayList<>(argTypes.size());
        for (Type t : argTypes) {
          completeArgTypes.add(t != null ? t : new AnyType(TypeOfAny.UNANNOTATED));
        }
        funcType =
            new CallableType(
                completeArgTypes,
                argKinds,
                argNames,
                returnType != null ? returnType : new AnyType(TypeOfAny.UNANNOTATED),
                UnresolvedInstance.MISSING_FALLBACK);
      }
    }

    FuncDef funcDef =
        new FuncDef(name, args, converter.asRequiredBlock(body, lineno), funcType);
    if (funcType != null) {
      // Later passes rewrite the declared type in place.
      funcDef.setUnanalyzedType(funcType.copy());
      funcType.setDefinition(funcDef);
      funcType.setLine(lineno);
    }
    funcDef.setCoroutine(isCoroutine);
    SourcePositions.tag(funcDef, n);

    if (decoratorList.isEmpty()) {
      return funcDef;
    }
    Var var = new Var(name);
    var.setReady(false);
    var.setLine(decoratorList.get(0).getLineno());

    funcDef.setDecorated(true);
    funcDef.setLine(lineno + decoratorList.size());
    funcDef.getBody().setLine(funcDef.getLine());
    return new Decorator(funcDef, converter.convertExpressions(decoratorList), var);
  }

  /** Parses a whole-signature type comment, reporting it when it does not parse. */
  private @Nullable RawNode parseFunctionTypeComment(String typeComment, RawNode n) {
    try {
      return FragmentParser.parseFunctionType(typeComment);
    } catch (RawSyntaxException e) {
      String stripped = stripComment(typeComment);
      converter.report(
          n.getLineno(),
          n.getCharno(),
          ConverterDiagnostics.FUNCTION_TYPE_COMMENT_SYNTAX_ERROR,
          stripped);
      if (!stripped.isEmpty() && stripped.charAt(0) != '(') {
        converter.report(
            n.getLineno(), n.getCharno(), ConverterDiagnostics.WRAP_ARGUMENT_TYPES);
      }
      return null;
    }
  }

  /** The text of a type comment up to any trailing comment, without surrounding whitespace. */
  private static String stripComment(String typeComment) {
    int hash = typeComment.indexOf('#');
    return (hash < 0 ? typeComment : typeComment.substring(0, hash)).strip();
  }

  /**
   * The inline annotation of every argument. With {@code anyWhenMissing}, unannotated arguments
   * get an unannotated Any instead of no type.
   */
  private static List<@Nullable Type> annotationTypes(
      List<Argument> args, boolean anyWhenMissing) {
    List<@Nullable Type> types = new ArrayList<>(args.size());
    for (Argument a : args) {
      Type t = a.getTypeAnnotation();
      if (t == null && anyWhenMissing) {
        t = new AnyType(TypeOfAny.UNANNOTATED);
      }
      types.add(t);
    }
    return types;
  }

  private @Nullable Type convertReturns(RawNode returns) {
    if (returns.isEmpty()) {
      return null;
    }
    return converter.typeConverter(returns.getLineno()).convert(returns);
  }

  /** An argument defaulting to None implicitly accepts None. */
  private void setTypeOptional(@Nullable Type type, @Nullable Expression initializer) {
    if (converter.getOptions().isNoImplicitOptional()) {
      return;
    }
    boolean optional =
        initializer instanceof NameExpr && ((NameExpr) initializer).getName().equals("None");
    if (type instanceof UnboundType) {
      ((UnboundType) type).setOptional(optional);
    }
  }

  /** {@code @no_type_check} or {@code @typing.no_type_check}. */
  private static boolean isNoTypeCheckDecorator(RawNode expr) {
    if (expr.isName()) {
      return "no_type_check".equals(expr.getString());
    } else if (expr.isAttribute()) {
      RawNode value = expr.getFirstChild();
      return value.isName()
          && "typing".equals(value.getString())
          && "no_type_check".equals(expr.getString());
    }
    return false;
  }

  private static AnyType fromError() {
    return new AnyType(TypeOfAny.FROM_ERROR);
  }

  // Classes

  private ClassDef convertClass(RawNode n) {
    converter.enterClass();
    try {
      Map<String, Expression> keywords = new LinkedHashMap<>();
      for (RawNode kw : n.getSecondChild().children()) {
        if (kw.getString() != null) {
          keywords.put(kw.getString(), converter.convertExpression(kw.getFirstChild()));
        }
      }
      ClassDef cdef =
          new ClassDef(
              n.getString(),
              converter.asRequiredBlock(n.getChildAtIndex(2), n.getLineno()),
              converter.convertExpressions(n.getFirstChild().children()),
              keywords);
      cdef.setDecorators(converter.convertExpressions(n.getChildAtIndex(3).children()));
      return cdef;
    } finally {
      converter.exitClass();
    }
  }

  // Simple statements

  private DelStmt convertDelete(RawNode n) {
    if (n.getChildCount() > 1) {
      TupleExpr tup = new TupleExpr(converter.convertExpressions(n.children()));
      tup.setLine(n.getLineno());
      return new DelStmt(tup);
    }
    return new DelStmt(converter.convertExpression(n.getFirstChild()));
  }

  private AssignmentStmt convertAssign(RawNode n) {
    List<Expression> lvalues = converter.convertExpressions(n.getFirstChild().children());
    Expression rvalue = converter.convertExpression(n.getSecondChild());
    Type type = null;
    if (n.getTypeComment() != null) {
      type =
          TypeConverter.parseTypeComment(
              n.getTypeComment(), n.getLineno(), converter.getReporter());
    }
    return new AssignmentStmt(lvalues, rvalue, type, false);
  }

  /** {@code x: T = value}; without a value, the right-hand side is a placeholder. */
  private AssignmentStmt convertAnnAssign(RawNode n) {
    RawNode value = n.getChildAtIndex(2);
    Expression rvalue;
    if (value.isEmpty()) {
      rvalue = new TempNode(new AnyType(TypeOfAny.SPECIAL_FORM), true);
    } else {
      rvalue = converter.convertExpression(value);
    }
    RawNode annotation = n.getSecondChild();
    Type type = converter.typeConverter(n.getLineno()).convert(annotation);
    type.setColumn(annotation.getCharno());
    return new AssignmentStmt(
        ImmutableList.of(converter.convertExpression(n.getFirstChild())), rvalue, type, true);
  }

  private ImmutableList<String> names(RawNode n) {
    ImmutableList.Builder<String> names = ImmutableList.builder();
    for (RawNode name : n.children()) {
      names.add(name.getString());
    }
    return names.build();
  }

  // Compound statements

  private ForStmt convertFor(RawNode n) {
    Type targetType = typeCommentOf(n);
    ForStmt node =
        new ForStmt(
            converter.convertExpression(n.getFirstChild()),
            converter.convertExpression(n.getSecondChild()),
            converter.asRequiredBlock(n.getChildAtIndex(2), n.getLineno()),
            converter.asBlock(n.getChildAtIndex(3), n.getLineno()),
            targetType);
    node.setAsync(n.getToken() == Token.ASYNC_FOR);
    return node;
  }

  private WithStmt convertWith(RawNode n) {
    Type targetType = typeCommentOf(n);
    List<Expression> exprs = new ArrayList<>();
    List<@Nullable Expression> targets = new ArrayList<>();
    for (RawNode item : n.getFirstChild().children()) {
      exprs.add(converter.convertExpression(item.getFirstChild()));
      targets.add(converter.convertOptionalExpression(item.getSecondChild()));
    }
    WithStmt node =
        new WithStmt(
            exprs,
            targets,
            converter.asRequiredBlock(n.getSecondChild(), n.getLineno()),
            targetType);
    node.setAsync(n.getToken() == Token.ASYNC_WITH);
    return node;
  }

  private @Nullable Type typeCommentOf(RawNode n) {
    String typeComment = n.getTypeComment();
    if (typeComment == null) {
      return null;
    }
    return TypeConverter.parseTypeComment(typeComment, n.getLineno(), converter.getReporter());
  }

  private TryStmt convertTry(RawNode n) {
    List<@Nullable NameExpr> vars = new ArrayList<>();
    List<@Nullable Expression> types = new ArrayList<>();
    List<Block> handlers = new ArrayList<>();
    for (RawNode h : n.getSecondChild().children()) {
      vars.add(h.getString() != null ? SourcePositions.tag(new NameExpr(h.getString()), h) : null);
      types.add(converter.convertOptionalExpression(h.getFirstChild()));
      handlers.add(converter.asRequiredBlock(h.getSecondChild(), h.getLineno()));
    }
    return new TryStmt(
        converter.asRequiredBlock(n.getFirstChild(), n.getLineno()),
        vars,
        types,
        handlers,
        converter.asBlock(n.getChildAtIndex(2), n.getLineno()),
        converter.asBlock(n.getChildAtIndex(3), n.getLineno()));
  }

  // Imports

  private Import convertImport(RawNode n) {
    ImmutableList.Builder<ImportedName> names = ImmutableList.builder();
    for (RawNode alias : n.children()) {
      String name = converter.getOptions().translateModuleId(alias.getString());
      String asName = (String) alias.getProp(RawNode.Prop.AS_NAME);
      if (asName == null && !name.equals(alias.getString())) {
        // A translated module stays reachable under the name it was imported by.
        asName = alias.getString();
      }
      names.add(new ImportedName(name, asName));
    }
    Import i = new Import(names.build());
    converter.addImport(i);
    return i;
  }

  private ImportBase convertImportFrom(RawNode n) {
    String module = n.getString();
    int level = n.getIntProp(RawNode.Prop.LEVEL, 0);
    ImportBase i;
    if (n.getChildCount() == 1 && "*".equals(n.getFirstChild().getString())) {
      i = new ImportAll(module != null ? module : "", level);
    } else {
      ImmutableList.Builder<ImportedName> names = ImmutableList.builder();
      for (RawNode alias : n.children()) {
        names.add(
            new ImportedName(alias.getString(), (String) alias.getProp(RawNode.Prop.AS_NAME)));
      }
      i =
          new ImportFrom(
              module != null ? converter.getOptions().translateModuleId(module) : "",
              level,
              names.build());
    }
    converter.addImport(i);
    return i;
  }
}
