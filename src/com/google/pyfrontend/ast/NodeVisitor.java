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

package com.google.pyfrontend.ast;

/**
 * Visits the concrete statement and expression kinds. Every method defaults to {@link
 * #visitDefault(SyntaxNode)} so consumers only override what they care about.
 */
public interface NodeVisitor<T> {

  T visitDefault(SyntaxNode node);

  // Statements

  default T visitBlock(Block node) {
    return visitDefault(node);
  }

  default T visitExpressionStmt(ExpressionStmt node) {
    return visitDefault(node);
  }

  default T visitAssignmentStmt(AssignmentStmt node) {
    return visitDefault(node);
  }

  default T visitOperatorAssignmentStmt(OperatorAssignmentStmt node) {
    return visitDefault(node);
  }

  default T visitReturnStmt(ReturnStmt node) {
    return visitDefault(node);
  }

  default T visitDelStmt(DelStmt node) {
    return visitDefault(node);
  }

  default T visitRaiseStmt(RaiseStmt node) {
    return visitDefault(node);
  }

  default T visitAssertStmt(AssertStmt node) {
    return visitDefault(node);
  }

  default T visitPassStmt(PassStmt node) {
    return visitDefault(node);
  }

  default T visitBreakStmt(BreakStmt node) {
    return visitDefault(node);
  }

  default T visitContinueStmt(ContinueStmt node) {
    return visitDefault(node);
  }

  default T visitGlobalDecl(GlobalDecl node) {
    return visitDefault(node);
  }

  default T visitNonlocalDecl(NonlocalDecl node) {
    return visitDefault(node);
  }

  default T visitWhileStmt(WhileStmt node) {
    return visitDefault(node);
  }

  default T visitForStmt(ForStmt node) {
    return visitDefault(node);
  }

  default T visitIfStmt(IfStmt node) {
    return visitDefault(node);
  }

  default T visitWithStmt(WithStmt node) {
    return visitDefault(node);
  }

  default T visitTryStmt(TryStmt node) {
    return visitDefault(node);
  }

  default T visitImport(Import node) {
    return visitDefault(node);
  }

  default T visitImportFrom(ImportFrom node) {
    return visitDefault(node);
  }

  default T visitImportAll(ImportAll node) {
    return visitDefault(node);
  }

  default T visitClassDef(ClassDef node) {
    return visitDefault(node);
  }

  default T visitFuncDef(FuncDef node) {
    return visitDefault(node);
  }

  default T visitDecorator(Decorator node) {
    return visitDefault(node);
  }

  default T visitOverloadedFuncDef(OverloadedFuncDef node) {
    return visitDefault(node);
  }

  // Expressions

  default T visitNameExpr(NameExpr node) {
    return visitDefault(node);
  }

  default T visitIntExpr(IntExpr node) {
    return visitDefault(node);
  }

  default T visitFloatExpr(FloatExpr node) {
    return visitDefault(node);
  }

  default T visitComplexExpr(ComplexExpr node) {
    return visitDefault(node);
  }

  default T visitStrExpr(StrExpr node) {
    return visitDefault(node);
  }

  default T visitBytesExpr(BytesExpr node) {
    return visitDefault(node);
  }

  default T visitEllipsisExpr(EllipsisExpr node) {
    return visitDefault(node);
  }

  default T visitTupleExpr(TupleExpr node) {
    return visitDefault(node);
  }

  default T visitListExpr(ListExpr node) {
    return visitDefault(node);
  }

  default T visitSetExpr(SetExpr node) {
    return visitDefault(node);
  }

  default T visitDictExpr(DictExpr node) {
    return visitDefault(node);
  }

  default T visitGeneratorExpr(GeneratorExpr node) {
    return visitDefault(node);
  }

  default T visitListComprehension(ListComprehension node) {
    return visitDefault(node);
  }

  default T visitSetComprehension(SetComprehension node) {
    return visitDefault(node);
  }

  default T visitDictionaryComprehension(DictionaryComprehension node) {
    return visitDefault(node);
  }

  default T visitConditionalExpr(ConditionalExpr node) {
    return visitDefault(node);
  }

  default T visitOpExpr(OpExpr node) {
    return visitDefault(node);
  }

  default T visitUnaryExpr(UnaryExpr node) {
    return visitDefault(node);
  }

  default T visitComparisonExpr(ComparisonExpr node) {
    return visitDefault(node);
  }

  default T visitLambdaExpr(LambdaExpr node) {
    return visitDefault(node);
  }

  default T visitCallExpr(CallExpr node) {
    return visitDefault(node);
  }

  default T visitMemberExpr(MemberExpr node) {
    return visitDefault(node);
  }

  default T visitSuperExpr(SuperExpr node) {
    return visitDefault(node);
  }

  default T visitIndexExpr(IndexExpr node) {
    return visitDefault(node);
  }

  default T visitSliceExpr(SliceExpr node) {
    return visitDefault(node);
  }

  default T visitStarExpr(StarExpr node) {
    return visitDefault(node);
  }

  default T visitAwaitExpr(AwaitExpr node) {
    return visitDefault(node);
  }

  default T visitYieldExpr(YieldExpr node) {
    return visitDefault(node);
  }

  default T visitYieldFromExpr(YieldFromExpr node) {
    return visitDefault(node);
  }

  default T visitTempNode(TempNode node) {
    return visitDefault(node);
  }
}
