package com.cliffc.pyopt.node;

import com.cliffc.pyopt.Change;
import com.cliffc.pyopt.ChangeTag;
import com.cliffc.pyopt.ExcType;
import com.cliffc.pyopt.SourceRef;
import com.cliffc.pyopt.TraceCollection;

/** Raising as an expression.  Only produced by optimization, where raising
 *  is predicted to happen in the middle of an expression.  The source language
 *  only knows raise statements.
 */
public class RaiseExprNode extends ExprNode {
  private static final String[] SLOTS = {"exception_type","exception_value"};
  public RaiseExprNode( ExprNode type, ExprNode value, SourceRef loc ) { super(loc,type,value); }
  @Override public String label() { return "RaiseExceptionExpr"; }
  @Override String[] slots() { return SLOTS; }

  @Override public Change computeExpression( TraceCollection trace ) {
    trace.onExceptionRaiseExit(ExcType.BaseException);
    return null;
  }

  // Unused, this is just a raise statement
  @Override public Change computeExpressionDrop( ExprOnlyStmtNode stmt, TraceCollection trace ) {
    RaiseImplicitNode raise = new RaiseImplicitNode((ExprNode)take(0),(ExprNode)take(1),null,null,_loc);
    return new Change(raise,ChangeTag.NEW_RAISE,"Propagated implicit raise expression to raise statement.");
  }

  @Override public boolean mayRaiseException( ExcType exc ) { return true; }
  @Override public boolean willRaiseAnyException() { return true; }
}
