package com.cliffc.pyopt.node;

import com.cliffc.pyopt.Change;
import com.cliffc.pyopt.ChangeTag;
import com.cliffc.pyopt.TraceCollection;

// An expression evaluated for its side effects; the value is discarded.
public class ExprOnlyStmtNode extends StmtNode {
  private static final String[] SLOTS = {"expression"};
  public ExprOnlyStmtNode( ExprNode expr ) { super(expr._loc,expr); }
  @Override public String label() { return "ExpressionOnly"; }
  @Override String[] slots() { return SLOTS; }
  @Override public String getStatementNiceName() { return "expression only statement"; }

  public ExprNode expr() { return (ExprNode)in(0); }

  @Override public Change computeStatement( TraceCollection trace ) {
    ExprNode expr = trace.onExpression(expr());
    if( !expr.mayHaveSideEffects() )
      return new Change(null,ChangeTag.NEW_STATEMENTS,"Removed statement without effect.");
    return expr.computeExpressionDrop(this,trace);
  }

  @Override public boolean willRaiseAnyException() { return expr().willRaiseAnyException(); }
}
