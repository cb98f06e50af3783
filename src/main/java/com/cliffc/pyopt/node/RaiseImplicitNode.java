package com.cliffc.pyopt.node;

import com.cliffc.pyopt.SourceRef;

// A raise the compiler made, e.g. from a raising expression.  Behaves exactly
// like the explicit one; only diagnostics differ.
public class RaiseImplicitNode extends RaiseNode {
  public RaiseImplicitNode( ExprNode type, ExprNode value, ExprNode trace, ExprNode cause, SourceRef loc ) {
    super(type,value,trace,cause,loc);
  }
  @Override public String label() { return "RaiseExceptionImplicit"; }
  @Override public String getStatementNiceName() { return "implicit exception raise statement"; }
}
