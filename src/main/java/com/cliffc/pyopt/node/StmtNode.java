package com.cliffc.pyopt.node;

import com.cliffc.pyopt.Change;
import com.cliffc.pyopt.SourceRef;
import com.cliffc.pyopt.TraceCollection;

public abstract class StmtNode extends Node {
  StmtNode( SourceRef loc, Node... kids ) { super(loc,kids); }

  @Override public final boolean isExpression() { return false; }

  /** Compute against the trace.  Children are computed through the trace, in
   *  evaluation order.
   *  @return null for no progress; else a replacement, where a null
   *  replacement deletes the statement and a {@link StatementsNode} is
   *  spliced in flat */
  public abstract Change computeStatement( TraceCollection trace );

  // Diagnostic label
  public abstract String getStatementNiceName();
}
