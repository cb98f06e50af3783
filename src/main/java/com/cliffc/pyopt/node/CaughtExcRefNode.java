package com.cliffc.pyopt.node;

import com.cliffc.pyopt.Change;
import com.cliffc.pyopt.ExcType;
import com.cliffc.pyopt.SourceRef;
import com.cliffc.pyopt.TraceCollection;

// Reads part of the exception currently being handled.  Pure reads.  Might
// become predictable from the handler they sit in; until then irreducible.
public abstract class CaughtExcRefNode extends ExprNode {
  CaughtExcRefNode( SourceRef loc ) { super(loc); }
  @Override public Change computeExpression( TraceCollection trace ) { return null; }
  @Override public boolean mayRaiseException( ExcType exc ) { return false; }
  @Override public boolean mayHaveSideEffects() { return false; }
}
