package com.cliffc.pyopt.node;

import com.cliffc.pyopt.Change;
import com.cliffc.pyopt.ExcType;
import com.cliffc.pyopt.SourceRef;
import com.cliffc.pyopt.TraceCollection;

// Builds an exception object without raising it, e.g. 'ValueError(x)'.
// Construction itself is taken not to raise once the arguments are computed;
// only the arguments can.
public class MakeExceptionNode extends ExprNode {
  public final ExcType _exc;
  public MakeExceptionNode( ExcType exc, SourceRef loc, ExprNode... args ) { super(loc,args); _exc=exc; }
  @Override public String label() { return "MakeException"; }
  @Override String details() { return _exc.name(); }
  @Override public String slotName( int i ) { return "args"+i; }

  public int nargs() { return len(); }

  @Override public Change computeExpression( TraceCollection trace ) { return null; }
}
