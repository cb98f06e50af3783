package com.cliffc.pyopt.node;

import com.cliffc.pyopt.Change;
import com.cliffc.pyopt.ExcType;
import com.cliffc.pyopt.LocalsScope;
import com.cliffc.pyopt.SourceRef;
import com.cliffc.pyopt.TraceCollection;

// The locals() dict of a scope.  Reading it cannot fail.
public class LocalsRefNode extends ExprNode {
  public final LocalsScope _scope;
  public LocalsRefNode( LocalsScope scope, SourceRef loc ) { super(loc); _scope=scope; }
  @Override public String label() { return "LocalsDictRef"; }
  @Override String details() { return _scope._name; }
  @Override public Change computeExpression( TraceCollection trace ) { return null; }
  @Override public boolean mayRaiseException( ExcType exc ) { return false; }
}
