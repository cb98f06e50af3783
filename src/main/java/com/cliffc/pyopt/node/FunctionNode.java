package com.cliffc.pyopt.node;

import com.cliffc.pyopt.Change;
import com.cliffc.pyopt.ExcType;
import com.cliffc.pyopt.LocalsScope;
import com.cliffc.pyopt.OptFault;
import com.cliffc.pyopt.SourceRef;
import com.cliffc.pyopt.TraceCollection;
import com.cliffc.pyopt.Variable;

// 'def': binds the function in the enclosing scope.  The body does not run
// here.
public class FunctionNode extends ProviderNode {
  public final Variable _bind;  // Name bound in the enclosing scope
  public FunctionNode( Variable bind, LocalsScope scope, StatementsNode body, SourceRef loc ) {
    super(scope,body,loc);
    if( scope._kind != LocalsScope.Kind.FUNCTION ) throw new OptFault(this,"function with "+scope);
    _bind = bind;
  }
  @Override public String label() { return "FunctionDef"; }
  @Override public String getStatementNiceName() { return "function definition"; }

  @Override public Change computeStatement( TraceCollection trace ) {
    trace.onVariableSet(_bind,null);
    return null;
  }
  @Override public boolean mayRaiseException( ExcType exc ) { return false; }
}
