package com.cliffc.pyopt.node;

import com.cliffc.pyopt.Change;
import com.cliffc.pyopt.ExcType;
import com.cliffc.pyopt.LocalsScope;
import com.cliffc.pyopt.OptFault;
import com.cliffc.pyopt.SourceRef;
import com.cliffc.pyopt.TraceCollection;
import com.cliffc.pyopt.Variable;

// 'class': runs the body right here, then binds the class in the enclosing
// scope.  The body is analyzed in its own trace, so to the enclosing trace it
// is unknown code.
public class ClassNode extends ProviderNode {
  public final Variable _bind;
  public ClassNode( Variable bind, LocalsScope scope, StatementsNode body, SourceRef loc ) {
    super(scope,body,loc);
    if( scope._kind != LocalsScope.Kind.CLASS ) throw new OptFault(this,"class with "+scope);
    _bind = bind;
  }
  @Override public String label() { return "ClassDef"; }
  @Override public String getStatementNiceName() { return "class definition"; }

  @Override public Change computeStatement( TraceCollection trace ) {
    trace.onControlFlowEscape();
    if( body().mayRaiseException(ExcType.BaseException) )
      trace.onExceptionRaiseExit(ExcType.BaseException);
    if( !body().willRaiseAnyException() )
      trace.onVariableSet(_bind,null);
    return null;
  }
  @Override public boolean willRaiseAnyException() { return body().willRaiseAnyException(); }
  @Override public boolean needsFrame() { return true; }
}
