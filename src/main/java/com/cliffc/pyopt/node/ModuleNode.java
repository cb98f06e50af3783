package com.cliffc.pyopt.node;

import com.cliffc.pyopt.Change;
import com.cliffc.pyopt.LocalsScope;
import com.cliffc.pyopt.OptFault;
import com.cliffc.pyopt.SourceRef;
import com.cliffc.pyopt.TraceCollection;

// Tree root: a compiled module.
public class ModuleNode extends ProviderNode {
  public ModuleNode( LocalsScope scope, StatementsNode body, SourceRef loc ) {
    super(scope,body,loc);
    if( scope._kind != LocalsScope.Kind.MODULE ) throw new OptFault(this,"module with "+scope);
  }
  @Override public String label() { return "Module"; }
  @Override public String getStatementNiceName() { return "module"; }
  @Override public boolean isCompiledModule() { return true; }

  @Override public Change computeStatement( TraceCollection trace ) {
    throw new OptFault(this,"a module is not a statement");
  }
}
