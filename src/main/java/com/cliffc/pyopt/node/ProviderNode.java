package com.cliffc.pyopt.node;

import com.cliffc.pyopt.LocalsScope;
import com.cliffc.pyopt.SourceRef;
import com.cliffc.pyopt.TraceCollection;

/** Provides a locals scope to the code in its body: a module, a function or
 *  a class body.  Each body is computed by the driver against its own
 *  {@link TraceCollection}.
 */
public abstract class ProviderNode extends StmtNode {
  private static final String[] SLOTS = {"body"};
  public final LocalsScope _scope;
  ProviderNode( LocalsScope scope, StatementsNode body, SourceRef loc ) {
    super(loc,body);
    _scope = scope;
  }
  @Override String[] slots() { return SLOTS; }
  @Override String details() { return _scope._name; }

  public StatementsNode body() { return (StatementsNode)in(0); }

  // Module namespaces are dicts already
  public boolean isCompiledModule() { return false; }

  public void computeBody( TraceCollection trace ) { trace.onStatement(body()); }
}
