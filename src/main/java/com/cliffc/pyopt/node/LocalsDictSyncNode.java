package com.cliffc.pyopt.node;

import com.cliffc.pyopt.Change;
import com.cliffc.pyopt.ChangeTag;
import com.cliffc.pyopt.ExcType;
import com.cliffc.pyopt.LocalsScope;
import com.cliffc.pyopt.SourceRef;
import com.cliffc.pyopt.TraceCollection;
import com.cliffc.pyopt.VariableTrace;

import java.util.Collections;
import java.util.Set;

/** Copies a dynamically executed locals dict back into the tracked variables
 *  of 'scope'.  Made by the builder after exec-like code.  Any local may have
 *  been bound or rebound unseen, so nothing known before survives it.
 */
public class LocalsDictSyncNode extends StmtNode {
  private static final String[] SLOTS = {"locals_arg"};
  public final LocalsScope _scope;
  private Set<VariableTrace> _previous_traces = Collections.emptySet();
  private Set<VariableTrace> _variable_traces = Collections.emptySet();

  public LocalsDictSyncNode( LocalsScope scope, ExprNode locals, SourceRef loc ) { super(loc,locals); _scope=scope; }
  @Override public String label() { return "LocalsDictSync"; }
  @Override String details() { return _scope._name; }
  @Override String[] slots() { return SLOTS; }
  @Override public String getStatementNiceName() { return "locals dict sync statement"; }

  public ExprNode localsArg() { return (ExprNode)in(0); }
  // Traces of the scope's variables just before and just after the last sync
  public Set<VariableTrace> getPreviousVariableTraces() { return _previous_traces; }
  public Set<VariableTrace> getVariableTraces() { return _variable_traces; }

  @Override public Change computeStatement( TraceCollection trace ) {
    ExprNode locals = trace.onExpression(localsArg());
    if( locals.willRaiseAnyException() )
      return new Change(new ExprOnlyStmtNode((ExprNode)take(0)),ChangeTag.NEW_RAISE,
                        "Locals dict sync raises implicitly when determining locals argument.");

    if( getParentVariableProvider().isCompiledModule() )
      return new Change(null,ChangeTag.NEW_STATEMENTS,"Removed sync back to locals without locals.");

    _previous_traces = trace.onLocalsUsage(_scope);
    if( _previous_traces.isEmpty() )
      return new Change(null,ChangeTag.NEW_STATEMENTS,"Removed sync back to locals without locals.");

    trace.removeAllKnowledge();
    _variable_traces = trace.onLocalsUsage(_scope);
    return null;
  }

  @Override public boolean mayRaiseException( ExcType exc ) { return false; }
}
