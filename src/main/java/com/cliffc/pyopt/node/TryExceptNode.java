package com.cliffc.pyopt.node;

import com.cliffc.pyopt.Change;
import com.cliffc.pyopt.ChangeTag;
import com.cliffc.pyopt.ExcType;
import com.cliffc.pyopt.SourceRef;
import com.cliffc.pyopt.TraceCollection;
import com.cliffc.pyopt.Variable;
import com.cliffc.pyopt.VariableTrace;
import com.cliffc.pyopt.TraceCollection.ExceptionExit;
import com.cliffc.pyopt.util.Ary;

import java.util.Map;

/** try/except catching everything ({@code except BaseException:}).  The
 *  handler starts from what is known at every point the tried block may
 *  raise; after the statement only what holds on both fall-through paths is
 *  known.
 */
public class TryExceptNode extends StmtNode {
  private static final String[] SLOTS = {"tried","handler"};
  public TryExceptNode( StatementsNode tried, StatementsNode handler, SourceRef loc ) { super(loc,tried,handler); }
  @Override public String label() { return "TryExcept"; }
  @Override String[] slots() { return SLOTS; }
  @Override public String getStatementNiceName() { return "try/except statement"; }

  public StatementsNode tried  () { return (StatementsNode)in(0); }
  public StatementsNode handler() { return (StatementsNode)in(1); }

  @Override public Change computeStatement( TraceCollection trace ) {
    trace.pushExceptionExits();
    trace.onStatement(tried());
    Ary<ExceptionExit> exits = trace.popExceptionExits();
    if( exits.isEmpty() )
      return new Change(take(0),ChangeTag.NEW_STATEMENTS,"Removed exception handler, the tried block cannot raise.");

    Map<Variable,VariableTrace> tried_end = tried().willRaiseAnyException() ? null : trace.snapshot();
    trace.restore(TraceCollection.mergeExits(exits));
    trace.onStatement(handler());
    Map<Variable,VariableTrace> handler_end = handler().willRaiseAnyException() ? null : trace.snapshot();
    trace.restore(TraceCollection.merge(tried_end,handler_end));
    return null;
  }

  // Whatever the tried block raises is caught
  @Override public boolean mayRaiseException( ExcType exc ) { return handler().mayRaiseException(exc); }
  @Override public boolean willRaiseAnyException() {
    return tried().willRaiseAnyException() && handler().willRaiseAnyException();
  }
}
