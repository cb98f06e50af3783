package com.cliffc.pyopt.node;

import com.cliffc.pyopt.Change;
import com.cliffc.pyopt.ExcType;
import com.cliffc.pyopt.SourceRef;
import com.cliffc.pyopt.TraceCollection;

// Bare 'raise' of the exception being handled.  Not reduced: that needs the
// handler it sits in correlated with what the tried block raises.
public class ReraiseNode extends StmtNode {
  public ReraiseNode( SourceRef loc ) { super(loc); }
  @Override public String label() { return "ReraiseException"; }
  @Override public String getStatementNiceName() { return "exception re-raise statement"; }

  @Override public Change computeStatement( TraceCollection trace ) {
    trace.onExceptionRaiseExit(ExcType.BaseException);
    return null;
  }

  @Override public boolean mayRaiseException( ExcType exc ) { return true; }
  @Override public boolean willRaiseAnyException() { return true; }
  // The exception being handled already has its traceback.  Not true without
  // one pending, which ends up with the wrong frame attached.
  @Override public boolean needsFrame() { return false; }
}
