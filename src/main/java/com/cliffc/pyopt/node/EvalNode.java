package com.cliffc.pyopt.node;

import com.cliffc.pyopt.Change;
import com.cliffc.pyopt.ExcType;
import com.cliffc.pyopt.SourceRef;
import com.cliffc.pyopt.TraceCollection;
import org.jetbrains.annotations.Nullable;

// eval(source, globals, locals).  Opaque: the source runs unseen.
public class EvalNode extends ExprNode {
  static final String[] SLOTS = {"source","globals_arg","locals_arg"};
  public EvalNode( ExprNode source, @Nullable ExprNode globals, @Nullable ExprNode locals, SourceRef loc ) {
    super(loc,source,globals,locals);
  }
  @Override public String label() { return "BuiltinEval"; }
  @Override String[] slots() { return SLOTS; }

  // TODO: evaluate constant source strings
  @Override public Change computeExpression( TraceCollection trace ) {
    trace.onExceptionRaiseExit(ExcType.BaseException);
    trace.onControlFlowEscape();
    return null;
  }

  @Override public boolean mayRaiseException( ExcType exc ) { return true; }
}
