package com.cliffc.pyopt.node;

import com.cliffc.pyopt.Change;
import com.cliffc.pyopt.ChangeTag;
import com.cliffc.pyopt.ExcType;
import com.cliffc.pyopt.OptFault;
import com.cliffc.pyopt.PyOpt;
import com.cliffc.pyopt.SourceRef;
import com.cliffc.pyopt.TraceCollection;
import org.jetbrains.annotations.Nullable;

/** The exec() builtin called as a function, Python 3 only.  Its value is
 *  always None.  In an early closure the locals are still the raw frame; if
 *  the value is unused there, the statement form syncs them back cheaper.
 */
public class ExecNode extends ExprNode {
  public final boolean _inEarlyClosure;
  public ExecNode( boolean inEarlyClosure, ExprNode source, @Nullable ExprNode globals, @Nullable ExprNode locals, SourceRef loc ) {
    super(loc,source,globals,locals);
    if( !PyOpt.isPython3() ) throw new OptFault(this,"exec() is a statement before Python 3");
    _inEarlyClosure = inEarlyClosure;
  }
  @Override public String label() { return "BuiltinExec"; }
  @Override String details() { return _inEarlyClosure ? "in_early_closure" : null; }
  @Override String[] slots() { return EvalNode.SLOTS; }

  // TODO: evaluate constant source strings
  @Override public Change computeExpression( TraceCollection trace ) {
    trace.onExceptionRaiseExit(ExcType.BaseException);
    trace.onControlFlowEscape();
    return null;
  }

  @Override public Change computeExpressionDrop( ExprOnlyStmtNode stmt, TraceCollection trace ) {
    if( !_inEarlyClosure ) return null;
    ExecStmtNode exec = new ExecStmtNode((ExprNode)take(0),(ExprNode)take(1),(ExprNode)take(2),_loc);
    return new Change(exec,ChangeTag.NEW_STATEMENTS,
                      "Replaced built-in exec call to exec statement in early closure context.");
  }

  @Override public boolean mayRaiseException( ExcType exc ) { return true; }
}
