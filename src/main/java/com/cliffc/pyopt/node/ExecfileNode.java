package com.cliffc.pyopt.node;

import com.cliffc.pyopt.Change;
import com.cliffc.pyopt.ChangeTag;
import com.cliffc.pyopt.ExcType;
import com.cliffc.pyopt.OptFault;
import com.cliffc.pyopt.PyOpt;
import com.cliffc.pyopt.SourceRef;
import com.cliffc.pyopt.TraceCollection;
import org.jetbrains.annotations.Nullable;

// execfile(filename, globals, locals), before Python 3 only.  Reading and
// compiling the file can always fail.
public class ExecfileNode extends ExprNode {
  public final boolean _inClassBody;
  public ExecfileNode( boolean inClassBody, ExprNode source, @Nullable ExprNode globals, @Nullable ExprNode locals, SourceRef loc ) {
    super(loc,source,globals,locals);
    if( PyOpt.isPython3() ) throw new OptFault(this,"execfile() does not exist in Python 3");
    _inClassBody = inClassBody;
  }
  @Override public String label() { return "BuiltinExecfile"; }
  @Override String details() { return _inClassBody ? "in_class_body" : null; }
  @Override String[] slots() { return EvalNode.SLOTS; }

  @Override public Change computeExpression( TraceCollection trace ) {
    trace.onExceptionRaiseExit(ExcType.BaseException);
    trace.onControlFlowEscape();
    return null;
  }

  // The copy back into a class body is only done right by the exec statement
  @Override public Change computeExpressionDrop( ExprOnlyStmtNode stmt, TraceCollection trace ) {
    if( !_inClassBody ) return null;
    ExecStmtNode exec = new ExecStmtNode((ExprNode)take(0),(ExprNode)take(1),(ExprNode)take(2),_loc);
    return new Change(exec,ChangeTag.NEW_STATEMENTS,"Changed 'execfile' with unused result to 'exec' on class level.");
  }

  @Override public boolean mayRaiseException( ExcType exc ) { return true; }
}
