package com.cliffc.pyopt.node;

import com.cliffc.pyopt.Change;
import com.cliffc.pyopt.ChangeTag;
import com.cliffc.pyopt.ExcType;
import com.cliffc.pyopt.OptFault;
import com.cliffc.pyopt.SourceRef;
import com.cliffc.pyopt.TraceCollection;
import org.jetbrains.annotations.Nullable;

/** exec as a statement: no value to make and throw away.  It does not sync
 *  function or class locals itself; it only forgets module variables.  The
 *  builder must follow it with a {@link LocalsDictSyncNode} for the enclosing
 *  scope, or knowledge of that scope's locals survives the exec.  A None
 *  globals or locals argument is the same as none at all and is dropped on
 *  the way in, so later passes cannot tell {@code exec(code, None, None)}
 *  from {@code exec(code)}.
 */
public class ExecStmtNode extends StmtNode {
  private static final String[] WHAT = {"source code","globals","locals"};
  public ExecStmtNode( ExprNode source, @Nullable ExprNode globals, @Nullable ExprNode locals, SourceRef loc ) {
    super(loc,source,globals,locals);
  }
  @Override public String label() { return "ExecStmt"; }
  @Override String[] slots() { return EvalNode.SLOTS; }
  @Override public String getStatementNiceName() { return "exec statement"; }

  public ExprNode source () { return (ExprNode)in(0); }
  public ExprNode globals() { return (ExprNode)in(1); }
  public ExprNode locals () { return (ExprNode)in(2); }

  @Override Node checkKid( int i, Node n ) {
    if( i>0 && n instanceof ConNode con && con.isNone() ) {
      if( con.parent()!=null )
        throw new OptFault(con,"already a child of "+con.parent().label()+" at "+con.parent()._loc);
      con.kill();
      return null;
    }
    return n;
  }

  @Override public Change computeStatement( TraceCollection trace ) {
    for( int i=0; i<3; i++ ) {
      trace.onExpression((ExprNode)in(i),i>0);
      ExprNode kid = (ExprNode)in(i); // Re-read, a None result is dropped
      if( kid==null ) continue;
      if( kid.mayRaiseException(ExcType.BaseException) )
        trace.onExceptionRaiseExit(ExcType.BaseException);
      if( !kid.willRaiseAnyException() ) continue;
      ExprNode[] prefix = new ExprNode[i+1];
      for( int j=0; j<=i; j++ )
        prefix[j] = (ExprNode)take(j);
      return new Change(StatementsNode.fromExpressions(_loc,prefix),ChangeTag.NEW_RAISE,
                        "Exec statement raises implicitly when determining "+WHAT[i]+" argument.");
    }
    // May or may not raise; nothing narrows it for source known to be safe
    trace.onExceptionRaiseExit(ExcType.BaseException);
    trace.onControlFlowEscape();
    return null;
  }

  @Override public boolean mayRaiseException( ExcType exc ) { return true; }
}
