package com.cliffc.pyopt.node;

import com.cliffc.pyopt.Change;
import com.cliffc.pyopt.ChangeTag;
import com.cliffc.pyopt.ExcType;
import com.cliffc.pyopt.OptFault;
import com.cliffc.pyopt.SourceRef;
import com.cliffc.pyopt.TraceCollection;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/** Explicit {@code raise type(value), trace from cause}.  The children nest:
 *  no value without a type, no traceback without a value.
 */
public class RaiseNode extends StmtNode {
  private static final String[] SLOTS = {"exception_type","exception_value","exception_trace","exception_cause"};
  private static final String[] WHAT  = {"type","value","traceback","cause"};

  public RaiseNode( @NotNull ExprNode type, @Nullable ExprNode value, @Nullable ExprNode trace, @Nullable ExprNode cause, SourceRef loc ) {
    super(loc,type,value,trace,cause);
    if( type==null ) throw new OptFault(this,"raise without an exception type; a bare raise is a re-raise");
    if( value==null && trace!=null ) throw new OptFault(this,"exception traceback without an exception value");
  }
  @Override public String label() { return "RaiseException"; }
  @Override String[] slots() { return SLOTS; }
  @Override public String getStatementNiceName() { return "exception raise statement"; }

  public ExprNode type () { return (ExprNode)in(0); }
  public ExprNode value() { return (ExprNode)in(1); }
  public ExprNode trace() { return (ExprNode)in(2); }
  public ExprNode cause() { return (ExprNode)in(3); }

  // Strictly type, value, trace, cause.  Once one of them raises, the raise
  // itself never happens: keep the side effects of what ran so far.
  @Override public Change computeStatement( TraceCollection trace ) {
    for( int i=0; i<SLOTS.length; i++ ) {
      ExprNode kid = trace.onExpression((ExprNode)in(i),true);
      if( kid==null || !kid.willRaiseAnyException() ) continue;
      ExprNode[] prefix = new ExprNode[i+1];
      for( int j=0; j<=i; j++ )
        prefix[j] = (ExprNode)take(j);
      return new Change(StatementsNode.fromExpressions(_loc,prefix),ChangeTag.NEW_RAISE,
                        "Explicit raise already raises implicitly building exception "+WHAT[i]+".");
    }
    // TODO: narrow to the class of the type child once exception classes are tracked
    trace.onExceptionRaiseExit(ExcType.BaseException);
    return null;
  }

  @Override public boolean mayRaiseException( ExcType exc ) { return true; }
  @Override public boolean willRaiseAnyException() { return true; }
  // Traceback attaches to the frame
  @Override public boolean needsFrame() { return true; }
}
