package com.cliffc.pyopt.node;

import com.cliffc.pyopt.Change;
import com.cliffc.pyopt.ChangeTag;
import com.cliffc.pyopt.ExcType;
import com.cliffc.pyopt.SourceRef;
import com.cliffc.pyopt.TraceCollection;
import com.cliffc.pyopt.util.Ary;

// Expression nodes produce a value.  All children of an expression are
// expressions.
public abstract class ExprNode extends Node {
  ExprNode( SourceRef loc, ExprNode... kids ) { super(loc,kids); }

  @Override public final boolean isExpression() { return true; }

  ExprNode kid( int i ) { return (ExprNode)in(i); }

  /** Compute the children left to right, then this node.  A child that is
   *  guaranteed to raise takes the place of the whole expression, after the
   *  side effects of the children evaluated before it; the later children
   *  never run.
   *  @return null for no progress */
  public Change computeExpressionRaw( TraceCollection trace ) {
    for( int i=0; i<len(); i++ ) {
      ExprNode kid = trace.onExpression(kid(i),true);
      if( kid==null || !kid.willRaiseAnyException() ) continue;
      Ary<ExprNode> effects = new Ary<>(ExprNode.class);
      for( int j=0; j<i; j++ )
        if( in(j)!=null )
          effects.add((ExprNode)take(j));
      ExprNode raise = (ExprNode)take(i);
      return new Change(SideEffectsNode.wrap(effects,raise,_loc), ChangeTag.NEW_RAISE,
                        "For "+label()+" the child '"+slotName(i)+"' raises.");
    }
    return computeExpression(trace);
  }

  /** Kind specific part of the computation, children already done.
   *  @return null for no progress */
  public abstract Change computeExpression( TraceCollection trace );

  /** The value is statically known to be unused.  'stmt' is the expression
   *  statement holding this.  The default is to keep it.
   *  @return null for no progress, or a replacement for 'stmt' */
  public Change computeExpressionDrop( ExprOnlyStmtNode stmt, TraceCollection trace ) { return null; }

  /** Could evaluating it be observed, other than by its value.  Raising
   *  counts. */
  public boolean mayHaveSideEffects() {
    if( mayRaiseException(ExcType.BaseException) ) return true;
    for( int i=0; i<len(); i++ )
      if( in(i)!=null && kid(i).mayHaveSideEffects() )
        return true;
    return false;
  }
}
