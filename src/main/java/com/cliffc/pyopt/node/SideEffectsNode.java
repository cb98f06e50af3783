package com.cliffc.pyopt.node;

import com.cliffc.pyopt.Change;
import com.cliffc.pyopt.ChangeTag;
import com.cliffc.pyopt.SourceRef;
import com.cliffc.pyopt.TraceCollection;
import com.cliffc.pyopt.util.Ary;

/** Evaluates some expressions only for their side effects, then the last
 *  one for the value.  Made by rewrites that must keep the effects of
 *  operands they otherwise throw away.
 */
public class SideEffectsNode extends ExprNode {
  SideEffectsNode( SourceRef loc, ExprNode[] kids ) { super(loc,kids); }
  @Override public String label() { return "SideEffects"; }
  @Override public String slotName( int i ) { return i==len()-1 ? "expression" : "effect"+i; }

  public ExprNode expression() { return kid(len()-1); }

  /** 'expr' after the effects that still have side effects; the rest are
   *  killed.  All are detached.  Just 'expr' when no effect is left. */
  public static ExprNode wrap( Ary<ExprNode> effects, ExprNode expr, SourceRef loc ) {
    Ary<ExprNode> kids = new Ary<>(ExprNode.class);
    for( ExprNode e : effects ) {
      if( e.mayHaveSideEffects() ) kids.add(e);
      else e.kill();
    }
    if( kids.isEmpty() ) return expr;
    kids.add(expr);
    return new SideEffectsNode(loc,kids.asAry());
  }

  // Already the shape a raising child gets rewritten to, so a raising value
  // is left alone.  An effect that always raises cuts off everything after it.
  @Override public Change computeExpressionRaw( TraceCollection trace ) {
    for( int i=0; i<len()-1; i++ ) {
      ExprNode kid = trace.onExpression(kid(i));
      if( !kid.willRaiseAnyException() ) continue;
      Ary<ExprNode> effects = new Ary<>(ExprNode.class);
      for( int j=0; j<i; j++ )
        effects.add((ExprNode)take(j));
      ExprNode raise = (ExprNode)take(i);
      return new Change(wrap(effects,raise,_loc),ChangeTag.NEW_RAISE,"Side effect raises, the later ones never run.");
    }
    trace.onExpression(expression());
    return computeExpression(trace);
  }

  // Effects may lose their side effects as they optimize
  @Override public Change computeExpression( TraceCollection trace ) {
    for( int i=0; i<len()-1; i++ )
      if( !kid(i).mayHaveSideEffects() ) {
        Ary<ExprNode> effects = new Ary<>(ExprNode.class);
        for( int j=0; j<len()-1; j++ )
          effects.add((ExprNode)take(j));
        ExprNode expr = (ExprNode)take(len()-1);
        return new Change(wrap(effects,expr,_loc),ChangeTag.NEW_EXPRESSION,"Removed side effects without effect.");
      }
    return null;
  }

  @Override public Change computeExpressionDrop( ExprOnlyStmtNode stmt, TraceCollection trace ) {
    ExprNode[] all = new ExprNode[len()];
    for( int i=0; i<len(); i++ )
      all[i] = (ExprNode)take(i);
    return new Change(StatementsNode.fromExpressions(_loc,all),ChangeTag.NEW_STATEMENTS,
                      "Side effects of unused expression turned into statements.");
  }

  @Override public boolean willRaiseAnyException() {
    for( int i=0; i<len(); i++ )
      if( kid(i).willRaiseAnyException() )
        return true;
    return false;
  }
}
