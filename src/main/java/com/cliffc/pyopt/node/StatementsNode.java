package com.cliffc.pyopt.node;

import com.cliffc.pyopt.Change;
import com.cliffc.pyopt.ChangeTag;
import com.cliffc.pyopt.SourceRef;
import com.cliffc.pyopt.TraceCollection;
import org.jetbrains.annotations.Nullable;

/** Ordered statement sequence.  Computes its statements in order and splices
 *  their replacements in place; never nested after a pass, and never has a
 *  live statement after one that is guaranteed to raise.
 */
public class StatementsNode extends StmtNode {
  public StatementsNode( SourceRef loc, StmtNode... stmts ) { super(loc,stmts); }

  @Override public String label() { return "Statements"; }
  @Override public String slotName( int i ) { return Integer.toString(i); }
  @Override public String getStatementNiceName() { return "statements sequence"; }

  public StmtNode stmt( int i ) { return (StmtNode)in(i); }
  public void add( StmtNode stmt ) { insertKid(len(),stmt); }

  // The sequence itself is never replaced; changes happen to its statements.
  @Override public Change computeStatement( TraceCollection trace ) {
    for( int i=0; i<len(); ) {
      StmtNode stmt = stmt(i);
      int n = 1;                // Statements now standing where 'stmt' was
      Change c = trace.onStatement(stmt);
      if( c != null ) {
        removeKid(i).kill();
        n = splice(i,c._nnn);
      } else if( stmt instanceof StatementsNode seq ) {
        removeKid(i);
        n = splice(i,seq);
        trace.signalChange(ChangeTag.NEW_STATEMENTS,seq._loc,"Flattened nested statements sequence.");
      }
      // Nothing after a statement that always raises can run
      for( int j=i; j<i+n; j++ )
        if( stmt(j).willRaiseAnyException() && j+1 < len() ) {
          StmtNode dead = stmt(j+1);
          trace.signalChange(ChangeTag.NEW_STATEMENTS,dead._loc,"Removed unreachable statements following "+stmt(j).getStatementNiceName()+".");
          while( len() > j+1 )
            removeKid(len()-1).kill();
          return null;
        }
      i += n;
    }
    return null;
  }

  // Insert a detached replacement at 'i', flattening sequences.
  // Returns the number of statements inserted.
  private int splice( int i, @Nullable Node nnn ) {
    if( nnn==null ) return 0;
    if( !(nnn instanceof StatementsNode seq) ) {
      insertKid(i,nnn);
      return 1;
    }
    int n = seq.len();
    for( int j=0; j<n; j++ )
      insertKid(i+j,seq.take(j));
    seq.kill();
    return n;
  }

  @Override public boolean willRaiseAnyException() {
    for( int i=0; i<len(); i++ )
      if( stmt(i).willRaiseAnyException() )
        return true;
    return false;
  }

  /** Statements evaluating just the side effects of 'exprs', in order.
   *  Expressions without side effects are dropped and killed.
   *  @return null if nothing is left, the one statement, or a sequence */
  public static @Nullable StmtNode fromExpressions( SourceRef loc, ExprNode... exprs ) {
    StatementsNode seq = new StatementsNode(loc);
    for( ExprNode e : exprs ) {
      if( e==null ) continue;
      if( e.mayHaveSideEffects() ) seq.add(new ExprOnlyStmtNode(e));
      else e.kill();
    }
    if( seq.len()==0 ) { seq.kill(); return null; }
    if( seq.len()>1 ) return seq;
    StmtNode s = (StmtNode)seq.take(0);
    seq.kill();
    return s;
  }
}
