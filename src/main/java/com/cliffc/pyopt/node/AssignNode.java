package com.cliffc.pyopt.node;

import com.cliffc.pyopt.Change;
import com.cliffc.pyopt.ChangeTag;
import com.cliffc.pyopt.SourceRef;
import com.cliffc.pyopt.TraceCollection;
import com.cliffc.pyopt.Variable;

// Assignment of an expression to a variable.
public class AssignNode extends StmtNode {
  private static final String[] SLOTS = {"source"};
  public final Variable _var;
  public AssignNode( Variable var, ExprNode source, SourceRef loc ) { super(loc,source); _var=var; }
  @Override public String label() { return "AssignVariable"; }
  @Override String details() { return _var._name; }
  @Override String[] slots() { return SLOTS; }
  @Override public String getStatementNiceName() { return "variable assignment statement"; }

  public ExprNode source() { return (ExprNode)in(0); }

  @Override public Change computeStatement( TraceCollection trace ) {
    ExprNode source = trace.onExpression(source());
    if( source.willRaiseAnyException() )
      return new Change(new ExprOnlyStmtNode((ExprNode)take(0)),ChangeTag.NEW_RAISE,
                        "Assignment raises while computing its source, never assigns.");
    trace.onVariableSet(_var,source);
    return null;
  }

  @Override public boolean willRaiseAnyException() { return source().willRaiseAnyException(); }
}
