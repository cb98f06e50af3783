package com.cliffc.pyopt.node;

import com.cliffc.pyopt.Change;
import com.cliffc.pyopt.ChangeTag;
import com.cliffc.pyopt.ExcType;
import com.cliffc.pyopt.SourceRef;
import com.cliffc.pyopt.TraceCollection;
import com.cliffc.pyopt.Variable;
import com.cliffc.pyopt.VariableTrace;

// Read of a variable.  Becomes the constant when the trace knows it.
public class VarRefNode extends ExprNode {
  public final Variable _var;
  private boolean _assigned;    // Known bound as of the last compute
  public VarRefNode( Variable var, SourceRef loc ) { super(loc); _var=var; }
  @Override public String label() { return "VariableRef"; }
  @Override String details() { return _var._name; }

  @Override public Change computeExpression( TraceCollection trace ) {
    VariableTrace t = trace.onVariableRead(_var);
    _assigned = t.isAssigned();
    if( t.constant()!=null )
      return new Change(t.constant().copy(_loc),ChangeTag.NEW_CONSTANT,"Value of variable '"+_var._name+"' is known.");
    if( !_assigned )
      trace.onExceptionRaiseExit(ExcType.NameError);
    return null;
  }

  @Override public boolean mayRaiseException( ExcType exc ) {
    return !_assigned && ExcType.NameError.isSubclassOf(exc);
  }
}
