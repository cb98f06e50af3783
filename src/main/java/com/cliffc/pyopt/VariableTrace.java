package com.cliffc.pyopt;

import com.cliffc.pyopt.node.ConNode;

/** What is known about one variable at one point of a pass.  Immutable; a
 *  write makes a new trace.  The constant, when known, is a private detached
 *  copy and never a node of the tree.
 */
public final class VariableTrace {
  public final Variable _var;
  private final boolean _assigned; // Known to be bound
  private final ConNode _con;      // Known constant value, or null

  private VariableTrace( Variable var, boolean assigned, ConNode con ) {
    assert con==null || (assigned && con.parent()==null);
    _var=var; _assigned=assigned; _con=con;
  }
  public static VariableTrace unknown( Variable var ) { return new VariableTrace(var,false,null); }
  public static VariableTrace assign( Variable var, ConNode con ) { return new VariableTrace(var,true,con); }

  public boolean isAssigned() { return _assigned; }
  public ConNode constant() { return _con; }

  // Same knowledge, for merging control flow
  boolean sameAs( VariableTrace t ) {
    if( _assigned != t._assigned ) return false;
    if( _con==null || t._con==null ) return _con==t._con;
    return _con.sameValue(t._con);
  }

  @Override public String toString() {
    if( !_assigned ) return _var+"=?";
    return _con==null ? _var+"=assigned" : _var+"="+_con.repr();
  }
}
