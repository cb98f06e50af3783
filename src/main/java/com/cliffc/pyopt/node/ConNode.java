package com.cliffc.pyopt.node;

import com.cliffc.pyopt.Change;
import com.cliffc.pyopt.ExcType;
import com.cliffc.pyopt.SourceRef;
import com.cliffc.pyopt.TraceCollection;

import java.math.BigInteger;
import java.util.Objects;

// Constant value nodes; no computation needed.  Values are Python None,
// int (as BigInteger), str and bool.
public class ConNode extends ExprNode {
  // Python None.  Java null is not a value here.
  public static final Object NONE = new Object() { @Override public String toString() { return "None"; } };

  public final Object _con;
  private ConNode( Object con, SourceRef loc ) {
    super(loc);
    assert con==NONE || con instanceof BigInteger || con instanceof String || con instanceof Boolean : "not a constant "+con;
    _con = con;
  }
  public static ConNode none( SourceRef loc ) { return new ConNode(NONE,loc); }
  public static ConNode of( long x, SourceRef loc ) { return new ConNode(BigInteger.valueOf(x),loc); }
  public static ConNode of( BigInteger x, SourceRef loc ) { return new ConNode(x,loc); }
  public static ConNode of( String s, SourceRef loc ) { return new ConNode(s,loc); }
  public static ConNode of( boolean b, SourceRef loc ) { return new ConNode(b,loc); }

  // A fresh detached node for the same value
  public ConNode copy( SourceRef loc ) { return new ConNode(_con,loc); }

  @Override public String label() { return "Con"; }
  @Override String details() { return repr(); }

  public boolean isNone() { return _con==NONE; }
  public BigInteger intValue() { return _con instanceof BigInteger x ? x : null; }
  public String strValue() { return _con instanceof String s ? s : null; }
  public boolean sameValue( ConNode con ) { return _con==con._con || Objects.equals(_con,con._con); }

  public String repr() {
    if( _con instanceof String s ) return "'"+s+"'";
    if( _con instanceof Boolean b ) return b ? "True" : "False";
    return _con.toString();
  }

  @Override public Change computeExpression( TraceCollection trace ) { return null; }
  @Override public boolean mayRaiseException( ExcType exc ) { return false; }
  @Override public boolean mayHaveSideEffects() { return false; }
}
