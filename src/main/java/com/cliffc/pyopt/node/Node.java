package com.cliffc.pyopt.node;

import com.cliffc.pyopt.ExcType;
import com.cliffc.pyopt.OptFault;
import com.cliffc.pyopt.SourceRef;
import com.cliffc.pyopt.util.Ary;
import com.cliffc.pyopt.util.SB;
import org.jetbrains.annotations.Nullable;

// Tree IR.  A node owns its children exclusively; the child back-points to
// its one parent for navigation only.  Ownership moves, it is never shared:
// a child is taken out of one parent before another may adopt it.
public abstract class Node {

  // --------------------------------------------------------------------------
  // Unique node-numbering, for debugging only
  public final int _uid;
  private static int CNT=1;
  public final SourceRef _loc;

  Node( SourceRef loc, Node... kids ) {
    _uid = CNT++;
    _loc = loc;
    _kids = new Ary<>(Node.class);
    for( int i=0; i<kids.length; i++ ) {
      _kids.add(null);
      setKid(i,kids[i]);
    }
  }

  // Kind label; unique per node class.  E.g. "RaiseException" or "ExecStmt"
  public abstract String label();
  // Extra per-instance info for printing, or null
  String details() { return null; }

  // --------------------------------------------------------------------------
  // Edge management.  Ordered child slots, nulls allowed for absent optional
  // children.  Slot order is evaluation order.

  private Node _par;            // Non-owning
  private Ary<Node> _kids;      // Null once killed

  public @Nullable Node parent() { return _par; }
  public int len() { return _kids._len; }
  public @Nullable Node in( int i ) { return _kids.at(i); }
  public boolean isDead() { return _kids==null; }

  // Names of the fixed slots, in evaluation order
  String[] slots() { return NO_SLOTS; }
  static final String[] NO_SLOTS = new String[0];
  public String slotName( int i ) { return slots()[i]; }

  // Per-kind normalization of an incoming child, e.g. a constant None
  // argument that means the same as no argument.
  Node checkKid( int i, Node n ) { return n; }

  // Take ownership of 'n'.  Owned nodes must be taken out of their parent first.
  private Node adopt( Node n ) {
    if( n==null ) return null;
    if( n._par != null )
      throw new OptFault(n,"already a child of "+n._par.label()+" at "+n._par._loc);
    if( n.isDead() ) throw new OptFault(n,"adopting a killed node");
    n._par = this;
    return n;
  }

  /** Set slot 'i'.  The previous child is detached but not killed.
   *  @return the previous child, or null */
  public Node setKid( int i, @Nullable Node n ) {
    n = checkKid(i,n);
    Node old = _kids.at(i);
    if( old==n ) return null;
    _kids.set(i,adopt(n));
    if( old != null ) old._par = null;
    return old;
  }

  // Take the child out of slot 'i', leaving the slot empty.  The caller owns it.
  public Node take( int i ) { return setKid(i,null); }

  public void replaceChild( Node old, Node nnn ) {
    int idx = _kids.find(old);
    if( idx == -1 ) throw new OptFault(this,"not the parent of "+old.label());
    Node x = setKid(idx,nnn);
    assert x==old;
  }

  // Variable length lists, statement sequences only
  void insertKid( int i, Node n ) { _kids.insert(i,null); setKid(i,n); }
  Node removeKid( int i ) {
    Node n = _kids.remove(i);
    if( n!=null ) n._par = null;
    return n;
  }

  // Tear down a detached subtree.  Every parent link in it is cleared, so no
  // back-reference keeps a dead subtree reachable.
  public void kill() {
    if( isDead() ) return;
    assert _par==null : "killing a node still owned by "+_par.label();
    for( int i=0; i<_kids._len; i++ ) {
      Node kid = _kids.at(i);
      if( kid==null ) continue;
      kid._par = null;
      kid.kill();
    }
    _kids = null;
  }

  // Nearest enclosing scope provider: module, function or class body
  public ProviderNode getParentVariableProvider() {
    for( Node n = _par; n!=null; n = n._par )
      if( n instanceof ProviderNode p )
        return p;
    throw new OptFault(this,"not inside any provider");
  }

  // --------------------------------------------------------------------------
  // Queries for the rewrites and the code generator

  /** Can evaluation possibly raise something an {@code except exc:} clause
   *  would catch.  By default, only if some child can. */
  public boolean mayRaiseException( ExcType exc ) {
    for( int i=0; i<len(); i++ )
      if( in(i)!=null && in(i).mayRaiseException(exc) )
        return true;
    return false;
  }

  /** Is evaluation guaranteed to raise, unconditionally.  Stronger than
   *  {@link #mayRaiseException}. */
  public boolean willRaiseAnyException() { return false; }

  // Needs a frame object materialized, e.g. to attach a traceback
  public boolean needsFrame() { return false; }

  public abstract boolean isExpression();

  // --------------------------------------------------------------------------
  // Printing.  One node per line, children indented under their slot name.

  @Override public final String toString() { return str(new SB()).toString(); }

  public final SB str( SB sb ) {
    sb.p(label());
    if( isDead() ) return sb.p(" DEAD").nl();
    String d = details();
    if( d!=null ) sb.p(' ').p(d);
    sb.nl().ii(1);
    for( int i=0; i<len(); i++ )
      if( in(i)!=null )
        in(i).str(sb.ip(slotName(i)).p(": "));
    return sb.di(1);
  }
}
