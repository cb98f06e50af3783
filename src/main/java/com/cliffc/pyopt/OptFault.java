package com.cliffc.pyopt;

import com.cliffc.pyopt.node.Node;

/** Optimizer-internal fault: a malformed tree from the builder or a broken
 *  rewrite rule.  Never a condition of the program being compiled; those are
 *  modeled as data ({@link ExcType}, exits in the {@link TraceCollection}).
 *  Not meant to be caught and recovered from.
 */
public class OptFault extends RuntimeException {
  public final String _kind;    // Node label, or null when no node is to blame
  public final SourceRef _loc;  // Where, or null
  public OptFault( Node n, String msg ) {
    super(msg(n==null ? null : n.label(), n==null ? null : n._loc, msg));
    _kind = n==null ? null : n.label();
    _loc  = n==null ? null : n._loc;
  }
  public OptFault( String msg ) { this(null,msg); }

  private static String msg( String kind, SourceRef loc, String msg ) {
    if( kind==null ) return msg;
    return kind+" at "+loc+": "+msg;
  }
}
