package com.cliffc.pyopt;

import com.cliffc.pyopt.node.Node;

/** Result of a compute call that made progress.  No progress is a plain
 *  {@code null} instead of a Change.  A null {@link #_nnn} deletes a statement
 *  from its sequence.
 */
public final class Change {
  public final Node _nnn;       // Replacement, already detached from the old tree
  public final ChangeTag _tag;
  public final String _msg;     // Human readable rationale
  public Change( Node nnn, ChangeTag tag, String msg ) {
    assert tag!=null && msg!=null;
    assert nnn==null || nnn.parent()==null : "replacement still owned";
    _nnn=nnn; _tag=tag; _msg=msg;
  }
  @Override public String toString() { return _tag+": "+_msg; }
}
