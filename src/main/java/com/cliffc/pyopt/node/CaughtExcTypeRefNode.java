package com.cliffc.pyopt.node;

import com.cliffc.pyopt.SourceRef;

public class CaughtExcTypeRefNode extends CaughtExcRefNode {
  public CaughtExcTypeRefNode( SourceRef loc ) { super(loc); }
  @Override public String label() { return "CaughtExceptionTypeRef"; }
}
