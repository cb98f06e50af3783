package com.cliffc.pyopt.node;

import com.cliffc.pyopt.SourceRef;

public class CaughtExcValueRefNode extends CaughtExcRefNode {
  public CaughtExcValueRefNode( SourceRef loc ) { super(loc); }
  @Override public String label() { return "CaughtExceptionValueRef"; }
}
