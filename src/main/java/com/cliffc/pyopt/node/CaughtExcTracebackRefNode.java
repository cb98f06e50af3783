package com.cliffc.pyopt.node;

import com.cliffc.pyopt.SourceRef;

public class CaughtExcTracebackRefNode extends CaughtExcRefNode {
  public CaughtExcTracebackRefNode( SourceRef loc ) { super(loc); }
  @Override public String label() { return "CaughtExceptionTracebackRef"; }
}
