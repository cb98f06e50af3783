package com.cliffc.pyopt;

// Machine readable kind of a rewrite, for the optimization log
public enum ChangeTag {
  NEW_RAISE("new_raise"),
  NEW_STATEMENTS("new_statements"),
  NEW_CONSTANT("new_constant"),
  NEW_EXPRESSION("new_expression");

  public final String _tag;
  ChangeTag( String tag ) { _tag=tag; }
  @Override public String toString() { return _tag; }
}
