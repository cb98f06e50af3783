package com.cliffc.pyopt.node;

import com.cliffc.pyopt.Change;
import com.cliffc.pyopt.ExcType;
import com.cliffc.pyopt.SourceRef;
import com.cliffc.pyopt.TraceCollection;
import org.jetbrains.annotations.Nullable;

// compile(source, filename, mode, flags, dont_inherit, optimize).  Malformed
// source or mode raise; the code does not run.
public class CompileNode extends ExprNode {
  private static final String[] SLOTS = {"source","filename","mode","flags","dont_inherit","optimize"};
  public CompileNode( ExprNode source, ExprNode filename, ExprNode mode,
                      @Nullable ExprNode flags, @Nullable ExprNode dontInherit, @Nullable ExprNode optimize, SourceRef loc ) {
    super(loc,source,filename,mode,flags,dontInherit,optimize);
  }
  @Override public String label() { return "BuiltinCompile"; }
  @Override String[] slots() { return SLOTS; }

  // TODO: compile constant source strings
  @Override public Change computeExpression( TraceCollection trace ) {
    trace.onExceptionRaiseExit(ExcType.BaseException);
    return null;
  }

  @Override public boolean mayRaiseException( ExcType exc ) { return true; }
}
