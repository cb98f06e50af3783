package com.cliffc.pyopt.node;

import com.cliffc.pyopt.Change;
import com.cliffc.pyopt.ExcType;
import com.cliffc.pyopt.SourceRef;
import com.cliffc.pyopt.TraceCollection;
import org.jetbrains.annotations.Nullable;

// ImportError(args..., name=, path=), with the extra diagnostic keywords.
public class MakeImportErrorNode extends ExprNode {
  private final int _nargs;
  public MakeImportErrorNode( ExprNode[] args, @Nullable ExprNode name, @Nullable ExprNode path, SourceRef loc ) {
    super(loc,kids(args,name,path));
    _nargs = args.length;
  }
  private static ExprNode[] kids( ExprNode[] args, ExprNode name, ExprNode path ) {
    ExprNode[] kids = new ExprNode[args.length+2];
    System.arraycopy(args,0,kids,0,args.length);
    kids[args.length  ] = name;
    kids[args.length+1] = path;
    return kids;
  }
  @Override public String label() { return "MakeImportError"; }
  @Override public String slotName( int i ) {
    return i<_nargs ? "args"+i : (i==_nargs ? "name" : "path");
  }

  public ExcType excType() { return ExcType.ImportError; }
  public int nargs() { return _nargs; }
  public ExprNode name() { return kid(_nargs  ); }
  public ExprNode path() { return kid(_nargs+1); }

  @Override public Change computeExpression( TraceCollection trace ) { return null; }
}
