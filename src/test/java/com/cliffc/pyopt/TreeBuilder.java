package com.cliffc.pyopt;

import com.cliffc.pyopt.node.*;

// Hand-built trees for the tests, standing in for the front end.  Every node
// gets its own line number so change records can be told apart.
public class TreeBuilder {
  public final LocalsScope _mod = new LocalsScope("__main__",LocalsScope.Kind.MODULE);
  private int _line;

  public SourceRef loc() { return new SourceRef("test.py",++_line); }

  public ConNode con( long x ) { return ConNode.of(x,loc()); }
  public ConNode str( String s ) { return ConNode.of(s,loc()); }
  public ConNode none() { return ConNode.none(loc()); }

  public VarRefNode ref( String name ) { return ref(_mod,name); }
  public VarRefNode ref( LocalsScope scope, String name ) { return new VarRefNode(scope.var(name),loc()); }
  public AssignNode assign( String name, ExprNode src ) { return assign(_mod,name,src); }
  public AssignNode assign( LocalsScope scope, String name, ExprNode src ) { return new AssignNode(scope.var(name),src,loc()); }

  public BinOpNode binop( BinOpNode.Op op, ExprNode l, ExprNode r ) { return new BinOpNode(op,l,r,loc()); }
  public BinOpNode add( ExprNode l, ExprNode r ) { return binop(BinOpNode.Op.ADD,l,r); }
  public BinOpNode div( ExprNode l, ExprNode r ) { return binop(BinOpNode.Op.FLOORDIV,l,r); }
  public BinOpNode truediv( ExprNode l, ExprNode r ) { return binop(BinOpNode.Op.TRUEDIV,l,r); }
  // 1//0
  public BinOpNode divByZero() { return div(con(1),con(0)); }

  public MakeExceptionNode exc( ExcType exc, ExprNode... args ) { return new MakeExceptionNode(exc,loc(),args); }
  public RaiseNode raise( ExprNode type ) { return new RaiseNode(type,null,null,null,loc()); }

  public ExprOnlyStmtNode expr( ExprNode e ) { return new ExprOnlyStmtNode(e); }
  public StatementsNode stmts( StmtNode... ss ) { return new StatementsNode(loc(),ss); }
  public TryExceptNode tryExcept( StatementsNode tried, StatementsNode handler ) { return new TryExceptNode(tried,handler,loc()); }

  public ModuleNode module( StmtNode... body ) { return new ModuleNode(_mod,stmts(body),loc()); }
  public FunctionNode function( String name, LocalsScope scope, StmtNode... body ) {
    return new FunctionNode(_mod.var(name),scope,stmts(body),loc());
  }
  public ClassNode klass( String name, LocalsScope scope, StmtNode... body ) {
    return new ClassNode(_mod.var(name),scope,stmts(body),loc());
  }

  // Run to the fixpoint
  public static Optimizer optimize( ModuleNode m ) {
    Optimizer opt = new Optimizer(m);
    opt.optimize();
    return opt;
  }

  // True if some change record carries this message
  public static boolean changed( Optimizer opt, String msg ) {
    for( Optimizer.ChangeRecord r : opt.changes() )
      if( r._msg.equals(msg) )
        return true;
    return false;
  }
}
