package com.cliffc.pyopt;

import com.cliffc.pyopt.node.*;
import org.junit.Test;

import java.math.BigInteger;

import static com.cliffc.pyopt.TreeBuilder.changed;
import static com.cliffc.pyopt.TreeBuilder.optimize;
import static org.junit.Assert.*;

public class TestOptimizer {
  private final TreeBuilder _b = new TreeBuilder();

  private static BigInteger intOf( ExprNode e ) { return ((ConNode)e).intValue(); }
  private static ExprNode source( ModuleNode m, int i ) { return ((AssignNode)m.body().stmt(i)).source(); }

  // A second run finds nothing left to do
  @Test public void testIdempotent() {
    ModuleNode m = _b.module(_b.assign("x",_b.con(6)),
                             _b.assign("y",_b.add(_b.ref("x"),_b.con(1))),
                             _b.expr(_b.ref("u")),
                             _b.raise(_b.exc(ExcType.ValueError,_b.div(_b.ref("y"),_b.con(0)))),
                             _b.assign("z",_b.con(2)));
    optimize(m);
    String once = m.toString();
    Optimizer again = optimize(m);
    assertEquals(1,again.passes());
    assertTrue(again.changes().isEmpty());
    assertEquals(once,m.toString());
  }

  @Test public void testUnreachable() {
    ModuleNode m = _b.module(_b.assign("a",_b.con(0)),
                             _b.raise(_b.exc(ExcType.RuntimeError)),
                             _b.assign("x",_b.con(1)),
                             _b.assign("y",_b.con(2)));
    Optimizer opt = optimize(m);
    assertEquals(2,m.body().len());
    assertTrue(changed(opt,"Removed unreachable statements following exception raise statement."));
    assertEquals(ChangeTag.NEW_STATEMENTS,opt.changes().get(0)._tag);
  }

  // Nothing survives past a statement that always raises
  @Test public void testNoStatementAfterRaise() {
    ModuleNode m = _b.module(_b.assign("a",_b.divByZero()),
                             _b.expr(_b.ref("b")),
                             _b.stmts(_b.assign("c",_b.con(1)),_b.assign("d",_b.con(2))));
    optimize(m);
    StatementsNode body = m.body();
    assertEquals(1,body.len());
    assertTrue(body.stmt(0) instanceof RaiseImplicitNode);
  }

  @Test public void testPassCap() {
    ModuleNode m = _b.module(_b.raise(_b.exc(ExcType.ValueError,_b.divByZero())));
    Optimizer opt = new Optimizer(m,1);
    OptFault f = assertThrows(OptFault.class, opt::optimize);
    assertEquals("Module",f._kind);
    assertTrue(f.getMessage().contains("no fixpoint after 1 passes"));
    assertEquals(1,opt.passes());
  }

  @Test public void testFlatten() {
    ModuleNode m = _b.module(_b.stmts(_b.assign("a",_b.con(1)),_b.stmts(_b.assign("b",_b.con(2)))),
                             _b.assign("c",_b.con(3)));
    Optimizer opt = optimize(m);
    assertTrue(changed(opt,"Flattened nested statements sequence."));
    StatementsNode body = m.body();
    assertEquals(3,body.len());
    for( int i=0; i<3; i++ )
      assertTrue(body.stmt(i) instanceof AssignNode);
  }

  @Test public void testTryRemoved() {
    AssignNode x1 = _b.assign("x",_b.con(1));
    ModuleNode m = _b.module(_b.tryExcept(_b.stmts(x1),_b.stmts(_b.assign("x",_b.con(2)))));
    Optimizer opt = optimize(m);
    assertTrue(changed(opt,"Removed exception handler, the tried block cannot raise."));
    assertEquals(1,m.body().len());
    assertSame(x1,m.body().stmt(0));
  }

  // x = 1
  // try:    x = 2; u
  // except: x = <2 or 3>
  // y = x
  @Test public void testTryMerge() {
    for( int h=2; h<=3; h++ ) {
      TreeBuilder b = new TreeBuilder();
      TryExceptNode te = b.tryExcept(b.stmts(b.assign("x",b.con(2)),b.expr(b.ref("u"))),
                                     b.stmts(b.assign("x",b.con(h))));
      ModuleNode m = b.module(b.assign("x",b.con(1)),te,b.assign("y",b.ref("x")));
      optimize(m);
      assertSame(te,m.body().stmt(1));
      ExprNode y = source(m,2);
      if( h==2 ) {
        assertEquals(BigInteger.TWO,intOf(y));
      } else {
        // Bound on both paths, value differs
        assertTrue(y instanceof VarRefNode);
        assertFalse(y.mayRaiseException(ExcType.NameError));
      }
    }
  }

  // The handler only knows what held where the tried block could raise
  @Test public void testHandlerStartsFromExits() {
    TryExceptNode te = _b.tryExcept(_b.stmts(_b.expr(_b.ref("u")),_b.assign("x",_b.con(5))),
                                    _b.stmts(_b.assign("y",_b.ref("x"))));
    ModuleNode m = _b.module(te);
    optimize(m);
    assertTrue(((AssignNode)te.handler().stmt(0)).source() instanceof VarRefNode);
  }

  @Test public void testRaisingAssignment() {
    ModuleNode m = _b.module(_b.assign("x",_b.div(_b.con(5),_b.con(0))));
    Optimizer opt = optimize(m);
    assertTrue(changed(opt,"Assignment raises while computing its source, never assigns."));
    assertFalse(m.toString().contains("AssignVariable"));
  }

  @Test public void testSideEffectsKept() {
    // z = u + 1//0
    ModuleNode m = _b.module(_b.assign("z",_b.add(_b.ref("u"),_b.divByZero())));
    Optimizer opt = optimize(m);
    assertTrue(changed(opt,"For BinOp the child 'right' raises."));
    assertTrue(changed(opt,"Side effects of unused expression turned into statements."));
    StatementsNode body = m.body();
    assertEquals(2,body.len());
    assertEquals("u",((VarRefNode)((ExprOnlyStmtNode)body.stmt(0)).expr())._var._name);
    assertTrue(body.stmt(1) instanceof RaiseImplicitNode);
  }

  @Test public void testConstantPropagation() {
    ModuleNode m = _b.module(_b.assign("x",_b.con(6)),
                             _b.assign("y",_b.add(_b.ref("x"),_b.con(1))),
                             _b.assign("q",_b.div(_b.con(-7),_b.con(2))),
                             _b.assign("r",_b.binop(BinOpNode.Op.MOD,_b.con(-7),_b.con(2))),
                             _b.assign("s",_b.add(_b.str("ab"),_b.str("cd"))),
                             _b.expr(_b.ref("y")));
    Optimizer opt = optimize(m);
    assertEquals(BigInteger.valueOf(7),intOf(source(m,1)));
    assertEquals(BigInteger.valueOf(-4),intOf(source(m,2)));
    assertEquals(BigInteger.ONE,intOf(source(m,3)));
    assertEquals("abcd",((ConNode)source(m,4)).strValue());
    // Known bound, no effect left
    assertEquals(5,m.body().len());
    for( Optimizer.ChangeRecord r : opt.changes() )
      assertEquals(1,r._pass);
  }

  // Floats are not modeled: 7/2 stays, and may raise
  @Test public void testTrueDivisionNotFolded() {
    ModuleNode m = _b.module(_b.assign("q",_b.truediv(_b.con(7),_b.con(2))));
    Optimizer opt = optimize(m);
    assertEquals(1,opt.passes());
    ExprNode q = source(m,0);
    assertTrue(q instanceof BinOpNode);
    assertTrue(q.mayRaiseException(ExcType.BaseException));
    assertFalse(q.willRaiseAnyException());
  }

  // Each provider body gets its own trace
  @Test public void testNestedProviders() {
    LocalsScope f = new LocalsScope("f",LocalsScope.Kind.FUNCTION);
    LocalsScope c = new LocalsScope("C",LocalsScope.Kind.CLASS);
    FunctionNode fn = _b.function("f",f,_b.assign(f,"a",_b.con(1)),_b.assign(f,"b",_b.ref(f,"a")),
                                  _b.assign(f,"g",_b.ref("x")));
    ClassNode cls = _b.klass("C",c,_b.raise(_b.exc(ExcType.TypeError)),_b.assign(c,"k",_b.con(1)));
    ModuleNode m = _b.module(_b.assign("x",_b.con(1)),fn,cls,_b.assign("h",_b.ref("C")));
    optimize(m);
    // Function locals fold; module state is not visible inside
    assertTrue(((AssignNode)fn.body().stmt(1)).source() instanceof ConNode);
    assertTrue(((AssignNode)fn.body().stmt(2)).source() instanceof VarRefNode);
    // The class body always raises, so nothing follows the class
    assertEquals(1,cls.body().len());
    assertTrue(cls.willRaiseAnyException());
    assertEquals(3,m.body().len());
  }
}
