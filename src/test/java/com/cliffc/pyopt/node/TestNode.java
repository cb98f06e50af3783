package com.cliffc.pyopt.node;

import com.cliffc.pyopt.ExcType;
import com.cliffc.pyopt.LocalsScope;
import com.cliffc.pyopt.OptFault;
import com.cliffc.pyopt.SourceRef;
import com.cliffc.pyopt.TreeBuilder;
import org.junit.Test;

import static org.junit.Assert.*;

public class TestNode {
  private final TreeBuilder _b = new TreeBuilder();

  @Test public void testSingleParent() {
    ConNode c = _b.con(1);
    ExprOnlyStmtNode s = _b.expr(c);
    assertSame(s,c.parent());
    OptFault f = assertThrows(OptFault.class, () -> _b.expr(c));
    assertEquals("Con",f._kind);
    assertTrue(f.getMessage().contains("already a child of ExpressionOnly"));

    // Ownership moves once taken out
    assertSame(c,s.take(0));
    assertNull(c.parent());
    assertNull(s.in(0));
    ExprOnlyStmtNode s2 = _b.expr(c);
    assertSame(s2,c.parent());
  }

  @Test public void testSetKid() {
    AssignNode a = _b.assign("x",_b.con(1));
    ExprNode old = a.source();
    ConNode two = _b.con(2);
    assertSame(old,a.setKid(0,two));
    assertNull(old.parent());
    assertFalse(old.isDead());  // Detached, not killed
    assertSame(two,a.source());
    assertSame(a,two.parent());

    // Not a child of 'a' any more
    assertThrows(OptFault.class, () -> a.replaceChild(old,_b.con(3)));
  }

  @Test public void testKill() {
    BinOpNode sum = _b.add(_b.con(1),_b.con(2));
    ConNode left = (ConNode)sum.left();
    StatementsNode seq = _b.stmts(_b.assign("x",sum));
    // Still owned
    assertThrows(AssertionError.class, sum::kill);
    seq.kill();
    assertTrue(seq.isDead());
    assertTrue(sum.isDead());
    assertTrue(left.isDead());
    assertNull(sum.parent());
    assertNull(left.parent());
    assertEquals("BinOp DEAD\n",sum.toString());
    // A killed node is never adopted again
    assertThrows(OptFault.class, () -> _b.expr(left));
  }

  @Test public void testRaiseNesting() {
    SourceRef loc = _b.loc();
    OptFault f = assertThrows(OptFault.class, () -> new RaiseNode(null,null,null,null,loc));
    assertEquals("RaiseException",f._kind);
    assertEquals(loc,f._loc);
    assertTrue(f.getMessage().startsWith("RaiseException at test.py:"));

    f = assertThrows(OptFault.class, () -> new RaiseNode(_b.exc(ExcType.ValueError),null,_b.none(),null,loc));
    assertTrue(f.getMessage().contains("traceback without an exception value"));

    RaiseNode ok = new RaiseNode(_b.exc(ExcType.ValueError),_b.con(1),_b.none(),_b.none(),loc);
    assertEquals(4,ok.len());
    assertEquals("exception_cause",ok.slotName(3));
  }

  @Test public void testExecStmtNone() {
    ExecStmtNode a = new ExecStmtNode(_b.str("x=1"),_b.none(),_b.none(),_b.loc());
    ExecStmtNode b = new ExecStmtNode(_b.str("x=1"),null,null,_b.loc());
    assertNull(a.globals());
    assertNull(a.locals());
    assertEquals(b.toString(),a.toString());

    // Later writes are normalized the same way
    ConNode none = _b.none();
    a.setKid(2,none);
    assertNull(a.locals());
    assertTrue(none.isDead());

    // An owned None is not silently stolen
    ConNode owned = _b.none();
    ExprOnlyStmtNode holder = _b.expr(owned);
    OptFault f = assertThrows(OptFault.class, () -> new ExecStmtNode(_b.str("x"),owned,null,_b.loc()));
    assertTrue(f.getMessage().contains("already a child of ExpressionOnly"));
    assertSame(holder,owned.parent());
    assertFalse(owned.isDead());

    // Only the optional arguments
    ExecStmtNode c = new ExecStmtNode(_b.none(),null,null,_b.loc());
    assertTrue(c.source() instanceof ConNode);
    // Anything else stays
    ExecStmtNode d = new ExecStmtNode(_b.str("pass"),_b.con(0),null,_b.loc());
    assertNotNull(d.globals());
  }

  @Test public void testParentProvider() {
    AssignNode a = _b.assign("x",_b.con(1));
    assertThrows(OptFault.class, a::getParentVariableProvider);
    ModuleNode m = _b.module(a);
    assertSame(m,a.getParentVariableProvider());
    assertSame(m,a.source().getParentVariableProvider());
  }

  @Test public void testPrint() {
    ModuleNode m = _b.module(_b.assign("x",_b.con(1)),_b.expr(_b.add(_b.ref("x"),_b.str("a"))));
    assertEquals("Module __main__\n"+
                 "  body: Statements\n"+
                 "    0: AssignVariable x\n"+
                 "      source: Con 1\n"+
                 "    1: ExpressionOnly\n"+
                 "      expression: BinOp +\n"+
                 "        left: VariableRef x\n"+
                 "        right: Con 'a'\n",
                 m.toString());
  }

  @Test public void testConstants() {
    assertEquals("True",ConNode.of(true,_b.loc()).repr());
    assertEquals("None",_b.none().repr());
    assertEquals("'a'",_b.str("a").repr());
    assertTrue(ConNode.of(false,_b.loc()).sameValue(ConNode.of(false,_b.loc())));
    assertFalse(_b.con(1).sameValue(_b.str("1")));
    assertTrue(_b.none().isNone());
  }

  @Test public void testWrongScope() {
    assertThrows(OptFault.class, () -> new ModuleNode(new LocalsScope("f",LocalsScope.Kind.FUNCTION),_b.stmts(),_b.loc()));
  }
}
