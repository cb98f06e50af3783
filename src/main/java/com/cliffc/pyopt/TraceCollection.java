package com.cliffc.pyopt;

import com.cliffc.pyopt.node.ConNode;
import com.cliffc.pyopt.node.ExprNode;
import com.cliffc.pyopt.node.StmtNode;
import com.cliffc.pyopt.util.Ary;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/** Data-flow context for one pass over one provider body.  Threaded by
 *  reference through every compute call, in source evaluation order, and
 *  thrown away at the end of the pass.  Knowledge learned here only survives
 *  through the rewrites it caused.
 */
public class TraceCollection {
  private static final Logger logger = LoggerFactory.getLogger(TraceCollection.class);

  /** A point where control may leave by raising, with the variable knowledge
   *  at that point.  Handlers start from the merge of these. */
  public static final class ExceptionExit {
    public final ExcType _exc;
    final Map<Variable,VariableTrace> _know;
    ExceptionExit( ExcType exc, Map<Variable,VariableTrace> know ) { _exc=exc; _know=know; }
    @Override public String toString() { return _exc.name()+_know.values(); }
  }

  private final Optimizer _opt;   // Change sink
  // Current knowledge, per variable.  Absent means nothing known.
  private HashMap<Variable,VariableTrace> _know = new HashMap<>();
  // Variables each scope used this pass.  Outlives removeAllKnowledge.
  private final LinkedHashMap<LocalsScope,LinkedHashSet<Variable>> _usage = new LinkedHashMap<>();
  // Exception exits; one frame per enclosing try, plus the provider's own
  private final ArrayDeque<Ary<ExceptionExit>> _exits = new ArrayDeque<>();

  public TraceCollection( Optimizer opt ) {
    _opt = opt;
    _exits.push(new Ary<>(ExceptionExit.class));
  }

  // --------------------------------------------------------------------------
  // Computing children

  public ExprNode onExpression( ExprNode expr ) { return onExpression(expr,false); }

  /** Compute 'expr' in place.  A replacement is spliced into the parent slot
   *  and the old node torn down.
   *  @return the node now in that slot; null only for an allowed absent child */
  public @Nullable ExprNode onExpression( @Nullable ExprNode expr, boolean allowNone ) {
    if( expr==null ) {
      if( allowNone ) return null;
      throw new OptFault("required expression is absent");
    }
    if( expr.parent()==null )
      throw new OptFault(expr,"computing a detached expression");
    Change c = expr.computeExpressionRaw(this);
    if( c==null ) return expr;
    signalChange(c._tag,expr._loc,c._msg);
    if( !(c._nnn instanceof ExprNode nnn) )
      throw new OptFault(expr,"expression replaced by "+(c._nnn==null ? "nothing" : c._nnn.label()));
    expr.parent().replaceChild(expr,nnn);
    expr.kill();
    return nnn;
  }

  /** Compute a statement.  The owner splices: statement replacements may be
   *  deletions or whole sequences.
   *  @return null for no change */
  public @Nullable Change onStatement( StmtNode stmt ) {
    Change c = stmt.computeStatement(this);
    if( c!=null ) signalChange(c._tag,stmt._loc,c._msg);
    return c;
  }

  public void signalChange( ChangeTag tag, SourceRef loc, String msg ) { _opt.signalChange(tag,loc,msg); }

  // --------------------------------------------------------------------------
  // Exception exits

  /** Control may leave here by raising 'exc' or a subclass. */
  public void onExceptionRaiseExit( ExcType exc ) {
    _exits.peek().add(new ExceptionExit(exc,new HashMap<>(_know)));
  }
  // Exits recorded so far in the innermost frame
  public Ary<ExceptionExit> exceptionExits() { return _exits.peek(); }
  public void pushExceptionExits() { _exits.push(new Ary<>(ExceptionExit.class)); }
  public Ary<ExceptionExit> popExceptionExits() {
    if( _exits.size()==1 ) throw new OptFault("unbalanced exception exit frames");
    return _exits.pop();
  }

  // Knowledge at the start of a handler for these exits
  public static Map<Variable,VariableTrace> mergeExits( Ary<ExceptionExit> exits ) {
    Map<Variable,VariableTrace> know = null;
    for( ExceptionExit exit : exits )
      know = merge(know,exit._know);
    return know;
  }

  // --------------------------------------------------------------------------
  // Variables

  public void onVariableSet( Variable var, @Nullable ExprNode value ) {
    use(var);
    ConNode con = value instanceof ConNode c ? c.copy(c._loc) : null;
    _know.put(var,VariableTrace.assign(var,con));
  }

  public VariableTrace onVariableRead( Variable var ) {
    use(var);
    VariableTrace t = _know.get(var);
    return t==null ? VariableTrace.unknown(var) : t;
  }

  private void use( Variable var ) {
    _usage.computeIfAbsent(var._scope, s -> new LinkedHashSet<>()).add(var);
  }

  /** Traces for every variable of 'scope' written or read so far this pass.
   *  Variables with nothing known get a fresh unknown trace, which becomes
   *  the current knowledge. */
  public Set<VariableTrace> onLocalsUsage( LocalsScope scope ) {
    LinkedHashSet<VariableTrace> traces = new LinkedHashSet<>();
    LinkedHashSet<Variable> vars = _usage.get(scope);
    if( vars==null ) return traces;
    for( Variable var : vars ) {
      VariableTrace t = _know.get(var);
      if( t==null ) _know.put(var, t = VariableTrace.unknown(var));
      traces.add(t);
    }
    return traces;
  }

  /** Forget everything known about every variable.  Used where dynamic code
   *  may have bound or rebound any name unseen. */
  public void removeAllKnowledge() {
    logger.atTrace().setMessage("Removing all knowledge of {} variables").addArgument(_know.size()).log();
    _know.clear();
  }

  /** Unknown code ran; it can reach any module variable through the module
   *  dict. */
  public void onControlFlowEscape() {
    _know.keySet().removeIf(Variable::isModuleVariable);
  }

  // --------------------------------------------------------------------------
  // Control flow joins

  public Map<Variable,VariableTrace> snapshot() { return new HashMap<>(_know); }
  public void restore( @Nullable Map<Variable,VariableTrace> know ) {
    _know = know==null ? new HashMap<>() : new HashMap<>(know);
  }

  /** Knowledge holding on both paths.  A null side is unreachable. */
  public static Map<Variable,VariableTrace> merge( @Nullable Map<Variable,VariableTrace> a, @Nullable Map<Variable,VariableTrace> b ) {
    if( a==null ) return b;
    if( b==null ) return a;
    HashMap<Variable,VariableTrace> know = new HashMap<>();
    for( Map.Entry<Variable,VariableTrace> e : a.entrySet() ) {
      VariableTrace ta = e.getValue(), tb = b.get(e.getKey());
      if( tb==null ) continue;
      if( ta.sameAs(tb) ) know.put(e.getKey(),ta);
      else if( ta.isAssigned() && tb.isAssigned() ) know.put(e.getKey(),VariableTrace.assign(e.getKey(),null));
    }
    return know;
  }

  @Override public String toString() { return "trace"+_know.values(); }
}
