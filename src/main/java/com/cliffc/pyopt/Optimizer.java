package com.cliffc.pyopt;

import com.cliffc.pyopt.node.ModuleNode;
import com.cliffc.pyopt.node.Node;
import com.cliffc.pyopt.node.ProviderNode;
import com.cliffc.pyopt.util.Ary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/** Fixpoint driver.  Owns the tree for the whole run.  One pass computes the
 *  module body and then every nested provider body, each against a fresh
 *  {@link TraceCollection}; replacements are spliced as they are found.  A
 *  pass without a single change is the fixpoint.
 */
public class Optimizer {
  private static final Logger logger = LoggerFactory.getLogger(Optimizer.class);

  /** One rewrite, as reported to the optimization log. */
  public static final class ChangeRecord {
    public final int _pass;
    public final ChangeTag _tag;
    public final SourceRef _loc;
    public final String _msg;
    ChangeRecord( int pass, ChangeTag tag, SourceRef loc, String msg ) { _pass=pass; _tag=tag; _loc=loc; _msg=msg; }
    @Override public String toString() { return _loc+" "+_tag+": "+_msg; }
  }

  public final ModuleNode _root;
  private final int _max_passes;
  private final Ary<ChangeRecord> _changes = new Ary<>(ChangeRecord.class);
  private int _pass;            // Current pass number, from 1
  private int _pass_changes;    // Changes signaled during the current pass

  public Optimizer( ModuleNode root ) { this(root,PyOpt.MAX_PASSES); }
  public Optimizer( ModuleNode root, int max_passes ) {
    assert root.parent()==null;
    _root = root;
    _max_passes = max_passes;
  }

  /** Run passes to the fixpoint.
   *  @return passes run, including the final one without changes */
  public int optimize() {
    try {
      while( true ) {
        if( _pass >= _max_passes )
          throw new OptFault(_root,"no fixpoint after "+_max_passes+" passes; last pass made "+_pass_changes+" changes");
        if( pass()==0 ) break;
      }
    } catch( OptFault fault ) {
      logger.atError().setMessage("Optimization of {} aborted: {}").addArgument(_root._scope).addArgument(fault.getMessage()).log();
      throw fault;
    }
    logger.atDebug().setMessage("Fixpoint for {} after {} passes, {} changes")
      .addArgument(_root._scope).addArgument(_pass).addArgument(_changes._len).log();
    return _pass;
  }

  /** One full pass.
   *  @return changes made */
  public int pass() {
    _pass++;
    _pass_changes = 0;
    Ary<ProviderNode> providers = new Ary<>(ProviderNode.class);
    providers(_root,providers);
    for( ProviderNode p : providers )
      if( !p.isDead() )         // Removed earlier in this pass
        p.computeBody(new TraceCollection(this));
    if( PyOpt.DEBUG )
      logger.atDebug().setMessage("After pass {}:\n{}").addArgument(_pass).addArgument(_root).log();
    return _pass_changes;
  }

  // Pre-order: outer bodies run before the bodies nested in them
  private static void providers( Node n, Ary<ProviderNode> ps ) {
    if( n instanceof ProviderNode p ) ps.add(p);
    for( int i=0; i<n.len(); i++ )
      if( n.in(i)!=null )
        providers(n.in(i),ps);
  }

  void signalChange( ChangeTag tag, SourceRef loc, String msg ) {
    _pass_changes++;
    _changes.add(new ChangeRecord(_pass,tag,loc,msg));
    logger.atDebug().setMessage("{} {}: {}").addArgument(loc).addArgument(tag).addArgument(msg).log();
  }

  public List<ChangeRecord> changes() { return Collections.unmodifiableList(Arrays.asList(_changes.asAry())); }
  public int passes() { return _pass; }
}
