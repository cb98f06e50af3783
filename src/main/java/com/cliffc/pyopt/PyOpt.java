package com.cliffc.pyopt;

/** Global knobs for the tree optimizer.  Seeded from system properties, and
 *  writable so tests can flip them (and must put them back).
 */
public abstract class PyOpt {
  // Cap on full passes before the fixpoint is declared broken.  Rewrites only
  // ever simplify, so hitting this means a rewrite rule cycles.
  public static int MAX_PASSES = Integer.getInteger("pyopt.maxPasses",100);

  // Python version the tree targets, as 0xMmm (0x30a is 3.10).  Some node
  // kinds only exist on one side of 3.0.
  public static int PYTHON_VERSION = Integer.getInteger("pyopt.pythonVersion",0x30a);
  public static boolean isPython3() { return PYTHON_VERSION >= 0x300; }

  // Dump the whole tree after every pass
  public static boolean DEBUG = Boolean.getBoolean("pyopt.debug");
}
