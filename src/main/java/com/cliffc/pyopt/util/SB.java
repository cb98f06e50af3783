package com.cliffc.pyopt.util;

/** Tight/tiny StringBuilder wrapper.
 *  Short short names on purpose; so they don't obscure the printing. */
public final class SB {
  public final StringBuilder _sb;
  int _indent = 0;
  public SB(        ) { _sb = new StringBuilder( ); }
  public SB p( String s ) { _sb.append(s); return this; }
  public SB p( char   s ) { _sb.append(s); return this; }
  // Not spelled "p" on purpose: too easy to accidentally call the autoboxed
  // version.
  public SB pobj( Object s ) { _sb.append(s); return this; }
  public SB i( ) { for( int i=0; i<_indent; i++ ) p("  "); return this; }
  public SB ip(String s) { return i().p(s); }

  // Increase indentation
  public SB ii( int i) { _indent += i; return this; }
  // Decrease indentation
  public SB di( int i) { _indent -= i; return this; }

  public SB nl( ) { return p('\n'); }

  @Override public String toString() { return _sb.toString(); }
}
