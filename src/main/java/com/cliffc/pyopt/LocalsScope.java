package com.cliffc.pyopt;

import java.util.LinkedHashMap;

/** A locals scope: the names one provider (module, function or class body)
 *  binds.  Variables are interned per scope, so identity compares.
 */
public final class LocalsScope {
  public enum Kind {
    MODULE,                     // Dict backed, visible to any code that runs
    FUNCTION,                   // Frame backed
    CLASS,                      // Dict backed, private to the class body
  }

  public final String _name;
  public final Kind _kind;
  private final LinkedHashMap<String,Variable> _vars = new LinkedHashMap<>();

  public LocalsScope( String name, Kind kind ) { _name=name; _kind=kind; }

  // Interned variable by name, made on first use
  public Variable var( String name ) {
    return _vars.computeIfAbsent(name, n -> new Variable(n,this));
  }

  @Override public String toString() { return _kind.name().toLowerCase()+" "+_name; }
}
