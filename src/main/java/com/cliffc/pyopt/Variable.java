package com.cliffc.pyopt;

// A named variable owned by one LocalsScope.  Identity equality.
public final class Variable {
  public final String _name;
  public final LocalsScope _scope;
  Variable( String name, LocalsScope scope ) { _name=name; _scope=scope; }
  public boolean isModuleVariable() { return _scope._kind==LocalsScope.Kind.MODULE; }
  @Override public String toString() { return _name; }
}
