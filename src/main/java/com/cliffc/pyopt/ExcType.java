package com.cliffc.pyopt;

/** The modeled Python exception classes.  Only what the rewrites produce or
 *  query; anything else is covered by {@code BaseException}.
 */
public enum ExcType {
  BaseException    (null),
  Exception        (BaseException),
  ArithmeticError  (Exception),
  ZeroDivisionError(ArithmeticError),
  ValueError       (Exception),
  TypeError        (Exception),
  NameError        (Exception),
  ImportError      (Exception),
  SyntaxError      (Exception),
  RuntimeError     (Exception),
  OSError          (Exception);

  public final ExcType _parent;
  ExcType( ExcType parent ) { _parent = parent; }

  // True if this class is 'exc' or derives from it, i.e. an 'except exc:'
  // clause catches it.
  public boolean isSubclassOf( ExcType exc ) {
    for( ExcType t = this; t!=null; t = t._parent )
      if( t==exc ) return true;
    return false;
  }
}
