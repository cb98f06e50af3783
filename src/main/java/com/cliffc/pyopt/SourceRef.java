package com.cliffc.pyopt;

// Point in the source to blame.  Immutable; shared freely between nodes.
public final class SourceRef {
  public final String _file;
  public final int _line;
  public SourceRef( String file, int line ) { _file=file; _line=line; }
  @Override public String toString() { return _file+":"+_line; }
  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    return o instanceof SourceRef ref && _line==ref._line && _file.equals(ref._file);
  }
  @Override public int hashCode() { return _file.hashCode()*31+_line; }
}
