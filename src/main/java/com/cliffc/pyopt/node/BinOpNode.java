package com.cliffc.pyopt.node;

import com.cliffc.pyopt.Change;
import com.cliffc.pyopt.ChangeTag;
import com.cliffc.pyopt.ExcType;
import com.cliffc.pyopt.OptFault;
import com.cliffc.pyopt.SourceRef;
import com.cliffc.pyopt.TraceCollection;

import java.math.BigInteger;

/** Binary arithmetic.  Folds constant operands; a constant division by zero
 *  becomes an expression that raises ZeroDivisionError.
 */
public class BinOpNode extends ExprNode {
  public enum Op {
    ADD("+"), SUB("-"), MUL("*"), TRUEDIV("/"), FLOORDIV("//"), MOD("%");
    public final String _str;
    Op( String str ) { _str=str; }
  }
  private static final String[] SLOTS = {"left","right"};

  public final Op _op;
  public BinOpNode( Op op, ExprNode left, ExprNode right, SourceRef loc ) { super(loc,left,right); _op=op; }
  @Override public String label() { return "BinOp"; }
  @Override String details() { return _op._str; }
  @Override String[] slots() { return SLOTS; }

  public ExprNode left () { return kid(0); }
  public ExprNode right() { return kid(1); }

  // Both operands integer constants
  private boolean isConstInts() {
    return left() instanceof ConNode l && l.intValue()!=null && right() instanceof ConNode r && r.intValue()!=null;
  }
  private boolean isConstStrs() {
    return _op==Op.ADD && left() instanceof ConNode l && l.strValue()!=null && right() instanceof ConNode r && r.strValue()!=null;
  }
  private boolean isZeroDivision() {
    return (_op==Op.TRUEDIV || _op==Op.FLOORDIV || _op==Op.MOD) && isConstInts() && ((ConNode)right()).intValue().signum()==0;
  }

  @Override public Change computeExpression( TraceCollection trace ) {
    if( isZeroDivision() ) {
      String msg = _op==Op.TRUEDIV ? "division by zero" : "integer division or modulo by zero";
      ExprNode exc = new MakeExceptionNode(ExcType.ZeroDivisionError,_loc,ConNode.of(msg,_loc));
      trace.onExceptionRaiseExit(ExcType.ZeroDivisionError);
      return new Change(new RaiseExprNode(exc,null,_loc),ChangeTag.NEW_RAISE,
                        "Operation "+_op._str+" with constant zero divisor raises ZeroDivisionError.");
    }
    ConNode folded = fold();
    if( folded != null )
      return new Change(folded,ChangeTag.NEW_CONSTANT,"Operation "+_op._str+" with constant operands folded.");
    trace.onExceptionRaiseExit(ExcType.BaseException);
    return null;
  }

  private ConNode fold() {
    if( !(left() instanceof ConNode l) || !(right() instanceof ConNode r) ) return null;
    BigInteger x = l.intValue(), y = r.intValue();
    // True division makes a float, which is not modeled
    if( x!=null && y!=null && _op!=Op.TRUEDIV ) {
      BigInteger z = switch( _op ) {
        case ADD -> x.add(y);
        case SUB -> x.subtract(y);
        case MUL -> x.multiply(y);
        case FLOORDIV -> floorDiv(x,y);
        case MOD -> x.subtract(floorDiv(x,y).multiply(y));
        default -> throw new OptFault(this,"no folding for "+_op._str);
      };
      return ConNode.of(z,_loc);
    }
    if( isConstStrs() )
      return ConNode.of(l.strValue()+r.strValue(),_loc);
    return null;
  }

  // Python rounds the quotient toward negative infinity
  private static BigInteger floorDiv( BigInteger x, BigInteger y ) {
    BigInteger[] qr = x.divideAndRemainder(y);
    if( qr[1].signum()!=0 && qr[1].signum()!=y.signum() )
      return qr[0].subtract(BigInteger.ONE);
    return qr[0];
  }

  @Override public boolean willRaiseAnyException() { return isZeroDivision(); }
  @Override public boolean mayRaiseException( ExcType exc ) {
    if( isZeroDivision() ) return ExcType.ZeroDivisionError.isSubclassOf(exc);
    // Large ints overflow a float
    return _op==Op.TRUEDIV || (!isConstStrs() && !isConstInts());
  }
}
