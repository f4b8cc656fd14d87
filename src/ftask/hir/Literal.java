package ftask.hir;

/**
* Base class for literals. Literals have no children and are always printed
* without parentheses.
*/
public abstract class Literal extends Expression {

    protected Literal() {
        super(-1);
        needs_parens = false;
    }

    @Override
    public Literal clone() {
        return (Literal)super.clone();
    }

}
