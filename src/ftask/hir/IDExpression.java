package ftask.hir;

/**
* Base class of named expressions: variable references ({@link Identifier})
* and structure member names ({@link NameID}).
*/
public abstract class IDExpression extends Expression {

    protected IDExpression() {
        super(-1);
        needs_parens = false;
    }

    /**
    * Returns the name of this expression as written in the source.
    *
    * @return the name.
    */
    public abstract String getName();

    @Override
    public IDExpression clone() {
        return (IDExpression)super.clone();
    }

}
