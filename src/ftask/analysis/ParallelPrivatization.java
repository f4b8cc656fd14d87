//============================================================================//
//    FCUDA
//    Copyright (c) <2016> 
//    <University of Illinois at Urbana-Champaign>
//    <University of California at Los Angeles> 
//    All rights reserved.
// 
//    Developed by:
// 
//        <ES CAD Group & IMPACT Research Group>
//            <University of Illinois at Urbana-Champaign>
//            <http://dchen.ece.illinois.edu/>
//            <http://impact.crhc.illinois.edu/>
// 
//        <VAST Laboratory>
//            <University of California at Los Angeles>
//            <http://vast.cs.ucla.edu/>
// 
//        <Hardware Research Group>
//            <Advanced Digital Sciences Center>
//            <http://adsc.illinois.edu/>
//============================================================================//

package ftask.analysis;

import java.util.*;

import ftask.hir.*;

/**
 * Computes the private variables of a parallel region. A scalar is private
 * when it is accessed at least twice in the region, its first access is a
 * write, and that write happens inside a loop or is the header of the
 * loop it controls. Arrays are never privatized. The result is ordered by
 * name so that repeated runs give the same clause.
 */
public class ParallelPrivatization
{
  private static class Access
  {
    final AccessType type;
    final boolean inLoop;

    Access(AccessType type, boolean inLoop)
    {
      this.type = type;
      this.inLoop = inLoop;
    }
  }

  private final ParallelRegion mRegion;
  private final Map<Symbol, List<Access>> mAccesses;

  public ParallelPrivatization(ParallelRegion region)
  {
    mRegion = region;
    mAccesses = new LinkedHashMap<Symbol, List<Access>>();
  }

  /**
   * @return the private scalars of the region, sorted by name
   */
  public List<Symbol> computePrivateSymbols()
  {
    mAccesses.clear();
    visit(mRegion.getBody());
    List<Symbol> ret = new ArrayList<Symbol>();
    for (Map.Entry<Symbol, List<Access>> entry : mAccesses.entrySet()) {
      Symbol sym = entry.getKey();
      List<Access> accesses = entry.getValue();
      if (!SymbolTools.isScalar(sym) || accesses.size() < 2)
        continue;
      Access first = accesses.get(0);
      if (first.type == AccessType.WRITE && first.inLoop)
        ret.add(sym);
    }
    return SymbolTools.sortByName(ret);
  }

  /**
   * Builds the private clause from {@link #computePrivateSymbols()}.
   */
  public Clause computePrivateClause()
  {
    List<Expression> items = new ArrayList<Expression>();
    for (Symbol sym : computePrivateSymbols())
      items.add(new Identifier(sym));
    return new Clause(ClauseType.PRIVATE, items);
  }

  private void visit(Statement stmt)
  {
    if (stmt instanceof CompoundStatement) {
      for (Statement child : ((CompoundStatement)stmt).getStatements())
        visit(child);
    }
    else if (stmt instanceof DirectiveRegion) {
      visit(((DirectiveRegion)stmt).getBody());
    }
    else if (stmt instanceof DoLoop) {
      DoLoop loop = (DoLoop)stmt;
      readAll(loop.getStart(), stmt);
      readAll(loop.getStop(), stmt);
      readAll(loop.getStep(), stmt);
      record(loop.getIndexVariable().getSymbol(), AccessType.WRITE, true);
      visit(loop.getBody());
    }
    else if (stmt instanceof IfStatement) {
      IfStatement ifStmt = (IfStatement)stmt;
      readAll(ifStmt.getControlExpression(), stmt);
      visit(ifStmt.getThenStatement());
      if (ifStmt.getElseStatement() != null)
        visit(ifStmt.getElseStatement());
    }
    else if (stmt instanceof ExpressionStatement) {
      Expression e = ((ExpressionStatement)stmt).getExpression();
      if (e instanceof AssignmentExpression) {
        AssignmentExpression assign = (AssignmentExpression)e;
        readAll(assign.getRHS(), stmt);
        Expression lhs = assign.getLHS();
        for (Expression index : subscriptsOf(lhs))
          readAll(index, stmt);
        Symbol sym = SymbolTools.getSymbolOf(lhs);
        if (sym != null)
          record(sym, AccessType.WRITE, isInLoop(stmt));
      } else {
        readAll(e, stmt);
      }
    }
  }

  // Every identifier of the expression is a read, subscripts included.
  private void readAll(Expression e, Statement stmt)
  {
    boolean inLoop = isInLoop(stmt);
    DFIterator<Identifier> iter = new DFIterator<Identifier>(e, Identifier.class);
    while (iter.hasNext())
      record(iter.next().getSymbol(), AccessType.READ, inLoop);
  }

  private void record(Symbol sym, AccessType type, boolean inLoop)
  {
    List<Access> accesses = mAccesses.get(sym);
    if (accesses == null) {
      accesses = new ArrayList<Access>(2);
      mAccesses.put(sym, accesses);
    }
    accesses.add(new Access(type, inLoop));
  }

  private boolean isInLoop(Statement stmt)
  {
    DoLoop loop = IRTools.getAncestorOfType(stmt, DoLoop.class);
    return loop != null && IRTools.isAncestorOf(mRegion, loop);
  }

  private static List<Expression> subscriptsOf(Expression ref)
  {
    List<Expression> ret = new ArrayList<Expression>();
    Expression e = ref;
    while (e instanceof AccessExpression)
      e = ((AccessExpression)e).getBase();
    if (e instanceof ArrayAccess)
      ret.addAll(((ArrayAccess)e).getIndices());
    return ret;
  }
}
