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
 * The five running sets of task clause inference, in slot order private,
 * firstprivate, shared, depend(in) and depend(out). Each set keeps the
 * order in which entries were first added and ignores entries structurally
 * equal to one already present. Entries are owned by the sets; callers add
 * fresh copies.
 */
public class ClauseSets
{
  private final List<List<Expression>> mSets;

  public ClauseSets()
  {
    mSets = new ArrayList<List<Expression>>(TaskRegion.NUM_CLAUSES);
    for (int i = 0; i < TaskRegion.NUM_CLAUSES; i++)
      mSets.add(new ArrayList<Expression>());
  }

  /**
   * Adds an entry unless an equal one is present.
   *
   * @return true if the entry was added
   */
  public boolean add(ClauseType type, Expression entry)
  {
    List<Expression> set = mSets.get(type.ordinal());
    if (set.contains(entry))
      return false;
    set.add(entry);
    return true;
  }

  /** Adds a bare reference to the symbol unless present. */
  public boolean addSymbol(ClauseType type, Symbol symbol)
  {
    return add(type, new Identifier(symbol));
  }

  public List<Expression> get(ClauseType type)
  {
    return Collections.unmodifiableList(mSets.get(type.ordinal()));
  }

  /** Checks if the set of the given type lists the symbol. */
  public boolean contains(ClauseType type, Symbol symbol)
  {
    for (Expression e : mSets.get(type.ordinal()))
      if (e instanceof Identifier && ((Identifier)e).getSymbol() == symbol)
        return true;
    return false;
  }

  /** Checks if the symbol is already private or firstprivate in the task. */
  public boolean isTaskLocal(Symbol symbol)
  {
    return contains(ClauseType.PRIVATE, symbol)
      || contains(ClauseType.FIRSTPRIVATE, symbol);
  }

  /**
   * Builds one clause per slot from copies of the entries.
   */
  public List<Clause> toClauses()
  {
    List<Clause> ret = new ArrayList<Clause>(TaskRegion.NUM_CLAUSES);
    for (ClauseType type : ClauseType.values()) {
      List<Expression> items = new ArrayList<Expression>();
      for (Expression e : mSets.get(type.ordinal()))
        items.add(e.clone());
      ret.add(new Clause(type, items));
    }
    return ret;
  }

  @Override
  public boolean equals(Object o)
  {
    return (o instanceof ClauseSets) && mSets.equals(((ClauseSets)o).mSets);
  }

  @Override
  public int hashCode()
  {
    return mSets.hashCode();
  }

  @Override
  public String toString()
  {
    StringBuilder sb = new StringBuilder(80);
    for (ClauseType type : ClauseType.values()) {
      if (sb.length() > 0)
        sb.append(" ");
      sb.append(type.name().toLowerCase()).append("={");
      sb.append(Tools.join(mSets.get(type.ordinal()), ", ")).append("}");
    }
    return sb.toString();
  }
}
