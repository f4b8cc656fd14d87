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

import ftask.hir.*;

/**
 * Read-only view of scoping used by task clause inference: maps names to
 * their declaring symbols and answers whether a symbol is private in a
 * parallel region.
 */
public interface SymbolResolver
{
  /**
   * @param name the name to resolve, case-insensitive
   * @param where the IR node whose scope is searched
   * @return the declaring symbol or null if the name is not declared
   */
  Symbol resolve(String name, Traversable where);

  /**
   * @return true if the symbol is private in the given parallel region
   */
  boolean isPrivateInEnclosingRegion(Symbol symbol, ParallelRegion region);
}
