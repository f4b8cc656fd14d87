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
 * Default resolver: names are looked up through the enclosing symbol tables
 * and privacy is read from the parallel region's private clause.
 */
public class RegionSymbolResolver implements SymbolResolver
{
  public Symbol resolve(String name, Traversable where)
  {
    return SymbolTools.findSymbol(where, name);
  }

  public boolean isPrivateInEnclosingRegion(Symbol symbol, ParallelRegion region)
  {
    if (region == null)
      return false;
    for (Symbol priv : region.getPrivateSymbols())
      if (priv == symbol)
        return true;
    return false;
  }
}
