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
 * Raised when task clauses cannot be inferred soundly for a region of code.
 * Each rejection carries the statement and the reference that triggered it so
 * the caller can point the user at the code to simplify.
 */
public class TaskClauseException extends Exception
{
  private static final long serialVersionUID = 1L;

  /**
   * Why inference was rejected.
   */
  public enum Reason
  {
    UNSUPPORTED_INDEX_FORM,
    NON_LITERAL_STEP_UNSUPPORTED,
    SHARED_USED_AS_INDEX,
    MISSING_ENCLOSING_REGION,
    MALFORMED_TASK_BODY,
    INVALID_NESTING
  }

  private final Reason reason;
  private final Statement statement;
  private final Traversable reference;

  public TaskClauseException(Reason reason, String message)
  {
    this(reason, message, null, null);
  }

  /**
   * @param reason the rejection category
   * @param message the detail message
   * @param statement the statement being analyzed, may be null
   * @param reference the offending reference or index, may be null
   */
  public TaskClauseException(Reason reason, String message,
                             Statement statement, Traversable reference)
  {
    super(message);
    this.reason = reason;
    this.statement = statement;
    this.reference = reference;
  }

  public Reason getReason()
  {
    return reason;
  }

  public Statement getStatement()
  {
    return statement;
  }

  public Traversable getReference()
  {
    return reference;
  }

  /**
   * One-line description: reason, message, then the offending reference and
   * statement when known.
   */
  public String describe()
  {
    StringBuilder sb = new StringBuilder(80);
    sb.append(reason).append(": ").append(getMessage());
    if (reference != null)
      sb.append(" [").append(reference).append("]");
    if (statement != null) {
      String text = statement.toString();
      int nl = text.indexOf('\n');
      if (nl >= 0)
        text = text.substring(0, nl);
      sb.append(" at ").append(text);
    }
    return sb.toString();
  }
}
