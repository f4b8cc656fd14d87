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

package ftask.exec;

/**
 * Immutable naming and reporting settings for task clause inference. The
 * value is built once by the driver and handed down the call chain; nothing
 * in the analysis reads a global option.
 */
public final class TaskClauseConfig
{
  public static final String DEFAULT_SENTINEL = "!$";
  public static final String DEFAULT_LBOUND = "LBOUND";
  public static final String DEFAULT_UBOUND = "UBOUND";

  private static final TaskClauseConfig DEFAULT =
    new TaskClauseConfig(DEFAULT_SENTINEL, DEFAULT_LBOUND, DEFAULT_UBOUND, 0);

  private final String mSentinel;
  private final String mLBound;
  private final String mUBound;
  private final int mVerbosity;

  /**
   * @param sentinel the directive prefix, such as !$
   * @param lbound intrinsic used for the lower end of a full-range term
   * @param ubound intrinsic used for the upper end of a full-range term
   * @param verbosity the reporting level, 0 to 3
   * @throws IllegalArgumentException if a name is empty or the verbosity is
   * negative
   */
  public TaskClauseConfig(String sentinel, String lbound, String ubound,
                          int verbosity)
  {
    if (isEmpty(sentinel) || isEmpty(lbound) || isEmpty(ubound))
      throw new IllegalArgumentException("sentinel and bound names must not be empty");
    if (verbosity < 0)
      throw new IllegalArgumentException("negative verbosity " + verbosity);
    mSentinel = sentinel;
    mLBound = lbound;
    mUBound = ubound;
    mVerbosity = verbosity;
  }

  /** The configuration used when no option is given. */
  public static TaskClauseConfig getDefault()
  {
    return DEFAULT;
  }

  public String getSentinel()
  {
    return mSentinel;
  }

  public String getLBoundName()
  {
    return mLBound;
  }

  public String getUBoundName()
  {
    return mUBound;
  }

  public int getVerbosity()
  {
    return mVerbosity;
  }

  /** Returns a copy with a different verbosity. */
  public TaskClauseConfig withVerbosity(int verbosity)
  {
    return new TaskClauseConfig(mSentinel, mLBound, mUBound, verbosity);
  }

  private static boolean isEmpty(String s)
  {
    return s == null || s.trim().length() == 0;
  }

  @Override
  public boolean equals(Object o)
  {
    if (!(o instanceof TaskClauseConfig))
      return false;
    TaskClauseConfig other = (TaskClauseConfig)o;
    return mSentinel.equals(other.mSentinel) && mLBound.equals(other.mLBound)
      && mUBound.equals(other.mUBound) && mVerbosity == other.mVerbosity;
  }

  @Override
  public int hashCode()
  {
    int h = mSentinel.hashCode();
    h = 31 * h + mLBound.hashCode();
    h = 31 * h + mUBound.hashCode();
    return 31 * h + mVerbosity;
  }

  @Override
  public String toString()
  {
    return "sentinel=" + mSentinel + " lbound=" + mLBound + " ubound=" + mUBound
      + " verbosity=" + mVerbosity;
  }
}
