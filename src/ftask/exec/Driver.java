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

import java.util.*;

import ftask.analysis.*;
import ftask.hir.*;
import ftask.transforms.*;

/**
 * Parses the options and runs the passes on a program handed over by the
 * frontend. The options are turned into one immutable
 * {@link TaskClauseConfig} that is passed to the passes.
 */
public class Driver
{
  protected CommandLineOptionSet options;

  private List<TaskClauseException> mFailures;

  public Driver()
  {
    options = new CommandLineOptionSet();
    mFailures = new ArrayList<TaskClauseException>();
    registerOptions();
  }

  /**
   * Registers the legal options and their default values.
   */
  protected void registerOptions()
  {
    options.add(options.UTILITY, "help",
                "Print this message");
    options.add(options.UTILITY, "dump-options",
                "Print every option with its default value in options file format");
    options.add(options.UTILITY, "verbosity", "0", "N",
                "Degree of status messages (0-3) that you wish to see (default is 0)");
    options.add(options.ANALYSIS, "parallel-private", "1", "0|1",
                "Compute the private clause of every parallel region before task inference");
    options.add(options.TRANSFORM, "task-clauses", "1", "0|1",
                "Infer private, firstprivate, shared and depend clauses of task regions");
    options.add(options.CODEGEN, "sentinel", TaskClauseConfig.DEFAULT_SENTINEL, "prefix",
                "Directive sentinel printed directly before every omp directive (default is !$)");
    options.add(options.CODEGEN, "lbound", TaskClauseConfig.DEFAULT_LBOUND, "name",
                "Intrinsic giving the lower bound of a dimension in full-range terms");
    options.add(options.CODEGEN, "ubound", TaskClauseConfig.DEFAULT_UBOUND, "name",
                "Intrinsic giving the upper bound of a dimension in full-range terms");
  }

  /**
   * Sets option values from arguments of the form -name or -name=value.
   * A bare -name sets the value to 1; unknown options are reported and
   * ignored.
   *
   * @throws IllegalArgumentException if an argument does not start with a dash
   */
  public void parseCommandLine(String[] args)
  {
    for (String opt : args) {
      if (opt.length() < 2 || opt.charAt(0) != '-')
        throw new IllegalArgumentException("not an option: " + opt);
      int eq = opt.indexOf('=');
      String name = (eq == -1) ? opt.substring(1) : opt.substring(1, eq);
      String value = (eq == -1) ? "1" : opt.substring(eq + 1);
      if (options.contains(name))
        options.setValue(name, value);
      else
        System.err.println("ignoring unrecognized option " + name);
    }
  }

  public String getOptionValue(String name)
  {
    return options.getValue(name);
  }

  public CommandLineOptionSet getOptions()
  {
    return options;
  }

  /**
   * Builds the configuration from the current option values.
   *
   * @throws IllegalArgumentException if the verbosity is not a number from 0
   * to 3 or a name is empty
   */
  public TaskClauseConfig buildConfig()
  {
    String v = getOptionValue("verbosity");
    int verbosity;
    try {
      verbosity = Integer.parseInt(v.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("verbosity must be a number: " + v, e);
    }
    if (verbosity < 0 || verbosity > 3)
      throw new IllegalArgumentException("verbosity must be between 0 and 3: " + v);
    return new TaskClauseConfig(getOptionValue("sentinel"), getOptionValue("lbound"),
                                getOptionValue("ubound"), verbosity);
  }

  /**
   * Runs the enabled passes on the program and returns it rendered with
   * the configured sentinel. With -help the usage is returned instead and
   * the program is left untouched.
   */
  public String run(String[] args, Program program)
  {
    parseCommandLine(args);
    if (isEnabled("help"))
      return options.getUsage();
    if (isEnabled("dump-options"))
      return options.dumpOptions();

    TaskClauseConfig config = buildConfig();
    PrintTools.setVerbosity(config.getVerbosity());
    PrintTools.printlnStatus(1, "[Driver]", config);
    runPasses(program, config);

    DFIterator<DirectiveRegion> iter =
      new DFIterator<DirectiveRegion>(program, DirectiveRegion.class);
    while (iter.hasNext())
      iter.next().setSentinel(config.getSentinel());
    return program.toString();
  }

  /**
   * Runs the nesting check, then the parallel private and task clause passes
   * if enabled. Failures of the check and of task inference are collected in
   * {@link #getFailures()}.
   */
  public void runPasses(Program program, TaskClauseConfig config)
  {
    mFailures.clear();
    DirectiveNestingCheck check = new DirectiveNestingCheck(program);
    AnalysisPass.run(check);
    mFailures.addAll(check.getFailures());

    if (isEnabled("parallel-private"))
      TransformPass.run(new ParallelPrivatePass(program));

    if (isEnabled("task-clauses")) {
      TaskClausePass pass = new TaskClausePass(program, config);
      TransformPass.run(pass);
      mFailures.addAll(pass.getFailures());
    }
  }

  /** The failures reported by the last run. */
  public List<TaskClauseException> getFailures()
  {
    return Collections.unmodifiableList(mFailures);
  }

  private boolean isEnabled(String name)
  {
    String value = getOptionValue(name);
    return value != null && !value.equals("0");
  }

  /**
   * Entry point without a frontend: prints the usage or the options.
   */
  public static void main(String[] args)
  {
    Driver driver = new Driver();
    driver.parseCommandLine(args);
    if (driver.isEnabled("dump-options"))
      System.out.print(driver.options.dumpOptions());
    else
      System.out.print(driver.options.getUsage());
  }
}
