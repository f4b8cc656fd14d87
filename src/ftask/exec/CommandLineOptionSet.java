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

/**
 * Registry of the command-line options: their group, usage text, example
 * argument and current value.
 */
public class CommandLineOptionSet
{
  public final int ANALYSIS = 1;
  public final int TRANSFORM = 2;
  public final int UTILITY = 3;
  public final int CODEGEN = 4;

  private static final String[] GROUP_NAMES =
    { "", "ANALYSIS", "TRANSFORM", "UTILITY", "CODEGEN" };

  private class OptionRecord
  {
    public int option_type;
    public String value;
    public String arg;
    public String usage;

    public OptionRecord(int type, String value, String arg, String usage)
    {
      this.option_type = type;
      this.value = value;
      this.arg = arg;
      this.usage = usage;
    }
  }

  private TreeMap<String, OptionRecord> name_to_record;

  public CommandLineOptionSet()
  {
    name_to_record = new TreeMap<String, OptionRecord>();
  }

  public void add(String name, String usage)
  {
    add(UTILITY, name, null, null, usage);
  }

  public void add(int type, String name, String usage)
  {
    add(type, name, null, null, usage);
  }

  public void add(int type, String name, String arg, String usage)
  {
    add(type, name, null, arg, usage);
  }

  /**
   * Registers an option.
   *
   * @param type one of ANALYSIS, TRANSFORM, UTILITY or CODEGEN
   * @param name the option name without the leading dash
   * @param value the default value, or null if unset by default
   * @param arg the example argument shown in the usage, or null for a flag
   * @param usage the description
   */
  public void add(int type, String name, String value, String arg, String usage)
  {
    name_to_record.put(name, new OptionRecord(type, value, arg, usage));
  }

  public boolean contains(String name)
  {
    return name_to_record.containsKey(name);
  }

  /**
   * Returns every option with its usage and current value in the format of
   * an options file.
   */
  public String dumpOptions()
  {
    StringBuilder sb = new StringBuilder(2000);
    for (Map.Entry<String, OptionRecord> entry : name_to_record.entrySet()) {
      OptionRecord record = entry.getValue();
      sb.append("#Option: ").append(entry.getKey()).append("\n#");
      sb.append(entry.getKey());
      if (record.arg != null)
        sb.append("=").append(record.arg);
      sb.append("\n#").append(record.usage.replaceAll("\n", "\n#")).append("\n");
      sb.append(entry.getKey());
      if (record.value != null)
        sb.append("=").append(record.value);
      sb.append("\n");
    }
    return sb.toString();
  }

  /** Returns the usage of all options grouped by type. */
  public String getUsage()
  {
    StringBuilder sb = new StringBuilder(4000);
    int[] order = { UTILITY, ANALYSIS, TRANSFORM, CODEGEN };
    for (int type : order) {
      String usage = getUsage(type);
      if (usage.length() == 0)
        continue;
      for (int i = 0; i < 80; i++) sb.append("-");
      sb.append("\n").append(GROUP_NAMES[type]).append("\n");
      for (int i = 0; i < 80; i++) sb.append("-");
      sb.append("\n").append(usage);
    }
    return sb.toString();
  }

  public String getUsage(int type)
  {
    StringBuilder sb = new StringBuilder(1000);
    for (Map.Entry<String, OptionRecord> entry : name_to_record.entrySet()) {
      OptionRecord record = entry.getValue();
      if (record.option_type == type) {
        sb.append("-").append(entry.getKey());
        if (record.arg != null)
          sb.append("=").append(record.arg);
        sb.append("\n    ").append(record.usage).append("\n\n");
      }
    }
    return sb.toString();
  }

  /** Returns the current value, or null if unset or unknown. */
  public String getValue(String name)
  {
    OptionRecord record = name_to_record.get(name);
    if (record == null)
      return null;
    return record.value;
  }

  public void setValue(String name, String value)
  {
    OptionRecord record = name_to_record.get(name);
    if (record != null)
      record.value = value;
  }

  /** Returns the group of the option, or 0 if it is unknown. */
  public int getType(String name)
  {
    OptionRecord record = name_to_record.get(name);
    if (record == null)
      return 0;
    return record.option_type;
  }
}
